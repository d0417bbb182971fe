package com.example.battlecore.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Seeded pseudo-random source shared by one game session.
 *
 * Backed by a SplitMix64 stream, so the complete internal state is a single 64-bit word.
 * {@link #exportState()} turns that word into a JSON-safe map and {@link #fromState(Map)}
 * rebuilds a generator that continues with exactly the same sequence.
 *
 * Instances are passed explicitly to every operation that needs randomness; there is no
 * shared static generator.
 */
public final class DeterministicRng {

    public static final String ALGORITHM = "splitmix64";

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;
    private static final double DOUBLE_UNIT = 0x1.0p-53;

    private long state;

    public DeterministicRng(long seed) {
        this.state = seed;
    }

    private DeterministicRng(long state, boolean restored) {
        this.state = state;
    }

    private long nextLong() {
        long z = (state += GOLDEN_GAMMA);
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    /**
     * Return a uniformly distributed integer N with {@code min <= N <= max}.
     */
    public int nextInt(int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("max " + max + " is below min " + min);
        }
        long bound = (long) max - (long) min + 1L;
        // Rejection sampling keeps the draw unbiased for every bound.
        long bits;
        long value;
        do {
            bits = nextLong() >>> 1;
            value = bits % bound;
        } while (bits - value + (bound - 1) < 0);
        return (int) (min + value);
    }

    /**
     * Return the next double in [0.0, 1.0).
     */
    public double nextDouble() {
        return (nextLong() >>> 11) * DOUBLE_UNIT;
    }

    public <T> T choice(List<T> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("Cannot choose from an empty sequence.");
        }
        return items.get(nextInt(0, items.size() - 1));
    }

    /**
     * Fisher-Yates shuffle, in place.
     */
    public <T> void shuffle(List<T> items) {
        for (int i = items.size() - 1; i > 0; i--) {
            int j = nextInt(0, i);
            Collections.swap(items, i, j);
        }
    }

    /**
     * Export the full internal state as plain strings, safe for any JSON encoder.
     */
    public Map<String, Object> exportState() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("algorithm", ALGORITHM);
        out.put("state", Long.toHexString(state));
        return out;
    }

    /**
     * Replace this generator's state with a previously exported one.
     */
    public void restoreState(Map<String, ?> exported) {
        this.state = parseState(exported);
    }

    public static DeterministicRng fromState(Map<String, ?> exported) {
        return new DeterministicRng(parseState(exported), true);
    }

    /**
     * Independent generator positioned at the same point of the stream.
     * Draws from the copy never advance this instance.
     */
    public DeterministicRng copy() {
        return new DeterministicRng(state, true);
    }

    private static long parseState(Map<String, ?> exported) {
        Objects.requireNonNull(exported, "exported state");
        Object algorithm = exported.get("algorithm");
        if (!ALGORITHM.equals(algorithm)) {
            throw new IllegalArgumentException("Unsupported RNG algorithm: " + algorithm);
        }
        Object raw = exported.get("state");
        if (!(raw instanceof String text) || text.isEmpty()) {
            throw new IllegalArgumentException("RNG state must be a hex string, got: " + raw);
        }
        try {
            return Long.parseUnsignedLong(text, 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("RNG state is not valid hex: " + text, e);
        }
    }

    @Override
    public String toString() {
        return "DeterministicRng[" + Long.toHexString(state) + "]";
    }
}
