package com.example.battlecore.util;

import java.util.Collection;

/**
 * Instance ids drawn from the session RNG, so the same seed always produces the same ids.
 */
public final class InstanceIds {
    
    private static final int MIN_SUFFIX = 100000;
    private static final int MAX_SUFFIX = 999999;
    
    private InstanceIds() {
    }
    
    /**
     * {@code prefix_NNNNNN} with a six digit suffix.
     */
    public static String make(String prefix, DeterministicRng rng) {
        return prefix + "_" + rng.nextInt(MIN_SUFFIX, MAX_SUFFIX);
    }
    
    /**
     * Like {@link #make(String, DeterministicRng)} but draws again while the id is already taken.
     */
    public static String makeUnique(String prefix, DeterministicRng rng, Collection<String> taken) {
        String id = make(prefix, rng);
        while (taken.contains(id)) {
            id = make(prefix, rng);
        }
        return id;
    }
}
