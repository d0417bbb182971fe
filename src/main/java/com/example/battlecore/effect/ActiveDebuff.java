package com.example.battlecore.effect;

import java.util.Objects;

/**
 * A debuff currently on a combatant. Expires at the start of round {@code expiresAtRound}.
 */
public final class ActiveDebuff {
    private final DebuffType type;
    private final int amount;
    private final int expiresAtRound;

    public ActiveDebuff(DebuffType type, int amount, int expiresAtRound) {
        this.type = Objects.requireNonNull(type, "type");
        this.amount = amount;
        this.expiresAtRound = expiresAtRound;
    }

    public DebuffType getType() { return type; }
    public int getAmount() { return amount; }
    public int getExpiresAtRound() { return expiresAtRound; }

    public boolean isExpired(int round) {
        return expiresAtRound <= round;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActiveDebuff)) return false;
        ActiveDebuff other = (ActiveDebuff) o;
        return type == other.type && amount == other.amount && expiresAtRound == other.expiresAtRound;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, amount, expiresAtRound);
    }

    @Override
    public String toString() {
        return type + "(" + amount + ", until round " + expiresAtRound + ")";
    }
}
