package com.example.battlecore.model;

/**
 * Pre-scaling stat block used by definitions and as the input to attribute scaling.
 */
public record BaseStats(int maxHp, int maxMp, int attack, int defense, int speed) {
    
    public BaseStats {
        if (maxHp < 1) throw new IllegalArgumentException("maxHp must be positive: " + maxHp);
        if (maxMp < 0) throw new IllegalArgumentException("maxMp must not be negative: " + maxMp);
    }
    
    public BaseStats withAttack(int newAttack) {
        return new BaseStats(maxHp, maxMp, newAttack, defense, speed);
    }
    
    public BaseStats withDefense(int newDefense) {
        return new BaseStats(maxHp, maxMp, attack, newDefense, speed);
    }
    
    /**
     * Fresh mutable stats at full HP and MP.
     */
    public Stats toFullStats() {
        return new Stats(maxHp, maxHp, maxMp, maxMp, attack, defense, speed);
    }
}
