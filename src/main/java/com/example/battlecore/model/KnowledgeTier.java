package com.example.battlecore.model;

/**
 * Kill-count driven information tiers about an enemy type.
 */
public enum KnowledgeTier {
    TIER_0,
    TIER_1,
    TIER_2,
    TIER_3;
    
    public int level() {
        return ordinal();
    }
}
