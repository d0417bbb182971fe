package com.example.battlecore.model;

import java.util.List;
import java.util.Locale;

/**
 * Definition of a skill usable in battle.
 */
public record SkillDefinition(
        String id,
        String name,
        TargetMode targetMode,
        int mpCost,
        int basePower,
        int maxTargets,
        List<String> tags,
        List<String> requiredWeaponTags,
        EffectType effectType) {
    
    /** Tag marking a skill as physical (scales with STR or DEX). */
    public static final String PHYSICAL_TAG = "physical";
    
    /** Tags marking a skill as elemental (scales with INT). */
    public static final List<String> ELEMENTAL_TAGS = List.of(
        "fire", "ice", "lightning", "water", "earth", "wind", "holy", "shadow", "arcane"
    );
    
    public SkillDefinition {
        tags = tags == null ? List.of() : List.copyOf(tags);
        requiredWeaponTags = requiredWeaponTags == null ? List.of() : List.copyOf(requiredWeaponTags);
        if (mpCost < 0) throw new IllegalArgumentException("mpCost must not be negative: " + mpCost);
        if (maxTargets < 1) maxTargets = 1;
    }
    
    public boolean isPhysical() {
        return tags.contains(PHYSICAL_TAG);
    }
    
    public boolean isElemental() {
        for (String tag : tags) {
            if (ELEMENTAL_TAGS.contains(tag)) return true;
        }
        return false;
    }
    
    /**
     * Who a skill may be aimed at.
     */
    public enum TargetMode {
        SELF,
        SINGLE_ENEMY,
        MULTI_ENEMY;
        
        public static TargetMode fromString(String s) {
            if (s == null) return SINGLE_ENEMY;
            switch (s.trim().toLowerCase(Locale.ROOT)) {
                case "self": return SELF;
                case "multi_enemy": case "multi": return MULTI_ENEMY;
                default: return SINGLE_ENEMY;
            }
        }
    }
    
    /**
     * Closed set of skill behaviors. Anything unrecognised maps to {@link #UNKNOWN},
     * which is paid for but has no effect.
     */
    public enum EffectType {
        DAMAGE,
        GUARD,
        UNKNOWN;
        
        public static EffectType fromString(String s) {
            if (s == null) return DAMAGE;
            switch (s.trim().toLowerCase(Locale.ROOT)) {
                case "damage": return DAMAGE;
                case "guard": return GUARD;
                default: return UNKNOWN;
            }
        }
    }
}
