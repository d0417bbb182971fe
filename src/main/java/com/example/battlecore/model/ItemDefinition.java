package com.example.battlecore.model;

import java.util.Locale;

/**
 * Definition of an inventory item. Only consumables can be used in battle.
 */
public record ItemDefinition(
        String id,
        String name,
        ItemKind kind,
        ItemTargeting targeting,
        int healHp,
        int healMp,
        int debuffAttackFlat,
        int debuffDefenseFlat,
        int value) {
    
    public boolean isConsumable() {
        return kind == ItemKind.CONSUMABLE;
    }
    
    public boolean isDebuffItem() {
        return debuffAttackFlat > 0 || debuffDefenseFlat > 0;
    }
    
    public enum ItemKind {
        CONSUMABLE,
        MATERIAL,
        EQUIPMENT,
        KEY_ITEM;
        
        public static ItemKind fromString(String s) {
            if (s == null) return MATERIAL;
            try {
                return valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return MATERIAL;
            }
        }
    }
    
    public enum ItemTargeting {
        SELF,
        ALLY,
        ENEMY;
        
        public static ItemTargeting fromString(String s) {
            if (s == null) return SELF;
            try {
                return valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return SELF;
            }
        }
    }
}
