package com.example.battlecore.effect;

/**
 * Flat stat reductions that can be placed on a combatant.
 */
public enum DebuffType {
    ATTACK_DOWN("Attack Down"),
    DEFENSE_DOWN("Defense Down");
    
    private final String displayName;
    
    DebuffType(String displayName) {
        this.displayName = displayName;
    }
    
    public String getDisplayName() {
        return displayName;
    }
}
