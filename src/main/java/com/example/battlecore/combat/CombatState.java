package com.example.battlecore.combat;

/**
 * Lifecycle of a battle.
 */
public enum CombatState {
    
    /** Combatants are being built and summons spawned */
    INITIALIZING("Initializing"),
    
    /** Turns are being taken */
    ACTIVE("Active"),
    
    /** One side has no living members left */
    ENDED("Ended");
    
    private final String displayName;
    
    CombatState(String displayName) {
        this.displayName = displayName;
    }
    
    public String getDisplayName() {
        return displayName;
    }
}
