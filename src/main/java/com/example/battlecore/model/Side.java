package com.example.battlecore.model;

/**
 * The two opposing sides of a battle.
 */
public enum Side {
    
    /** Player, recruited party members and their summons */
    ALLIES("Allies"),
    
    /** Everything the party is fighting */
    ENEMIES("Enemies");
    
    private final String displayName;
    
    Side(String displayName) {
        this.displayName = displayName;
    }
    
    public String getDisplayName() {
        return displayName;
    }
    
    public Side opposite() {
        return this == ALLIES ? ENEMIES : ALLIES;
    }
}
