package com.example.battlecore.model;

/**
 * Allocatable attributes of the player and party members.
 * BOND is not a stat bonus; it is the capacity available for equipped summons.
 */
public record Attributes(int str, int dex, int intel, int vit, int bond) {
    
    public static final Attributes NONE = new Attributes(0, 0, 0, 0, 0);
    
    public Attributes {
        if (str < 0 || dex < 0 || intel < 0 || vit < 0 || bond < 0) {
            throw new IllegalArgumentException("Attributes must not be negative");
        }
    }
}
