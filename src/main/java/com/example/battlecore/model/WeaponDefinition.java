package com.example.battlecore.model;

import java.util.List;

public record WeaponDefinition(String id, String name, int attack, List<String> tags) {
    
    /** Weapon tag that switches basic attacks from STR to DEX scaling. */
    public static final String FINESSE_TAG = "finesse";
    
    public WeaponDefinition {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
