package com.example.battlecore.model;

import java.util.Locale;

/**
 * How an enemy's HP is shown to the player.
 */
public enum HpVisibilityMode {
    /** Shown as {@code ???} */
    HIDDEN,
    /** A min-max range computed once from max HP */
    STATIC_RANGE,
    /** Exact current/max, tracking damage */
    REALTIME;
    
    public static HpVisibilityMode fromString(String s) {
        if (s == null || s.isEmpty()) return HIDDEN;
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return HIDDEN;
        }
    }
}
