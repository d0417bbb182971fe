package com.example.battlecore.model;

import java.util.List;

/**
 * Equipped weapon and armour ids of one party member, in slot order.
 */
public record Equipment(List<String> weaponIds, List<String> armourIds) {
    
    public static final Equipment EMPTY = new Equipment(List.of(), List.of());
    
    public Equipment {
        weaponIds = weaponIds == null ? List.of() : List.copyOf(weaponIds);
        armourIds = armourIds == null ? List.of() : List.copyOf(armourIds);
    }
}
