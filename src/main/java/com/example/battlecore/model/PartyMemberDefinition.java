package com.example.battlecore.model;

import java.util.List;

/**
 * A recruitable companion. Equipment in the game state overrides the default weapons and armour.
 */
public record PartyMemberDefinition(
        String id,
        String name,
        int baseHp,
        int baseMp,
        int speed,
        List<String> tags,
        List<String> weaponIds,
        List<String> armourIds,
        Attributes startingAttributes,
        List<String> defaultSummonIds) {
    
    public PartyMemberDefinition {
        tags = tags == null ? List.of() : List.copyOf(tags);
        weaponIds = weaponIds == null ? List.of() : List.copyOf(weaponIds);
        armourIds = armourIds == null ? List.of() : List.copyOf(armourIds);
        defaultSummonIds = defaultSummonIds == null ? List.of() : List.copyOf(defaultSummonIds);
        startingAttributes = startingAttributes == null ? Attributes.NONE : startingAttributes;
    }
}
