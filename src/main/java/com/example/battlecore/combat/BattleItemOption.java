package com.example.battlecore.combat;

import com.example.battlecore.model.ItemDefinition;

/**
 * A consumable the party carries that can be used in battle.
 */
public record BattleItemOption(String itemId, String itemName, int quantity,
                               ItemDefinition.ItemTargeting targeting) {
}
