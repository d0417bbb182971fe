package com.example.battlecore.combat;

/**
 * Outcome of an enemy choosing whom to attack.
 *
 * @param threat the chosen target's threat value at the time of the choice
 * @param antiRepeatApplied true when the enemy turned away from its previous target
 */
public record TargetSelection(Combatant target, int threat, boolean antiRepeatApplied) {
}
