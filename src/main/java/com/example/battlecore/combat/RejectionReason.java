package com.example.battlecore.combat;

/**
 * Why a requested battle action was refused.
 */
public enum RejectionReason {
    BATTLE_OVER,
    NO_CURRENT_ACTOR,
    NOT_ACTORS_TURN,
    UNKNOWN_COMBATANT,
    TARGET_NOT_ALIVE,
    INVALID_TARGET_SIDE,
    DUPLICATE_TARGET,
    TARGET_COUNT,
    INSUFFICIENT_MP,
    UNKNOWN_SKILL,
    SKILL_NOT_AVAILABLE,
    UNKNOWN_ITEM,
    ITEM_NOT_CONSUMABLE,
    TARGETING_NOT_SUPPORTED,
    ITEM_NOT_AVAILABLE,
    MISSING_ACTION_FIELD
}
