package com.example.battlecore.event;

/**
 * Something that happened during a battle, returned in order by every battle operation.
 * 
 * The set of implementations is closed; {@link #type()} identifies the variant so a renderer can
 * switch over it exhaustively.
 */
public interface BattleEvent {
    
    Type type();
    
    enum Type {
        BATTLE_STARTED,
        SUMMON_SPAWNED,
        ATTACK_RESOLVED,
        SKILL_USED,
        SKILL_FAILED,
        GUARD_APPLIED,
        ITEM_USED,
        DEBUFF_APPLIED,
        DEBUFF_EXPIRED,
        COMBATANT_DEFEATED,
        PARTY_TALK,
        GOLD_GRANTED,
        EXP_GRANTED,
        LEVEL_UP,
        LOOT_ACQUIRED,
        BATTLE_RESOLVED
    }
}
