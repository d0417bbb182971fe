package com.example.battlecore.combat;

import java.util.List;

/**
 * A decision made by the player for the current actor. Fields an action type does not use stay null.
 */
public record BattleAction(ActionType type, String targetId, List<String> targetIds,
                           String skillId, String itemId, String speakerId) {
    
    public enum ActionType {
        ATTACK,
        SKILL,
        TALK,
        ITEM
    }
    
    public static BattleAction attack(String targetId) {
        return new BattleAction(ActionType.ATTACK, targetId, null, null, null, null);
    }
    
    public static BattleAction skill(String skillId, List<String> targetIds) {
        return new BattleAction(ActionType.SKILL, null, targetIds, skillId, null, null);
    }
    
    public static BattleAction talk(String speakerId) {
        return new BattleAction(ActionType.TALK, null, null, null, null, speakerId);
    }
    
    public static BattleAction item(String itemId, String targetId) {
        return new BattleAction(ActionType.ITEM, targetId, null, null, itemId, null);
    }
}
