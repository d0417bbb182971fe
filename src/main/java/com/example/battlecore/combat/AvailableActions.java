package com.example.battlecore.combat;

import com.example.battlecore.model.SkillDefinition;

import java.util.List;

/**
 * What the current actor may do this turn.
 */
public record AvailableActions(String actorId, boolean canAttack,
                               List<SkillDefinition> skills,
                               boolean canUseItem, List<BattleItemOption> items,
                               boolean canTalk) {
    
    /** Nobody is acting */
    public static AvailableActions none() {
        return new AvailableActions(null, false, List.of(), false, List.of(), false);
    }
    
    public boolean canUseSkill() {
        return !skills.isEmpty();
    }
}
