package com.example.battlecore.event;

/**
 * A damaging skill hit one target. Multi-target skills produce one event per target.
 */
public record SkillUsedEvent(String actorId, String actorName,
                             String skillId, String skillName,
                             String targetId, String targetName,
                             int damage, int guardAbsorbed, int targetHp) implements BattleEvent {
    
    @Override
    public Type type() {
        return Type.SKILL_USED;
    }
}
