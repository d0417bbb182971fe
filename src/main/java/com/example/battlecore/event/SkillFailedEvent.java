package com.example.battlecore.event;

/**
 * A skill was paid for but did nothing.
 */
public record SkillFailedEvent(String actorId, String actorName, String skillId, Reason reason) implements BattleEvent {
    
    public enum Reason {
        /** The skill's effect type is not one the engine knows how to resolve */
        UNSUPPORTED_EFFECT
    }
    
    @Override
    public Type type() {
        return Type.SKILL_FAILED;
    }
}
