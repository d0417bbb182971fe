package com.example.battlecore.event;

public record GuardAppliedEvent(String combatantId, String combatantName, int amount) implements BattleEvent {
    
    @Override
    public Type type() {
        return Type.GUARD_APPLIED;
    }
}
