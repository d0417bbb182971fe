package com.example.battlecore.event;

public record CombatantDefeatedEvent(String combatantId, String combatantName) implements BattleEvent {
    
    @Override
    public Type type() {
        return Type.COMBATANT_DEFEATED;
    }
}
