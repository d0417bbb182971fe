package com.example.battlecore.event;

import java.util.List;

public record BattleStartedEvent(String battleId, List<String> enemyNames, int battleLevel) implements BattleEvent {
    
    public BattleStartedEvent {
        enemyNames = List.copyOf(enemyNames);
    }
    
    @Override
    public Type type() {
        return Type.BATTLE_STARTED;
    }
}
