package com.example.battlecore.event;

import com.example.battlecore.model.Side;

public record BattleResolvedEvent(Side victor) implements BattleEvent {
    
    @Override
    public Type type() {
        return Type.BATTLE_RESOLVED;
    }
}
