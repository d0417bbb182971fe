package com.example.battlecore.event;

import com.example.battlecore.effect.DebuffType;

public record DebuffAppliedEvent(String targetId, String targetName, DebuffType debuffType, int amount, int expiresAtRound) implements BattleEvent {
    
    @Override
    public Type type() {
        return Type.DEBUFF_APPLIED;
    }
}
