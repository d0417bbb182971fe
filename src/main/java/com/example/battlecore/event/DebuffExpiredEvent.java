package com.example.battlecore.event;

import com.example.battlecore.effect.DebuffType;

public record DebuffExpiredEvent(String targetId, String targetName, DebuffType debuffType) implements BattleEvent {
    
    @Override
    public Type type() {
        return Type.DEBUFF_EXPIRED;
    }
}
