package com.example.battlecore.event;

public record LevelUpEvent(String memberId, String memberName, int newLevel) implements BattleEvent {
    
    @Override
    public Type type() {
        return Type.LEVEL_UP;
    }
}
