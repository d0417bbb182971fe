package com.example.battlecore.event;

public record ExpGrantedEvent(String memberId, String memberName, int amount, int newLevel) implements BattleEvent {
    
    @Override
    public Type type() {
        return Type.EXP_GRANTED;
    }
}
