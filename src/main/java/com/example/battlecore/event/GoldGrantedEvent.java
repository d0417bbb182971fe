package com.example.battlecore.event;

public record GoldGrantedEvent(int amount, int totalGold) implements BattleEvent {
    
    @Override
    public Type type() {
        return Type.GOLD_GRANTED;
    }
}
