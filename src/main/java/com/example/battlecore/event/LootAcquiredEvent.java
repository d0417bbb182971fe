package com.example.battlecore.event;

public record LootAcquiredEvent(String itemId, String itemName, int quantity) implements BattleEvent {
    
    @Override
    public Type type() {
        return Type.LOOT_ACQUIRED;
    }
}
