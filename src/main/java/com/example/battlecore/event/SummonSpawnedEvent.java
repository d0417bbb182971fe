package com.example.battlecore.event;

public record SummonSpawnedEvent(String summonId, String summonName, String ownerId, int bondCost) implements BattleEvent {
    
    @Override
    public Type type() {
        return Type.SUMMON_SPAWNED;
    }
}
