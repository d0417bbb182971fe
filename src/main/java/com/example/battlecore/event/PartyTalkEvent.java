package com.example.battlecore.event;

public record PartyTalkEvent(String speakerId, String speakerName, String text) implements BattleEvent {
    
    @Override
    public Type type() {
        return Type.PARTY_TALK;
    }
}
