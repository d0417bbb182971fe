package com.example.battlecore.event;

/**
 * A basic attack landed.
 *
 * @param damage HP actually removed, after any guard absorbed its share
 */
public record AttackResolvedEvent(String attackerId, String attackerName,
                                  String targetId, String targetName,
                                  int damage, int guardAbsorbed, int targetHp) implements BattleEvent {
    
    @Override
    public Type type() {
        return Type.ATTACK_RESOLVED;
    }
}
