package com.example.battlecore.combat;

import com.example.battlecore.model.Side;

import java.util.List;

/**
 * Snapshot of a battle for rendering.
 */
public record BattleView(String battleId, int round, String currentActorId,
                         List<CombatantView> allies, List<CombatantView> enemies,
                         boolean over, Side victor) {
}
