package com.example.battlecore.combat;

import com.example.battlecore.model.Side;

import java.util.List;

/**
 * Read-only picture of a combatant. Enemy HP and MP are already filtered by knowledge.
 *
 * @param debuffs display names of active debuffs
 */
public record CombatantView(String id, String name, Side side,
                            String hpDisplay, String mpDisplay,
                            boolean alive, int guardReduction,
                            List<String> debuffs) {
}
