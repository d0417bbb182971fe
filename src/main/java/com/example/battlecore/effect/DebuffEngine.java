package com.example.battlecore.effect;

import com.example.battlecore.combat.BattleState;
import com.example.battlecore.combat.Combatant;
import com.example.battlecore.event.BattleEvent;
import com.example.battlecore.event.DebuffExpiredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies non-stacking debuffs and expires them at round boundaries.
 * Debuffs only ever expire inside {@link #startNewRound(BattleState)}, never mid-round.
 */
public class DebuffEngine {
    private static final Logger logger = LoggerFactory.getLogger(DebuffEngine.class);

    /**
     * Place a debuff unless one of the same type is already active.
     * @return true if applied; false leaves the debuff list untouched
     */
    public boolean applyNoStack(Combatant target, DebuffType type, int amount, int expiresAtRound) {
        for (ActiveDebuff existing : target.getDebuffs()) {
            if (existing.getType() == type) {
                logger.debug("{} already has {}, not stacking", target.getInstanceId(), type);
                return false;
            }
        }
        target.addDebuff(new ActiveDebuff(type, amount, expiresAtRound));
        logger.debug("{} gains {} {} until round {}", target.getInstanceId(), type, amount, expiresAtRound);
        return true;
    }

    /**
     * Sum of the magnitudes of every active debuff of {@code type}.
     */
    public static int total(Combatant combatant, DebuffType type) {
        int sum = 0;
        for (ActiveDebuff d : combatant.getDebuffs()) {
            if (d.getType() == type) sum += d.getAmount();
        }
        return sum;
    }

    /**
     * Advance to the next round and drop every debuff whose expiry round has been reached.
     * Dead combatants had their debuffs cleared when they fell, so they never report an expiry.
     */
    public List<BattleEvent> startNewRound(BattleState state) {
        state.setRoundIndex(state.getRoundIndex() + 1);
        int round = state.getRoundIndex();
        List<BattleEvent> events = new ArrayList<>();
        for (Combatant c : state.getAllCombatants()) {
            List<ActiveDebuff> toExpire = new ArrayList<>();
            for (ActiveDebuff d : c.getDebuffs()) {
                if (d.isExpired(round)) toExpire.add(d);
            }
            for (ActiveDebuff d : toExpire) {
                c.removeDebuff(d);
                if (c.isAlive()) {
                    events.add(new DebuffExpiredEvent(c.getInstanceId(), c.getDisplayName(), d.getType()));
                }
            }
        }
        logger.debug("Battle {} enters round {} ({} debuffs expired)", state.getBattleId(), round, events.size());
        return events;
    }
}
