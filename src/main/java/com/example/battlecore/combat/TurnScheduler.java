package com.example.battlecore.combat;

import com.example.battlecore.effect.DebuffEngine;
import com.example.battlecore.event.BattleEvent;
import com.example.battlecore.event.BattleResolvedEvent;
import com.example.battlecore.model.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Speed-ordered turn queue with round boundaries.
 * 
 * The queue is always the living combatants sorted by descending speed, ties by instance id.
 * Cycling back to the head of the queue starts a new round.
 */
public class TurnScheduler {
    private static final Logger logger = LoggerFactory.getLogger(TurnScheduler.class);
    
    /** Faster first, then lexicographic instance id */
    public static final Comparator<Combatant> TURN_ORDER =
            Comparator.comparingInt((Combatant c) -> -c.getStats().getSpeed())
                    .thenComparing(Combatant::getInstanceId);
    
    private final DebuffEngine debuffEngine;
    
    public TurnScheduler(DebuffEngine debuffEngine) {
        this.debuffEngine = debuffEngine;
    }
    
    /**
     * Recompute the queue from the living combatants. Clears the current actor when nobody is alive.
     */
    public void rebuild(BattleState state) {
        List<Combatant> living = new ArrayList<>();
        for (Combatant c : state.getAllCombatants()) {
            if (c.isAlive()) living.add(c);
        }
        living.sort(TURN_ORDER);
        List<String> ids = new ArrayList<>(living.size());
        for (Combatant c : living) ids.add(c.getInstanceId());
        state.replaceTurnQueue(ids);
        if (ids.isEmpty()) {
            state.setCurrentActorId(null);
        }
    }
    
    /**
     * Put the head of a freshly built queue in charge of round 1.
     */
    public void begin(BattleState state) {
        rebuild(state);
        List<String> queue = state.getTurnQueue();
        state.setRoundIndex(1);
        state.setCurrentActorId(queue.isEmpty() ? null : queue.get(0));
    }
    
    /**
     * Hand the turn to whoever follows {@code lastActorId}.
     * 
     * Moving back to the head of the queue starts a new round and expires debuffs. If the last actor
     * is no longer in the queue the head goes next. Nothing is scheduled once the battle is over.
     */
    public List<BattleEvent> advanceTurn(BattleState state, String lastActorId) {
        List<BattleEvent> events = new ArrayList<>();
        if (state.isOver()) {
            state.setCurrentActorId(null);
            return events;
        }
        rebuild(state);
        List<String> queue = state.getTurnQueue();
        if (queue.isEmpty()) {
            return events;
        }
        
        int idx = queue.indexOf(lastActorId);
        int nextIndex = idx >= 0 ? (idx + 1) % queue.size() : 0;
        boolean wrapped = nextIndex == 0;
        String next = queue.get(nextIndex);
        
        if (wrapped) {
            events.addAll(debuffEngine.startNewRound(state));
            logger.debug("Battle {} round {} begins", state.getBattleId(), state.getRoundIndex());
        }
        state.setCurrentActorId(next);
        return events;
    }
    
    /**
     * End the battle the moment one side has nobody left standing. The queue is rebuilt first so the
     * final queue holds only the survivors.
     * @return the resolution event, produced only by the call that ends the battle
     */
    public Optional<BattleResolvedEvent> checkVictory(BattleState state) {
        if (state.isOver()) {
            return Optional.empty();
        }
        Side winner = null;
        if (state.getLivingEnemies().isEmpty()) {
            winner = Side.ALLIES;
        } else if (state.getLivingAllies().isEmpty()) {
            winner = Side.ENEMIES;
        }
        if (winner == null) {
            return Optional.empty();
        }
        rebuild(state);
        state.end(winner);
        logger.info("Battle {} ended in round {}, victor {}", state.getBattleId(), state.getRoundIndex(), winner);
        return Optional.of(new BattleResolvedEvent(winner));
    }
}
