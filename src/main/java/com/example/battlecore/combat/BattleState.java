package com.example.battlecore.combat;

import com.example.battlecore.knowledge.EnemyKnowledgeSnapshot;
import com.example.battlecore.model.Side;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A single battle in progress.
 *
 * Holds both sides, the turn queue, threat bookkeeping and the knowledge snapshot taken at battle start.
 * All mutation happens through the battle services, synchronously, inside the action that caused it.
 */
public class BattleState {

    private final String battleId;

    private CombatState state = CombatState.INITIALIZING;

    /** Player first, then party members in party order, then summons as they spawn */
    private final List<Combatant> allies = new ArrayList<>();

    private final List<Combatant> enemies = new ArrayList<>();

    /** Living combatant ids sorted by (-speed, id) */
    private final List<String> turnQueue = new ArrayList<>();

    private String currentActorId;

    /** Starts at 1 and grows by one per full cycle of the queue */
    private int roundIndex = 1;

    /** enemy id -> (ally id -> threat) */
    private final Map<String, Map<String, Integer>> enemyAggro = new LinkedHashMap<>();

    /** ally id -> (enemy id -> threat) */
    private final Map<String, Map<String, Integer>> partyThreat = new LinkedHashMap<>();

    /** enemy id -> ally id it last damaged */
    private final Map<String, String> lastTarget = new LinkedHashMap<>();

    /** enemy id -> what the party knew about it when the snapshot was taken */
    private final Map<String, EnemyKnowledgeSnapshot> knowledgeSnapshot = new LinkedHashMap<>();

    /** Knowledge keys revealed by party talk, for this battle only */
    private final Set<String> revealedKnowledgeKeys = new HashSet<>();

    private boolean over;

    private Side victor;

    private final String playerId;

    private boolean rewardsApplied;

    private boolean defeatApplied;

    public BattleState(String battleId, String playerId) {
        this.battleId = battleId;
        this.playerId = playerId;
    }

    // Identification

    public String getBattleId() { return battleId; }

    public String getPlayerId() { return playerId; }

    public CombatState getState() { return state; }

    public void setState(CombatState state) { this.state = state; }

    public boolean isActive() { return state == CombatState.ACTIVE; }

    // Combatants

    public List<Combatant> getAllies() { return Collections.unmodifiableList(allies); }

    public List<Combatant> getEnemies() { return Collections.unmodifiableList(enemies); }

    public void addAlly(Combatant ally) { allies.add(ally); }

    public void addEnemy(Combatant enemy) { enemies.add(enemy); }

    /**
     * Allies first, then enemies, each in insertion order.
     */
    public List<Combatant> getAllCombatants() {
        List<Combatant> all = new ArrayList<>(allies.size() + enemies.size());
        all.addAll(allies);
        all.addAll(enemies);
        return all;
    }

    public Optional<Combatant> findCombatant(String instanceId) {
        if (instanceId == null) return Optional.empty();
        for (Combatant c : allies) {
            if (c.getInstanceId().equals(instanceId)) return Optional.of(c);
        }
        for (Combatant c : enemies) {
            if (c.getInstanceId().equals(instanceId)) return Optional.of(c);
        }
        return Optional.empty();
    }

    public List<Combatant> getLivingAllies() {
        return living(allies);
    }

    public List<Combatant> getLivingEnemies() {
        return living(enemies);
    }

    public List<Combatant> getLiving(Side side) {
        return side == Side.ALLIES ? getLivingAllies() : getLivingEnemies();
    }

    private static List<Combatant> living(List<Combatant> list) {
        List<Combatant> out = new ArrayList<>();
        for (Combatant c : list) {
            if (c.isAlive()) out.add(c);
        }
        return out;
    }

    // Turn order

    public List<String> getTurnQueue() { return Collections.unmodifiableList(turnQueue); }

    void replaceTurnQueue(List<String> ids) {
        turnQueue.clear();
        turnQueue.addAll(ids);
    }

    public String getCurrentActorId() { return currentActorId; }

    public void setCurrentActorId(String currentActorId) { this.currentActorId = currentActorId; }

    public Optional<Combatant> getCurrentActor() {
        return findCombatant(currentActorId);
    }

    public int getRoundIndex() { return roundIndex; }

    public void setRoundIndex(int roundIndex) { this.roundIndex = roundIndex; }

    // Threat

    public Map<String, Map<String, Integer>> getEnemyAggro() { return enemyAggro; }

    public Map<String, Map<String, Integer>> getPartyThreat() { return partyThreat; }

    public Map<String, String> getLastTarget() { return lastTarget; }

    // Knowledge

    public Map<String, EnemyKnowledgeSnapshot> getKnowledgeSnapshot() { return knowledgeSnapshot; }

    public Set<String> getRevealedKnowledgeKeys() { return revealedKnowledgeKeys; }

    // Resolution

    public boolean isOver() { return over; }

    public Side getVictor() { return victor; }

    /**
     * Mark the battle as finished with the given winner. The current actor is cleared.
     */
    void end(Side winner) {
        this.over = true;
        this.victor = winner;
        this.state = CombatState.ENDED;
        this.currentActorId = null;
    }

    public boolean isRewardsApplied() { return rewardsApplied; }

    void setRewardsApplied(boolean rewardsApplied) { this.rewardsApplied = rewardsApplied; }

    public boolean isDefeatApplied() { return defeatApplied; }

    void setDefeatApplied(boolean defeatApplied) { this.defeatApplied = defeatApplied; }

    @Override
    public String toString() {
        return "BattleState{" + battleId + ", " + state + ", round " + roundIndex
                + ", actor " + currentActorId + ", queue " + turnQueue + "}";
    }
}
