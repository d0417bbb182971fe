package com.example.battlecore.combat;

import com.example.battlecore.config.CombatConfig;
import com.example.battlecore.model.Side;
import com.example.battlecore.util.DeterministicRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Threat bookkeeping and AI target selection for both sides.
 * 
 * The RNG is drawn only to break exact ties, so a battle without ties consumes no randomness here.
 */
public class ThreatEngine {
    private static final Logger logger = LoggerFactory.getLogger(ThreatEngine.class);
    
    private final CombatConfig config;
    
    public ThreatEngine(CombatConfig config) {
        this.config = config;
    }
    
    /**
     * Starting threat of a target: (maxHp + defense) / divisor, at least 1, plus a bonus for the player.
     */
    public int baseThreat(Combatant target, String playerId) {
        int base = Math.max(1, (target.getStats().getMaxHp() + target.getStats().getDefense())
                / config.getAggroBaseDivisor());
        if (playerId != null && playerId.equals(target.getInstanceId())) {
            base += config.getPlayerBaseBonus();
        }
        return base;
    }
    
    /**
     * Seed every (enemy, living ally) and (ally, living enemy) pair that has no value yet.
     */
    public void seed(BattleState state) {
        for (Combatant ally : state.getLivingAllies()) {
            seedAlly(state, ally);
        }
    }
    
    /**
     * Seed one ally into every enemy's aggro table and its own threat table. Used for spawned summons.
     */
    public void seedAlly(BattleState state, Combatant ally) {
        String playerId = state.getPlayerId();
        for (Combatant enemy : state.getLivingEnemies()) {
            aggroTable(state, enemy).putIfAbsent(ally.getInstanceId(), baseThreat(ally, playerId));
            threatTable(state, ally).putIfAbsent(enemy.getInstanceId(), baseThreat(enemy, playerId));
        }
    }
    
    /**
     * Book damage that landed. Allied hits raise threat both ways; enemy hits remember the victim.
     */
    public void recordDamage(BattleState state, Combatant attacker, Combatant target, int damage) {
        if (damage <= 0 || !attacker.isHostileTo(target)) {
            return;
        }
        String playerId = state.getPlayerId();
        if (attacker.getSide() == Side.ALLIES) {
            int gain = damage + config.getHitBonus();
            aggroTable(state, target).merge(attacker.getInstanceId(), baseThreat(attacker, playerId) + gain,
                    (old, ignored) -> old + gain);
            threatTable(state, attacker).merge(target.getInstanceId(), baseThreat(target, playerId) + gain,
                    (old, ignored) -> old + gain);
        } else {
            state.getLastTarget().put(attacker.getInstanceId(), target.getInstanceId());
        }
    }
    
    /**
     * Pick the living ally an enemy attacks next and remember it as that enemy's last target.
     * 
     * Highest threat wins, ties broken by one RNG draw. An enemy that would hit its previous
     * target again switches to the best other ally unless its previous target leads by at least
     * the anti-repeat gap.
     */
    public TargetSelection selectEnemyTarget(BattleState state, Combatant enemy, DeterministicRng rng) {
        List<Combatant> living = state.getLivingAllies();
        if (living.isEmpty()) {
            throw new IllegalStateException("No living allies to target");
        }
        Map<String, Integer> table = aggroTable(state, enemy);
        Map<String, Integer> threats = new LinkedHashMap<>();
        for (Combatant ally : living) {
            int value = table.computeIfAbsent(ally.getInstanceId(), id -> baseThreat(ally, state.getPlayerId()));
            threats.put(ally.getInstanceId(), value);
        }
        
        List<Integer> sorted = new ArrayList<>(threats.values());
        sorted.sort(Comparator.reverseOrder());
        int top = sorted.get(0);
        List<Combatant> topAllies = withThreat(living, threats, top);
        
        String last = state.getLastTarget().get(enemy.getInstanceId());
        boolean lastIsTop = last != null && threats.containsKey(last) && threats.get(last) == top;
        
        Combatant chosen;
        boolean antiRepeat = false;
        if (lastIsTop && living.size() > 1) {
            int gap = top - sorted.get(1);
            if (gap >= config.getAntiRepeatIgnoreGap()) {
                chosen = state.findCombatant(last).orElseThrow();
            } else {
                List<Combatant> others = new ArrayList<>();
                for (Combatant ally : living) {
                    if (!ally.getInstanceId().equals(last)) others.add(ally);
                }
                int best = Integer.MIN_VALUE;
                for (Combatant ally : others) best = Math.max(best, threats.get(ally.getInstanceId()));
                chosen = pick(withThreat(others, threats, best), rng);
                antiRepeat = true;
            }
        } else {
            chosen = pick(topAllies, rng);
        }
        
        state.getLastTarget().put(enemy.getInstanceId(), chosen.getInstanceId());
        int value = threats.get(chosen.getInstanceId());
        logger.debug("{} targets {} (threat {}, anti-repeat {})",
                enemy.getInstanceId(), chosen.getInstanceId(), value, antiRepeat);
        return new TargetSelection(chosen, value, antiRepeat);
    }
    
    /**
     * Living enemies in descending order of this ally's threat toward them.
     * Equal-threat groups of more than one enemy are shuffled with the RNG.
     */
    public List<Combatant> orderEnemiesByThreat(BattleState state, Combatant ally, DeterministicRng rng) {
        Map<String, Integer> table = threatTable(state, ally);
        TreeMap<Integer, List<Combatant>> groups = new TreeMap<>(Comparator.reverseOrder());
        for (Combatant enemy : state.getLivingEnemies()) {
            int value = table.computeIfAbsent(enemy.getInstanceId(), id -> baseThreat(enemy, state.getPlayerId()));
            groups.computeIfAbsent(value, k -> new ArrayList<>()).add(enemy);
        }
        List<Combatant> ordered = new ArrayList<>();
        for (List<Combatant> group : groups.values()) {
            if (group.size() > 1) {
                rng.shuffle(group);
            }
            ordered.addAll(group);
        }
        return ordered;
    }
    
    public int getAggro(BattleState state, String enemyId, String allyId) {
        Map<String, Integer> table = state.getEnemyAggro().get(enemyId);
        return table == null ? 0 : table.getOrDefault(allyId, 0);
    }
    
    public int getPartyThreat(BattleState state, String allyId, String enemyId) {
        Map<String, Integer> table = state.getPartyThreat().get(allyId);
        return table == null ? 0 : table.getOrDefault(enemyId, 0);
    }
    
    private static Map<String, Integer> aggroTable(BattleState state, Combatant enemy) {
        return state.getEnemyAggro().computeIfAbsent(enemy.getInstanceId(), k -> new LinkedHashMap<>());
    }
    
    private static Map<String, Integer> threatTable(BattleState state, Combatant ally) {
        return state.getPartyThreat().computeIfAbsent(ally.getInstanceId(), k -> new LinkedHashMap<>());
    }
    
    private static List<Combatant> withThreat(List<Combatant> candidates, Map<String, Integer> threats, int value) {
        List<Combatant> out = new ArrayList<>();
        for (Combatant c : candidates) {
            if (threats.get(c.getInstanceId()) == value) out.add(c);
        }
        return out;
    }
    
    private static Combatant pick(List<Combatant> tied, DeterministicRng rng) {
        if (tied.size() == 1) {
            return tied.get(0);
        }
        return tied.get(rng.nextInt(0, tied.size() - 1));
    }
}
