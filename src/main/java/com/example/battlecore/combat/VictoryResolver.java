package com.example.battlecore.combat;

import com.example.battlecore.config.CombatConfig;
import com.example.battlecore.event.BattleEvent;
import com.example.battlecore.event.ExpGrantedEvent;
import com.example.battlecore.event.GoldGrantedEvent;
import com.example.battlecore.event.LevelUpEvent;
import com.example.battlecore.knowledge.KnowledgeDisclosure;
import com.example.battlecore.knowledge.KnowledgeService;
import com.example.battlecore.model.EnemyDefinition;
import com.example.battlecore.model.GameState;
import com.example.battlecore.model.PartyMemberDefinition;
import com.example.battlecore.model.Player;
import com.example.battlecore.model.Side;
import com.example.battlecore.persistence.CombatContent;
import com.example.battlecore.util.DeterministicRng;
import com.example.battlecore.util.LootRoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies the outcome of a finished battle to the persistent game state.
 * Both outcomes are idempotent: only the first call on a battle changes anything.
 */
public class VictoryResolver {
    private static final Logger logger = LoggerFactory.getLogger(VictoryResolver.class);

    private final CombatContent content;
    private final CombatConfig config;
    private final KnowledgeService knowledgeService;
    private final KnowledgeDisclosure disclosure;
    private final CombatantFactory combatantFactory;
    private final LootRoller lootRoller;

    public VictoryResolver(CombatContent content, CombatConfig config, KnowledgeService knowledgeService,
                           KnowledgeDisclosure disclosure, CombatantFactory combatantFactory, LootRoller lootRoller) {
        this.content = content;
        this.config = config;
        this.knowledgeService = knowledgeService;
        this.disclosure = disclosure;
        this.combatantFactory = combatantFactory;
        this.lootRoller = lootRoller;
    }

    /**
     * Grant gold, experience, kills and loot for a battle the allies won.
     *
     * @return the reward events; empty when the allies did not win or rewards were already applied
     */
    public List<BattleEvent> applyVictoryRewards(BattleState battle, GameState state, DeterministicRng rng) {
        if (!battle.isOver() || battle.getVictor() != Side.ALLIES || battle.isRewardsApplied()) {
            return List.of();
        }
        battle.setRewardsApplied(true);
        Player player = state.getPlayer();
        List<BattleEvent> events = new ArrayList<>();

        if (player != null) {
            player.getStats().restoreMp();
        }
        state.setLastBattleDefeat(false);

        int totalGold = 0;
        int totalExp = 0;
        Map<String, Integer> kills = new LinkedHashMap<>();
        List<Combatant> defeated = new ArrayList<>();
        for (Combatant enemy : battle.getEnemies()) {
            if (enemy.isAlive()) {
                continue;
            }
            defeated.add(enemy);
            kills.merge(disclosure.knowledgeKeyOf(enemy), 1, Integer::sum);
            Optional<EnemyDefinition> def = content.enemies().find(enemy.getSourceId());
            if (def.isPresent()) {
                totalGold += Math.max(0, def.get().rewardGold());
                totalExp += Math.max(0, def.get().rewardExp());
            }
        }

        if (totalGold > 0) {
            state.addGold(totalGold);
            events.add(new GoldGrantedEvent(totalGold, state.getGold()));
        }

        if (totalExp > 0 && player != null) {
            List<String> participants = new ArrayList<>();
            participants.add(player.getId());
            participants.addAll(state.getPartyMemberIds());
            int share = totalExp / participants.size();
            int remainder = totalExp % participants.size();
            for (String memberId : participants) {
                int amount = memberId.equals(player.getId()) ? share + remainder : share;
                if (amount > 0) {
                    events.addAll(awardExp(state, memberId, amount));
                }
            }
        }

        knowledgeService.recordKills(state, kills);

        for (Combatant enemy : defeated) {
            events.addAll(lootRoller.roll(enemy.getTags(), state.getInventory(), rng));
        }

        logger.info("Battle {} rewards: {} gold, {} exp, {} kills recorded",
                battle.getBattleId(), totalGold, totalExp, defeated.size());
        return events;
    }

    /**
     * Flag the defeat and put the player back on their feet with full HP and MP.
     *
     * @return true the first time it is applied to a battle the enemies won
     */
    public boolean applyDefeatOutcome(BattleState battle, GameState state) {
        if (!battle.isOver() || battle.getVictor() != Side.ENEMIES || battle.isDefeatApplied()) {
            return false;
        }
        battle.setDefeatApplied(true);
        state.setLastBattleDefeat(true);
        if (state.getPlayer() != null) {
            state.getPlayer().getStats().restoreHp();
            state.getPlayer().getStats().restoreMp();
        }
        logger.info("Battle {} lost; player restored", battle.getBattleId());
        return true;
    }

    private List<BattleEvent> awardExp(GameState state, String memberId, int amount) {
        List<BattleEvent> events = new ArrayList<>();
        int level = state.getLevel(memberId);
        int exp = state.getExp(memberId) + amount;
        List<Integer> reached = new ArrayList<>();
        int threshold = config.expToNextLevel(level);
        while (exp >= threshold) {
            exp -= threshold;
            level++;
            reached.add(level);
            threshold = config.expToNextLevel(level);
        }
        state.getMemberLevels().put(memberId, level);
        state.getMemberExp().put(memberId, exp);

        String name = memberName(state, memberId);
        events.add(new ExpGrantedEvent(memberId, name, amount, level));
        for (int newLevel : reached) {
            events.add(new LevelUpEvent(memberId, name, newLevel));
        }
        if (!reached.isEmpty()) {
            Player player = state.getPlayer();
            if (player != null && memberId.equals(player.getId())) {
                combatantFactory.refreshPlayerStats(state);
                player.getStats().restoreHp();
                player.getStats().restoreMp();
            }
            logger.debug("{} reached level {}", memberId, level);
        }
        return events;
    }

    private String memberName(GameState state, String memberId) {
        Player player = state.getPlayer();
        if (player != null && memberId.equals(player.getId())) {
            return player.getName();
        }
        return content.partyMembers().find(memberId).map(PartyMemberDefinition::name).orElse(memberId);
    }
}
