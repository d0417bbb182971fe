package com.example.battlecore;

import com.example.battlecore.combat.BattleService;
import com.example.battlecore.combat.BattleState;
import com.example.battlecore.combat.FactoryException;
import com.example.battlecore.event.BattleEvent;
import com.example.battlecore.event.ExpGrantedEvent;
import com.example.battlecore.event.GoldGrantedEvent;
import com.example.battlecore.event.LevelUpEvent;
import com.example.battlecore.event.LootAcquiredEvent;
import com.example.battlecore.model.GameState;
import com.example.battlecore.model.Side;
import com.example.battlecore.model.Stats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Victory and defeat outcome Tests")
public class VictoryResolverTest {

    private BattleService service;

    @BeforeEach
    void setUp() {
        service = new BattleService(TestFixtures.content(), TestFixtures.config());
    }

    private BattleState winAgainst(String enemyOrGroupId, GameState state) throws FactoryException {
        BattleState battle = service.startBattle(enemyOrGroupId, state, state.getRng()).battle();
        TestFixtures.softenEnemies(battle);
        TestFixtures.playOut(service, battle, state);
        assertEquals(Side.ALLIES, battle.getVictor());
        return battle;
    }

    @Test
    @DisplayName("Beating the goblin pack pays gold, exp, a level and loot")
    void testVictory_goblinPack() throws FactoryException {
        GameState state = TestFixtures.gameState(12);
        BattleState battle = winAgainst("goblin_pack", state);

        List<BattleEvent> events = service.applyVictoryRewards(battle, state, state.getRng());

        assertEquals(new GoldGrantedEvent(12, 12), events.get(0));
        assertEquals(new ExpGrantedEvent("hero", "Hero", 17, 2), events.get(1));
        assertEquals(new LevelUpEvent("hero", "Hero", 2), events.get(2));
        assertEquals(12, state.getGold());
        assertEquals(2, state.getLevel("hero"));
        assertEquals(7, state.getExp("hero"));

        int ears = 0;
        for (BattleEvent e : events) {
            if (e instanceof LootAcquiredEvent loot && loot.itemId().equals("goblin_ear")) ears += loot.quantity();
        }
        assertEquals(2, ears);
        assertEquals(2, state.getInventory().getQuantity("goblin_ear"));

        assertEquals(2, service.getKnowledgeService().getKillCount(state, "goblin"));
        assertEquals(1, service.getKnowledgeService().getKillCount(state, "slime_family"));
        assertEquals(0, service.getKnowledgeService().getKillCount(state, "slime"));

        Stats stats = state.getPlayer().getStats();
        assertEquals(stats.getMaxHp(), stats.getHp());
        assertEquals(stats.getMaxMp(), stats.getMp());
        assertFalse(state.isLastBattleDefeat());
    }

    @Test
    @DisplayName("Rewards are applied only once per battle")
    void testVictory_idempotent() throws FactoryException {
        GameState state = TestFixtures.gameState(12);
        BattleState battle = winAgainst("goblin_pack", state);
        service.applyVictoryRewards(battle, state, state.getRng());
        Map<String, Object> rng = state.getRng().exportState();
        Map<String, Integer> inventory = Map.copyOf(state.getInventory().getItems());

        assertTrue(service.applyVictoryRewards(battle, state, state.getRng()).isEmpty());
        assertEquals(12, state.getGold());
        assertEquals(2, service.getKnowledgeService().getKillCount(state, "goblin"));
        assertEquals(inventory, state.getInventory().getItems());
        assertEquals(rng, state.getRng().exportState());
    }

    @Test
    @DisplayName("Exp is split across the party with the remainder going to the player")
    void testVictory_expSplit() throws FactoryException {
        GameState state = TestFixtures.gameStateWithMira(8);
        BattleState battle = winAgainst("goblin_pack", state);

        List<BattleEvent> events = service.applyVictoryRewards(battle, state, state.getRng());
        assertTrue(events.contains(new ExpGrantedEvent("hero", "Hero", 9, 1)));
        assertTrue(events.contains(new ExpGrantedEvent("mira", "Mira", 8, 1)));
        assertEquals(9, state.getExp("hero"));
        assertEquals(8, state.getExp("mira"));
        for (BattleEvent e : events) {
            assertFalse(e instanceof LevelUpEvent);
        }
    }

    @Test
    @DisplayName("Enemies without a matching loot table draw nothing from the RNG")
    void testVictory_noLootTable_noRng() throws FactoryException {
        GameState state = TestFixtures.gameState(5);
        BattleState battle = winAgainst("slime", state);
        Map<String, Object> before = state.getRng().exportState();

        List<BattleEvent> events = service.applyVictoryRewards(battle, state, state.getRng());
        assertEquals(before, state.getRng().exportState());
        assertEquals(2, state.getGold());
        for (BattleEvent e : events) {
            assertFalse(e instanceof LootAcquiredEvent);
        }
    }

    @Test
    void testVictory_certainDrop() throws FactoryException {
        GameState state = TestFixtures.gameState(5);
        BattleState battle = winAgainst("wolf", state);
        List<BattleEvent> events = service.applyVictoryRewards(battle, state, state.getRng());
        assertTrue(events.contains(new LootAcquiredEvent("potion", "Potion", 1)));
        assertEquals(1, state.getInventory().getQuantity("potion"));
    }

    @Test
    void testVictory_beforeTheEnd() throws FactoryException {
        GameState state = TestFixtures.gameState(5);
        BattleState battle = service.startBattle("wolf", state, state.getRng()).battle();
        assertTrue(service.applyVictoryRewards(battle, state, state.getRng()).isEmpty());
        assertFalse(service.applyDefeatOutcome(battle, state));
    }

    @Test
    @DisplayName("Defeat restores the player and flags the loss once")
    void testDefeat() throws FactoryException {
        GameState state = TestFixtures.gameState(5);
        BattleState battle = service.startBattle("wolf", state, state.getRng()).battle();
        state.getPlayer().getStats().setHp(1);

        service.runEnemyTurn(battle, state.getRng());
        assertTrue(battle.isOver());
        assertEquals(Side.ENEMIES, battle.getVictor());

        assertTrue(service.applyVictoryRewards(battle, state, state.getRng()).isEmpty());
        assertTrue(service.applyDefeatOutcome(battle, state));
        assertTrue(state.isLastBattleDefeat());
        assertEquals(36, state.getPlayer().getStats().getHp());
        assertEquals(12, state.getPlayer().getStats().getMp());
        assertEquals(0, state.getGold());

        assertFalse(service.applyDefeatOutcome(battle, state));
    }
}
