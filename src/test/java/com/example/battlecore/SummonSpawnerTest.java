package com.example.battlecore;

import com.example.battlecore.combat.BattleService;
import com.example.battlecore.combat.BattleState;
import com.example.battlecore.combat.Combatant;
import com.example.battlecore.combat.FactoryException;
import com.example.battlecore.combat.SummonSpawner;
import com.example.battlecore.event.BattleEvent;
import com.example.battlecore.event.SummonSpawnedEvent;
import com.example.battlecore.model.Attributes;
import com.example.battlecore.model.GameState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SummonSpawner Tests")
public class SummonSpawnerTest {

    private BattleService service;

    @BeforeEach
    void setUp() {
        service = new BattleService(TestFixtures.content(), TestFixtures.config());
    }

    private static List<SummonSpawnedEvent> spawned(List<BattleEvent> events) {
        List<SummonSpawnedEvent> out = new ArrayList<>();
        for (BattleEvent e : events) {
            if (e instanceof SummonSpawnedEvent s) out.add(s);
        }
        return out;
    }

    private static List<Combatant> summons(BattleState battle) {
        List<Combatant> out = new ArrayList<>();
        for (Combatant ally : battle.getAllies()) {
            if (ally.isSummon()) out.add(ally);
        }
        return out;
    }

    @Test
    @DisplayName("Loadout stops at the first summon the owner cannot afford")
    void testSpawn_stopsAtFirstUnaffordable() throws FactoryException {
        GameState state = TestFixtures.gameState(3);
        state.getPlayer().setEquippedSummons(List.of("wisp", "golem", "sprite"));

        BattleService.BattleStart start = service.startBattle("goblin", state, state.getRng());
        List<SummonSpawnedEvent> events = spawned(start.events());
        assertEquals(1, events.size());
        assertEquals("Wisp", events.get(0).summonName());
        assertEquals("hero", events.get(0).ownerId());
        assertEquals(1, events.get(0).bondCost());
        assertEquals(1, summons(start.battle()).size());
    }

    @Test
    @DisplayName("Summon stats grow with the owner's BOND")
    void testSpawn_bondScaledStats() throws FactoryException {
        GameState state = TestFixtures.gameState(3);
        state.getPlayer().setEquippedSummons(List.of("wisp"));
        BattleState battle = service.startBattle("goblin", state, state.getRng()).battle();

        Combatant wisp = summons(battle).get(0);
        assertEquals(12, wisp.getStats().getMaxHp());
        assertEquals(12, wisp.getStats().getHp());
        assertEquals(4, wisp.getStats().getAttack());
        assertEquals(4, wisp.getStats().getSpeed());
        assertEquals("hero", wisp.getOwnerId());
        assertEquals(1, wisp.getBondCost());
        assertEquals("wisp", wisp.getSourceId());
        assertEquals(List.of(SummonSpawner.SUMMON_TAG, "spirit"), wisp.getTags());
        assertTrue(wisp.getInstanceId().startsWith("summon_"));
    }

    @Test
    @DisplayName("Summons join the turn queue and every enemy's aggro table")
    void testSpawn_joinsQueueAndThreat() throws FactoryException {
        GameState state = TestFixtures.gameState(3);
        state.getPlayer().setEquippedSummons(List.of("wisp"));
        BattleState battle = service.startBattle("goblin_pack", state, state.getRng()).battle();
        Combatant wisp = summons(battle).get(0);

        assertTrue(battle.getTurnQueue().contains(wisp.getInstanceId()));
        for (Combatant enemy : battle.getEnemies()) {
            assertEquals(2, service.getThreatEngine().getAggro(battle, enemy.getInstanceId(), wisp.getInstanceId()));
        }
    }

    @Test
    void testSpawn_partyMemberDefaultLoadout() throws FactoryException {
        GameState state = TestFixtures.gameStateWithMira(3);
        BattleState battle = service.startBattle("goblin", state, state.getRng()).battle();

        List<Combatant> summons = summons(battle);
        assertEquals(1, summons.size());
        assertEquals("Sprite", summons.get(0).getDisplayName());
        assertEquals("party_mira", summons.get(0).getOwnerId());
        assertEquals(summons.get(0).getInstanceId(), battle.getCurrentActorId());
    }

    @Test
    void testSpawn_zeroBondSpawnsNothing() throws FactoryException {
        GameState state = TestFixtures.gameStateWithMira(3);
        state.getPartyMemberSummons().put("mira", List.of("sprite"));
        state.getPartyMemberAttributes().put("mira",
                new Attributes(1, 2, 1, 1, 0));
        BattleState battle = service.startBattle("goblin", state, state.getRng()).battle();
        assertTrue(summons(battle).isEmpty());
    }

    @Test
    void testSpawn_unknownSummonFails() {
        GameState state = TestFixtures.gameState(3);
        state.getPlayer().setEquippedSummons(List.of("phoenix"));
        assertThrows(FactoryException.class, () -> service.startBattle("goblin", state, state.getRng()));
    }

    @Test
    @DisplayName("The same seed spawns the same summon ids")
    void testSpawn_deterministicIds() throws FactoryException {
        GameState first = TestFixtures.gameStateWithMira(99);
        GameState second = TestFixtures.gameStateWithMira(99);
        BattleState a = service.startBattle("goblin_pack", first, first.getRng()).battle();
        BattleState b = service.startBattle("goblin_pack", second, second.getRng()).battle();
        assertEquals(summons(a).get(0).getInstanceId(), summons(b).get(0).getInstanceId());
        assertEquals(a.getTurnQueue(), b.getTurnQueue());
    }
}
