package com.example.battlecore;

import com.example.battlecore.combat.ActionRejectedException;
import com.example.battlecore.combat.BattleService;
import com.example.battlecore.combat.BattleState;
import com.example.battlecore.combat.CombatState;
import com.example.battlecore.combat.Combatant;
import com.example.battlecore.combat.FactoryException;
import com.example.battlecore.combat.RejectionReason;
import com.example.battlecore.effect.DebuffType;
import com.example.battlecore.event.AttackResolvedEvent;
import com.example.battlecore.event.BattleEvent;
import com.example.battlecore.event.BattleResolvedEvent;
import com.example.battlecore.event.BattleStartedEvent;
import com.example.battlecore.event.CombatantDefeatedEvent;
import com.example.battlecore.event.DebuffAppliedEvent;
import com.example.battlecore.event.DebuffExpiredEvent;
import com.example.battlecore.event.GuardAppliedEvent;
import com.example.battlecore.event.ItemUsedEvent;
import com.example.battlecore.event.SkillFailedEvent;
import com.example.battlecore.event.SkillUsedEvent;
import com.example.battlecore.model.Equipment;
import com.example.battlecore.model.GameState;
import com.example.battlecore.model.Side;
import com.example.battlecore.util.DeterministicRng;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BattleService Tests")
public class BattleServiceTest {

    private BattleService service;
    private GameState state;

    @BeforeEach
    void setUp() {
        service = new BattleService(TestFixtures.content(), TestFixtures.config());
        state = TestFixtures.gameState(1);
    }

    private BattleState start(String enemyOrGroupId) throws FactoryException {
        return service.startBattle(enemyOrGroupId, state, state.getRng()).battle();
    }

    private static String enemyId(BattleState battle, int index) {
        return battle.getEnemies().get(index).getInstanceId();
    }

    private static <T extends BattleEvent> T first(List<BattleEvent> events, Class<T> type) {
        for (BattleEvent e : events) {
            if (type.isInstance(e)) return type.cast(e);
        }
        throw new AssertionError("No " + type.getSimpleName() + " in " + events);
    }

    private static boolean contains(List<BattleEvent> events, Class<? extends BattleEvent> type) {
        for (BattleEvent e : events) {
            if (type.isInstance(e)) return true;
        }
        return false;
    }

    /** Everything an action could change, flattened for comparison. */
    private String fingerprint(BattleState battle) {
        StringBuilder sb = new StringBuilder();
        for (Combatant c : battle.getAllCombatants()) {
            sb.append(c.getInstanceId()).append(':').append(c.getStats()).append(':')
                    .append(c.getGuardReduction()).append(':').append(c.getDebuffs().size()).append(';');
        }
        sb.append(battle.getCurrentActorId()).append('|').append(battle.getRoundIndex()).append('|')
                .append(battle.getEnemyAggro()).append('|').append(battle.getPartyThreat()).append('|')
                .append(battle.getLastTarget()).append('|').append(battle.getRevealedKnowledgeKeys()).append('|')
                .append(state.getInventory().getItems()).append('|').append(state.getRng().exportState());
        return sb.toString();
    }

    private void assertRejected(BattleState battle, RejectionReason reason, Executable action) {
        String before = fingerprint(battle);
        ActionRejectedException e = assertThrows(ActionRejectedException.class, action);
        assertEquals(reason, e.getReason());
        assertEquals(before, fingerprint(battle), "rejected action changed state");
    }

    // Setup

    @Test
    void testStart_unknownId() {
        assertThrows(FactoryException.class, () -> start("dragon"));
    }

    @Test
    void testStart_emptyGroup() {
        assertThrows(FactoryException.class, () -> start("empty_group"));
    }

    @Test
    void testStart_noPlayer() {
        GameState empty = new GameState(new DeterministicRng(1));
        assertThrows(FactoryException.class, () -> service.startBattle("goblin", empty, empty.getRng()));
    }

    @Test
    @DisplayName("A group battle names duplicates, orders turns by speed and opens round 1")
    void testStart_group() throws FactoryException {
        BattleService.BattleStart start = service.startBattle("goblin_pack", state, state.getRng());
        BattleState battle = start.battle();

        BattleStartedEvent started = (BattleStartedEvent) start.events().get(0);
        assertEquals(List.of("Goblin (1)", "Goblin (2)", "Slime"), started.enemyNames());
        assertEquals(0, started.battleLevel());
        assertTrue(battle.getBattleId().startsWith("battle_"));
        assertEquals(battle.getBattleId(), started.battleId());

        HashSet<String> ids = new HashSet<>();
        for (Combatant enemy : battle.getEnemies()) {
            assertTrue(enemy.getInstanceId().startsWith("enemy_"));
            ids.add(enemy.getInstanceId());
        }
        assertEquals(3, ids.size());

        assertEquals(CombatState.ACTIVE, battle.getState());
        assertEquals(1, battle.getRoundIndex());
        assertEquals("hero", battle.getCurrentActorId());
        assertEquals(4, battle.getTurnQueue().size());
        assertEquals(enemyId(battle, 2), battle.getTurnQueue().get(3));
    }

    @Test
    void testStart_playerStats() throws FactoryException {
        BattleState battle = start("goblin");
        Combatant hero = battle.findCombatant("hero").orElseThrow();
        assertEquals(36, hero.getStats().getMaxHp());
        assertEquals(12, hero.getStats().getMaxMp());
        assertEquals(6, hero.getStats().getSpeed());
        assertEquals(List.of("sword"), hero.getWeaponTags());
        assertSame(state.getPlayer().getStats(), hero.getStats());
    }

    @Test
    @DisplayName("Battle level scales enemy stats")
    void testStart_battleLevel() throws FactoryException {
        BattleState battle = service.startBattle("goblin", state, state.getRng(), 2).battle();
        Combatant goblin = battle.getEnemies().get(0);
        assertEquals(44, goblin.getStats().getMaxHp());
        assertEquals(9, goblin.getStats().getAttack());
        assertEquals(3, goblin.getStats().getDefense());
    }

    @Test
    @DisplayName("The same seed produces the same battle")
    void testStart_deterministic() throws FactoryException {
        GameState other = TestFixtures.gameState(1);
        BattleState a = start("goblin_pack");
        BattleState b = service.startBattle("goblin_pack", other, other.getRng()).battle();
        assertEquals(a.getBattleId(), b.getBattleId());
        assertEquals(a.getTurnQueue(), b.getTurnQueue());
        assertEquals(state.getRng().exportState(), other.getRng().exportState());
    }

    // Basic attacks and skills

    @Test
    @DisplayName("A three-round duel against a goblin")
    void testDuel() throws FactoryException {
        BattleState battle = start("goblin");
        String goblin = enemyId(battle, 0);
        Map<String, Object> rng = state.getRng().exportState();
        assertEquals(7, service.estimateDamage(battle, "hero", goblin, null));
        assertEquals(rng, state.getRng().exportState());

        List<BattleEvent> events = service.basicAttack(battle, "hero", goblin);
        AttackResolvedEvent hit = (AttackResolvedEvent) events.get(0);
        assertEquals(7, hit.damage());
        assertEquals(13, hit.targetHp());
        assertEquals(goblin, battle.getCurrentActorId());

        events = service.runEnemyTurn(battle, state.getRng());
        SkillUsedEvent stab = first(events, SkillUsedEvent.class);
        assertEquals("goblin_stab", stab.skillId());
        assertEquals("hero", stab.targetId());
        assertEquals(5, stab.damage());
        assertEquals(2, battle.findCombatant(goblin).orElseThrow().getStats().getMp());
        assertEquals(2, battle.getRoundIndex());
        assertEquals("hero", battle.getCurrentActorId());

        service.basicAttack(battle, "hero", goblin);
        service.runEnemyTurn(battle, state.getRng());
        assertEquals(0, battle.findCombatant(goblin).orElseThrow().getStats().getMp());
        assertEquals(26, state.getPlayer().getStats().getHp());

        events = service.basicAttack(battle, "hero", goblin);
        assertEquals(new CombatantDefeatedEvent(goblin, "Goblin"), events.get(1));
        assertEquals(new BattleResolvedEvent(Side.ALLIES), events.get(2));
        assertTrue(battle.isOver());
        assertNull(battle.getCurrentActorId());
        assertEquals(3, battle.getRoundIndex());
    }

    @Test
    @DisplayName("Out of MP, enemies fall back to a basic attack")
    void testEnemyTurn_basicAttackWithoutMp() throws FactoryException {
        BattleState battle = start("goblin");
        String goblin = enemyId(battle, 0);
        battle.findCombatant(goblin).orElseThrow().getStats().setMp(1);
        service.basicAttack(battle, "hero", goblin);
        List<BattleEvent> events = service.runEnemyTurn(battle, state.getRng());
        AttackResolvedEvent attack = first(events, AttackResolvedEvent.class);
        assertEquals(3, attack.damage());
    }

    @Test
    void testCleave_hitsTwo() throws FactoryException {
        BattleState battle = start("goblin_pack");
        List<BattleEvent> events = service.useSkill(battle, "hero", "cleave",
                List.of(enemyId(battle, 0), enemyId(battle, 1)));
        assertEquals(9, ((SkillUsedEvent) events.get(0)).damage());
        assertEquals(9, ((SkillUsedEvent) events.get(1)).damage());
        assertEquals(7, state.getPlayer().getStats().getMp());
        assertEquals(11, battle.getEnemies().get(1).getStats().getHp());
    }

    @Test
    @DisplayName("Guard soaks up the next hit and is then gone")
    void testGuard() throws FactoryException {
        BattleState battle = start("goblin");
        List<BattleEvent> events = service.useSkill(battle, "hero", "guard_stance", List.of());
        assertEquals(new GuardAppliedEvent("hero", "Hero", 3), events.get(0));
        assertEquals(10, state.getPlayer().getStats().getMp());

        SkillUsedEvent stab = first(service.runEnemyTurn(battle, state.getRng()), SkillUsedEvent.class);
        assertEquals(2, stab.damage());
        assertEquals(3, stab.guardAbsorbed());
        assertEquals(34, state.getPlayer().getStats().getHp());
        assertEquals(0, battle.findCombatant("hero").orElseThrow().getGuardReduction());
    }

    @Test
    @DisplayName("A skill with an unknown effect spends its MP and reports failure")
    void testUnknownEffect() throws FactoryException {
        state.getEquipment().put("hero", new Equipment(List.of("oak_staff"), List.of("leather_vest")));
        BattleState battle = start("goblin");
        List<String> skills = new ArrayList<>();
        service.getAvailableSkills(battle, "hero").forEach(s -> skills.add(s.id()));
        assertEquals(List.of("firebolt", "blink"), skills);

        List<BattleEvent> events = service.useSkill(battle, "hero", "blink", List.of());
        SkillFailedEvent failed = (SkillFailedEvent) events.get(0);
        assertEquals(SkillFailedEvent.Reason.UNSUPPORTED_EFFECT, failed.reason());
        assertEquals(11, state.getPlayer().getStats().getMp());
        assertEquals(enemyId(battle, 0), battle.getCurrentActorId());
    }

    // Rejections

    @Test
    @DisplayName("Rejected skills leave the battle untouched")
    void testSkillRejections() throws FactoryException {
        BattleState battle = start("goblin_pack");
        String g1 = enemyId(battle, 0);
        String g2 = enemyId(battle, 1);
        String slime = enemyId(battle, 2);

        assertRejected(battle, RejectionReason.UNKNOWN_SKILL,
                () -> service.useSkill(battle, "hero", "meteor", List.of(g1)));
        assertRejected(battle, RejectionReason.SKILL_NOT_AVAILABLE,
                () -> service.useSkill(battle, "hero", "firebolt", List.of(g1)));
        assertRejected(battle, RejectionReason.TARGET_COUNT,
                () -> service.useSkill(battle, "hero", "power_strike", List.of()));
        assertRejected(battle, RejectionReason.TARGET_COUNT,
                () -> service.useSkill(battle, "hero", "power_strike", List.of(g1, g2)));
        assertRejected(battle, RejectionReason.TARGET_COUNT,
                () -> service.useSkill(battle, "hero", "cleave", List.of(g1, g2, slime)));
        assertRejected(battle, RejectionReason.DUPLICATE_TARGET,
                () -> service.useSkill(battle, "hero", "cleave", List.of(g1, g1)));
        assertRejected(battle, RejectionReason.INVALID_TARGET_SIDE,
                () -> service.useSkill(battle, "hero", "power_strike", List.of("hero")));
        assertRejected(battle, RejectionReason.UNKNOWN_COMBATANT,
                () -> service.useSkill(battle, "hero", "power_strike", List.of("ghost")));

        battle.findCombatant(g2).orElseThrow().takeDamage(100);
        assertRejected(battle, RejectionReason.TARGET_NOT_ALIVE,
                () -> service.useSkill(battle, "hero", "cleave", List.of(g1, g2)));

        state.getPlayer().getStats().setMp(2);
        assertRejected(battle, RejectionReason.INSUFFICIENT_MP,
                () -> service.useSkill(battle, "hero", "power_strike", List.of(g1)));
    }

    @Test
    void testAttackRejections() throws FactoryException {
        BattleState battle = start("goblin_pack");
        String g1 = enemyId(battle, 0);

        assertRejected(battle, RejectionReason.NOT_ACTORS_TURN,
                () -> service.basicAttack(battle, g1, "hero"));
        assertRejected(battle, RejectionReason.INVALID_TARGET_SIDE,
                () -> service.basicAttack(battle, "hero", "hero"));
        assertRejected(battle, RejectionReason.UNKNOWN_COMBATANT,
                () -> service.basicAttack(battle, "hero", "ghost"));
        assertRejected(battle, RejectionReason.NOT_ACTORS_TURN,
                () -> service.runEnemyTurn(battle, state.getRng()));
    }

    @Test
    @DisplayName("Nothing can act once the battle is over")
    void testBattleOver() throws FactoryException {
        BattleState battle = start("goblin");
        TestFixtures.softenEnemies(battle);
        service.basicAttack(battle, "hero", enemyId(battle, 0));
        assertTrue(battle.isOver());

        assertRejected(battle, RejectionReason.BATTLE_OVER,
                () -> service.basicAttack(battle, "hero", enemyId(battle, 0)));
        assertRejected(battle, RejectionReason.BATTLE_OVER,
                () -> service.runAllyAiTurn(battle, state.getRng()));
    }

    // Items

    @Test
    @DisplayName("Healing clamps at the maximum and still uses up the item")
    void testPotion() throws FactoryException {
        state.getInventory().addItem("potion", 2);
        BattleState battle = start("goblin");

        ItemUsedEvent used = first(service.useItem(battle, state, "hero", "potion", "hero"), ItemUsedEvent.class);
        assertEquals(0, used.hpRestored());
        assertFalse(used.hadEffect());
        assertEquals(1, state.getInventory().getQuantity("potion"));

        service.runEnemyTurn(battle, state.getRng());
        used = first(service.useItem(battle, state, "hero", "potion", "hero"), ItemUsedEvent.class);
        assertEquals(5, used.hpRestored());
        assertTrue(used.hadEffect());
        assertEquals(36, state.getPlayer().getStats().getHp());
        assertEquals(0, state.getInventory().getQuantity("potion"));
    }

    @Test
    void testEther() throws FactoryException {
        state.getInventory().addItem("ether", 1);
        BattleState battle = start("goblin");
        state.getPlayer().getStats().setMp(9);
        ItemUsedEvent used = first(service.useItem(battle, state, "hero", "ether", "hero"), ItemUsedEvent.class);
        assertEquals(3, used.mpRestored());
        assertEquals(12, state.getPlayer().getStats().getMp());
    }

    @Test
    @DisplayName("A debuff item is spent even when the target already carries the debuff")
    void testDebuffItem_noStack() throws FactoryException {
        state.getInventory().addItem("weakening_dust", 2);
        BattleState battle = start("goblin");
        String goblin = enemyId(battle, 0);

        List<BattleEvent> events = service.useItem(battle, state, "hero", "weakening_dust", goblin);
        assertTrue(first(events, ItemUsedEvent.class).hadEffect());
        assertEquals(new DebuffAppliedEvent(goblin, "Goblin", DebuffType.ATTACK_DOWN, 2, 3),
                first(events, DebuffAppliedEvent.class));

        SkillUsedEvent stab = first(service.runEnemyTurn(battle, state.getRng()), SkillUsedEvent.class);
        assertEquals(3, stab.damage());

        events = service.useItem(battle, state, "hero", "weakening_dust", goblin);
        assertFalse(first(events, ItemUsedEvent.class).hadEffect());
        assertFalse(contains(events, DebuffAppliedEvent.class));
        assertEquals(0, state.getInventory().getQuantity("weakening_dust"));
        assertEquals(1, battle.findCombatant(goblin).orElseThrow().getDebuffs().size());

        events = service.runEnemyTurn(battle, state.getRng());
        assertEquals(3, battle.getRoundIndex());
        assertTrue(contains(events, DebuffExpiredEvent.class));
        assertTrue(battle.findCombatant(goblin).orElseThrow().getDebuffs().isEmpty());
    }

    @Test
    void testDefenseDebuff() throws FactoryException {
        state.getInventory().addItem("armor_break", 1);
        BattleState battle = start("goblin");
        String goblin = enemyId(battle, 0);
        DebuffAppliedEvent applied = first(service.useItem(battle, state, "hero", "armor_break", goblin),
                DebuffAppliedEvent.class);
        assertEquals(DebuffType.DEFENSE_DOWN, applied.debuffType());
        assertEquals(8, service.estimateDamage(battle, "hero", goblin, null));
    }

    @Test
    @DisplayName("Invalid item use is rejected before anything is consumed")
    void testItemRejections() throws FactoryException {
        state.getInventory().addItem("potion", 1);
        state.getInventory().addItem("ether", 1);
        state.getInventory().addItem("weakening_dust", 1);
        state.getInventory().addItem("firecracker", 1);
        state.getInventory().addItem("goblin_ear", 1);
        BattleState battle = start("goblin");
        String goblin = enemyId(battle, 0);

        assertRejected(battle, RejectionReason.UNKNOWN_ITEM,
                () -> service.useItem(battle, state, "hero", "elixir", "hero"));
        assertRejected(battle, RejectionReason.ITEM_NOT_CONSUMABLE,
                () -> service.useItem(battle, state, "hero", "goblin_ear", "hero"));
        assertRejected(battle, RejectionReason.TARGETING_NOT_SUPPORTED,
                () -> service.useItem(battle, state, "hero", "firecracker", goblin));
        assertRejected(battle, RejectionReason.INVALID_TARGET_SIDE,
                () -> service.useItem(battle, state, "hero", "potion", goblin));
        assertRejected(battle, RejectionReason.INVALID_TARGET_SIDE,
                () -> service.useItem(battle, state, "hero", "ether", goblin));
        assertRejected(battle, RejectionReason.INVALID_TARGET_SIDE,
                () -> service.useItem(battle, state, "hero", "weakening_dust", "hero"));
        assertRejected(battle, RejectionReason.UNKNOWN_COMBATANT,
                () -> service.useItem(battle, state, "hero", "potion", "ghost"));
        assertRejected(battle, RejectionReason.ITEM_NOT_AVAILABLE,
                () -> service.useItem(battle, state, "hero", "armor_break", goblin));
        assertRejected(battle, RejectionReason.NOT_ACTORS_TURN,
                () -> service.useItem(battle, state, goblin, "potion", goblin));
    }

    @Test
    void testBattleItems_consumablesOnly() {
        state.getInventory().addItem("potion", 2);
        state.getInventory().addItem("goblin_ear", 4);
        state.getInventory().addItem("ether", 1);
        List<String> ids = new ArrayList<>();
        service.getBattleItems(state).forEach(o -> ids.add(o.itemId()));
        assertEquals(List.of("ether", "potion"), ids);
    }

    // AI and determinism

    @Test
    @DisplayName("Party members use their first affordable skill on their top threat")
    void testAllyAi() throws FactoryException {
        state = TestFixtures.gameStateWithMira(4);
        BattleState battle = start("goblin_pack");
        Combatant sprite = battle.getCurrentActor().orElseThrow();
        assertTrue(sprite.isSummon());

        AttackResolvedEvent poke = first(service.runAllyAiTurn(battle, state.getRng()), AttackResolvedEvent.class);
        assertEquals(sprite.getInstanceId(), poke.attackerId());
        assertEquals("party_mira", battle.getCurrentActorId());

        SkillUsedEvent strike = first(service.runAllyAiTurn(battle, state.getRng()), SkillUsedEvent.class);
        assertEquals("power_strike", strike.skillId());
        assertTrue(strike.targetName().startsWith("Goblin"));
        assertEquals(10, strike.damage());
        assertEquals(7, battle.findCombatant("party_mira").orElseThrow().getStats().getMp());
        assertEquals("hero", battle.getCurrentActorId());
    }

    @Test
    @DisplayName("Two battles from the same seed play out identically")
    void testFullBattle_deterministic() throws FactoryException {
        GameState first = TestFixtures.gameStateWithMira(2024);
        GameState second = TestFixtures.gameStateWithMira(2024);
        BattleState a = service.startBattle("goblin_pack", first, first.getRng()).battle();
        BattleState b = service.startBattle("goblin_pack", second, second.getRng()).battle();

        List<BattleEvent> eventsA = TestFixtures.playOut(service, a, first);
        List<BattleEvent> eventsB = TestFixtures.playOut(service, b, second);
        eventsA.addAll(service.applyVictoryRewards(a, first, first.getRng()));
        eventsB.addAll(service.applyVictoryRewards(b, second, second.getRng()));

        assertEquals(eventsA, eventsB);
        assertEquals(a.getVictor(), b.getVictor());
        assertEquals(a.getRoundIndex(), b.getRoundIndex());
        assertEquals(first.getRng().exportState(), second.getRng().exportState());
        assertEquals(first.getInventory().getItems(), second.getInventory().getItems());
        assertEquals(first.getPlayer().getStats().getHp(), second.getPlayer().getStats().getHp());
    }

    private static void assertQueueHoldsOnlyLiving(BattleState battle) {
        for (String id : battle.getTurnQueue()) {
            assertTrue(battle.findCombatant(id).orElseThrow().isAlive(), "fallen combatant left in queue: " + id);
        }
    }

    @Test
    @DisplayName("After a victory the queue holds only the survivors")
    void testFinishedBattle_queueAfterVictory() throws FactoryException {
        BattleState battle = start("goblin_pack");
        TestFixtures.softenEnemies(battle);
        TestFixtures.playOut(service, battle, state);

        assertEquals(Side.ALLIES, battle.getVictor());
        assertQueueHoldsOnlyLiving(battle);
        assertEquals(List.of("hero"), battle.getTurnQueue());
    }

    @Test
    @DisplayName("After a defeat the queue holds only the survivors")
    void testFinishedBattle_queueAfterDefeat() throws FactoryException {
        BattleState battle = start("wolf");
        state.getPlayer().getStats().setHp(1);
        service.runEnemyTurn(battle, state.getRng());

        assertEquals(Side.ENEMIES, battle.getVictor());
        assertQueueHoldsOnlyLiving(battle);
        assertEquals(List.of(enemyId(battle, 0)), battle.getTurnQueue());
    }
}
