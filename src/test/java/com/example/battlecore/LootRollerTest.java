package com.example.battlecore;

import com.example.battlecore.event.LootAcquiredEvent;
import com.example.battlecore.model.PartyInventory;
import com.example.battlecore.util.DeterministicRng;
import com.example.battlecore.util.LootRoller;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LootRoller Tests")
public class LootRollerTest {

    private LootRoller roller;
    private PartyInventory inventory;

    @BeforeEach
    void setUp() {
        roller = new LootRoller(TestFixtures.content());
        inventory = new PartyInventory();
    }

    @Test
    void testCertainDrop() {
        List<LootAcquiredEvent> loot = roller.roll(List.of("beast"), inventory, new DeterministicRng(1));
        assertEquals(List.of(new LootAcquiredEvent("potion", "Potion", 1)), loot);
        assertEquals(1, inventory.getQuantity("potion"));
    }

    @Test
    @DisplayName("Forbidden tags exclude a table and its rolls")
    void testForbiddenTag_noRolls() {
        DeterministicRng rng = new DeterministicRng(1);
        Map<String, Object> before = rng.exportState();
        assertTrue(roller.roll(List.of("beast", "undead"), inventory, rng).isEmpty());
        assertTrue(roller.roll(List.of("ooze"), inventory, rng).isEmpty());
        assertEquals(before, rng.exportState());
        assertTrue(inventory.getItems().isEmpty());
    }

    @Test
    @DisplayName("Each drop of a matching table is rolled independently")
    void testGoblinTable() {
        int potions = 0;
        for (long seed = 0; seed < 40; seed++) {
            PartyInventory bag = new PartyInventory();
            List<LootAcquiredEvent> loot = roller.roll(List.of("goblin", "humanoid"), bag, new DeterministicRng(seed));
            assertEquals("goblin_ear", loot.get(0).itemId());
            assertEquals(1, bag.getQuantity("goblin_ear"));
            int potion = bag.getQuantity("potion");
            assertTrue(potion >= 0 && potion <= 2);
            potions += potion;
        }
        assertTrue(potions > 0, "half-chance potion never dropped in 40 rolls");
    }

    @Test
    void testSameSeedSameLoot() {
        PartyInventory other = new PartyInventory();
        List<LootAcquiredEvent> a = roller.roll(List.of("goblin"), inventory, new DeterministicRng(7));
        List<LootAcquiredEvent> b = roller.roll(List.of("goblin"), other, new DeterministicRng(7));
        assertEquals(a, b);
        assertEquals(inventory.getItems(), other.getItems());
    }
}
