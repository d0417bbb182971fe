package com.example.battlecore.util;

import com.example.battlecore.event.LootAcquiredEvent;
import com.example.battlecore.model.ItemDefinition;
import com.example.battlecore.model.LootDrop;
import com.example.battlecore.model.LootTable;
import com.example.battlecore.model.PartyInventory;
import com.example.battlecore.persistence.CombatContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Rolls loot for a defeated enemy against every loot table whose tag filter it passes.
 * 
 * Per eligible drop: one {@code nextDouble}; the drop happens when the roll is below its chance.
 * Quantity is drawn only when min and max differ. Enemies no table matches consume no randomness.
 */
public class LootRoller {
    private static final Logger logger = LoggerFactory.getLogger(LootRoller.class);
    
    private final CombatContent content;
    
    public LootRoller(CombatContent content) {
        this.content = content;
    }
    
    public List<LootAcquiredEvent> roll(Collection<String> enemyTags, PartyInventory inventory, DeterministicRng rng) {
        List<LootAcquiredEvent> events = new ArrayList<>();
        for (LootTable table : content.lootTables().all()) {
            if (!table.matches(enemyTags)) {
                continue;
            }
            for (LootDrop drop : table.drops()) {
                double roll = rng.nextDouble();
                if (roll >= drop.chance()) {
                    continue;
                }
                int quantity = drop.minQuantity() == drop.maxQuantity()
                        ? drop.minQuantity()
                        : rng.nextInt(drop.minQuantity(), drop.maxQuantity());
                if (quantity <= 0) {
                    continue;
                }
                inventory.addItem(drop.itemId(), quantity);
                String name = content.items().find(drop.itemId()).map(ItemDefinition::name).orElse(drop.itemId());
                logger.debug("Loot from table {}: {} x{}", table.id(), drop.itemId(), quantity);
                events.add(new LootAcquiredEvent(drop.itemId(), name, quantity));
            }
        }
        return events;
    }
}
