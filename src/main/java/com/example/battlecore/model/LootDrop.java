package com.example.battlecore.model;

/**
 * One possible drop of a loot table.
 *
 * @param chance probability in [0, 1] that the drop happens
 */
public record LootDrop(String itemId, double chance, int minQuantity, int maxQuantity) {
    
    public LootDrop {
        if (chance < 0.0 || chance > 1.0) {
            throw new IllegalArgumentException("chance must be within [0, 1]: " + chance);
        }
        if (minQuantity < 0 || maxQuantity < minQuantity) {
            throw new IllegalArgumentException("invalid quantity range " + minQuantity + ".." + maxQuantity);
        }
    }
}
