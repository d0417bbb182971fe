package com.example.battlecore.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Shared item stock of the whole party. Iteration is in item id order.
 */
public class PartyInventory {
    
    private final Map<String, Integer> items = new TreeMap<>();
    
    public void addItem(String itemId, int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive: " + quantity);
        }
        items.merge(itemId, quantity, Integer::sum);
    }
    
    /**
     * Remove {@code quantity} of an item.
     * @return false, leaving the inventory unchanged, when not enough are held
     */
    public boolean removeItem(String itemId, int quantity) {
        int held = getQuantity(itemId);
        if (quantity <= 0 || held < quantity) {
            return false;
        }
        if (held == quantity) {
            items.remove(itemId);
        } else {
            items.put(itemId, held - quantity);
        }
        return true;
    }
    
    public int getQuantity(String itemId) {
        return items.getOrDefault(itemId, 0);
    }
    
    public boolean hasItem(String itemId) {
        return getQuantity(itemId) > 0;
    }
    
    public Map<String, Integer> getItems() {
        return Collections.unmodifiableMap(items);
    }
}
