package com.example.battlecore.model;

import java.util.Collection;
import java.util.List;

/**
 * Tag-filtered drop table. A table applies to a defeated enemy when every required tag is present
 * and no forbidden tag is.
 */
public record LootTable(String id, List<String> requiredTags, List<String> forbiddenTags, List<LootDrop> drops) {
    
    public LootTable {
        requiredTags = requiredTags == null ? List.of() : List.copyOf(requiredTags);
        forbiddenTags = forbiddenTags == null ? List.of() : List.copyOf(forbiddenTags);
        drops = drops == null ? List.of() : List.copyOf(drops);
    }
    
    public boolean matches(Collection<String> enemyTags) {
        if (!enemyTags.containsAll(requiredTags)) {
            return false;
        }
        for (String forbidden : forbiddenTags) {
            if (enemyTags.contains(forbidden)) return false;
        }
        return true;
    }
}
