package com.example.battlecore.model;

import java.util.Collection;
import java.util.List;

/**
 * Something a party member knows about a kind of enemy.
 * Matched first by knowledge key, then by tag overlap.
 */
public record KnowledgeEntry(List<String> knowledgeKeys, List<String> enemyTags, String speedHint, String behavior) {
    
    public KnowledgeEntry {
        knowledgeKeys = knowledgeKeys == null ? List.of() : List.copyOf(knowledgeKeys);
        enemyTags = enemyTags == null ? List.of() : List.copyOf(enemyTags);
    }
    
    public boolean coversKey(String knowledgeKey) {
        return knowledgeKeys.contains(knowledgeKey);
    }
    
    public boolean sharesTagWith(Collection<String> tags) {
        for (String tag : enemyTags) {
            if (tags.contains(tag)) return true;
        }
        return false;
    }
}
