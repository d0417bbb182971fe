package com.example.battlecore.model;

import java.util.List;

/**
 * Static definition of an enemy type.
 *
 * @param knowledgeKey optional override of the key kill counters are recorded under
 * @param skillIds skills this enemy may use, in preference order
 */
public record EnemyDefinition(
        String id,
        String name,
        BaseStats stats,
        List<String> tags,
        List<String> skillIds,
        int rewardGold,
        int rewardExp,
        String knowledgeKey) {
    
    public EnemyDefinition {
        tags = tags == null ? List.of() : List.copyOf(tags);
        skillIds = skillIds == null ? List.of() : List.copyOf(skillIds);
    }
    
    /**
     * The key kill counters and knowledge snapshots are stored under.
     */
    public String resolvedKnowledgeKey() {
        return knowledgeKey != null && !knowledgeKey.isBlank() ? knowledgeKey : id;
    }
}
