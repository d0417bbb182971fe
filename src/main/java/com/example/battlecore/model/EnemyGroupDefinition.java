package com.example.battlecore.model;

import java.util.List;

/**
 * A named encounter made of several enemies. The same enemy id may appear more than once.
 */
public record EnemyGroupDefinition(String id, String name, List<String> enemyIds) {
    
    public EnemyGroupDefinition {
        enemyIds = enemyIds == null ? List.of() : List.copyOf(enemyIds);
    }
}
