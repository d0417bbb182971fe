package com.example.battlecore.knowledge;

import com.example.battlecore.model.HpVisibilityMode;
import com.example.battlecore.model.KnowledgeTier;

/**
 * What the party knew about one enemy instance when the snapshot was taken.
 * The static range is fixed at snapshot time and ignores later damage.
 */
public record EnemyKnowledgeSnapshot(
        String enemyId,
        String knowledgeKey,
        KnowledgeTier tier,
        HpVisibilityMode mode,
        int staticLow,
        int staticHigh) {
    
    public String staticRangeText() {
        return staticLow + "-" + staticHigh;
    }
}
