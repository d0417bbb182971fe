package com.example.battlecore.model;

import java.util.List;

/**
 * A summonable creature. Spawning it reserves {@code bondCost} of its owner's BOND.
 */
public record SummonDefinition(String id, String name, BaseStats stats, int bondCost,
                               List<String> tags, BondScaling scaling) {
    
    public SummonDefinition {
        tags = tags == null ? List.of() : List.copyOf(tags);
        scaling = scaling == null ? BondScaling.NONE : scaling;
        if (bondCost < 0) throw new IllegalArgumentException("bondCost must not be negative: " + bondCost);
    }
}
