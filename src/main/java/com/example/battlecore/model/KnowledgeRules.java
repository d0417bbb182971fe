package com.example.battlecore.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Kill thresholds for each knowledge tier and the HP visibility each tier grants.
 */
public record KnowledgeRules(int tier1Kills, int tier2Kills, int tier3Kills,
                             Map<KnowledgeTier, HpVisibilityMode> visibilityByTier) {
    
    public static final int DEFAULT_TIER1_KILLS = 25;
    public static final int DEFAULT_TIER2_KILLS = 75;
    public static final int DEFAULT_TIER3_KILLS = 150;
    
    public KnowledgeRules {
        if (tier1Kills < 0 || tier2Kills < tier1Kills || tier3Kills < tier2Kills) {
            throw new IllegalArgumentException("Knowledge thresholds must be ascending: "
                    + tier1Kills + "/" + tier2Kills + "/" + tier3Kills);
        }
        EnumMap<KnowledgeTier, HpVisibilityMode> copy = new EnumMap<>(defaultVisibility());
        if (visibilityByTier != null) {
            copy.putAll(visibilityByTier);
        }
        visibilityByTier = Collections.unmodifiableMap(copy);
    }
    
    public static KnowledgeRules defaults() {
        return new KnowledgeRules(DEFAULT_TIER1_KILLS, DEFAULT_TIER2_KILLS, DEFAULT_TIER3_KILLS, null);
    }
    
    public KnowledgeTier tierFor(int kills) {
        if (kills >= tier3Kills) return KnowledgeTier.TIER_3;
        if (kills >= tier2Kills) return KnowledgeTier.TIER_2;
        if (kills >= tier1Kills) return KnowledgeTier.TIER_1;
        return KnowledgeTier.TIER_0;
    }
    
    public HpVisibilityMode visibilityFor(KnowledgeTier tier) {
        return visibilityByTier.get(tier);
    }
    
    private static Map<KnowledgeTier, HpVisibilityMode> defaultVisibility() {
        EnumMap<KnowledgeTier, HpVisibilityMode> map = new EnumMap<>(KnowledgeTier.class);
        map.put(KnowledgeTier.TIER_0, HpVisibilityMode.HIDDEN);
        map.put(KnowledgeTier.TIER_1, HpVisibilityMode.STATIC_RANGE);
        map.put(KnowledgeTier.TIER_2, HpVisibilityMode.REALTIME);
        map.put(KnowledgeTier.TIER_3, HpVisibilityMode.REALTIME);
        return map;
    }
}
