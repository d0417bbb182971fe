package com.example.battlecore.knowledge;

import com.example.battlecore.model.GameState;
import com.example.battlecore.model.HpVisibilityMode;
import com.example.battlecore.model.KnowledgeRules;
import com.example.battlecore.model.KnowledgeTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Reads and writes the persistent per-key kill counters and maps them to knowledge tiers.
 * Never touches the RNG.
 */
public class KnowledgeService {
    private static final Logger logger = LoggerFactory.getLogger(KnowledgeService.class);
    
    private final KnowledgeRules rules;
    
    public KnowledgeService(KnowledgeRules rules) {
        this.rules = rules;
    }
    
    public KnowledgeRules getRules() {
        return rules;
    }
    
    public int getKillCount(GameState state, String key) {
        Integer count = state.getKnowledgeKillCounts().get(key);
        return count == null || count < 0 ? 0 : count;
    }
    
    public KnowledgeTier getTier(GameState state, String key) {
        return rules.tierFor(getKillCount(state, key));
    }
    
    public HpVisibilityMode getHpVisibilityMode(KnowledgeTier tier) {
        return rules.visibilityFor(tier);
    }
    
    public HpVisibilityMode getHpVisibilityMode(GameState state, String key) {
        return getHpVisibilityMode(getTier(state, key));
    }
    
    /**
     * Add kills per key. Blank keys and non-positive increments are skipped.
     */
    public void recordKills(GameState state, Map<String, Integer> killsByKey) {
        for (Map.Entry<String, Integer> entry : killsByKey.entrySet()) {
            String key = entry.getKey();
            Integer increment = entry.getValue();
            if (key == null || key.isBlank() || increment == null || increment <= 0) {
                continue;
            }
            int total = getKillCount(state, key) + increment;
            state.getKnowledgeKillCounts().put(key, total);
            logger.debug("Knowledge '{}' now at {} kills", key, total);
        }
    }
    
    /**
     * @return the stored value, or 0 when the key is blank or the value negative (nothing stored)
     */
    public int setKillCount(GameState state, String key, int value) {
        if (key == null || key.isBlank() || value < 0) {
            return 0;
        }
        state.getKnowledgeKillCounts().put(key.trim(), value);
        return value;
    }
    
    /**
     * Adjust a counter by {@code delta}, never going below 0.
     * @return the new total, or 0 for a blank key
     */
    public int addKillCount(GameState state, String key, int delta) {
        if (key == null || key.isBlank()) {
            return 0;
        }
        String normalized = key.trim();
        int total = Math.max(0, getKillCount(state, normalized) + delta);
        state.getKnowledgeKillCounts().put(normalized, total);
        return total;
    }
}
