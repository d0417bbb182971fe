package com.example.battlecore.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The player character as persisted between battles.
 * 
 * {@link #getStats()} always returns the same object; battles write HP and MP changes into it directly.
 */
public class Player {
    
    private final String id;
    private final String name;
    private final String classId;
    
    /** Pre-attribute stats; attack and defense are refreshed from equipment at battle start */
    private BaseStats baseStats;
    
    /** Current stats after attribute scaling */
    private final Stats stats;
    
    private Attributes attributes;
    
    /** Summon ids in spawn order */
    private final List<String> equippedSummons = new ArrayList<>();
    
    public Player(String id, String name, String classId, BaseStats baseStats, Attributes attributes) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.classId = classId;
        this.baseStats = Objects.requireNonNull(baseStats, "baseStats");
        this.attributes = attributes == null ? Attributes.NONE : attributes;
        this.stats = baseStats.toFullStats();
    }
    
    public String getId() { return id; }
    
    public String getName() { return name; }
    
    public String getClassId() { return classId; }
    
    public BaseStats getBaseStats() { return baseStats; }
    
    public void setBaseStats(BaseStats baseStats) { this.baseStats = Objects.requireNonNull(baseStats); }
    
    public Stats getStats() { return stats; }
    
    public Attributes getAttributes() { return attributes; }
    
    public void setAttributes(Attributes attributes) { this.attributes = Objects.requireNonNull(attributes); }
    
    public List<String> getEquippedSummons() { return equippedSummons; }
    
    public void setEquippedSummons(List<String> summonIds) {
        equippedSummons.clear();
        if (summonIds != null) equippedSummons.addAll(summonIds);
    }
}
