package com.example.battlecore.combat;

import com.example.battlecore.effect.ActiveDebuff;
import com.example.battlecore.model.Attributes;
import com.example.battlecore.model.BaseStats;
import com.example.battlecore.model.Side;
import com.example.battlecore.model.Stats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One participant of a battle: the player, a party member, a summon or an enemy.
 * Tracks battle-only state such as guard and debuffs on top of the participant's stats.
 */
public class Combatant {
    
    /** Unique within the battle */
    private final String instanceId;
    
    private String displayName;
    
    private final Side side;
    
    /** Current stats; for the player this is the same object the game state holds */
    private final Stats stats;
    
    /** Stats before attribute scaling, null for enemies and summons */
    private final BaseStats baseStats;
    
    /** Only the player and party members have attributes */
    private final Attributes attributes;
    
    private final List<String> tags;
    
    /** Tags of every equipped weapon, used for skill availability and finesse */
    private final List<String> weaponTags;
    
    /** Damage the next hit against this combatant absorbs, consumed by that hit */
    private int guardReduction;
    
    private final List<ActiveDebuff> debuffs = new ArrayList<>();
    
    /** Definition this combatant was built from (enemy id, party member id, summon id or class id) */
    private final String sourceId;
    
    /** Combatant id of the owner, summons only */
    private final String ownerId;
    
    /** BOND reserved by this summon */
    private final int bondCost;
    
    private Combatant(Builder b) {
        this.instanceId = Objects.requireNonNull(b.instanceId, "instanceId");
        this.displayName = Objects.requireNonNull(b.displayName, "displayName");
        this.side = Objects.requireNonNull(b.side, "side");
        this.stats = Objects.requireNonNull(b.stats, "stats");
        this.baseStats = b.baseStats;
        this.attributes = b.attributes;
        this.tags = List.copyOf(b.tags);
        this.weaponTags = List.copyOf(b.weaponTags);
        this.sourceId = b.sourceId;
        this.ownerId = b.ownerId;
        this.bondCost = b.bondCost;
    }
    
    public static Builder builder(String instanceId, String displayName, Side side, Stats stats) {
        return new Builder(instanceId, displayName, side, stats);
    }
    
    // Identification
    
    public String getInstanceId() { return instanceId; }
    
    public String getDisplayName() { return displayName; }
    
    void setDisplayName(String displayName) { this.displayName = displayName; }
    
    public Side getSide() { return side; }
    
    public String getSourceId() { return sourceId; }
    
    public String getOwnerId() { return ownerId; }
    
    public int getBondCost() { return bondCost; }
    
    public boolean isSummon() { return ownerId != null; }
    
    public boolean isHostileTo(Combatant other) {
        return side != other.side;
    }
    
    // Stats
    
    public Stats getStats() { return stats; }
    
    public BaseStats getBaseStats() { return baseStats; }
    
    public Attributes getAttributes() { return attributes; }
    
    public boolean hasAttributes() { return attributes != null && baseStats != null; }
    
    public List<String> getTags() { return tags; }
    
    public List<String> getWeaponTags() { return weaponTags; }
    
    public boolean isAlive() {
        return stats.getHp() > 0;
    }
    
    /**
     * Remove HP. A combatant that drops to 0 loses all of its debuffs immediately.
     */
    public void takeDamage(int amount) {
        stats.setHp(stats.getHp() - Math.max(0, amount));
        if (!isAlive()) {
            debuffs.clear();
        }
    }
    
    // Guard
    
    public int getGuardReduction() { return guardReduction; }
    
    public void setGuardReduction(int guardReduction) { this.guardReduction = Math.max(0, guardReduction); }
    
    // Debuffs
    
    public List<ActiveDebuff> getDebuffs() {
        return Collections.unmodifiableList(debuffs);
    }
    
    public void addDebuff(ActiveDebuff debuff) {
        debuffs.add(debuff);
    }
    
    public void removeDebuff(ActiveDebuff debuff) {
        debuffs.remove(debuff);
    }
    
    @Override
    public String toString() {
        return instanceId + "(" + displayName + ", " + side + ", " + stats + ")";
    }
    
    public static final class Builder {
        private final String instanceId;
        private final String displayName;
        private final Side side;
        private final Stats stats;
        private BaseStats baseStats;
        private Attributes attributes;
        private List<String> tags = List.of();
        private List<String> weaponTags = List.of();
        private String sourceId;
        private String ownerId;
        private int bondCost;
        
        private Builder(String instanceId, String displayName, Side side, Stats stats) {
            this.instanceId = instanceId;
            this.displayName = displayName;
            this.side = side;
            this.stats = stats;
        }
        
        public Builder attributes(BaseStats baseStats, Attributes attributes) {
            this.baseStats = baseStats;
            this.attributes = attributes;
            return this;
        }
        
        public Builder tags(List<String> tags) { this.tags = tags; return this; }
        
        public Builder weaponTags(List<String> weaponTags) { this.weaponTags = weaponTags; return this; }
        
        public Builder sourceId(String sourceId) { this.sourceId = sourceId; return this; }
        
        public Builder summonedBy(String ownerId, int bondCost) {
            this.ownerId = ownerId;
            this.bondCost = bondCost;
            return this;
        }
        
        public Combatant build() {
            return new Combatant(this);
        }
    }
}
