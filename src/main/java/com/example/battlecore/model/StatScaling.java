package com.example.battlecore.model;

import com.example.battlecore.config.CombatConfig;

/**
 * Derives combat stats from base stats, attributes, battle level and summon bond.
 * All methods are pure.
 */
public class StatScaling {
    
    private final CombatConfig config;
    
    public StatScaling(CombatConfig config) {
        this.config = config;
    }
    
    /**
     * Apply VIT/INT/STR/DEX contributions to a base stat block.
     * Current HP and MP are carried over and clamped to the new maxima.
     */
    public Stats applyAttributeScaling(BaseStats base, Attributes attributes, int currentHp, int currentMp) {
        int maxHp = base.maxHp() + attributes.vit() * config.getVitHpPerPoint();
        int maxMp = base.maxMp() + attributes.intel() * config.getIntMpPerPoint();
        int attack = base.attack() + attributes.str() * config.getStrAttackPerPoint();
        int speed = base.speed() + attributes.dex() * config.getDexSpeedPerPoint();
        return new Stats(maxHp, Math.min(currentHp, maxHp), maxMp, Math.min(currentMp, maxMp),
                attack, base.defense(), speed);
    }
    
    /**
     * STR contribution to a physical attack.
     */
    public int strengthBonus(Attributes attributes) {
        return attributes.str() * config.getStrAttackPerPoint();
    }
    
    /**
     * DEX contribution to a finesse attack, at the same rate STR contributes.
     */
    public int dexterityBonus(Attributes attributes) {
        return attributes.dex() * config.getStrAttackPerPoint();
    }
    
    /**
     * INT contribution to a magical attack.
     */
    public int intelligenceBonus(Attributes attributes) {
        return attributes.intel() * config.getStrAttackPerPoint();
    }
    
    /**
     * Linear per-level growth of an enemy. Levels below 0 count as 0. The result is at full HP and MP.
     */
    public Stats scaleEnemy(BaseStats base, int battleLevel) {
        int level = Math.max(0, battleLevel);
        int maxHp = base.maxHp() + config.getEnemyHpPerLevel() * level;
        int attack = base.attack() + config.getEnemyAttackPerLevel() * level;
        int defense = base.defense() + config.getEnemyDefensePerLevel() * level;
        int speed = base.speed() + config.getEnemySpeedPerLevel() * level;
        return new Stats(maxHp, maxHp, base.maxMp(), base.maxMp(), attack, defense, speed);
    }
    
    /**
     * Summon stats: base plus floor(bond x per-bond rate) for each stat. HP is at least 1, the rest at least 0.
     */
    public Stats scaleSummon(BaseStats base, int ownerBond, BondScaling scaling) {
        int bond = Math.max(0, ownerBond);
        int maxHp = Math.max(1, base.maxHp() + (int) Math.floor(bond * scaling.hpPerBond()));
        int attack = Math.max(0, base.attack() + (int) Math.floor(bond * scaling.attackPerBond()));
        int defense = Math.max(0, base.defense() + (int) Math.floor(bond * scaling.defensePerBond()));
        int speed = Math.max(0, base.speed() + (int) Math.floor(bond * scaling.speedPerBond()));
        return new Stats(maxHp, maxHp, base.maxMp(), base.maxMp(), attack, defense, speed);
    }
}
