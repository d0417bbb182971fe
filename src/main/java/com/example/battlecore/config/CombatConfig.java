package com.example.battlecore.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.Map;

/**
 * Tuning constants of the combat engine.
 *
 * Loaded from the classpath resource {@code /combat.yaml}. Every key is optional; missing keys,
 * a missing file or an unreadable file fall back to the built-in defaults.
 *
 * <pre>
 * combat:        minimum_damage, hit_bonus, debuff_duration_rounds
 * threat:        base_divisor, player_bonus, anti_repeat_ignore_gap
 * knowledge:     static_range_percent
 * experience:    base, step
 * enemy_scaling: hp_per_level, attack_per_level, defense_per_level, speed_per_level
 * attributes:    vit_hp, int_mp, str_attack, dex_speed
 * </pre>
 */
public final class CombatConfig {
    private static final Logger logger = LoggerFactory.getLogger(CombatConfig.class);

    public static final String DEFAULT_RESOURCE = "/combat.yaml";

    /** Damage never drops below this, however high the defense */
    private final int minimumDamage;
    /** Added to threat on every damaging hit, on top of the damage itself */
    private final int hitBonus;
    /** Rounds a debuff item's effect lasts */
    private final int debuffDurationRounds;

    private final int aggroBaseDivisor;
    private final int playerBaseBonus;
    /** Threat lead at which an enemy keeps hitting its previous target */
    private final int antiRepeatIgnoreGap;

    /** Half-width of the tier-1 HP range, in percent of max HP */
    private final int staticRangePercent;

    private final int expBase;
    private final int expStep;

    private final int enemyHpPerLevel;
    private final int enemyAttackPerLevel;
    private final int enemyDefensePerLevel;
    private final int enemySpeedPerLevel;

    private final int vitHpPerPoint;
    private final int intMpPerPoint;
    private final int strAttackPerPoint;
    private final int dexSpeedPerPoint;

    private CombatConfig(Builder b) {
        this.minimumDamage = b.minimumDamage;
        this.hitBonus = b.hitBonus;
        this.debuffDurationRounds = b.debuffDurationRounds;
        this.aggroBaseDivisor = b.aggroBaseDivisor;
        this.playerBaseBonus = b.playerBaseBonus;
        this.antiRepeatIgnoreGap = b.antiRepeatIgnoreGap;
        this.staticRangePercent = b.staticRangePercent;
        this.expBase = b.expBase;
        this.expStep = b.expStep;
        this.enemyHpPerLevel = b.enemyHpPerLevel;
        this.enemyAttackPerLevel = b.enemyAttackPerLevel;
        this.enemyDefensePerLevel = b.enemyDefensePerLevel;
        this.enemySpeedPerLevel = b.enemySpeedPerLevel;
        this.vitHpPerPoint = b.vitHpPerPoint;
        this.intMpPerPoint = b.intMpPerPoint;
        this.strAttackPerPoint = b.strAttackPerPoint;
        this.dexSpeedPerPoint = b.dexSpeedPerPoint;
    }

    public static CombatConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Load from {@link #DEFAULT_RESOURCE}, or defaults when it is absent.
     */
    public static CombatConfig load() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public static CombatConfig loadResource(String resource) {
        try (InputStream in = CombatConfig.class.getResourceAsStream(resource)) {
            if (in == null) {
                logger.info("No {} on classpath, using default combat configuration", resource);
                return defaults();
            }
            return load(in);
        } catch (Exception e) {
            logger.warn("Failed to read combat configuration {}: {}", resource, e.getMessage());
            return defaults();
        }
    }

    @SuppressWarnings("unchecked")
    public static CombatConfig load(InputStream in) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(in);
        if (!(loaded instanceof Map)) {
            logger.warn("Combat configuration is empty or not a mapping, using defaults");
            return defaults();
        }
        Map<String, Object> root = (Map<String, Object>) loaded;
        Builder b = builder();

        Map<String, Object> combat = section(root, "combat");
        b.minimumDamage(getInt(combat, "minimum_damage", b.minimumDamage));
        b.hitBonus(getInt(combat, "hit_bonus", b.hitBonus));
        b.debuffDurationRounds(getInt(combat, "debuff_duration_rounds", b.debuffDurationRounds));

        Map<String, Object> threat = section(root, "threat");
        b.aggroBaseDivisor(getInt(threat, "base_divisor", b.aggroBaseDivisor));
        b.playerBaseBonus(getInt(threat, "player_bonus", b.playerBaseBonus));
        b.antiRepeatIgnoreGap(getInt(threat, "anti_repeat_ignore_gap", b.antiRepeatIgnoreGap));

        Map<String, Object> knowledge = section(root, "knowledge");
        b.staticRangePercent(getInt(knowledge, "static_range_percent", b.staticRangePercent));

        Map<String, Object> experience = section(root, "experience");
        b.expBase(getInt(experience, "base", b.expBase));
        b.expStep(getInt(experience, "step", b.expStep));

        Map<String, Object> enemy = section(root, "enemy_scaling");
        b.enemyHpPerLevel(getInt(enemy, "hp_per_level", b.enemyHpPerLevel));
        b.enemyAttackPerLevel(getInt(enemy, "attack_per_level", b.enemyAttackPerLevel));
        b.enemyDefensePerLevel(getInt(enemy, "defense_per_level", b.enemyDefensePerLevel));
        b.enemySpeedPerLevel(getInt(enemy, "speed_per_level", b.enemySpeedPerLevel));

        Map<String, Object> attributes = section(root, "attributes");
        b.vitHpPerPoint(getInt(attributes, "vit_hp", b.vitHpPerPoint));
        b.intMpPerPoint(getInt(attributes, "int_mp", b.intMpPerPoint));
        b.strAttackPerPoint(getInt(attributes, "str_attack", b.strAttackPerPoint));
        b.dexSpeedPerPoint(getInt(attributes, "dex_speed", b.dexSpeedPerPoint));

        return b.build();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> root, String key) {
        Object val = root.get(key);
        if (val instanceof Map) return (Map<String, Object>) val;
        if (val != null) {
            logger.warn("Combat configuration section '{}' is not a mapping, ignoring it", key);
        }
        return Map.of();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).intValue();
        if (val instanceof String) {
            try {
                return Integer.parseInt(((String) val).trim());
            } catch (NumberFormatException e) {
                logger.warn("Combat configuration key '{}' is not a number: {}", key, val);
                return defaultVal;
            }
        }
        return defaultVal;
    }

    public int getMinimumDamage() { return minimumDamage; }
    public int getHitBonus() { return hitBonus; }
    public int getDebuffDurationRounds() { return debuffDurationRounds; }
    public int getAggroBaseDivisor() { return aggroBaseDivisor; }
    public int getPlayerBaseBonus() { return playerBaseBonus; }
    public int getAntiRepeatIgnoreGap() { return antiRepeatIgnoreGap; }
    public int getStaticRangePercent() { return staticRangePercent; }
    public int getExpBase() { return expBase; }
    public int getExpStep() { return expStep; }
    public int getEnemyHpPerLevel() { return enemyHpPerLevel; }
    public int getEnemyAttackPerLevel() { return enemyAttackPerLevel; }
    public int getEnemyDefensePerLevel() { return enemyDefensePerLevel; }
    public int getEnemySpeedPerLevel() { return enemySpeedPerLevel; }
    public int getVitHpPerPoint() { return vitHpPerPoint; }
    public int getIntMpPerPoint() { return intMpPerPoint; }
    public int getStrAttackPerPoint() { return strAttackPerPoint; }
    public int getDexSpeedPerPoint() { return dexSpeedPerPoint; }

    /**
     * Experience needed to advance from {@code level} to the next one.
     */
    public int expToNextLevel(int level) {
        return expBase + (Math.max(1, level) - 1) * expStep;
    }

    public static final class Builder {
        private int minimumDamage = 1;
        private int hitBonus = 0;
        private int debuffDurationRounds = 2;
        private int aggroBaseDivisor = 5;
        private int playerBaseBonus = 2;
        private int antiRepeatIgnoreGap = 10;
        private int staticRangePercent = 20;
        private int expBase = 10;
        private int expStep = 5;
        private int enemyHpPerLevel = 12;
        private int enemyAttackPerLevel = 2;
        private int enemyDefensePerLevel = 1;
        private int enemySpeedPerLevel = 1;
        private int vitHpPerPoint = 3;
        private int intMpPerPoint = 2;
        private int strAttackPerPoint = 1;
        private int dexSpeedPerPoint = 1;

        private Builder() {
        }

        public Builder minimumDamage(int v) { this.minimumDamage = v; return this; }
        public Builder hitBonus(int v) { this.hitBonus = v; return this; }
        public Builder debuffDurationRounds(int v) { this.debuffDurationRounds = v; return this; }
        public Builder aggroBaseDivisor(int v) { this.aggroBaseDivisor = v; return this; }
        public Builder playerBaseBonus(int v) { this.playerBaseBonus = v; return this; }
        public Builder antiRepeatIgnoreGap(int v) { this.antiRepeatIgnoreGap = v; return this; }
        public Builder staticRangePercent(int v) { this.staticRangePercent = v; return this; }
        public Builder expBase(int v) { this.expBase = v; return this; }
        public Builder expStep(int v) { this.expStep = v; return this; }
        public Builder enemyHpPerLevel(int v) { this.enemyHpPerLevel = v; return this; }
        public Builder enemyAttackPerLevel(int v) { this.enemyAttackPerLevel = v; return this; }
        public Builder enemyDefensePerLevel(int v) { this.enemyDefensePerLevel = v; return this; }
        public Builder enemySpeedPerLevel(int v) { this.enemySpeedPerLevel = v; return this; }
        public Builder vitHpPerPoint(int v) { this.vitHpPerPoint = v; return this; }
        public Builder intMpPerPoint(int v) { this.intMpPerPoint = v; return this; }
        public Builder strAttackPerPoint(int v) { this.strAttackPerPoint = v; return this; }
        public Builder dexSpeedPerPoint(int v) { this.dexSpeedPerPoint = v; return this; }

        public CombatConfig build() {
            if (minimumDamage < 0) {
                logger.warn("minimum_damage {} is negative, using 0", minimumDamage);
                minimumDamage = 0;
            }
            if (aggroBaseDivisor < 1) {
                logger.warn("threat base_divisor {} is below 1, using 1", aggroBaseDivisor);
                aggroBaseDivisor = 1;
            }
            if (debuffDurationRounds < 1) {
                logger.warn("debuff_duration_rounds {} is below 1, using 1", debuffDurationRounds);
                debuffDurationRounds = 1;
            }
            if (staticRangePercent < 0 || staticRangePercent > 100) {
                logger.warn("static_range_percent {} is outside 0..100, using 20", staticRangePercent);
                staticRangePercent = 20;
            }
            if (expBase < 1) {
                logger.warn("experience base {} is below 1, using 1", expBase);
                expBase = 1;
            }
            if (expStep < 0) {
                logger.warn("experience step {} is negative, using 0", expStep);
                expStep = 0;
            }
            return new CombatConfig(this);
        }
    }
}
