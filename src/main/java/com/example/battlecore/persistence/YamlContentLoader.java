package com.example.battlecore.persistence;

import com.example.battlecore.model.ArmourDefinition;
import com.example.battlecore.model.Attributes;
import com.example.battlecore.model.BaseStats;
import com.example.battlecore.model.BondScaling;
import com.example.battlecore.model.EnemyDefinition;
import com.example.battlecore.model.EnemyGroupDefinition;
import com.example.battlecore.model.HpVisibilityMode;
import com.example.battlecore.model.ItemDefinition;
import com.example.battlecore.model.KnowledgeEntry;
import com.example.battlecore.model.KnowledgeRules;
import com.example.battlecore.model.KnowledgeTier;
import com.example.battlecore.model.LootDrop;
import com.example.battlecore.model.LootTable;
import com.example.battlecore.model.PartyMemberDefinition;
import com.example.battlecore.model.SkillDefinition;
import com.example.battlecore.model.SummonDefinition;
import com.example.battlecore.model.WeaponDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reads combat content from a single YAML document into a {@link CombatContent}.
 *
 * Top-level keys (all optional): {@code enemies}, {@code enemy_groups}, {@code skills}, {@code items},
 * {@code loot_tables}, {@code summons}, {@code party_members}, {@code weapons}, {@code armour},
 * {@code knowledge} (member id to a list of entries) and {@code knowledge_rules}.
 */
public class YamlContentLoader {
    private static final Logger logger = LoggerFactory.getLogger(YamlContentLoader.class);

    public CombatContent loadResource(String resource) throws ContentLoadException {
        try (InputStream in = YamlContentLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ContentLoadException("Content resource not found: " + resource);
            }
            CombatContent content = load(in);
            logger.info("Loaded combat content from {}", resource);
            return content;
        } catch (ContentLoadException e) {
            throw e;
        } catch (Exception e) {
            throw new ContentLoadException("Failed to read content resource " + resource, e);
        }
    }

    @SuppressWarnings("unchecked")
    public CombatContent load(InputStream in) throws ContentLoadException {
        Object loaded;
        try {
            loaded = new Yaml().load(in);
        } catch (YAMLException e) {
            throw new ContentLoadException("Malformed content document: " + e.getMessage(), e);
        }
        if (loaded == null) {
            return CombatContent.builder().build();
        }
        if (!(loaded instanceof Map)) {
            throw new ContentLoadException("Content document root must be a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;
        CombatContent.Builder builder = CombatContent.builder();

        for (Map<String, Object> data : list(root, "weapons")) {
            builder.weapon(new WeaponDefinition(
                    requireId(data, "weapon"),
                    getString(data, "name", ""),
                    getInt(data, "attack", 0),
                    getStringList(data, "tags")));
        }
        for (Map<String, Object> data : list(root, "armour")) {
            builder.armour(new ArmourDefinition(
                    requireId(data, "armour"),
                    getString(data, "name", ""),
                    getString(data, "slot", "body"),
                    getInt(data, "defense", 0)));
        }
        for (Map<String, Object> data : list(root, "skills")) {
            builder.skill(parseSkill(data));
        }
        for (Map<String, Object> data : list(root, "items")) {
            builder.item(parseItem(data));
        }
        for (Map<String, Object> data : list(root, "enemies")) {
            String id = requireId(data, "enemy");
            builder.enemy(new EnemyDefinition(
                    id,
                    getString(data, "name", id),
                    parseStats(data, "enemy " + id),
                    getStringList(data, "tags"),
                    getStringList(data, "skills"),
                    getInt(data, "gold", 0),
                    getInt(data, "exp", 0),
                    getString(data, "knowledge_key", null)));
        }
        for (Map<String, Object> data : list(root, "enemy_groups")) {
            String id = requireId(data, "enemy group");
            builder.enemyGroup(new EnemyGroupDefinition(id, getString(data, "name", id),
                    getStringList(data, "enemies")));
        }
        for (Map<String, Object> data : list(root, "loot_tables")) {
            builder.lootTable(parseLootTable(data));
        }
        for (Map<String, Object> data : list(root, "summons")) {
            String id = requireId(data, "summon");
            builder.summon(new SummonDefinition(
                    id,
                    getString(data, "name", id),
                    parseStats(data, "summon " + id),
                    getInt(data, "bond_cost", 0),
                    getStringList(data, "tags"),
                    parseBondScaling(map(data, "bond_scaling"))));
        }
        for (Map<String, Object> data : list(root, "party_members")) {
            String id = requireId(data, "party member");
            builder.partyMember(new PartyMemberDefinition(
                    id,
                    getString(data, "name", id),
                    getInt(data, "base_hp", 1),
                    getInt(data, "base_mp", 0),
                    getInt(data, "speed", 0),
                    getStringList(data, "tags"),
                    getStringList(data, "weapons"),
                    getStringList(data, "armour"),
                    parseAttributes(map(data, "attributes")),
                    getStringList(data, "summons")));
        }

        Object knowledgeObj = root.get("knowledge");
        if (knowledgeObj instanceof Map) {
            for (Map.Entry<String, Object> member : ((Map<String, Object>) knowledgeObj).entrySet()) {
                if (!(member.getValue() instanceof List)) {
                    throw new ContentLoadException("Knowledge for '" + member.getKey() + "' must be a list");
                }
                for (Object entryObj : (List<Object>) member.getValue()) {
                    if (!(entryObj instanceof Map)) continue;
                    Map<String, Object> data = (Map<String, Object>) entryObj;
                    builder.knowledge(member.getKey(), new KnowledgeEntry(
                            getStringList(data, "knowledge_keys"),
                            getStringList(data, "enemy_tags"),
                            getString(data, "speed_hint", null),
                            getString(data, "behavior", null)));
                }
            }
        }

        Map<String, Object> rules = map(root, "knowledge_rules");
        if (!rules.isEmpty()) {
            builder.knowledgeRules(parseKnowledgeRules(rules));
        }
        return builder.build();
    }

    private SkillDefinition parseSkill(Map<String, Object> data) throws ContentLoadException {
        String id = requireId(data, "skill");
        String effectStr = getString(data, "effect_type", "damage");
        SkillDefinition.EffectType effectType = SkillDefinition.EffectType.fromString(effectStr);
        if (effectType == SkillDefinition.EffectType.UNKNOWN) {
            logger.warn("Skill '{}' has unsupported effect type '{}'; it will have no effect", id, effectStr);
        }
        try {
            return new SkillDefinition(
                    id,
                    getString(data, "name", id),
                    SkillDefinition.TargetMode.fromString(getString(data, "target_mode", "single_enemy")),
                    getInt(data, "mp_cost", 0),
                    getInt(data, "base_power", 0),
                    getInt(data, "max_targets", 1),
                    getStringList(data, "tags"),
                    getStringList(data, "required_weapon_tags"),
                    effectType);
        } catch (IllegalArgumentException e) {
            throw new ContentLoadException("Invalid skill '" + id + "': " + e.getMessage(), e);
        }
    }

    private ItemDefinition parseItem(Map<String, Object> data) throws ContentLoadException {
        String id = requireId(data, "item");
        return new ItemDefinition(
                id,
                getString(data, "name", id),
                ItemDefinition.ItemKind.fromString(getString(data, "kind", "material")),
                ItemDefinition.ItemTargeting.fromString(getString(data, "targeting", "self")),
                getInt(data, "heal_hp", 0),
                getInt(data, "heal_mp", 0),
                getInt(data, "debuff_attack_flat", 0),
                getInt(data, "debuff_defense_flat", 0),
                getInt(data, "value", 0));
    }

    @SuppressWarnings("unchecked")
    private LootTable parseLootTable(Map<String, Object> data) throws ContentLoadException {
        String id = requireId(data, "loot table");
        List<LootDrop> drops = new ArrayList<>();
        for (Map<String, Object> drop : list(data, "drops")) {
            String itemId = getString(drop, "item_id", null);
            if (itemId == null) {
                throw new ContentLoadException("Loot table '" + id + "' has a drop without item_id");
            }
            int min = getInt(drop, "min_qty", 1);
            int max = getInt(drop, "max_qty", min);
            try {
                drops.add(new LootDrop(itemId, getDouble(drop, "chance", 1.0), min, max));
            } catch (IllegalArgumentException e) {
                throw new ContentLoadException("Invalid drop in loot table '" + id + "': " + e.getMessage(), e);
            }
        }
        return new LootTable(id, getStringList(data, "required_tags"), getStringList(data, "forbidden_tags"), drops);
    }

    private KnowledgeRules parseKnowledgeRules(Map<String, Object> data) throws ContentLoadException {
        Map<String, Object> thresholds = map(data, "thresholds");
        EnumMap<KnowledgeTier, HpVisibilityMode> visibility = new EnumMap<>(KnowledgeTier.class);
        // Keys may be written as 0..3 (parsed as integers) or TIER_0..TIER_3.
        Map<?, ?> byTier = map(data, "hp_visibility_by_tier");
        for (Map.Entry<?, ?> entry : byTier.entrySet()) {
            String key = String.valueOf(entry.getKey()).trim().toUpperCase();
            KnowledgeTier tier = null;
            for (KnowledgeTier candidate : KnowledgeTier.values()) {
                if (key.equals(candidate.name()) || key.equals(String.valueOf(candidate.level()))) {
                    tier = candidate;
                }
            }
            if (tier == null) {
                throw new ContentLoadException("Unknown knowledge tier '" + entry.getKey() + "'");
            }
            visibility.put(tier, HpVisibilityMode.fromString(String.valueOf(entry.getValue())));
        }
        try {
            return new KnowledgeRules(
                    getInt(thresholds, "tier1_kills", KnowledgeRules.DEFAULT_TIER1_KILLS),
                    getInt(thresholds, "tier2_kills", KnowledgeRules.DEFAULT_TIER2_KILLS),
                    getInt(thresholds, "tier3_kills", KnowledgeRules.DEFAULT_TIER3_KILLS),
                    visibility);
        } catch (IllegalArgumentException e) {
            throw new ContentLoadException("Invalid knowledge rules: " + e.getMessage(), e);
        }
    }

    private BaseStats parseStats(Map<String, Object> data, String owner) throws ContentLoadException {
        Map<String, Object> stats = map(data, "stats");
        try {
            return new BaseStats(
                    getInt(stats, "max_hp", 1),
                    getInt(stats, "max_mp", 0),
                    getInt(stats, "attack", 0),
                    getInt(stats, "defense", 0),
                    getInt(stats, "speed", 0));
        } catch (IllegalArgumentException e) {
            throw new ContentLoadException("Invalid stats for " + owner + ": " + e.getMessage(), e);
        }
    }

    private static BondScaling parseBondScaling(Map<String, Object> data) {
        if (data.isEmpty()) return BondScaling.NONE;
        return new BondScaling(
                getDouble(data, "hp_per_bond", 0),
                getDouble(data, "atk_per_bond", 0),
                getDouble(data, "def_per_bond", 0),
                getDouble(data, "init_per_bond", 0));
    }

    private static Attributes parseAttributes(Map<String, Object> data) {
        if (data.isEmpty()) return Attributes.NONE;
        return new Attributes(
                getInt(data, "STR", 0),
                getInt(data, "DEX", 0),
                getInt(data, "INT", 0),
                getInt(data, "VIT", 0),
                getInt(data, "BOND", 0));
    }

    private static String requireId(Map<String, Object> data, String kind) throws ContentLoadException {
        String id = getString(data, "id", null);
        if (id == null || id.isBlank()) {
            throw new ContentLoadException("A " + kind + " definition is missing its id");
        }
        return id;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> list(Map<String, Object> map, String key) throws ContentLoadException {
        Object val = map.get(key);
        if (val == null) return List.of();
        if (!(val instanceof List)) {
            throw new ContentLoadException("'" + key + "' must be a list");
        }
        List<Map<String, Object>> out = new ArrayList<>();
        for (Object o : (List<Object>) val) {
            if (!(o instanceof Map)) {
                throw new ContentLoadException("Every entry of '" + key + "' must be a mapping");
            }
            out.add((Map<String, Object>) o);
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Map<String, Object> data, String key) {
        Object val = data.get(key);
        return val instanceof Map ? (Map<String, Object>) val : Map.of();
    }

    private static List<String> getStringList(Map<String, Object> map, String key) {
        List<String> out = new ArrayList<>();
        Object val = map.get(key);
        if (val instanceof List) {
            for (Object o : (List<?>) val) {
                if (o != null) out.add(String.valueOf(o));
            }
        } else if (val != null) {
            out.add(val.toString());
        }
        return out;
    }

    private static String getString(Map<String, Object> map, String key, String defaultVal) {
        Object val = map.get(key);
        return val != null ? val.toString() : defaultVal;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).intValue();
        if (val instanceof String) {
            try { return Integer.parseInt(((String) val).trim()); } catch (NumberFormatException e) { return defaultVal; }
        }
        return defaultVal;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).doubleValue();
        if (val instanceof String) {
            try { return Double.parseDouble(((String) val).trim()); } catch (NumberFormatException e) { return defaultVal; }
        }
        return defaultVal;
    }
}
