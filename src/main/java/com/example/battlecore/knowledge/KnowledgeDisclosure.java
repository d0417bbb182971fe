package com.example.battlecore.knowledge;

import com.example.battlecore.combat.BattleState;
import com.example.battlecore.combat.Combatant;
import com.example.battlecore.config.CombatConfig;
import com.example.battlecore.model.EnemyDefinition;
import com.example.battlecore.model.GameState;
import com.example.battlecore.model.HpVisibilityMode;
import com.example.battlecore.model.KnowledgeEntry;
import com.example.battlecore.model.KnowledgeTier;
import com.example.battlecore.persistence.CombatContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Decides how much the party may see about each enemy.
 *
 * A snapshot of tier and HP visibility is taken per enemy at battle start and only changes through
 * {@link #refreshSnapshot(BattleState, GameState)}. Party talk can reveal a knowledge key for the rest
 * of the battle, which lifts a hidden enemy to a static range; kill counters are never written here.
 */
public class KnowledgeDisclosure {
    private static final Logger logger = LoggerFactory.getLogger(KnowledgeDisclosure.class);

    public static final String HIDDEN_HP = "???";

    private final CombatContent content;
    private final KnowledgeService knowledgeService;
    private final CombatConfig config;

    public KnowledgeDisclosure(CombatContent content, KnowledgeService knowledgeService, CombatConfig config) {
        this.content = content;
        this.knowledgeService = knowledgeService;
        this.config = config;
    }

    /**
     * Knowledge key of an enemy combatant: its definition's override, else the definition id.
     */
    public String knowledgeKeyOf(Combatant enemy) {
        String sourceId = enemy.getSourceId() != null ? enemy.getSourceId() : enemy.getInstanceId();
        return content.enemies().find(sourceId)
                .map(EnemyDefinition::resolvedKnowledgeKey)
                .orElse(sourceId);
    }

    /**
     * Record tier, visibility mode and frozen HP range for every enemy, replacing any earlier snapshot.
     */
    public void takeSnapshot(BattleState battle, GameState gameState) {
        Map<String, EnemyKnowledgeSnapshot> snapshot = battle.getKnowledgeSnapshot();
        snapshot.clear();
        for (Combatant enemy : battle.getEnemies()) {
            String key = knowledgeKeyOf(enemy);
            KnowledgeTier tier = knowledgeService.getTier(gameState, key);
            HpVisibilityMode mode = knowledgeService.getHpVisibilityMode(tier);
            int[] range = staticRange(enemy.getStats().getMaxHp());
            snapshot.put(enemy.getInstanceId(),
                    new EnemyKnowledgeSnapshot(enemy.getInstanceId(), key, tier, mode, range[0], range[1]));
        }
        logger.debug("Knowledge snapshot for battle {}: {}", battle.getBattleId(), snapshot.values());
    }

    /**
     * Recompute the snapshot from the current kill counters. Temporary reveals are kept.
     */
    public void refreshSnapshot(BattleState battle, GameState gameState) {
        takeSnapshot(battle, gameState);
    }

    /**
     * Range shown for tier-1 knowledge: maxHp minus/plus {@code staticRangePercent}, low at least 1.
     */
    public int[] staticRange(int maxHp) {
        int p = config.getStaticRangePercent();
        int low = Math.max(1, maxHp * (100 - p) / 100);
        int high = (maxHp * (100 + p) + 99) / 100;
        return new int[] { low, Math.max(low, high) };
    }

    /**
     * Visibility currently in effect for an enemy, after temporary reveals.
     */
    public HpVisibilityMode effectiveMode(BattleState battle, Combatant enemy) {
        EnemyKnowledgeSnapshot snap = battle.getKnowledgeSnapshot().get(enemy.getInstanceId());
        if (snap == null) {
            return HpVisibilityMode.HIDDEN;
        }
        if (snap.mode() == HpVisibilityMode.HIDDEN && battle.getRevealedKnowledgeKeys().contains(snap.knowledgeKey())) {
            return HpVisibilityMode.STATIC_RANGE;
        }
        return snap.mode();
    }

    /**
     * Text shown in place of an enemy's HP.
     */
    public String hpDisplay(BattleState battle, Combatant enemy) {
        EnemyKnowledgeSnapshot snap = battle.getKnowledgeSnapshot().get(enemy.getInstanceId());
        switch (effectiveMode(battle, enemy)) {
            case REALTIME:
                return enemy.getStats().getHp() + "/" + enemy.getStats().getMaxHp();
            case STATIC_RANGE:
                return snap.staticRangeText();
            case HIDDEN:
            default:
                return HIDDEN_HP;
        }
    }

    /**
     * Build what {@code speaker} has to say about the living enemies and reveal every matched key
     * for the rest of the battle.
     */
    public String partyTalk(BattleState battle, Combatant speaker) {
        Set<String> matched = new TreeSet<>();
        String text = buildTalkText(battle, speaker, matched);
        battle.getRevealedKnowledgeKeys().addAll(matched);
        if (!matched.isEmpty()) {
            logger.debug("{} revealed knowledge keys {}", speaker.getInstanceId(), matched);
        }
        return text;
    }

    /**
     * Same text as {@link #partyTalk(BattleState, Combatant)} without revealing anything.
     */
    public String partyTalkPreview(BattleState battle, Combatant speaker) {
        return buildTalkText(battle, speaker, new TreeSet<>());
    }

    private String buildTalkText(BattleState battle, Combatant speaker, Set<String> matchedKeys) {
        String speakerName = speaker.getDisplayName();
        String sourceId = speaker.getSourceId() != null ? speaker.getSourceId() : speaker.getInstanceId();
        List<KnowledgeEntry> entries = content.knowledgeFor(sourceId);
        if (entries.isEmpty()) {
            return uncertain(speakerName);
        }

        // One representative living enemy per knowledge key, keys in sorted order.
        Map<String, Combatant> groups = new TreeMap<>();
        for (Combatant enemy : battle.getLivingEnemies()) {
            groups.putIfAbsent(knowledgeKeyOf(enemy), enemy);
        }

        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, Combatant> group : groups.entrySet()) {
            String key = group.getKey();
            Combatant enemy = group.getValue();
            Optional<KnowledgeEntry> entry = matchEntry(entries, key, enemy.getTags());
            if (entry.isEmpty()) {
                continue;
            }
            matchedKeys.add(key);
            StringBuilder line = new StringBuilder(hpSentence(battle, enemy));
            if (entry.get().speedHint() != null && !entry.get().speedHint().isBlank()) {
                line.append(' ').append(entry.get().speedHint());
            }
            if (entry.get().behavior() != null && !entry.get().behavior().isBlank()) {
                line.append(' ').append(entry.get().behavior());
            }
            lines.add(line.toString());
        }
        if (lines.isEmpty()) {
            return uncertain(speakerName);
        }
        return speakerName + ": " + String.join(" ", lines);
    }

    /**
     * First entry naming the key, else first entry sharing a tag, else none.
     */
    static Optional<KnowledgeEntry> matchEntry(List<KnowledgeEntry> entries, String key, List<String> enemyTags) {
        for (KnowledgeEntry e : entries) {
            if (e.coversKey(key)) return Optional.of(e);
        }
        for (KnowledgeEntry e : entries) {
            if (e.sharesTagWith(enemyTags)) return Optional.of(e);
        }
        return Optional.empty();
    }

    private String hpSentence(BattleState battle, Combatant enemy) {
        String name = content.enemies().find(enemy.getSourceId())
                .map(EnemyDefinition::name)
                .orElse(enemy.getDisplayName());
        EnemyKnowledgeSnapshot snap = battle.getKnowledgeSnapshot().get(enemy.getInstanceId());
        KnowledgeTier tier = snap != null ? snap.tier() : KnowledgeTier.TIER_0;
        if (tier.level() >= KnowledgeTier.TIER_2.level()) {
            return name + " look to have " + enemy.getStats().getHp() + "/" + enemy.getStats().getMaxHp() + " HP.";
        }
        String range = snap != null ? snap.staticRangeText() : rangeText(enemy.getStats().getMaxHp());
        return name + " look to have around " + range + " HP.";
    }

    private String rangeText(int maxHp) {
        int[] range = staticRange(maxHp);
        return range[0] + "-" + range[1];
    }

    private static String uncertain(String speakerName) {
        return speakerName + ": I'm not sure about these foes.";
    }
}
