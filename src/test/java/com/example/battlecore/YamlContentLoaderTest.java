package com.example.battlecore;

import com.example.battlecore.model.EnemyDefinition;
import com.example.battlecore.model.HpVisibilityMode;
import com.example.battlecore.model.ItemDefinition;
import com.example.battlecore.model.KnowledgeTier;
import com.example.battlecore.model.SkillDefinition;
import com.example.battlecore.model.SummonDefinition;
import com.example.battlecore.persistence.CombatContent;
import com.example.battlecore.persistence.ContentLoadException;
import com.example.battlecore.persistence.MissingDefinitionException;
import com.example.battlecore.persistence.YamlContentLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("YamlContentLoader Tests")
public class YamlContentLoaderTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Test content loads every kind of definition")
    void testLoadResource_allKinds() {
        CombatContent content = TestFixtures.content();
        assertEquals(3, content.enemies().all().size());
        assertEquals(2, content.enemyGroups().all().size());
        assertEquals(6, content.skills().all().size());
        assertEquals(6, content.items().all().size());
        assertEquals(2, content.lootTables().all().size());
        assertEquals(3, content.summons().all().size());
        assertEquals(1, content.partyMembers().all().size());
        assertEquals(3, content.weapons().all().size());
        assertEquals(1, content.armour().all().size());
        assertEquals(2, content.knowledgeFor("mira").size());
    }

    @Test
    void testEnemy_fieldsAndKnowledgeKey() {
        CombatContent content = TestFixtures.content();
        EnemyDefinition slime = content.enemies().get("slime");
        assertEquals("Slime", slime.name());
        assertEquals(12, slime.stats().maxHp());
        assertEquals("slime_family", slime.resolvedKnowledgeKey());
        assertEquals("goblin", content.enemies().get("goblin").resolvedKnowledgeKey());
        assertEquals(List.of("goblin_stab"), content.enemies().get("goblin").skillIds());
    }

    @Test
    @DisplayName("Unknown effect types load as UNKNOWN")
    void testSkill_unknownEffectType() {
        SkillDefinition blink = TestFixtures.content().skills().get("blink");
        assertEquals(SkillDefinition.EffectType.UNKNOWN, blink.effectType());
        assertEquals(SkillDefinition.TargetMode.SELF, blink.targetMode());
    }

    @Test
    void testItemAndSummon_fields() {
        CombatContent content = TestFixtures.content();
        ItemDefinition dust = content.items().get("weakening_dust");
        assertTrue(dust.isConsumable());
        assertTrue(dust.isDebuffItem());
        assertEquals(ItemDefinition.ItemTargeting.ENEMY, dust.targeting());
        assertFalse(content.items().get("goblin_ear").isConsumable());

        SummonDefinition wisp = content.summons().get("wisp");
        assertEquals(1, wisp.bondCost());
        assertEquals(1.5, wisp.scaling().hpPerBond(), 0.0001);
    }

    @Test
    @DisplayName("Integer tier keys map onto knowledge tiers")
    void testKnowledgeRules_integerTierKeys() {
        CombatContent content = TestFixtures.content();
        assertEquals(25, content.knowledgeRules().tier1Kills());
        assertEquals(HpVisibilityMode.STATIC_RANGE, content.knowledgeRules().visibilityFor(KnowledgeTier.TIER_1));
    }

    @Test
    void testLookup_missingIdThrows() {
        CombatContent content = TestFixtures.content();
        assertThrows(MissingDefinitionException.class, () -> content.enemies().get("dragon"));
        assertTrue(content.enemies().find("dragon").isEmpty());
    }

    @Test
    void testLoad_emptyDocument() throws ContentLoadException {
        CombatContent content = new YamlContentLoader().load(yaml(""));
        assertTrue(content.enemies().all().isEmpty());
    }

    @Test
    void testLoad_malformedDocumentsRejected() {
        YamlContentLoader loader = new YamlContentLoader();
        assertThrows(ContentLoadException.class, () -> loader.load(yaml("- just\n- a list\n")));
        assertThrows(ContentLoadException.class, () -> loader.load(yaml("enemies:\n  - name: No Id\n")));
        assertThrows(ContentLoadException.class, () -> loader.load(yaml("enemies: nope\n")));
        assertThrows(ContentLoadException.class, () -> loader.loadResource("/data/missing.yaml"));
    }
}
