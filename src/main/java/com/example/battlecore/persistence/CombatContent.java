package com.example.battlecore.persistence;

import com.example.battlecore.model.ArmourDefinition;
import com.example.battlecore.model.EnemyDefinition;
import com.example.battlecore.model.EnemyGroupDefinition;
import com.example.battlecore.model.ItemDefinition;
import com.example.battlecore.model.KnowledgeEntry;
import com.example.battlecore.model.KnowledgeRules;
import com.example.battlecore.model.LootTable;
import com.example.battlecore.model.PartyMemberDefinition;
import com.example.battlecore.model.SkillDefinition;
import com.example.battlecore.model.SummonDefinition;
import com.example.battlecore.model.WeaponDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All content definitions the combat engine reads, one lookup per kind.
 * Built once and treated as immutable afterwards.
 */
public final class CombatContent {

    private final InMemoryDefinitionLookup<EnemyDefinition> enemies =
            new InMemoryDefinitionLookup<>("enemy", EnemyDefinition::id);
    private final InMemoryDefinitionLookup<EnemyGroupDefinition> enemyGroups =
            new InMemoryDefinitionLookup<>("enemy group", EnemyGroupDefinition::id);
    private final InMemoryDefinitionLookup<SkillDefinition> skills =
            new InMemoryDefinitionLookup<>("skill", SkillDefinition::id);
    private final InMemoryDefinitionLookup<ItemDefinition> items =
            new InMemoryDefinitionLookup<>("item", ItemDefinition::id);
    private final InMemoryDefinitionLookup<LootTable> lootTables =
            new InMemoryDefinitionLookup<>("loot table", LootTable::id);
    private final InMemoryDefinitionLookup<SummonDefinition> summons =
            new InMemoryDefinitionLookup<>("summon", SummonDefinition::id);
    private final InMemoryDefinitionLookup<PartyMemberDefinition> partyMembers =
            new InMemoryDefinitionLookup<>("party member", PartyMemberDefinition::id);
    private final InMemoryDefinitionLookup<WeaponDefinition> weapons =
            new InMemoryDefinitionLookup<>("weapon", WeaponDefinition::id);
    private final InMemoryDefinitionLookup<ArmourDefinition> armour =
            new InMemoryDefinitionLookup<>("armour", ArmourDefinition::id);

    /** Knowledge entries per party member id, in document order */
    private final Map<String, List<KnowledgeEntry>> knowledge = new LinkedHashMap<>();

    private KnowledgeRules knowledgeRules = KnowledgeRules.defaults();

    private CombatContent() {
    }

    public static Builder builder() {
        return new Builder();
    }

    public DefinitionLookup<EnemyDefinition> enemies() { return enemies; }
    public DefinitionLookup<EnemyGroupDefinition> enemyGroups() { return enemyGroups; }
    public DefinitionLookup<SkillDefinition> skills() { return skills; }
    public DefinitionLookup<ItemDefinition> items() { return items; }
    public DefinitionLookup<LootTable> lootTables() { return lootTables; }
    public DefinitionLookup<SummonDefinition> summons() { return summons; }
    public DefinitionLookup<PartyMemberDefinition> partyMembers() { return partyMembers; }
    public DefinitionLookup<WeaponDefinition> weapons() { return weapons; }
    public DefinitionLookup<ArmourDefinition> armour() { return armour; }

    public KnowledgeRules knowledgeRules() { return knowledgeRules; }

    /**
     * What a party member knows, empty when the member has no entries.
     */
    public List<KnowledgeEntry> knowledgeFor(String memberId) {
        List<KnowledgeEntry> entries = knowledge.get(memberId);
        return entries == null ? List.of() : Collections.unmodifiableList(entries);
    }

    public static final class Builder {
        private final CombatContent content = new CombatContent();
        private boolean built;

        private Builder() {
        }

        public Builder enemy(EnemyDefinition def) { check(); content.enemies.register(def); return this; }
        public Builder enemyGroup(EnemyGroupDefinition def) { check(); content.enemyGroups.register(def); return this; }
        public Builder skill(SkillDefinition def) { check(); content.skills.register(def); return this; }
        public Builder item(ItemDefinition def) { check(); content.items.register(def); return this; }
        public Builder lootTable(LootTable def) { check(); content.lootTables.register(def); return this; }
        public Builder summon(SummonDefinition def) { check(); content.summons.register(def); return this; }
        public Builder partyMember(PartyMemberDefinition def) { check(); content.partyMembers.register(def); return this; }
        public Builder weapon(WeaponDefinition def) { check(); content.weapons.register(def); return this; }
        public Builder armour(ArmourDefinition def) { check(); content.armour.register(def); return this; }

        public Builder knowledge(String memberId, KnowledgeEntry entry) {
            check();
            content.knowledge.computeIfAbsent(memberId, k -> new ArrayList<>()).add(entry);
            return this;
        }

        public Builder knowledgeRules(KnowledgeRules rules) {
            check();
            content.knowledgeRules = rules;
            return this;
        }

        public CombatContent build() {
            check();
            built = true;
            return content;
        }

        private void check() {
            if (built) {
                throw new IllegalStateException("CombatContent already built");
            }
        }
    }
}
