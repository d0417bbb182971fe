package com.example.battlecore.combat;

import com.example.battlecore.model.ArmourDefinition;
import com.example.battlecore.model.Attributes;
import com.example.battlecore.model.BaseStats;
import com.example.battlecore.model.EnemyDefinition;
import com.example.battlecore.model.Equipment;
import com.example.battlecore.model.GameState;
import com.example.battlecore.model.PartyMemberDefinition;
import com.example.battlecore.model.Player;
import com.example.battlecore.model.Side;
import com.example.battlecore.model.StatScaling;
import com.example.battlecore.model.Stats;
import com.example.battlecore.model.WeaponDefinition;
import com.example.battlecore.persistence.CombatContent;
import com.example.battlecore.util.DeterministicRng;
import com.example.battlecore.util.InstanceIds;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds battle combatants from definitions and persistent state.
 */
public class CombatantFactory {

    /** Instance id prefix of party member combatants */
    public static final String PARTY_PREFIX = "party_";

    private final CombatContent content;
    private final StatScaling scaling;

    public CombatantFactory(CombatContent content, StatScaling scaling) {
        this.content = content;
        this.scaling = scaling;
    }

    /**
     * Enemies scaled to the battle level, with RNG-drawn unique instance ids.
     * Enemies sharing a name get " (1)", " (2)", ... appended in order.
     *
     * @param taken ids already in use; the new ids are added to it
     */
    public List<Combatant> buildEnemies(List<String> enemyIds, int battleLevel, DeterministicRng rng,
                                        Set<String> taken) throws FactoryException {
        List<Combatant> enemies = new ArrayList<>();
        for (String enemyId : enemyIds) {
            Optional<EnemyDefinition> found = content.enemies().find(enemyId);
            if (found.isEmpty()) {
                throw new FactoryException("Unknown enemy id '" + enemyId + "'");
            }
            EnemyDefinition def = found.get();
            String instanceId = InstanceIds.makeUnique("enemy", rng, taken);
            taken.add(instanceId);
            enemies.add(Combatant.builder(instanceId, def.name(), Side.ENEMIES, scaling.scaleEnemy(def.stats(), battleLevel))
                    .tags(def.tags())
                    .sourceId(def.id())
                    .build());
        }
        disambiguateNames(enemies);
        return enemies;
    }

    static void disambiguateNames(List<Combatant> enemies) {
        Map<String, Integer> totals = new HashMap<>();
        for (Combatant c : enemies) {
            totals.merge(c.getDisplayName(), 1, Integer::sum);
        }
        Map<String, Integer> seen = new HashMap<>();
        for (Combatant c : enemies) {
            String name = c.getDisplayName();
            if (totals.get(name) > 1) {
                int n = seen.merge(name, 1, Integer::sum);
                c.setDisplayName(name + " (" + n + ")");
            }
        }
    }

    /**
     * The player's combatant. Shares the player's {@link Stats} object, refreshed from equipment first.
     */
    public Combatant buildPlayer(GameState state) {
        Player player = state.getPlayer();
        Equipment equipment = equipmentOf(state, player.getId());
        BaseStats equipped = refreshPlayerStats(state);
        return Combatant.builder(player.getId(), player.getName(), Side.ALLIES, player.getStats())
                .attributes(equipped, player.getAttributes())
                .weaponTags(weaponTags(equipment.weaponIds()))
                .sourceId(player.getClassId())
                .build();
    }

    /**
     * Recompute the player's stats from base stats, equipment and attributes, in place.
     * A resource that was full stays full; otherwise it is clamped to the new maximum.
     *
     * @return the equipment-adjusted base stats
     */
    public BaseStats refreshPlayerStats(GameState state) {
        Player player = state.getPlayer();
        Equipment equipment = equipmentOf(state, player.getId());
        BaseStats base = player.getBaseStats();
        BaseStats equipped = base
                .withAttack(calculateAttack(equipment.weaponIds(), base.attack()))
                .withDefense(calculateDefense(equipment.armourIds(), base.defense()));
        Stats current = player.getStats();
        boolean hpFull = current.getHp() >= current.getMaxHp();
        boolean mpFull = current.getMp() >= current.getMaxMp();
        Stats scaled = scaling.applyAttributeScaling(equipped, player.getAttributes(), current.getHp(), current.getMp());
        current.copyFrom(scaled);
        if (hpFull) current.restoreHp();
        if (mpFull) current.restoreMp();
        return equipped;
    }

    /**
     * A recruited party member at full HP and MP.
     */
    public Combatant buildPartyMember(String memberId, GameState state) throws FactoryException {
        Optional<PartyMemberDefinition> found = content.partyMembers().find(memberId);
        if (found.isEmpty()) {
            throw new FactoryException("Unknown party member id '" + memberId + "'");
        }
        PartyMemberDefinition def = found.get();
        Equipment equipment = state.getEquipment(memberId);
        List<String> weaponIds = equipment != null && !equipment.weaponIds().isEmpty()
                ? equipment.weaponIds()
                : def.weaponIds().subList(0, Math.min(2, def.weaponIds().size()));
        List<String> armourIds = equipment != null && !equipment.armourIds().isEmpty()
                ? equipment.armourIds()
                : def.armourIds();
        BaseStats base = new BaseStats(def.baseHp(), def.baseMp(),
                calculateAttack(weaponIds, 1), calculateDefense(armourIds, 0), def.speed());
        Attributes attributes = state.getPartyMemberAttributes().getOrDefault(memberId, def.startingAttributes());
        Stats stats = scaling.applyAttributeScaling(base, attributes, Integer.MAX_VALUE, Integer.MAX_VALUE);
        return Combatant.builder(PARTY_PREFIX + memberId, def.name(), Side.ALLIES, stats)
                .attributes(base, attributes)
                .tags(def.tags())
                .weaponTags(weaponTags(weaponIds))
                .sourceId(memberId)
                .build();
    }

    /**
     * Attack of the first known weapon, else the fallback; at least 1.
     */
    int calculateAttack(Collection<String> weaponIds, int fallback) {
        for (String weaponId : weaponIds) {
            Optional<WeaponDefinition> weapon = content.weapons().find(weaponId);
            if (weapon.isPresent()) {
                return Math.max(1, weapon.get().attack());
            }
        }
        return Math.max(1, fallback);
    }

    /**
     * Sum of known armour defense, or the fallback when that sum is 0.
     */
    int calculateDefense(Collection<String> armourIds, int fallback) {
        int total = 0;
        for (String armourId : armourIds) {
            total += content.armour().find(armourId).map(ArmourDefinition::defense).orElse(0);
        }
        return total > 0 ? total : Math.max(0, fallback);
    }

    List<String> weaponTags(Collection<String> weaponIds) {
        Set<String> tags = new LinkedHashSet<>();
        for (String weaponId : weaponIds) {
            content.weapons().find(weaponId).ifPresent(w -> tags.addAll(w.tags()));
        }
        return new ArrayList<>(tags);
    }

    private static Equipment equipmentOf(GameState state, String memberId) {
        Equipment equipment = state.getEquipment(memberId);
        return equipment == null ? Equipment.EMPTY : equipment;
    }
}
