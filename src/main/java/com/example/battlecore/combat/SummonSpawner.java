package com.example.battlecore.combat;

import com.example.battlecore.event.BattleEvent;
import com.example.battlecore.event.SummonSpawnedEvent;
import com.example.battlecore.model.Attributes;
import com.example.battlecore.model.GameState;
import com.example.battlecore.model.PartyMemberDefinition;
import com.example.battlecore.model.Side;
import com.example.battlecore.model.StatScaling;
import com.example.battlecore.model.Stats;
import com.example.battlecore.model.SummonDefinition;
import com.example.battlecore.persistence.CombatContent;
import com.example.battlecore.util.DeterministicRng;
import com.example.battlecore.util.InstanceIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Spawns the summons each owner has equipped, limited by the owner's BOND.
 *
 * Owners go in order: the player, then party members in party order. Each owner's summons spawn in
 * loadout order until one costs more than the BOND left; that summon and every one after it stay home.
 */
public class SummonSpawner {
    private static final Logger logger = LoggerFactory.getLogger(SummonSpawner.class);

    public static final String SUMMON_TAG = "summon";

    private final CombatContent content;
    private final StatScaling scaling;
    private final ThreatEngine threatEngine;
    private final TurnScheduler scheduler;

    public SummonSpawner(CombatContent content, StatScaling scaling, ThreatEngine threatEngine, TurnScheduler scheduler) {
        this.content = content;
        this.scaling = scaling;
        this.threatEngine = threatEngine;
        this.scheduler = scheduler;
    }

    public List<BattleEvent> spawnEquipped(BattleState battle, GameState state, DeterministicRng rng)
            throws FactoryException {
        List<BattleEvent> events = new ArrayList<>();
        Set<String> taken = new HashSet<>();
        for (Combatant c : battle.getAllCombatants()) {
            taken.add(c.getInstanceId());
        }

        if (state.getPlayer() != null) {
            events.addAll(spawnForOwner(battle, state.getPlayer().getId(),
                    state.getPlayer().getAttributes().bond(), state.getPlayer().getEquippedSummons(), rng, taken));
        }
        for (String memberId : state.getPartyMemberIds()) {
            Optional<PartyMemberDefinition> def = content.partyMembers().find(memberId);
            Attributes attributes = state.getPartyMemberAttributes().get(memberId);
            if (attributes == null) {
                attributes = def.map(PartyMemberDefinition::startingAttributes).orElse(Attributes.NONE);
            }
            List<String> loadout = state.getPartyMemberSummons().get(memberId);
            if (loadout == null) {
                loadout = def.map(PartyMemberDefinition::defaultSummonIds).orElse(List.of());
            }
            events.addAll(spawnForOwner(battle, CombatantFactory.PARTY_PREFIX + memberId,
                    attributes.bond(), loadout, rng, taken));
        }
        if (!events.isEmpty()) {
            scheduler.rebuild(battle);
        }
        return events;
    }

    private List<BattleEvent> spawnForOwner(BattleState battle, String ownerId, int bond, List<String> summonIds,
                                            DeterministicRng rng, Set<String> taken) throws FactoryException {
        List<BattleEvent> events = new ArrayList<>();
        int remaining = bond;
        for (String summonId : summonIds) {
            Optional<SummonDefinition> found = content.summons().find(summonId);
            if (found.isEmpty()) {
                throw new FactoryException("Unknown summon id '" + summonId + "' equipped by " + ownerId);
            }
            SummonDefinition def = found.get();
            if (def.bondCost() > remaining) {
                logger.debug("{} cannot afford summon {} (cost {}, {} BOND left); stopping",
                        ownerId, summonId, def.bondCost(), remaining);
                break;
            }
            Stats stats = scaling.scaleSummon(def.stats(), bond, def.scaling());
            String instanceId = InstanceIds.makeUnique("summon", rng, taken);
            taken.add(instanceId);
            List<String> tags = new ArrayList<>();
            tags.add(SUMMON_TAG);
            for (String tag : def.tags()) {
                if (!tags.contains(tag)) tags.add(tag);
            }
            Combatant summon = Combatant.builder(instanceId, def.name(), Side.ALLIES, stats)
                    .tags(tags)
                    .sourceId(def.id())
                    .summonedBy(ownerId, def.bondCost())
                    .build();
            battle.addAlly(summon);
            threatEngine.seedAlly(battle, summon);
            remaining -= def.bondCost();
            events.add(new SummonSpawnedEvent(instanceId, def.name(), ownerId, def.bondCost()));
            logger.debug("{} summoned {} as {} ({} BOND left)", ownerId, summonId, instanceId, remaining);
        }
        return events;
    }
}
