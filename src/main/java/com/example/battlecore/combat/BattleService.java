package com.example.battlecore.combat;

import com.example.battlecore.config.CombatConfig;
import com.example.battlecore.effect.ActiveDebuff;
import com.example.battlecore.effect.DebuffEngine;
import com.example.battlecore.effect.DebuffType;
import com.example.battlecore.event.AttackResolvedEvent;
import com.example.battlecore.event.BattleEvent;
import com.example.battlecore.event.BattleResolvedEvent;
import com.example.battlecore.event.BattleStartedEvent;
import com.example.battlecore.event.CombatantDefeatedEvent;
import com.example.battlecore.event.DebuffAppliedEvent;
import com.example.battlecore.event.ItemUsedEvent;
import com.example.battlecore.event.PartyTalkEvent;
import com.example.battlecore.knowledge.KnowledgeDisclosure;
import com.example.battlecore.knowledge.KnowledgeService;
import com.example.battlecore.model.EnemyGroupDefinition;
import com.example.battlecore.model.GameState;
import com.example.battlecore.model.HpVisibilityMode;
import com.example.battlecore.model.ItemDefinition;
import com.example.battlecore.model.KnowledgeEntry;
import com.example.battlecore.model.Side;
import com.example.battlecore.model.SkillDefinition;
import com.example.battlecore.model.StatScaling;
import com.example.battlecore.model.Stats;
import com.example.battlecore.persistence.CombatContent;
import com.example.battlecore.util.DeterministicRng;
import com.example.battlecore.util.InstanceIds;
import com.example.battlecore.util.LootRoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs battles: setup, player and AI actions, turn hand-off and outcome.
 *
 * Every action validates first and throws {@link ActionRejectedException} before touching any state.
 * Randomness comes only from the {@link DeterministicRng} passed in; estimates and previews never draw.
 */
public class BattleService {
    private static final Logger logger = LoggerFactory.getLogger(BattleService.class);

    private final CombatContent content;
    private final CombatConfig config;

    // Engines
    private final DebuffEngine debuffEngine;
    private final TurnScheduler scheduler;
    private final ThreatEngine threatEngine;
    private final CombatCalculator calculator;
    private final SkillResolver skillResolver;

    // Setup and outcome
    private final CombatantFactory combatantFactory;
    private final SummonSpawner summonSpawner;
    private final KnowledgeService knowledgeService;
    private final KnowledgeDisclosure disclosure;
    private final VictoryResolver victoryResolver;

    public BattleService(CombatContent content, CombatConfig config) {
        this.content = content;
        this.config = config;
        StatScaling scaling = new StatScaling(config);
        this.debuffEngine = new DebuffEngine();
        this.scheduler = new TurnScheduler(debuffEngine);
        this.threatEngine = new ThreatEngine(config);
        this.calculator = new CombatCalculator(config, scaling);
        this.skillResolver = new SkillResolver(content, calculator, threatEngine);
        this.combatantFactory = new CombatantFactory(content, scaling);
        this.summonSpawner = new SummonSpawner(content, scaling, threatEngine, scheduler);
        this.knowledgeService = new KnowledgeService(content.knowledgeRules());
        this.disclosure = new KnowledgeDisclosure(content, knowledgeService, config);
        this.victoryResolver = new VictoryResolver(content, config, knowledgeService, disclosure,
                combatantFactory, new LootRoller(content));
    }

    /**
     * A freshly started battle and the events its setup produced.
     */
    public record BattleStart(BattleState battle, List<BattleEvent> events) {
    }

    public BattleStart startBattle(String enemyOrGroupId, GameState state, DeterministicRng rng)
            throws FactoryException {
        return startBattle(enemyOrGroupId, state, rng, 0);
    }

    /**
     * Set up a battle against one enemy or an enemy group.
     *
     * Draws from the RNG in a fixed order: enemy instance ids, the battle id, then summon ids.
     *
     * @param enemyOrGroupId an enemy id, or failing that an enemy group id
     * @param battleLevel levels of enemy scaling to apply
     * @throws FactoryException when there is no player or any referenced definition is missing
     */
    public BattleStart startBattle(String enemyOrGroupId, GameState state, DeterministicRng rng, int battleLevel)
            throws FactoryException {
        if (state.getPlayer() == null) {
            throw new FactoryException("Cannot start a battle without a player");
        }
        List<String> enemyIds = resolveEnemyIds(enemyOrGroupId);

        Set<String> taken = new HashSet<>();
        taken.add(state.getPlayer().getId());
        for (String memberId : state.getPartyMemberIds()) {
            taken.add(CombatantFactory.PARTY_PREFIX + memberId);
        }
        List<Combatant> enemies = combatantFactory.buildEnemies(enemyIds, battleLevel, rng, taken);

        List<Combatant> allies = new ArrayList<>();
        allies.add(combatantFactory.buildPlayer(state));
        for (String memberId : state.getPartyMemberIds()) {
            allies.add(combatantFactory.buildPartyMember(memberId, state));
        }

        String battleId = InstanceIds.make("battle", rng);
        BattleState battle = new BattleState(battleId, state.getPlayer().getId());
        for (Combatant ally : allies) battle.addAlly(ally);
        for (Combatant enemy : enemies) battle.addEnemy(enemy);

        List<BattleEvent> events = new ArrayList<>();
        List<String> enemyNames = new ArrayList<>();
        for (Combatant enemy : enemies) enemyNames.add(enemy.getDisplayName());
        events.add(new BattleStartedEvent(battleId, enemyNames, battleLevel));

        events.addAll(summonSpawner.spawnEquipped(battle, state, rng));
        threatEngine.seed(battle);
        disclosure.takeSnapshot(battle, state);
        scheduler.begin(battle);
        battle.setState(CombatState.ACTIVE);

        logger.info("[BattleService] Battle {} started against {} (level {}, {} allies)",
                battleId, enemyNames, battleLevel, battle.getAllies().size());
        return new BattleStart(battle, events);
    }

    private List<String> resolveEnemyIds(String enemyOrGroupId) throws FactoryException {
        if (content.enemies().contains(enemyOrGroupId)) {
            return List.of(enemyOrGroupId);
        }
        Optional<EnemyGroupDefinition> group = content.enemyGroups().find(enemyOrGroupId);
        if (group.isEmpty()) {
            throw new FactoryException("Unknown enemy or enemy group '" + enemyOrGroupId + "'");
        }
        if (group.get().enemyIds().isEmpty()) {
            throw new FactoryException("Enemy group '" + enemyOrGroupId + "' has no members");
        }
        return group.get().enemyIds();
    }

    // -----------------------
    // Actions
    // -----------------------

    /**
     * Weapon attack with no skill power and no MP cost.
     */
    public List<BattleEvent> basicAttack(BattleState battle, String attackerId, String targetId) {
        Combatant attacker = requireActor(battle, attackerId);
        Combatant target = requireHostileTarget(battle, attacker, targetId);

        List<BattleEvent> events = new ArrayList<>();
        CombatCalculator.HitResult hit = calculator.applyHit(attacker, target, null);
        threatEngine.recordDamage(battle, attacker, target, hit.damage());
        events.add(new AttackResolvedEvent(attacker.getInstanceId(), attacker.getDisplayName(),
                target.getInstanceId(), target.getDisplayName(),
                hit.damage(), hit.absorbed(), target.getStats().getHp()));
        if (hit.killed()) {
            events.add(new CombatantDefeatedEvent(target.getInstanceId(), target.getDisplayName()));
        }
        logger.debug("{} attacks {} for {} ({} absorbed)",
                attacker.getInstanceId(), target.getInstanceId(), hit.damage(), hit.absorbed());
        finishAction(battle, attacker.getInstanceId(), events);
        return events;
    }

    public List<BattleEvent> useSkill(BattleState battle, String actorId, String skillId, List<String> targetIds) {
        Combatant actor = requireActor(battle, actorId);
        SkillDefinition skill = content.skills().find(skillId).orElseThrow(() ->
                new ActionRejectedException(RejectionReason.UNKNOWN_SKILL, "No skill '" + skillId + "'"));
        if (!skillResolver.isAvailable(actor, skill)) {
            throw new ActionRejectedException(RejectionReason.SKILL_NOT_AVAILABLE,
                    actor.getDisplayName() + " cannot use " + skill.name());
        }
        List<Combatant> targets = skillResolver.validate(battle, actor, skill, targetIds);

        List<BattleEvent> events = new ArrayList<>(skillResolver.resolve(battle, actor, skill, targets));
        finishAction(battle, actor.getInstanceId(), events);
        return events;
    }

    /**
     * Use one consumable from the party inventory. Heals clamp to the maximum; debuff items hit enemies
     * and are spent even when the target already carries that debuff.
     */
    public List<BattleEvent> useItem(BattleState battle, GameState state, String actorId, String itemId, String targetId) {
        Combatant actor = requireActor(battle, actorId);
        Combatant target = battle.findCombatant(targetId).orElseThrow(() ->
                new ActionRejectedException(RejectionReason.UNKNOWN_COMBATANT, "No combatant '" + targetId + "'"));
        if (!target.isAlive()) {
            throw new ActionRejectedException(RejectionReason.TARGET_NOT_ALIVE,
                    target.getDisplayName() + " is already defeated");
        }
        ItemDefinition item = content.items().find(itemId).orElseThrow(() ->
                new ActionRejectedException(RejectionReason.UNKNOWN_ITEM, "No item '" + itemId + "'"));
        if (!item.isConsumable()) {
            throw new ActionRejectedException(RejectionReason.ITEM_NOT_CONSUMABLE, item.name() + " cannot be used");
        }
        checkItemTarget(actor, target, item);
        if (state.getInventory().getQuantity(itemId) < 1) {
            throw new ActionRejectedException(RejectionReason.ITEM_NOT_AVAILABLE, "The party has no " + item.name());
        }

        state.getInventory().removeItem(itemId, 1);
        List<BattleEvent> events = new ArrayList<>();
        if (item.isDebuffItem()) {
            DebuffType type = item.debuffAttackFlat() > 0 ? DebuffType.ATTACK_DOWN : DebuffType.DEFENSE_DOWN;
            int amount = item.debuffAttackFlat() > 0 ? item.debuffAttackFlat() : item.debuffDefenseFlat();
            int expiresAt = battle.getRoundIndex() + config.getDebuffDurationRounds();
            boolean applied = debuffEngine.applyNoStack(target, type, amount, expiresAt);
            events.add(new ItemUsedEvent(actor.getInstanceId(), actor.getDisplayName(), item.id(), item.name(),
                    target.getInstanceId(), target.getDisplayName(), 0, 0, applied));
            if (applied) {
                events.add(new DebuffAppliedEvent(target.getInstanceId(), target.getDisplayName(), type, amount, expiresAt));
            }
        } else {
            Stats stats = target.getStats();
            int hpBefore = stats.getHp();
            int mpBefore = stats.getMp();
            if (item.healHp() > 0) stats.setHp(stats.getHp() + item.healHp());
            if (item.healMp() > 0) stats.setMp(stats.getMp() + item.healMp());
            int hpRestored = stats.getHp() - hpBefore;
            int mpRestored = stats.getMp() - mpBefore;
            events.add(new ItemUsedEvent(actor.getInstanceId(), actor.getDisplayName(), item.id(), item.name(),
                    target.getInstanceId(), target.getDisplayName(), hpRestored, mpRestored,
                    hpRestored > 0 || mpRestored > 0));
        }
        logger.debug("{} uses {} on {}", actor.getInstanceId(), itemId, target.getInstanceId());
        finishAction(battle, actor.getInstanceId(), events);
        return events;
    }

    private static void checkItemTarget(Combatant actor, Combatant target, ItemDefinition item) {
        switch (item.targeting()) {
            case SELF:
                if (!actor.getInstanceId().equals(target.getInstanceId())) {
                    throw new ActionRejectedException(RejectionReason.INVALID_TARGET_SIDE,
                            item.name() + " can only be used on yourself");
                }
                break;
            case ALLY:
                if (target.getSide() != actor.getSide()) {
                    throw new ActionRejectedException(RejectionReason.INVALID_TARGET_SIDE,
                            item.name() + " can only be used on an ally");
                }
                break;
            case ENEMY:
                if (!item.isDebuffItem()) {
                    throw new ActionRejectedException(RejectionReason.TARGETING_NOT_SUPPORTED,
                            item.name() + " has no effect on enemies");
                }
                break;
            default:
                throw new ActionRejectedException(RejectionReason.TARGETING_NOT_SUPPORTED,
                        item.name() + " has unsupported targeting");
        }
        if (item.isDebuffItem() && !actor.isHostileTo(target)) {
            throw new ActionRejectedException(RejectionReason.INVALID_TARGET_SIDE,
                    item.name() + " must be used on an enemy");
        }
    }

    /**
     * A party member shares what they know about the living enemies. Uses up the current actor's turn.
     */
    public List<BattleEvent> partyTalk(BattleState battle, String speakerId) {
        Combatant actor = requireCurrentActor(battle);
        Combatant speaker = requireSpeaker(battle, speakerId);
        String text = disclosure.partyTalk(battle, speaker);
        List<BattleEvent> events = new ArrayList<>();
        events.add(new PartyTalkEvent(speaker.getInstanceId(), speaker.getDisplayName(), text));
        events.addAll(scheduler.advanceTurn(battle, actor.getInstanceId()));
        return events;
    }

    /**
     * The text {@link #partyTalk} would produce, without revealing anything or ending the turn.
     */
    public String partyTalkPreview(BattleState battle, String speakerId) {
        return disclosure.partyTalkPreview(battle, requireSpeaker(battle, speakerId));
    }

    private Combatant requireSpeaker(BattleState battle, String speakerId) {
        Combatant speaker = battle.findCombatant(speakerId).orElseThrow(() ->
                new ActionRejectedException(RejectionReason.UNKNOWN_COMBATANT, "No combatant '" + speakerId + "'"));
        if (speaker.getSide() != Side.ALLIES || speaker.isSummon()) {
            throw new ActionRejectedException(RejectionReason.INVALID_TARGET_SIDE,
                    speaker.getDisplayName() + " cannot talk strategy");
        }
        if (!speaker.isAlive()) {
            throw new ActionRejectedException(RejectionReason.TARGET_NOT_ALIVE,
                    speaker.getDisplayName() + " is in no state to talk");
        }
        return speaker;
    }

    // -----------------------
    // AI
    // -----------------------

    /**
     * The current enemy picks a target by threat, then uses its first affordable single-target damage skill
     * or attacks.
     */
    public List<BattleEvent> runEnemyTurn(BattleState battle, DeterministicRng rng) {
        Combatant actor = requireCurrentActor(battle);
        if (actor.getSide() != Side.ENEMIES) {
            throw new ActionRejectedException(RejectionReason.NOT_ACTORS_TURN,
                    actor.getDisplayName() + " is not an enemy");
        }
        List<BattleEvent> events = new ArrayList<>();
        if (battle.getLivingAllies().isEmpty()) {
            scheduler.checkVictory(battle).ifPresent(events::add);
            return events;
        }
        TargetSelection selection = threatEngine.selectEnemyTarget(battle, actor, rng);
        String targetId = selection.target().getInstanceId();
        for (SkillDefinition skill : skillResolver.availableSkills(actor)) {
            if (skill.targetMode() == SkillDefinition.TargetMode.SINGLE_ENEMY
                    && skill.effectType() == SkillDefinition.EffectType.DAMAGE
                    && actor.getStats().getMp() >= skill.mpCost()) {
                return useSkill(battle, actor.getInstanceId(), skill.id(), List.of(targetId));
            }
        }
        return basicAttack(battle, actor.getInstanceId(), targetId);
    }

    /**
     * A party member or summon acts on its own: the first affordable skill it can aim, else an attack on the
     * enemy it has most threat toward.
     */
    public List<BattleEvent> runAllyAiTurn(BattleState battle, DeterministicRng rng) {
        Combatant actor = requireCurrentActor(battle);
        if (actor.getSide() != Side.ALLIES) {
            throw new ActionRejectedException(RejectionReason.NOT_ACTORS_TURN,
                    actor.getDisplayName() + " is not an ally");
        }
        List<Combatant> livingEnemies = battle.getLivingEnemies();
        if (livingEnemies.isEmpty()) {
            List<BattleEvent> events = new ArrayList<>();
            scheduler.checkVictory(battle).ifPresent(events::add);
            return events;
        }

        List<Combatant> ordered = null;
        for (SkillDefinition skill : skillResolver.availableSkills(actor)) {
            if (skill.effectType() == SkillDefinition.EffectType.UNKNOWN
                    || actor.getStats().getMp() < skill.mpCost()) {
                continue;
            }
            List<String> targetIds;
            switch (skill.targetMode()) {
                case SELF:
                    targetIds = List.of();
                    break;
                case SINGLE_ENEMY:
                    if (ordered == null) ordered = threatEngine.orderEnemiesByThreat(battle, actor, rng);
                    targetIds = List.of(ordered.get(0).getInstanceId());
                    break;
                case MULTI_ENEMY:
                    if (livingEnemies.size() < 2) {
                        continue;
                    }
                    if (ordered == null) ordered = threatEngine.orderEnemiesByThreat(battle, actor, rng);
                    targetIds = new ArrayList<>();
                    for (Combatant enemy : ordered.subList(0, Math.min(skill.maxTargets(), ordered.size()))) {
                        targetIds.add(enemy.getInstanceId());
                    }
                    break;
                default:
                    continue;
            }
            logger.debug("{} (AI) chooses {} on {}", actor.getInstanceId(), skill.id(), targetIds);
            return useSkill(battle, actor.getInstanceId(), skill.id(), targetIds);
        }

        if (ordered == null) ordered = threatEngine.orderEnemiesByThreat(battle, actor, rng);
        return basicAttack(battle, actor.getInstanceId(), ordered.get(0).getInstanceId());
    }

    // -----------------------
    // Queries
    // -----------------------

    /**
     * Projected damage of a basic attack ({@code skillId} null) or a skill. Pure: no state change, no RNG.
     */
    public int estimateDamage(BattleState battle, String attackerId, String targetId, String skillId) {
        Combatant attacker = requireCombatant(battle, attackerId);
        Combatant target = requireCombatant(battle, targetId);
        SkillDefinition skill = null;
        if (skillId != null) {
            skill = content.skills().find(skillId).orElseThrow(() ->
                    new ActionRejectedException(RejectionReason.UNKNOWN_SKILL, "No skill '" + skillId + "'"));
        }
        return calculator.estimateDamage(attacker, target, skill);
    }

    public List<SkillDefinition> getAvailableSkills(BattleState battle, String combatantId) {
        return skillResolver.availableSkills(requireCombatant(battle, combatantId));
    }

    /**
     * Consumables in the party inventory, by item id.
     */
    public List<BattleItemOption> getBattleItems(GameState state) {
        List<BattleItemOption> options = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : state.getInventory().getItems().entrySet()) {
            if (entry.getValue() <= 0) {
                continue;
            }
            Optional<ItemDefinition> item = content.items().find(entry.getKey());
            if (item.isPresent() && item.get().isConsumable()) {
                options.add(new BattleItemOption(item.get().id(), item.get().name(), entry.getValue(),
                        item.get().targeting()));
            }
        }
        return options;
    }

    public BattleView getBattleView(BattleState battle) {
        List<CombatantView> allies = new ArrayList<>();
        for (Combatant ally : battle.getAllies()) {
            Stats s = ally.getStats();
            allies.add(toView(ally, s.getHp() + "/" + s.getMaxHp(), s.getMp() + "/" + s.getMaxMp()));
        }
        List<CombatantView> enemies = new ArrayList<>();
        for (Combatant enemy : battle.getEnemies()) {
            String mp = disclosure.effectiveMode(battle, enemy) == HpVisibilityMode.REALTIME
                    ? enemy.getStats().getMp() + "/" + enemy.getStats().getMaxMp()
                    : KnowledgeDisclosure.HIDDEN_HP;
            enemies.add(toView(enemy, disclosure.hpDisplay(battle, enemy), mp));
        }
        return new BattleView(battle.getBattleId(), battle.getRoundIndex(), battle.getCurrentActorId(),
                allies, enemies, battle.isOver(), battle.getVictor());
    }

    private static CombatantView toView(Combatant c, String hp, String mp) {
        List<String> debuffs = new ArrayList<>();
        for (ActiveDebuff d : c.getDebuffs()) {
            debuffs.add(d.getType().getDisplayName() + " " + d.getAmount());
        }
        return new CombatantView(c.getInstanceId(), c.getDisplayName(), c.getSide(), hp, mp,
                c.isAlive(), c.getGuardReduction(), debuffs);
    }

    /**
     * True when any party member has a knowledge entry sharing a tag with the enemy.
     */
    public boolean hasKnowledgeOfEnemy(GameState state, Collection<String> enemyTags) {
        for (String memberId : state.getPartyMemberIds()) {
            for (KnowledgeEntry entry : content.knowledgeFor(memberId)) {
                if (entry.sharesTagWith(enemyTags)) {
                    return true;
                }
            }
        }
        return false;
    }

    public void refreshKnowledgeSnapshot(BattleState battle, GameState state) {
        disclosure.refreshSnapshot(battle, state);
    }

    // -----------------------
    // Outcome
    // -----------------------

    public List<BattleEvent> applyVictoryRewards(BattleState battle, GameState state, DeterministicRng rng) {
        return victoryResolver.applyVictoryRewards(battle, state, rng);
    }

    public boolean applyDefeatOutcome(BattleState battle, GameState state) {
        return victoryResolver.applyDefeatOutcome(battle, state);
    }

    public KnowledgeService getKnowledgeService() {
        return knowledgeService;
    }

    public ThreatEngine getThreatEngine() {
        return threatEngine;
    }

    // -----------------------
    // Helpers
    // -----------------------

    /** Either end the battle or pass the turn on. */
    private void finishAction(BattleState battle, String actorId, List<BattleEvent> events) {
        Optional<BattleResolvedEvent> resolved = scheduler.checkVictory(battle);
        if (resolved.isPresent()) {
            events.add(resolved.get());
            return;
        }
        events.addAll(scheduler.advanceTurn(battle, actorId));
    }

    private Combatant requireCurrentActor(BattleState battle) {
        if (battle.isOver()) {
            throw new ActionRejectedException(RejectionReason.BATTLE_OVER, "Battle " + battle.getBattleId() + " is over");
        }
        String currentId = battle.getCurrentActorId();
        if (currentId == null) {
            throw new ActionRejectedException(RejectionReason.NO_CURRENT_ACTOR, "Nobody is acting");
        }
        return requireCombatant(battle, currentId);
    }

    private Combatant requireActor(BattleState battle, String actorId) {
        Combatant current = requireCurrentActor(battle);
        if (!current.getInstanceId().equals(actorId)) {
            throw new ActionRejectedException(RejectionReason.NOT_ACTORS_TURN,
                    "It is " + current.getDisplayName() + "'s turn, not " + actorId + "'s");
        }
        return current;
    }

    private static Combatant requireCombatant(BattleState battle, String id) {
        return battle.findCombatant(id).orElseThrow(() ->
                new ActionRejectedException(RejectionReason.UNKNOWN_COMBATANT, "No combatant '" + id + "'"));
    }

    private static Combatant requireHostileTarget(BattleState battle, Combatant attacker, String targetId) {
        Combatant target = requireCombatant(battle, targetId);
        if (!attacker.isHostileTo(target)) {
            throw new ActionRejectedException(RejectionReason.INVALID_TARGET_SIDE,
                    attacker.getDisplayName() + " cannot attack " + target.getDisplayName());
        }
        if (!target.isAlive()) {
            throw new ActionRejectedException(RejectionReason.TARGET_NOT_ALIVE,
                    target.getDisplayName() + " is already defeated");
        }
        return target;
    }
}
