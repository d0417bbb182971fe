package com.example.battlecore.combat;

import com.example.battlecore.event.BattleEvent;
import com.example.battlecore.event.CombatantDefeatedEvent;
import com.example.battlecore.event.GuardAppliedEvent;
import com.example.battlecore.event.SkillFailedEvent;
import com.example.battlecore.event.SkillUsedEvent;
import com.example.battlecore.model.EnemyDefinition;
import com.example.battlecore.model.Side;
import com.example.battlecore.model.SkillDefinition;
import com.example.battlecore.persistence.CombatContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Validates and resolves skill use.
 *
 * {@link #validate} performs every check; only after it passes does {@link #resolve} spend MP and
 * apply the effect, so a rejected skill never changes anything.
 */
public class SkillResolver {
    private static final Logger logger = LoggerFactory.getLogger(SkillResolver.class);

    private final CombatContent content;
    private final CombatCalculator calculator;
    private final ThreatEngine threatEngine;

    public SkillResolver(CombatContent content, CombatCalculator calculator, ThreatEngine threatEngine) {
        this.content = content;
        this.calculator = calculator;
        this.threatEngine = threatEngine;
    }

    /**
     * Enemies use the skills their definition lists. Allies need at least one weapon tag and use every
     * skill whose required weapon tags they all carry.
     */
    public List<SkillDefinition> availableSkills(Combatant combatant) {
        List<SkillDefinition> available = new ArrayList<>();
        if (combatant.getSide() == Side.ENEMIES) {
            Optional<EnemyDefinition> def = content.enemies().find(combatant.getSourceId());
            if (def.isPresent()) {
                for (String skillId : def.get().skillIds()) {
                    content.skills().find(skillId).ifPresent(available::add);
                }
            }
            return available;
        }
        if (combatant.getWeaponTags().isEmpty()) {
            return available;
        }
        for (SkillDefinition skill : content.skills().all()) {
            if (combatant.getWeaponTags().containsAll(skill.requiredWeaponTags())) {
                available.add(skill);
            }
        }
        return available;
    }

    public boolean isAvailable(Combatant combatant, SkillDefinition skill) {
        for (SkillDefinition s : availableSkills(combatant)) {
            if (s.id().equals(skill.id())) return true;
        }
        return false;
    }

    /**
     * Check MP and targets without touching state.
     *
     * @return the resolved targets; the actor itself for self skills
     * @throws ActionRejectedException on insufficient MP or an invalid target list
     */
    public List<Combatant> validate(BattleState battle, Combatant actor, SkillDefinition skill, List<String> targetIds) {
        if (actor.getStats().getMp() < skill.mpCost()) {
            throw new ActionRejectedException(RejectionReason.INSUFFICIENT_MP,
                    actor.getDisplayName() + " needs " + skill.mpCost() + " MP for " + skill.name()
                            + " but has " + actor.getStats().getMp());
        }
        if (skill.targetMode() == SkillDefinition.TargetMode.SELF) {
            return List.of(actor);
        }
        List<String> ids = targetIds == null ? List.of() : targetIds;
        if (skill.targetMode() == SkillDefinition.TargetMode.SINGLE_ENEMY && ids.size() != 1) {
            throw new ActionRejectedException(RejectionReason.TARGET_COUNT,
                    skill.name() + " needs exactly one target, got " + ids.size());
        }
        if (skill.targetMode() == SkillDefinition.TargetMode.MULTI_ENEMY
                && (ids.isEmpty() || ids.size() > skill.maxTargets())) {
            throw new ActionRejectedException(RejectionReason.TARGET_COUNT,
                    skill.name() + " needs 1 to " + skill.maxTargets() + " targets, got " + ids.size());
        }
        List<Combatant> targets = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String id : ids) {
            Combatant target = battle.findCombatant(id).orElseThrow(() ->
                    new ActionRejectedException(RejectionReason.UNKNOWN_COMBATANT, "No combatant '" + id + "'"));
            if (!actor.isHostileTo(target)) {
                throw new ActionRejectedException(RejectionReason.INVALID_TARGET_SIDE,
                        skill.name() + " cannot target " + target.getDisplayName());
            }
            if (!target.isAlive()) {
                throw new ActionRejectedException(RejectionReason.TARGET_NOT_ALIVE,
                        target.getDisplayName() + " is already defeated");
            }
            if (!seen.add(id)) {
                throw new ActionRejectedException(RejectionReason.DUPLICATE_TARGET,
                        target.getDisplayName() + " was selected twice");
            }
            targets.add(target);
        }
        return targets;
    }

    /**
     * Spend the MP and apply the effect to already validated targets.
     */
    public List<BattleEvent> resolve(BattleState battle, Combatant actor, SkillDefinition skill, List<Combatant> targets) {
        List<BattleEvent> events = new ArrayList<>();
        actor.getStats().setMp(actor.getStats().getMp() - skill.mpCost());

        switch (skill.effectType()) {
            case DAMAGE:
                for (Combatant target : targets) {
                    CombatCalculator.HitResult hit = calculator.applyHit(actor, target, skill);
                    threatEngine.recordDamage(battle, actor, target, hit.damage());
                    events.add(new SkillUsedEvent(actor.getInstanceId(), actor.getDisplayName(),
                            skill.id(), skill.name(), target.getInstanceId(), target.getDisplayName(),
                            hit.damage(), hit.absorbed(), target.getStats().getHp()));
                    if (hit.killed()) {
                        events.add(new CombatantDefeatedEvent(target.getInstanceId(), target.getDisplayName()));
                    }
                    logger.debug("{} uses {} on {} for {} ({} absorbed)",
                            actor.getInstanceId(), skill.id(), target.getInstanceId(), hit.damage(), hit.absorbed());
                }
                break;
            case GUARD:
                actor.setGuardReduction(skill.basePower());
                events.add(new GuardAppliedEvent(actor.getInstanceId(), actor.getDisplayName(), skill.basePower()));
                logger.debug("{} guards for {}", actor.getInstanceId(), skill.basePower());
                break;
            case UNKNOWN:
            default:
                logger.warn("Skill '{}' has an unsupported effect type; {} spent {} MP for nothing",
                        skill.id(), actor.getInstanceId(), skill.mpCost());
                events.add(new SkillFailedEvent(actor.getInstanceId(), actor.getDisplayName(), skill.id(),
                        SkillFailedEvent.Reason.UNSUPPORTED_EFFECT));
                break;
        }
        return events;
    }
}
