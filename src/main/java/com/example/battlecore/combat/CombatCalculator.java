package com.example.battlecore.combat;

import com.example.battlecore.config.CombatConfig;
import com.example.battlecore.effect.DebuffEngine;
import com.example.battlecore.effect.DebuffType;
import com.example.battlecore.model.Attributes;
import com.example.battlecore.model.SkillDefinition;
import com.example.battlecore.model.StatScaling;
import com.example.battlecore.model.WeaponDefinition;

/**
 * Damage math for basic attacks and skills.
 *
 * Effective attack: action attack - sum(ATTACK_DOWN), at least 1.
 * Effective defense: defense - sum(DEFENSE_DOWN), at least 0.
 * Damage: max(minimum, effective attack + skill power - effective defense).
 * A standing guard on the target absorbs first and is then cleared.
 *
 * Action attack for combatants without attributes is their attack stat. With attributes it is the
 * base attack plus:
 *   - basic attack: STR, or DEX when a weapon is tagged finesse
 *   - physical skill: same as a basic attack
 *   - elemental skill: INT
 *   - physical and elemental: (physical + INT) / 2
 *   - neither: INT
 */
public class CombatCalculator {

    private final CombatConfig config;
    private final StatScaling scaling;

    public CombatCalculator(CombatConfig config, StatScaling scaling) {
        this.config = config;
        this.scaling = scaling;
    }

    /**
     * Attack value before debuffs.
     *
     * @param skill the skill being used, or null for a basic attack
     */
    public int computeActionAttack(Combatant attacker, SkillDefinition skill) {
        if (!attacker.hasAttributes()) {
            return attacker.getStats().getAttack();
        }
        int base = attacker.getBaseStats().attack();
        Attributes attrs = attacker.getAttributes();
        int physical = attacker.getWeaponTags().contains(WeaponDefinition.FINESSE_TAG)
                ? scaling.dexterityBonus(attrs)
                : scaling.strengthBonus(attrs);
        if (skill == null) {
            return base + physical;
        }
        int magical = scaling.intelligenceBonus(attrs);
        boolean isPhysical = skill.isPhysical();
        boolean isElemental = skill.isElemental();
        if (isPhysical && isElemental) {
            return base + (physical + magical) / 2;
        }
        if (isPhysical) {
            return base + physical;
        }
        return base + magical;
    }

    public int effectiveAttack(Combatant attacker, int actionAttack) {
        return Math.max(1, actionAttack - DebuffEngine.total(attacker, DebuffType.ATTACK_DOWN));
    }

    public int effectiveDefense(Combatant target) {
        return Math.max(0, target.getStats().getDefense() - DebuffEngine.total(target, DebuffType.DEFENSE_DOWN));
    }

    /**
     * Damage before guard. Reads state only.
     */
    public int computeDamage(Combatant attacker, Combatant target, SkillDefinition skill) {
        int attack = effectiveAttack(attacker, computeActionAttack(attacker, skill));
        int bonusPower = skill == null ? 0 : skill.basePower();
        int defense = effectiveDefense(target);
        return Math.max(config.getMinimumDamage(), attack + bonusPower - defense);
    }

    /**
     * Projected damage for display. Same math as a real hit; guard is not subtracted and nothing is mutated.
     */
    public int estimateDamage(Combatant attacker, Combatant target, SkillDefinition skill) {
        return computeDamage(attacker, target, skill);
    }

    /**
     * Land a hit: the target's guard absorbs first and is cleared, the rest comes off HP.
     */
    public HitResult applyHit(Combatant attacker, Combatant target, SkillDefinition skill) {
        int raw = computeDamage(attacker, target, skill);
        int absorbed = 0;
        if (target.getGuardReduction() > 0) {
            absorbed = Math.min(raw, target.getGuardReduction());
            target.setGuardReduction(0);
        }
        int damage = Math.max(0, raw - absorbed);
        target.takeDamage(damage);
        return new HitResult(damage, absorbed, !target.isAlive());
    }

    /**
     * @param damage HP removed
     * @param absorbed amount the target's guard soaked up
     */
    public record HitResult(int damage, int absorbed, boolean killed) {
    }
}
