package com.example.battlecore.combat;

import com.example.battlecore.event.BattleEvent;
import com.example.battlecore.model.GameState;
import com.example.battlecore.model.Side;
import com.example.battlecore.model.SkillDefinition;
import com.example.battlecore.util.DeterministicRng;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Front end for one battle. Exposes state and accepts decisions; it never renders or prompts.
 * AI turns and rewards draw from the game state's RNG.
 */
public class BattleController {

    private final BattleService service;
    private final BattleState battle;
    private final GameState state;

    public BattleController(BattleService service, BattleState battle, GameState state) {
        this.service = service;
        this.battle = battle;
        this.state = state;
    }

    public BattleState getBattle() { return battle; }

    public BattleView getBattleView() {
        return service.getBattleView(battle);
    }

    // Whose turn

    /** The current actor is the player character. */
    public boolean isPlayerControlledTurn() {
        String actorId = battle.getCurrentActorId();
        return actorId != null && state.getPlayer() != null && actorId.equals(state.getPlayer().getId());
    }

    /** The current actor is an ally other than the player: a party member or summon. */
    public boolean isAllyAiTurn() {
        if (isPlayerControlledTurn()) {
            return false;
        }
        Optional<Combatant> actor = battle.getCurrentActor();
        return actor.isPresent() && actor.get().getSide() == Side.ALLIES;
    }

    public boolean isEnemyTurn() {
        Optional<Combatant> actor = battle.getCurrentActor();
        return actor.isPresent() && actor.get().getSide() == Side.ENEMIES;
    }

    public AvailableActions getAvailableActions() {
        String actorId = battle.getCurrentActorId();
        if (actorId == null || battle.isOver()) {
            return AvailableActions.none();
        }
        List<SkillDefinition> skills = service.getAvailableSkills(battle, actorId);
        List<BattleItemOption> items = service.getBattleItems(state);
        return new AvailableActions(actorId, true, skills, !items.isEmpty(), items,
                !state.getPartyMemberIds().isEmpty());
    }

    /**
     * Carry out the player's decision for the current actor.
     *
     * @throws ActionRejectedException when a field the action type needs is missing or the action is invalid
     */
    public List<BattleEvent> applyPlayerAction(BattleAction action) {
        if (action == null || action.type() == null) {
            throw new ActionRejectedException(RejectionReason.MISSING_ACTION_FIELD, "Action type is required");
        }
        String actorId = battle.getCurrentActorId();
        if (actorId == null) {
            throw new ActionRejectedException(RejectionReason.NO_CURRENT_ACTOR, "Nobody is acting");
        }
        switch (action.type()) {
            case ATTACK:
                require(action.targetId(), "Attack needs a target");
                return service.basicAttack(battle, actorId, action.targetId());
            case SKILL:
                require(action.skillId(), "Skill needs a skill id");
                // self skills need no targets; the target count is checked per target mode
                List<String> targetIds = action.targetIds() == null ? List.of() : action.targetIds();
                return service.useSkill(battle, actorId, action.skillId(), targetIds);
            case TALK:
                require(action.speakerId(), "Talk needs a speaker");
                return service.partyTalk(battle, action.speakerId());
            case ITEM:
                require(action.itemId(), "Item needs an item id");
                require(action.targetId(), "Item needs a target");
                return service.useItem(battle, state, actorId, action.itemId(), action.targetId());
            default:
                throw new ActionRejectedException(RejectionReason.MISSING_ACTION_FIELD,
                        "Unsupported action type " + action.type());
        }
    }

    private static void require(Object field, String message) {
        if (field == null) {
            throw new ActionRejectedException(RejectionReason.MISSING_ACTION_FIELD, message);
        }
    }

    public List<BattleEvent> runAllyAiTurn() {
        if (battle.getCurrentActorId() == null) {
            return List.of();
        }
        return service.runAllyAiTurn(battle, rng());
    }

    public List<BattleEvent> runEnemyTurn() {
        return service.runEnemyTurn(battle, rng());
    }

    public List<BattleEvent> applyVictoryRewards() {
        return service.applyVictoryRewards(battle, state, rng());
    }

    public boolean applyDefeatOutcome() {
        return service.applyDefeatOutcome(battle, state);
    }

    public String partyTalkPreview(String speakerId) {
        return service.partyTalkPreview(battle, speakerId);
    }

    public int estimateDamage(String attackerId, String targetId, String skillId) {
        return service.estimateDamage(battle, attackerId, targetId, skillId);
    }

    public void refreshKnowledgeSnapshot() {
        service.refreshKnowledgeSnapshot(battle, state);
    }

    /**
     * The full state panel is shown on the first turn and at the start of every player-controlled turn.
     */
    public boolean shouldRenderStatePanel(boolean isFirstTurn) {
        return isFirstTurn || isPlayerControlledTurn();
    }

    public boolean hasKnowledgeOfEnemy(Collection<String> enemyTags) {
        return service.hasKnowledgeOfEnemy(state, enemyTags);
    }

    private DeterministicRng rng() {
        return state.getRng();
    }
}
