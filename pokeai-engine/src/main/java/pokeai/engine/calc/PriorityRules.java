package pokeai.engine.calc;

import pokeai.data.Effect;
import pokeai.data.EffectKind;
import pokeai.data.Terrain;
import pokeai.data.TriggerPhase;
import pokeai.engine.effect.EffectContext;
import pokeai.engine.effect.EffectLookup;
import pokeai.model.BattleState;
import pokeai.model.Pokemon;

/**
 * Effective move priority after ability bonuses and terrain.
 */
public final class PriorityRules {
    /** Switches resolve before any move. */
    public static final int SWITCH_PRIORITY = 7;

    private final EffectLookup effects;

    public PriorityRules(EffectLookup effects) {
        this.effects = effects;
    }

    public int priority(BattleState state, Pokemon user, Pokemon foe, AttackProfile attack) {
        int priority = attack.getPriority();
        if (attack.getMode() != MoveMode.NORMAL && attack.isDamaging()) {
            return priority;
        }
        EffectContext ctx = EffectContext.of(state, user, foe).withMove(attack.getMove(), attack.getType(), 1.0);
        for (Effect effect : effects.active(TriggerPhase.PRIORITY, user, ctx)) {
            if (effect.getKind() == EffectKind.PRIORITY_BONUS) {
                priority += (int) effect.getValue();
            }
        }
        if ("grassyglide".equals(attack.getMoveId()) && state.getField().getTerrain() == Terrain.GRASSY
                && effects.isGrounded(user, ctx)) {
            priority += 1;
        }
        return priority;
    }
}
