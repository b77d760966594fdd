package pokeai.engine.turn;

import pokeai.data.Effect;
import pokeai.data.EffectKind;
import pokeai.data.EffectTarget;
import pokeai.data.HazardKind;
import pokeai.data.Stat;
import pokeai.data.StatusCondition;
import pokeai.data.TriggerPhase;
import pokeai.engine.calc.HazardCalculator;
import pokeai.engine.calc.HazardOutcome;
import pokeai.engine.effect.BattleContext;
import pokeai.engine.effect.EffectContext;
import pokeai.engine.effect.EffectLookup;
import pokeai.engine.effect.FieldMachine;
import pokeai.engine.effect.StatChanges;
import pokeai.engine.effect.StatusMachine;
import pokeai.engine.effect.VolatileMachine;
import pokeai.engine.error.InvalidActionException;
import pokeai.model.EventType;
import pokeai.model.Pokemon;
import pokeai.model.Side;
import pokeai.model.SideId;

/**
 * Switching out and in: Regenerator and volatile clearing on the way out, hazards and switch-in
 * abilities on the way in.
 */
public final class SwitchHandler {
    private final EffectLookup effects;
    private final HazardCalculator hazards;
    private final StatusMachine status;
    private final VolatileMachine volatiles;
    private final FieldMachine field;
    private final StatChanges statChanges;

    public SwitchHandler(EffectLookup effects, StatusMachine status, VolatileMachine volatiles, FieldMachine field,
                         StatChanges statChanges) {
        this.effects = effects;
        this.hazards = new HazardCalculator(effects);
        this.status = status;
        this.volatiles = volatiles;
        this.field = field;
        this.statChanges = statChanges;
    }

    /** Replaces the active with the Pokemon in {@code slot}; a fainted outgoing Pokemon skips switch-out effects. */
    public void switchTo(BattleContext ctx, SideId sideId, int slot, boolean forced) {
        Side side = ctx.side(sideId);
        if (slot < 0 || slot >= side.getTeam().size() || slot == side.getActiveIndex()) {
            throw new InvalidActionException("Cannot switch " + side.getName() + " to slot " + slot);
        }
        Pokemon incoming = side.getTeam().get(slot);
        if (incoming.isFainted()) {
            throw new InvalidActionException(incoming.getName() + " has fainted");
        }
        Pokemon outgoing = side.getActive();
        if (outgoing != null && !outgoing.isFainted()) {
            switchOut(ctx, sideId, outgoing);
        }
        side.setActiveIndex(slot);
        incoming.setRevealed(true);
        ctx.emit(forced ? EventType.FORCED_SWITCH : EventType.SWITCH, sideId, incoming, incoming.getSpecies(),
                incoming.getHp());
        switchIn(ctx, sideId, incoming);
    }

    /** Brings out the current active at the start of a battle. */
    public void sendOut(BattleContext ctx, SideId sideId) {
        Pokemon lead = ctx.side(sideId).getActive();
        lead.setRevealed(true);
        ctx.emit(EventType.SWITCH, sideId, lead, lead.getSpecies(), lead.getHp());
        switchIn(ctx, sideId, lead);
    }

    void switchOut(BattleContext ctx, SideId sideId, Pokemon outgoing) {
        EffectContext ectx = ctx.context(outgoing, ctx.foeOf(sideId));
        for (Effect effect : effects.active(TriggerPhase.SWITCH_OUT, outgoing, ectx)) {
            if (effect.getKind() == EffectKind.HEAL && !outgoing.isFullHp()) {
                int healed = ctx.healFraction(sideId, outgoing, effect.getValue(), outgoing.getAbility());
                if (healed > 0) {
                    ctx.emit(EventType.ABILITY, sideId, outgoing, outgoing.getAbility());
                }
            }
        }
        volatiles.clearOnSwitchOut(ctx, sideId, outgoing);
        if (outgoing.getStatus() == StatusCondition.TOXIC) {
            outgoing.setToxicCounter(0);
        }
    }

    void switchIn(BattleContext ctx, SideId sideId, Pokemon incoming) {
        Side side = ctx.side(sideId);
        HazardOutcome outcome = hazards.onEntry(ctx.getState(), side, incoming);
        if (outcome.isAbsorbsToxicSpikes()) {
            side.getHazards().remove(HazardKind.TOXIC_SPIKES);
            ctx.emit(EventType.HAZARDS_CLEARED, sideId, incoming, "toxic spikes");
        }
        int damage = outcome.damageHp(incoming.getMaxHp());
        if (damage > 0) {
            ctx.emit(EventType.HAZARD_DAMAGE, sideId, incoming, null, damage);
            ctx.damage(sideId, incoming, damage, "hazards");
        }
        if (incoming.isFainted()) {
            return;
        }
        if (outcome.getStatus() != StatusCondition.NONE
                && status.getRules().canInflict(ctx.getState(), incoming, outcome.getStatus(), null)) {
            status.inflict(ctx, sideId, incoming, outcome.getStatus(), null, null);
        }
        if (outcome.isSpeedDrop()) {
            statChanges.apply(ctx, sideId, incoming, Stat.SPE, -1, ctx.foeOf(sideId));
        }
        Pokemon foe = ctx.foeOf(sideId);
        EffectContext ectx = ctx.context(incoming, foe);
        for (Effect effect : effects.active(TriggerPhase.SWITCH_IN, incoming, ectx)) {
            if (effect.getKind() != EffectKind.STAT_CHANGE) {
                continue;
            }
            boolean onFoe = effect.getTarget() == EffectTarget.FOE;
            Pokemon target = onFoe ? foe : incoming;
            if (target == null || target.isFainted()) {
                continue;
            }
            ctx.emit(EventType.ABILITY, sideId, incoming, incoming.getAbility());
            statChanges.apply(ctx, onFoe ? sideId.opponent() : sideId, target, effect.getStat(),
                    (int) effect.getValue(), incoming);
        }
        field.onSwitchIn(ctx, sideId, incoming);
    }
}
