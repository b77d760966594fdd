package pokeai.engine.action;

import com.google.common.collect.ImmutableSet;
import pokeai.data.Capability;
import pokeai.data.Dex;
import pokeai.data.Effect;
import pokeai.data.FormatRules;
import pokeai.data.Move;
import pokeai.data.PokemonType;
import pokeai.data.SideConditionKind;
import pokeai.data.VolatileKind;
import pokeai.engine.effect.EffectContext;
import pokeai.engine.effect.EffectLookup;
import pokeai.engine.error.MissingEntityException;
import pokeai.model.BattleState;
import pokeai.model.MoveSlot;
import pokeai.model.Pokemon;
import pokeai.model.Side;
import pokeai.model.SideId;
import pokeai.model.VolatileState;

import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates the actions a side may submit: moves first, then the tera / mega / Z / dynamax
 * variants, then switches. Inapplicable actions are kept with a reason; variants the format does
 * not have at all are left out.
 */
public class LegalActionGenerator {
    private static final ImmutableSet<String> GRAVITY_BANNED = ImmutableSet.of(
            "bounce", "fly", "flyingpress", "highjumpkick", "jumpkick", "magnetrise", "skydrop",
            "splash", "telekinesis", "floatyfall");

    private final Dex dex;
    private final EffectLookup effects;

    public LegalActionGenerator(Dex dex, EffectLookup effects) {
        this.dex = dex;
        this.effects = effects;
    }

    public List<LegalAction> generate(BattleState state, SideId sideId, FormatRules format) {
        Side side = state.getSide(sideId);
        Side foeSide = state.getSide(sideId.opponent());
        Pokemon active = side.getActive();
        if (active == null) {
            throw new MissingEntityException(side.getName() + " has no active Pokemon");
        }
        List<LegalAction> actions = new ArrayList<>();

        if (active.isFainted()) {
            if (side.hasHealthyBench()) {
                addSwitches(actions, side, null);
            } else {
                actions.add(LegalAction.enabled(BattleAction.pass()));
            }
            return actions;
        }
        if (foeSide.needsReplacement()) {
            actions.add(LegalAction.enabled(BattleAction.pass()));
            return actions;
        }
        if (active.getVolatiles().has(VolatileKind.RECHARGE)) {
            actions.add(LegalAction.enabled(BattleAction.pass()));
            return actions;
        }
        VolatileState charging = active.getVolatiles().get(VolatileKind.CHARGING);
        if (charging != null && charging.getMoveId() != null) {
            actions.add(LegalAction.enabled(BattleAction.move(charging.getMoveId())));
            return actions;
        }

        Pokemon foe = foeSide.getActive();
        EffectContext ctx = EffectContext.of(state, active, foe);

        if (!active.hasUsableMove()) {
            actions.add(LegalAction.enabled(BattleAction.move(Move.STRUGGLE)));
        } else {
            for (MoveSlot slot : active.getMoves()) {
                String reason = moveBlockReason(state, active, slot, ctx);
                actions.add(toLegal(BattleAction.move(slot.getMoveId()), reason));
            }
            addVariants(actions, state, side, active, format, ctx);
        }

        addSwitches(actions, side, trapReason(state, active, foe));

        boolean anyEnabled = false;
        for (LegalAction action : actions) {
            anyEnabled |= action.isEnabled();
        }
        if (!anyEnabled) {
            actions.add(LegalAction.enabled(BattleAction.pass()));
        }
        return actions;
    }

    /** Enabled actions only. */
    public List<BattleAction> enabledActions(BattleState state, SideId sideId, FormatRules format) {
        List<BattleAction> result = new ArrayList<>();
        for (LegalAction legal : generate(state, sideId, format)) {
            if (legal.isEnabled()) {
                result.add(legal.getAction());
            }
        }
        return result;
    }

    private void addVariants(List<LegalAction> actions, BattleState state, Side side, Pokemon active,
                             FormatRules format, EffectContext ctx) {
        if (format.allowsTera()) {
            String variantReason = null;
            if (active.isTerastallized()) {
                variantReason = "already terastallized";
            } else if (side.isTeraUsed()) {
                variantReason = "tera already used";
            } else if (active.getTera().getType() == null || !active.getTera().isAvailable()) {
                variantReason = "no tera available";
            }
            for (MoveSlot slot : active.getMoves()) {
                String reason = firstNonNull(variantReason, moveBlockReason(state, active, slot, ctx));
                actions.add(toLegal(BattleAction.tera(slot.getMoveId()), reason));
            }
        }
        if (format.allowsMega() && !active.isMegaEvolved()
                && dex.megaForme(active.getSpecies(), active.getItem()) != null) {
            String variantReason = side.isMegaUsed() ? "mega evolution already used" : null;
            for (MoveSlot slot : active.getMoves()) {
                String reason = firstNonNull(variantReason, moveBlockReason(state, active, slot, ctx));
                actions.add(toLegal(BattleAction.mega(slot.getMoveId()), reason));
            }
        }
        if (format.allowsZMove()) {
            Effect crystal = effects.capability(active, Capability.Z_CRYSTAL, ctx);
            if (crystal != null) {
                String variantReason = side.isZMoveUsed() ? "z-move already used" : null;
                for (MoveSlot slot : active.getMoves()) {
                    Move move = dex.move(slot.getMoveId());
                    if (move == null || !move.isDamaging() || move.getType() != crystal.getType()) {
                        continue;
                    }
                    String reason = firstNonNull(variantReason, moveBlockReason(state, active, slot, ctx));
                    actions.add(toLegal(BattleAction.zMove(slot.getMoveId()), reason));
                }
            }
        }
        if (format.allowsDynamax() && !active.isDynamaxed()) {
            String variantReason = side.isDynamaxUsed() ? "dynamax already used" : null;
            for (MoveSlot slot : active.getMoves()) {
                String reason = firstNonNull(variantReason, slot.hasPp() ? null : "no PP remaining");
                actions.add(toLegal(BattleAction.dynamax(slot.getMoveId()), reason));
            }
        }
    }

    private void addSwitches(List<LegalAction> actions, Side side, String trapReason) {
        for (int slot : side.benchSlots()) {
            Pokemon candidate = side.getTeam().get(slot);
            String reason = candidate.isFainted() ? "fainted" : trapReason;
            actions.add(toLegal(BattleAction.switchTo(slot), reason));
        }
    }

    /** Why a move slot cannot be used this turn, or null. */
    String moveBlockReason(BattleState state, Pokemon active, MoveSlot slot, EffectContext ctx) {
        Move move = dex.move(slot.getMoveId());
        if (move == null) {
            return "unknown move";
        }
        if (!slot.hasPp()) {
            return "no PP remaining";
        }
        if (active.isDynamaxed()) {
            return null;
        }
        VolatileState lock = active.getVolatiles().get(VolatileKind.CHOICE_LOCK);
        if (lock != null && !lock.getMoveId().equals(slot.getMoveId())
                && effects.has(active, Capability.CHOICE_LOCK, ctx)) {
            return "locked into " + lock.getMoveId();
        }
        VolatileState encore = active.getVolatiles().get(VolatileKind.ENCORE);
        if (encore != null && encore.getMoveId() != null && !encore.getMoveId().equals(slot.getMoveId())) {
            MoveSlot encored = active.findMove(encore.getMoveId());
            if (encored != null && encored.hasPp()) {
                return "encored into " + encore.getMoveId();
            }
        }
        if (move.isStatus() && active.getVolatiles().has(VolatileKind.TAUNT)) {
            return "taunted";
        }
        VolatileState disable = active.getVolatiles().get(VolatileKind.DISABLE);
        if (disable != null && slot.getMoveId().equals(disable.getMoveId())) {
            return "disabled";
        }
        if (state.isFieldConditionActive(SideConditionKind.GRAVITY) && GRAVITY_BANNED.contains(move.getId())) {
            return "prevented by gravity";
        }
        return null;
    }

    private String trapReason(BattleState state, Pokemon active, Pokemon foe) {
        if (foe == null || foe.isFainted() || active.hasType(PokemonType.GHOST)) {
            return null;
        }
        EffectContext foeCtx = EffectContext.of(state, foe, active);
        if (effects.has(foe, Capability.TRAPS_FOE, foeCtx)) {
            return "trapped by " + foe.getAbility();
        }
        return null;
    }

    private static LegalAction toLegal(BattleAction action, String reason) {
        return reason == null ? LegalAction.enabled(action) : LegalAction.disabled(action, reason);
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }
}
