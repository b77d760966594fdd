package pokeai.engine.turn;

import pokeai.data.EffectTarget;
import pokeai.data.FormatRules;
import pokeai.data.MoveEffect;
import pokeai.data.VolatileKind;
import pokeai.engine.effect.BattleContext;
import pokeai.engine.effect.FieldMachine;
import pokeai.engine.effect.StatChanges;
import pokeai.engine.effect.StatusMachine;
import pokeai.engine.effect.VolatileMachine;
import pokeai.model.EventType;
import pokeai.model.Pokemon;
import pokeai.model.SideId;

/**
 * Applies the data-driven effects of a move once it has connected.
 */
final class MoveEffectApplier {
    private final StatusMachine status;
    private final VolatileMachine volatiles;
    private final FieldMachine field;
    private final StatChanges statChanges;

    MoveEffectApplier(StatusMachine status, VolatileMachine volatiles, FieldMachine field, StatChanges statChanges) {
        this.status = status;
        this.volatiles = volatiles;
        this.field = field;
        this.statChanges = statChanges;
    }

    /** Everything a single use of a move needs to know to apply its effects. */
    static final class Use {
        final SideId userSide;
        final Pokemon user;
        final Pokemon target;
        final FormatRules format;
        final boolean targetActed;
        final boolean blockedBySubstitute;

        Use(SideId userSide, Pokemon user, Pokemon target, FormatRules format, boolean targetActed,
            boolean blockedBySubstitute) {
            this.userSide = userSide;
            this.user = user;
            this.target = target;
            this.format = format;
            this.targetActed = targetActed;
            this.blockedBySubstitute = blockedBySubstitute;
        }
    }

    void apply(BattleContext ctx, Use use, MoveEffect effect) {
        boolean onFoe = effect.getTarget() == EffectTarget.FOE;
        SideId targetSide = onFoe ? use.userSide.opponent() : use.userSide;
        Pokemon target = onFoe ? use.target : use.user;
        if (onFoe && (target == null || target.isFainted() || use.blockedBySubstitute)) {
            return;
        }
        if (use.user.isFainted() && !onFoe) {
            return;
        }
        if (!effect.isGuaranteed() && !ctx.getRandom().chance(effect.getChance())) {
            return;
        }
        switch (effect.getKind()) {
            case INFLICT_STATUS:
                status.inflict(ctx, targetSide, target, effect.getStatus(), use.user, use.format);
                break;
            case BOOST:
                statChanges.apply(ctx, targetSide, target, effect.getBoosts(), use.user);
                break;
            case INFLICT_VOLATILE:
                if (effect.getVolatileKind() == VolatileKind.FLINCH && use.targetActed) {
                    return;
                }
                volatiles.start(ctx, targetSide, target, effect.getVolatileKind(), use.user);
                break;
            case SET_HAZARD:
                field.setHazard(ctx, use.userSide.opponent(), use.user, effect.getHazard());
                break;
            case REMOVE_HAZARDS:
                field.clearHazards(ctx, targetSide, use.user, onFoe);
                break;
            case SET_SCREEN:
                field.setScreen(ctx, use.userSide, use.user, effect.getScreen());
                break;
            case SET_WEATHER:
                field.setWeather(ctx, use.userSide, use.user, effect.getWeather(), false);
                break;
            case SET_TERRAIN:
                field.setTerrain(ctx, use.userSide, use.user, effect.getTerrain(), false);
                break;
            case SET_SIDE_CONDITION:
                field.setSideCondition(ctx, use.userSide, use.user, effect.getSideCondition());
                break;
            case HEAL:
                if (target.isFullHp()) {
                    ctx.emit(EventType.FAIL, targetSide, target, "already at full HP");
                    return;
                }
                ctx.healFraction(targetSide, target, effect.getFraction(), "move");
                break;
            case PROTECT:
                volatiles.protect(ctx, use.userSide, use.user, use.targetActed);
                break;
            case REST:
                status.rest(ctx, use.userSide, use.user);
                break;
            default:
                throw new IllegalStateException("Unhandled move effect " + effect.getKind());
        }
    }
}
