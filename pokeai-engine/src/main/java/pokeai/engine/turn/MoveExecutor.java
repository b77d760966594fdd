package pokeai.engine.turn;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pokeai.data.Capability;
import pokeai.data.Dex;
import pokeai.data.Effect;
import pokeai.data.EffectKind;
import pokeai.data.EffectTarget;
import pokeai.data.FormatRules;
import pokeai.data.Move;
import pokeai.data.MoveEffect;
import pokeai.data.MoveEffectKind;
import pokeai.data.PokemonType;
import pokeai.data.TriggerPhase;
import pokeai.data.VolatileKind;
import pokeai.data.Weather;
import pokeai.engine.calc.AccuracyCalculator;
import pokeai.engine.calc.AttackProfile;
import pokeai.engine.calc.DamageCalculator;
import pokeai.engine.calc.DamageRoll;
import pokeai.engine.calc.MoveMode;
import pokeai.engine.effect.BattleContext;
import pokeai.engine.effect.EffectContext;
import pokeai.engine.effect.EffectLookup;
import pokeai.engine.effect.StatusMachine;
import pokeai.engine.effect.VolatileMachine;
import pokeai.engine.error.InvalidActionException;
import pokeai.model.EventType;
import pokeai.model.MoveSlot;
import pokeai.model.Pokemon;
import pokeai.model.SideId;
import pokeai.model.VolatileState;

/**
 * Runs one move from the gates before it to the effects after it.
 */
public final class MoveExecutor {
    private static final Logger log = LoggerFactory.getLogger(MoveExecutor.class);

    static final double CRIT_CHANCE = 1.0 / 24;
    static final double HIGH_CRIT_CHANCE = 1.0 / 8;
    static final double STRUGGLE_RECOIL = 0.25;

    private final Dex dex;
    private final EffectLookup effects;
    private final DamageCalculator damage;
    private final AccuracyCalculator accuracy;
    private final StatusMachine status;
    private final VolatileMachine volatiles;
    private final MoveEffectApplier applier;

    MoveExecutor(Dex dex, EffectLookup effects, StatusMachine status, VolatileMachine volatiles,
                 MoveEffectApplier applier) {
        this.dex = dex;
        this.effects = effects;
        this.damage = new DamageCalculator(effects);
        this.accuracy = new AccuracyCalculator(effects);
        this.status = status;
        this.volatiles = volatiles;
        this.applier = applier;
    }

    /**
     * @param targetActed whether the opposing active has already acted this turn
     */
    void execute(BattleContext ctx, SideId sideId, String moveId, MoveMode requestedMode, FormatRules format,
                 boolean targetActed) {
        Pokemon user = ctx.side(sideId).getActive();
        if (user == null || user.isFainted()) {
            return;
        }
        Move move = dex.move(moveId);
        if (move == null) {
            throw new InvalidActionException("Unknown move " + moveId);
        }
        MoveMode mode = user.isDynamaxed() ? MoveMode.MAX_MOVE : requestedMode;
        AttackProfile attack = AttackProfile.of(move, mode);

        if (!status.beforeMove(ctx, sideId, user) || !volatiles.beforeMove(ctx, sideId, user, move)) {
            user.getVolatiles().remove(VolatileKind.CHARGING);
            return;
        }
        boolean releasingCharge = user.getVolatiles().remove(VolatileKind.CHARGING) != null;
        if (mode == MoveMode.Z_MOVE) {
            ctx.side(sideId).setZMoveUsed(true);
            ctx.emit(EventType.ZMOVE, sideId, user, move.getId());
        }
        ctx.emit(EventType.MOVE, sideId, user, move.getId());
        if (!releasingCharge) {
            deductPp(ctx, sideId, user, move);
        }
        user.setLastMove(move.getId());
        if (!isProtectMove(move)) {
            volatiles.resetProtectStreak(user);
        }
        lockChoice(ctx, sideId, user, move);

        if (move.isCharge() && !releasingCharge && !skipsCharge(ctx, move)) {
            user.getVolatiles().put(new VolatileState(VolatileKind.CHARGING, VolatileKind.CHARGING.getDefaultTurns())
                    .withMove(move.getId()));
            ctx.emit(EventType.VOLATILE_START, sideId, user, "charging");
            return;
        }
        if (attack.isMaxGuard()) {
            volatiles.protect(ctx, sideId, user, targetActed);
            return;
        }

        SideId foeSide = sideId.opponent();
        Pokemon target = ctx.side(foeSide).getActive();
        boolean targetsFoe = move.getTarget().targetsFoe();
        if (targetsFoe && (target == null || target.isFainted())) {
            ctx.emit(EventType.NO_OP, sideId, user, "no target");
            return;
        }
        if (targetsFoe && target.getVolatiles().has(VolatileKind.PROTECT)) {
            ctx.emit(EventType.PROTECT, foeSide, target, "blocked " + move.getId());
            return;
        }
        if (targetsFoe) {
            double hitChance = accuracy.accuracy(ctx.getState(), user, target, attack);
            if (!ctx.getRandom().chance(hitChance)) {
                ctx.emit(EventType.MISS, sideId, user, move.getId());
                return;
            }
            if (absorbedByAbility(ctx, foeSide, target, user, attack)) {
                return;
            }
        }

        if (attack.isDamaging()) {
            hit(ctx, sideId, user, foeSide, target, attack, format, targetActed);
        } else {
            useStatusMove(ctx, sideId, user, target, attack, format, targetActed);
        }
        if (move.isRecharge() && !user.isFainted()) {
            user.getVolatiles().put(new VolatileState(VolatileKind.RECHARGE, VolatileKind.RECHARGE.getDefaultTurns()));
        }
    }

    private void hit(BattleContext ctx, SideId sideId, Pokemon user, SideId foeSide, Pokemon target,
                     AttackProfile attack, FormatRules format, boolean targetActed) {
        Move move = attack.getMove();
        EffectContext targetCtx = ctx.context(target, user);
        boolean crit = !effects.has(target, Capability.CRIT_IMMUNE, targetCtx)
                && ctx.getRandom().chance(move.isHighCrit() ? HIGH_CRIT_CHANCE : CRIT_CHANCE);
        DamageRoll roll = damage.calculate(ctx.getState(), user, ctx.side(sideId), target, ctx.side(foeSide),
                attack, crit);
        if (roll.isImmune()) {
            ctx.emit(EventType.IMMUNE, foeSide, target, move.getId());
            return;
        }
        int amount = roll.roll(ctx.getRandom().nextInt(DamageRoll.ROLLS));
        if (crit) {
            ctx.emit(EventType.CRIT, foeSide, target, move.getId());
        }

        boolean substitute = target.getVolatiles().has(VolatileKind.SUBSTITUTE) && !move.isSound()
                && !effects.has(user, Capability.BYPASS_SCREENS, ctx.context(user, target));
        int dealt;
        if (substitute) {
            dealt = volatiles.hitSubstitute(ctx, foeSide, target, amount);
        } else {
            amount = applySurvival(ctx, foeSide, target, user, amount);
            dealt = ctx.damage(foeSide, target, amount, move.getId());
            popBalloon(ctx, foeSide, target, user);
            status.onHitBy(ctx, foeSide, target, move);
            if (attack.isContact() && !user.isFainted()) {
                contactEffects(ctx, sideId, user, foeSide, target);
            }
        }

        afterHit(ctx, sideId, user, move, dealt);

        MoveEffectApplier.Use use = new MoveEffectApplier.Use(sideId, user, target, format, targetActed, substitute);
        for (MoveEffect effect : attack.effects()) {
            applier.apply(ctx, use, effect);
        }
    }

    private void useStatusMove(BattleContext ctx, SideId sideId, Pokemon user, Pokemon target, AttackProfile attack,
                               FormatRules format, boolean targetActed) {
        Move move = attack.getMove();
        boolean targetsFoe = move.getTarget().targetsFoe();
        if (targetsFoe && move.getType() == PokemonType.ELECTRIC && target.hasType(PokemonType.GROUND)) {
            // thunder wave does not affect ground types
            ctx.emit(EventType.IMMUNE, sideId.opponent(), target, move.getId());
            return;
        }
        boolean substitute = targetsFoe && target.getVolatiles().has(VolatileKind.SUBSTITUTE) && !move.isSound()
                && !effects.has(user, Capability.BYPASS_SCREENS, ctx.context(user, target));
        MoveEffectApplier.Use use = new MoveEffectApplier.Use(sideId, user, target, format, targetActed, substitute);
        if (substitute && hasFoeEffect(attack)) {
            ctx.emit(EventType.FAIL, sideId.opponent(), target, "substitute");
        }
        for (MoveEffect effect : attack.effects()) {
            applier.apply(ctx, use, effect);
        }
    }

    private static boolean hasFoeEffect(AttackProfile attack) {
        for (MoveEffect effect : attack.effects()) {
            if (effect.getTarget() == EffectTarget.FOE && effect.getKind() != MoveEffectKind.REMOVE_HAZARDS) {
                return true;
            }
        }
        return false;
    }

    /** Volt Absorb, Water Absorb, Flash Fire and Good as Gold. */
    private boolean absorbedByAbility(BattleContext ctx, SideId foeSide, Pokemon target, Pokemon user,
                                      AttackProfile attack) {
        EffectContext ectx = ctx.context(target, user).withMove(attack.getMove(), attack.getType(), 1.0);
        Effect immunity = damage.immunityEffect(target, attack, ectx);
        if (immunity == null) {
            return false;
        }
        ctx.emit(EventType.ABILITY, foeSide, target, target.getAbility());
        if (immunity.getValue() > 0) {
            ctx.healFraction(foeSide, target, immunity.getValue(), target.getAbility());
        }
        if (effects.has(target, Capability.FLASH_FIRE, ectx)) {
            target.getVolatiles().add(VolatileKind.FLASH_FIRE);
        }
        ctx.emit(EventType.IMMUNE, foeSide, target, attack.getMoveId());
        return true;
    }

    /** Focus Sash and Sturdy leave a Pokemon hit from full HP at 1 HP. */
    private int applySurvival(BattleContext ctx, SideId side, Pokemon target, Pokemon attacker, int amount) {
        if (!target.isFullHp() || amount < target.getHp()) {
            return amount;
        }
        EffectContext ectx = ctx.context(target, attacker);
        Effect survive = effects.capability(target, Capability.SURVIVE_FROM_FULL, ectx);
        if (survive == null) {
            return amount;
        }
        if (effects.grantedByItem(target, Capability.SURVIVE_FROM_FULL, ectx)) {
            if (survive.isConsumed()) {
                ctx.consumeItem(side, target);
            }
        } else {
            ctx.emit(EventType.ABILITY, side, target, target.getAbility());
        }
        return target.getHp() - 1;
    }

    private void popBalloon(BattleContext ctx, SideId side, Pokemon target, Pokemon attacker) {
        if (target.isFainted() || target.getItem() == null) {
            return;
        }
        EffectContext ectx = ctx.context(target, attacker);
        Effect balloon = effects.capability(target, Capability.UNGROUNDED, ectx);
        if (balloon != null && balloon.isConsumed() && effects.grantedByItem(target, Capability.UNGROUNDED, ectx)) {
            ctx.consumeItem(side, target);
        }
    }

    /** Rough Skin, Iron Barbs, Rocky Helmet, Flame Body and Static punish the attacker. */
    private void contactEffects(BattleContext ctx, SideId attackerSide, Pokemon attacker, SideId holderSide,
                                Pokemon holder) {
        EffectContext holderCtx = ctx.context(holder, attacker);
        boolean magicGuard = effects.has(attacker, Capability.MAGIC_GUARD, ctx.context(attacker, holder));
        for (Effect effect : effects.active(TriggerPhase.CONTACT, holder, holderCtx)) {
            if (attacker.isFainted()) {
                return;
            }
            if (effect.getKind() == EffectKind.DAMAGE && !magicGuard) {
                ctx.damageFraction(attackerSide, attacker, effect.getValue(), sourceOf(holder, effect));
            } else if (effect.getKind() == EffectKind.INFLICT_STATUS && ctx.getRandom().chance(effect.getValue())
                    && status.getRules().canInflict(ctx.getState(), attacker, effect.getStatus(), holder)) {
                ctx.emit(EventType.ABILITY, holderSide, holder, holder.getAbility());
                status.inflict(ctx, attackerSide, attacker, effect.getStatus(), holder, null);
            }
        }
    }

    private String sourceOf(Pokemon holder, Effect effect) {
        return effects.getTable().abilityEffects(TriggerPhase.CONTACT, holder.getAbility()).contains(effect)
                ? holder.getAbility() : holder.getItem();
    }

    /** Drain, recoil, struggle recoil and Life Orb. */
    private void afterHit(BattleContext ctx, SideId sideId, Pokemon user, Move move, int dealt) {
        if (user.isFainted()) {
            return;
        }
        EffectContext ectx = ctx.context(user, ctx.foeOf(sideId));
        boolean magicGuard = effects.has(user, Capability.MAGIC_GUARD, ectx);
        if (move.getDrain() > 0 && dealt > 0) {
            ctx.heal(sideId, user, Math.max(1, (int) Math.floor(dealt * move.getDrain())), "drain");
        }
        if (move.isStruggle()) {
            ctx.damage(sideId, user, Math.max(1, (int) Math.round(user.getMaxHp() * STRUGGLE_RECOIL)), "recoil");
            return;
        }
        if (move.getRecoil() > 0 && dealt > 0 && !magicGuard) {
            ctx.damage(sideId, user, Math.max(1, (int) Math.round(dealt * move.getRecoil())), "recoil");
        }
        if (dealt > 0 && !magicGuard) {
            for (Effect effect : effects.active(TriggerPhase.AFTER_ATTACK, user, ectx)) {
                if (effect.getKind() == EffectKind.DAMAGE && !user.isFainted()) {
                    ctx.damageFraction(sideId, user, effect.getValue(), user.getItem());
                }
            }
        }
    }

    private void deductPp(BattleContext ctx, SideId sideId, Pokemon user, Move move) {
        if (move.isStruggle()) {
            return;
        }
        MoveSlot slot = user.findMove(move.getId());
        if (slot == null) {
            throw new InvalidActionException(user.getName() + " does not know " + move.getId());
        }
        Pokemon foe = ctx.foeOf(sideId);
        boolean pressure = foe != null && !foe.isFainted()
                && effects.has(foe, Capability.PRESSURE, ctx.context(foe, user));
        slot.deductPp(pressure ? 2 : 1);
    }

    private void lockChoice(BattleContext ctx, SideId sideId, Pokemon user, Move move) {
        if (user.isDynamaxed() || move.isStruggle() || user.getVolatiles().has(VolatileKind.CHOICE_LOCK)) {
            return;
        }
        if (effects.has(user, Capability.CHOICE_LOCK, ctx.context(user, ctx.foeOf(sideId)))) {
            user.getVolatiles().put(new VolatileState(VolatileKind.CHOICE_LOCK, -1).withMove(move.getId()));
            log.trace("{} locked into {}", user.getName(), move.getId());
        }
    }

    private static boolean skipsCharge(BattleContext ctx, Move move) {
        return "solarbeam".equals(move.getId()) && ctx.getState().getField().getWeather() == Weather.SUN;
    }

    private static boolean isProtectMove(Move move) {
        for (MoveEffect effect : move.getEffects()) {
            if (effect.getKind() == MoveEffectKind.PROTECT) {
                return true;
            }
        }
        return false;
    }
}
