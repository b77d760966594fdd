package pokeai.engine.calc;

import com.google.common.collect.ImmutableList;
import pokeai.data.Capability;
import pokeai.data.Effect;
import pokeai.data.EffectKind;
import pokeai.data.PokemonType;
import pokeai.data.ScreenKind;
import pokeai.data.SideConditionKind;
import pokeai.data.Stat;
import pokeai.data.StatusCondition;
import pokeai.data.Terrain;
import pokeai.data.TriggerPhase;
import pokeai.data.TypeChart;
import pokeai.data.VolatileKind;
import pokeai.data.Weather;
import pokeai.engine.effect.EffectContext;
import pokeai.engine.effect.EffectLookup;
import pokeai.model.BattleState;
import pokeai.model.Pokemon;
import pokeai.model.Side;

import java.util.ArrayList;
import java.util.List;

/**
 * Damage formula with the canonical sixteen-value random factor. Each modifier is applied in
 * turn and floored, so every roll is an exact integer HP amount. Pure: no argument is modified.
 */
public final class DamageCalculator {
    private final EffectLookup effects;

    public DamageCalculator(EffectLookup effects) {
        this.effects = effects;
    }

    public DamageRoll calculate(BattleState state, Pokemon attacker, Side attackerSide, Pokemon defender,
                                Side defenderSide, AttackProfile attack, boolean crit) {
        EffectContext attackerCtx = EffectContext.of(state, attacker, defender);
        double effectiveness = effectiveness(attack, defender, attackerCtx);
        if (!attack.isDamaging()) {
            return DamageRoll.zero(defender.getHp(), defender.getMaxHp(), effectiveness);
        }
        if (effectiveness == 0 || isImmune(state, defender, attacker, attack)) {
            return DamageRoll.zero(defender.getHp(), defender.getMaxHp(), 0);
        }
        attackerCtx.withMove(attack.getMove(), attack.getType(), effectiveness);
        EffectContext defenderCtx = EffectContext.of(state, defender, attacker)
                .withMove(attack.getMove(), attack.getType(), effectiveness);

        int power = basePower(state, attacker, defender, attack, attackerCtx);
        int atk = attackStat(attacker, defender, attack, crit, attackerCtx, defenderCtx);
        int def = defenseStat(state, attacker, defender, attack, crit, attackerCtx, defenderCtx);

        int base = (2 * attacker.getLevel() / 5 + 2) * power * atk / def / 50 + 2;
        base = (int) Math.floor(base * weatherModifier(state.getField().getWeather(), attack.getType()));
        if (crit) {
            base = (int) Math.floor(base * 1.5);
        }

        double stab = stab(attacker, attack.getType(), attackerCtx);
        boolean burned = attack.isPhysical() && attacker.getStatus() == StatusCondition.BURN;
        boolean screened = !crit && screened(state, defenderSide, attack)
                && !effects.has(attacker, Capability.BYPASS_SCREENS, attackerCtx);
        double finalModifier = effects.multiplier(TriggerPhase.FINAL_DAMAGE, attacker, attackerCtx)
                * effects.multiplier(TriggerPhase.DAMAGE_TAKEN, defender, defenderCtx);

        int[] rolls = new int[DamageRoll.ROLLS];
        for (int i = 0; i < DamageRoll.ROLLS; i++) {
            int damage = base * (85 + i) / 100;
            damage = (int) Math.floor(damage * stab);
            damage = (int) Math.floor(damage * effectiveness);
            if (burned) {
                damage = damage / 2;
            }
            if (screened) {
                damage = damage / 2;
            }
            damage = (int) Math.floor(damage * finalModifier);
            rolls[i] = Math.max(1, damage);
        }
        boolean survives = effects.has(defender, Capability.SURVIVE_FROM_FULL, defenderCtx);
        return new DamageRoll(rolls, defender.getHp(), defender.getMaxHp(), effectiveness, survives);
    }

    /** Type effectiveness including grounding: Levitate and Air Balloon dodge Ground, Gravity grounds Flying types. */
    public double effectiveness(AttackProfile attack, Pokemon defender, EffectContext ctx) {
        if (attack.getType() == null) {
            return 1.0;
        }
        List<PokemonType> types = defender.getTypes();
        if (attack.getType() == PokemonType.GROUND) {
            if (ctx.isGravity()) {
                List<PokemonType> grounded = new ArrayList<>(types);
                grounded.remove(PokemonType.FLYING);
                types = grounded.isEmpty() ? ImmutableList.of(PokemonType.NORMAL) : grounded;
            } else if (!effects.isGrounded(defender, EffectContext.of(ctx, defender))) {
                return 0;
            }
        }
        return TypeChart.effectiveness(attack.getType(), types);
    }

    /** Ability or item immunity of the defender to this attack (Flash Fire, Volt Absorb, Good as Gold). */
    public boolean isImmune(BattleState state, Pokemon defender, Pokemon attacker, AttackProfile attack) {
        if (!attack.getMove().getTarget().targetsFoe()) {
            return false;
        }
        EffectContext ctx = EffectContext.of(state, defender, attacker).withMove(attack.getMove(), attack.getType(), 1.0);
        return immunityEffect(defender, attack, ctx) != null;
    }

    public Effect immunityEffect(Pokemon defender, AttackProfile attack, EffectContext ctx) {
        for (Effect effect : effects.active(TriggerPhase.IMMUNITY, defender, ctx)) {
            if (effect.getKind() != EffectKind.IMMUNITY) {
                continue;
            }
            if (effect.getType() == null || effect.getType() == attack.getType()) {
                return effect;
            }
        }
        return null;
    }

    private int basePower(BattleState state, Pokemon attacker, Pokemon defender, AttackProfile attack,
                          EffectContext ctx) {
        double power = attack.getBasePower();
        if (attacker.isTerastallized() && attack.getType() == attacker.getTera().getType() && power < 60
                && attack.getMode() == MoveMode.NORMAL && attack.getMove().getPriority() <= 0) {
            power = 60;
        }
        power *= effects.multiplier(TriggerPhase.BASE_POWER, attacker, ctx);
        Terrain terrain = state.getField().getTerrain();
        if (terrain.getBoostedType() != null && terrain.getBoostedType() == attack.getType()
                && effects.isGrounded(attacker, ctx)) {
            power *= 1.3;
        }
        EffectContext defenderCtx = EffectContext.of(ctx, defender);
        if (terrain == Terrain.MISTY && attack.getType() == PokemonType.DRAGON && effects.isGrounded(defender, defenderCtx)) {
            power *= 0.5;
        }
        if (terrain == Terrain.GRASSY && "earthquake".equals(attack.getMoveId()) && effects.isGrounded(defender, defenderCtx)) {
            power *= 0.5;
        }
        if (attack.getType() == PokemonType.FIRE && attacker.getVolatiles().has(VolatileKind.FLASH_FIRE)) {
            power *= 1.5;
        }
        return Math.max(1, (int) Math.floor(power));
    }

    private int attackStat(Pokemon attacker, Pokemon defender, AttackProfile attack, boolean crit,
                           EffectContext attackerCtx, EffectContext defenderCtx) {
        Stat stat = attack.isPhysical() ? Stat.ATK : Stat.SPA;
        int stage = effects.has(defender, Capability.IGNORE_FOE_BOOSTS, defenderCtx) ? 0 : attacker.getBoosts().get(stat);
        if (crit && stage < 0) {
            stage = 0;
        }
        double value = StatCalculator.applyStage(attacker.getStat(stat), stage);
        value *= effects.multiplier(TriggerPhase.ATTACK_STAT, attacker, attackerCtx, stat);
        return Math.max(1, (int) Math.floor(value));
    }

    private int defenseStat(BattleState state, Pokemon attacker, Pokemon defender, AttackProfile attack, boolean crit,
                            EffectContext attackerCtx, EffectContext defenderCtx) {
        Stat stat = attack.isPhysical() ? Stat.DEF : Stat.SPD;
        Stat rawStat = stat;
        if (state.isFieldConditionActive(SideConditionKind.WONDER_ROOM)) {
            rawStat = stat == Stat.DEF ? Stat.SPD : Stat.DEF;
        }
        int stage = effects.has(attacker, Capability.IGNORE_FOE_BOOSTS, attackerCtx) ? 0 : defender.getBoosts().get(stat);
        if (crit && stage > 0) {
            stage = 0;
        }
        double value = StatCalculator.applyStage(defender.getStat(rawStat), stage);
        value *= effects.multiplier(TriggerPhase.DEFENSE_STAT, defender, defenderCtx, stat);
        Weather weather = state.getField().getWeather();
        if (weather == Weather.SAND && stat == Stat.SPD && defender.hasType(PokemonType.ROCK)) {
            value *= 1.5;
        }
        if (weather == Weather.SNOW && stat == Stat.DEF && defender.hasType(PokemonType.ICE)) {
            value *= 1.5;
        }
        return Math.max(1, (int) Math.floor(value));
    }

    static double weatherModifier(Weather weather, PokemonType type) {
        if (type == PokemonType.FIRE) {
            return weather == Weather.SUN ? 1.5 : weather == Weather.RAIN ? 0.5 : 1.0;
        }
        if (type == PokemonType.WATER) {
            return weather == Weather.RAIN ? 1.5 : weather == Weather.SUN ? 0.5 : 1.0;
        }
        return 1.0;
    }

    /** Same-type bonus, including terastallization rules. Adaptability replaces 1.5 with 2.0. */
    public double stab(Pokemon attacker, PokemonType moveType, EffectContext ctx) {
        if (moveType == null) {
            return 1.0;
        }
        double bonus = 1.5;
        boolean adaptability = false;
        for (Effect effect : effects.active(TriggerPhase.STAB, attacker, ctx)) {
            if (effect.getKind() == EffectKind.MULTIPLIER) {
                bonus = effect.getValue();
                adaptability = true;
            }
        }
        boolean original = attacker.getOriginalTypes().contains(moveType);
        if (attacker.isTerastallized() && attacker.getTera().getType() != null) {
            if (moveType == attacker.getTera().getType()) {
                if (original) {
                    return adaptability ? 2.25 : 2.0;
                }
                return bonus;
            }
            return original ? 1.5 : 1.0;
        }
        return original ? bonus : 1.0;
    }

    private static boolean screened(BattleState state, Side defenderSide, AttackProfile attack) {
        if (defenderSide == null) {
            return false;
        }
        if (defenderSide.hasScreen(ScreenKind.AURORA_VEIL) && state.getField().getWeather().isHailOrSnow()) {
            return true;
        }
        return attack.isPhysical() ? defenderSide.hasScreen(ScreenKind.REFLECT) : defenderSide.hasScreen(ScreenKind.LIGHT_SCREEN);
    }
}
