package pokeai.engine.effect;

import pokeai.data.StatusCondition;
import pokeai.data.VolatileKind;
import pokeai.engine.BattleRandom;
import pokeai.model.BattleEvent;
import pokeai.model.BattleState;
import pokeai.model.EventType;
import pokeai.model.Pokemon;
import pokeai.model.Side;
import pokeai.model.SideId;
import pokeai.model.VolatileState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything a single Advance mutates: the working copy of the state, its random source and the
 * events produced so far. Not shared between threads.
 */
public final class BattleContext {
    private final BattleState state;
    private final BattleRandom random;
    private final EffectLookup effects;
    private final List<BattleEvent> events = new ArrayList<>();

    public BattleContext(BattleState state, EffectLookup effects) {
        this.state = state;
        this.effects = effects;
        this.random = new BattleRandom(state.getRngState());
    }

    public BattleState getState() {
        return state;
    }

    public BattleRandom getRandom() {
        return random;
    }

    public EffectLookup getEffects() {
        return effects;
    }

    public List<BattleEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public Side side(SideId id) {
        return state.getSide(id);
    }

    /** The opposing active Pokemon of {@code id}, or null. */
    public Pokemon foeOf(SideId id) {
        return state.getSide(id.opponent()).getActive();
    }

    public EffectContext context(SideId holderSide) {
        Pokemon holder = state.getSide(holderSide).getActive();
        return EffectContext.of(state, holder, foeOf(holderSide));
    }

    public EffectContext context(Pokemon holder, Pokemon foe) {
        return EffectContext.of(state, holder, foe);
    }

    public void emit(EventType type, SideId side, Pokemon pokemon, String detail, int amount) {
        events.add(new BattleEvent(state.getTurn(), type, side, pokemon == null ? null : pokemon.getName(),
                detail, amount));
    }

    public void emit(EventType type, SideId side, Pokemon pokemon, String detail) {
        emit(type, side, pokemon, detail, 0);
    }

    public void emit(EventType type, SideId side, String detail) {
        emit(type, side, null, detail, 0);
    }

    /**
     * Removes up to {@code amount} HP and logs it, with a faint event when HP reaches zero.
     *
     * @return the HP actually lost
     */
    public int damage(SideId side, Pokemon target, int amount, String source) {
        if (target.isFainted() || amount <= 0) {
            return 0;
        }
        int dealt = Math.min(amount, target.getHp());
        target.setHp(target.getHp() - dealt);
        emit(EventType.DAMAGE, side, target, source, dealt);
        if (target.getHp() == 0) {
            faint(side, target);
        }
        return dealt;
    }

    /** Damage as a fraction of max HP, at least 1. */
    public int damageFraction(SideId side, Pokemon target, double fraction, String source) {
        return damage(side, target, Math.max(1, (int) Math.floor(target.getMaxHp() * fraction)), source);
    }

    public int heal(SideId side, Pokemon target, int amount, String source) {
        if (target.isFainted() || amount <= 0 || target.isFullHp()) {
            return 0;
        }
        int healed = Math.min(amount, target.getMaxHp() - target.getHp());
        target.setHp(target.getHp() + healed);
        emit(EventType.HEAL, side, target, source, healed);
        return healed;
    }

    public int healFraction(SideId side, Pokemon target, double fraction, String source) {
        return heal(side, target, Math.max(1, (int) Math.floor(target.getMaxHp() * fraction)), source);
    }

    public void faint(SideId side, Pokemon target) {
        target.setHp(0);
        VolatileState dynamax = target.getVolatiles().get(VolatileKind.DYNAMAX);
        if (dynamax != null) {
            target.setMaxHp(dynamax.getCounter());
        }
        target.getVolatiles().clear();
        target.getBoosts().clear();
        target.setStatus(StatusCondition.FAINTED);
        emit(EventType.FAINT, side, target, null);
    }

    /** Removes the held item and logs it. */
    public void consumeItem(SideId side, Pokemon holder) {
        String item = holder.getItem();
        if (item != null) {
            holder.setItem(null);
            emit(EventType.ITEM_CONSUMED, side, holder, item);
        }
    }

    /** Writes the random source back so the next Advance continues the same sequence. */
    public void commitRandom() {
        state.setRngState(random.getState());
    }
}
