package pokeai.engine;

import pokeai.data.ScreenKind;
import pokeai.data.SideConditionKind;
import pokeai.data.Stat;
import pokeai.data.StatusCondition;
import pokeai.engine.error.StateInvariantViolationException;
import pokeai.model.BattleState;
import pokeai.model.Field;
import pokeai.model.MoveSlot;
import pokeai.model.Pokemon;
import pokeai.model.Side;
import pokeai.model.StatBoosts;
import pokeai.model.VolatileState;

import java.util.Map;

/**
 * Consistency checks run after every mutation pass. A failure here is an engine bug, never a
 * consequence of user input that got past validation.
 */
public final class Invariants {

    private Invariants() {}

    public static void check(BattleState state) {
        checkSide(state.getP1());
        checkSide(state.getP2());
        checkField(state.getField());
        if (state.getTurn() < 0) {
            fail("Negative turn counter " + state.getTurn());
        }
    }

    private static void checkSide(Side side) {
        int size = side.getTeam().size();
        if (size < 1 || size > 6) {
            fail(side.getName() + " has " + size + " team members");
        }
        if (side.getActiveIndex() < 0 || side.getActiveIndex() >= size) {
            fail(side.getName() + " active slot " + side.getActiveIndex() + " out of range");
        }
        for (Pokemon p : side.getTeam()) {
            checkPokemon(side, p);
        }
        for (Map.Entry<ScreenKind, Integer> e : side.getScreens().entrySet()) {
            if (e.getValue() <= 0) {
                fail(side.getName() + " " + e.getKey() + " counter " + e.getValue());
            }
        }
        for (Map.Entry<SideConditionKind, Integer> e : side.getConditions().entrySet()) {
            if (e.getValue() <= 0) {
                fail(side.getName() + " " + e.getKey() + " counter " + e.getValue());
            }
        }
    }

    private static void checkPokemon(Side side, Pokemon p) {
        String who = side.getName() + "/" + p.getName();
        if (p.getMaxHp() <= 0) {
            fail(who + " max HP " + p.getMaxHp());
        }
        if (p.getHp() < 0 || p.getHp() > p.getMaxHp()) {
            fail(who + " HP " + p.getHp() + " outside [0, " + p.getMaxHp() + "]");
        }
        boolean faintedStatus = p.getStatus() == StatusCondition.FAINTED;
        if (faintedStatus != (p.getHp() == 0)) {
            fail(who + " fainted status " + faintedStatus + " with HP " + p.getHp());
        }
        if (p.getTera().isUsed() && p.getTera().isAvailable()) {
            fail(who + " tera used but still available");
        }
        for (Map.Entry<Stat, Integer> boost : p.getBoosts().asMap().entrySet()) {
            if (Math.abs(boost.getValue()) > StatBoosts.MAX_STAGE) {
                fail(who + " " + boost.getKey() + " stage " + boost.getValue());
            }
        }
        if (p.getMoves().size() > 4) {
            fail(who + " knows " + p.getMoves().size() + " moves");
        }
        for (MoveSlot slot : p.getMoves()) {
            if (slot.getPp() < 0 || slot.getPp() > slot.getMaxPp()) {
                fail(who + " " + slot.getMoveId() + " PP " + slot.getPp() + "/" + slot.getMaxPp());
            }
        }
        if (p.getSleepTurns() < 0 || p.getToxicCounter() < 0) {
            fail(who + " negative status counter");
        }
        for (VolatileState v : p.getVolatiles().all()) {
            if (v.hasCountdown() && v.getTurnsLeft() == 0) {
                fail(who + " expired volatile " + v.getKind() + " still active");
            }
        }
    }

    private static void checkField(Field field) {
        if (field.getWeatherTurns() < 0 || field.getTerrainTurns() < 0) {
            fail("Negative field counter: " + field);
        }
    }

    private static void fail(String message) {
        throw new StateInvariantViolationException(message);
    }
}
