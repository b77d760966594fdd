package pokeai.engine;

import org.testng.Assert;
import org.testng.annotations.Test;
import pokeai.engine.action.BattleAction;
import pokeai.engine.calc.CalcResult;
import pokeai.engine.error.BattleException;
import pokeai.engine.error.ErrorKind;
import pokeai.engine.error.InvalidActionException;
import pokeai.engine.error.StateInvariantViolationException;
import pokeai.engine.error.UnsupportedFormatException;
import pokeai.model.BattlePhase;
import pokeai.model.BattleState;
import pokeai.model.EventType;
import pokeai.model.SideId;

import java.util.Collections;
import java.util.List;

import static pokeai.engine.BattleFixtures.ENGINE;
import static pokeai.engine.BattleFixtures.FORMAT;
import static pokeai.engine.BattleFixtures.team;

public class BattleEngineTest {

    @Test
    public void testUnsupportedFormat() {
        try {
            ENGINE.format("gen1ou");
            Assert.fail("Expected UnsupportedFormatException");
        } catch (UnsupportedFormatException e) {
            Assert.assertEquals(e.getKind(), ErrorKind.UNSUPPORTED_FORMAT);
        }
    }

    @Test
    public void testFormatIdsAreNormalized() {
        Assert.assertEquals(ENGINE.format("[Gen 9] OU").getId(), "gen9ou");
    }

    @Test(expectedExceptions = UnsupportedFormatException.class)
    public void testFormatMustMatchBattle() {
        BattleState state = BattleFixtures.dragapultVsGarchomp(1);
        ENGINE.evaluate(new EvaluateRequest("gen9ubers", state, SideId.P1,
                Collections.<BattleAction>emptyList(), null));
    }

    @Test
    public void testStartSendsOutLeads() {
        BattleState prepared = BattleFixtures.prepared(team(BattleFixtures.dragapult()),
                team(BattleFixtures.garchomp()), 2);
        Assert.assertEquals(prepared.getPhase(), BattlePhase.PREPARATION);

        AdvanceResult result = ENGINE.start(prepared);
        Assert.assertEquals(result.getNextState().getPhase(), BattlePhase.BATTLE);
        Assert.assertEquals(result.getNextState().getTurn(), 0);
        long switches = result.getEvents().stream().filter(e -> e.getType() == EventType.SWITCH).count();
        Assert.assertEquals(switches, 2);
        Assert.assertEquals(prepared.getPhase(), BattlePhase.PREPARATION, "start leaves its input alone");
    }

    @Test(expectedExceptions = InvalidActionException.class)
    public void testStartTwiceIsRejected() {
        ENGINE.start(BattleFixtures.dragapultVsGarchomp(3));
    }

    @Test
    public void testEvaluateDefaultsToEnabledActions() {
        BattleState state = BattleFixtures.dragapultVsGarchomp(4);
        List<CalcResult> results = ENGINE.evaluate(new EvaluateRequest(FORMAT, state, SideId.P1,
                Collections.<BattleAction>emptyList(), null));
        Assert.assertEquals(results.size(), ENGINE.enabledActions(FORMAT, state, SideId.P1).size());
    }

    @Test
    public void testEvaluateWithoutActiveGivesErrorResult() {
        BattleState state = BattleFixtures.dragapultVsGarchomp(6);
        state.getP1().setActiveIndex(-1);
        List<CalcResult> results = ENGINE.evaluate(new EvaluateRequest(FORMAT, state, SideId.P1,
                Collections.<BattleAction>emptyList(), null));
        Assert.assertEquals(results.size(), 1);
        CalcResult result = results.get(0);
        Assert.assertTrue(result.isError());
        Assert.assertEquals(result.getErrorKind(), ErrorKind.MISSING_ENTITY);
        Assert.assertEquals(result.getAccuracy(), 0.0);
        Assert.assertEquals(result.getFormat(), FORMAT);
    }

    @Test
    public void testBrokenStateFailsInvariantCheck() {
        BattleState state = BattleFixtures.dragapultVsGarchomp(5);
        state.getP1().getActive().setHp(state.getP1().getActive().getMaxHp() + 1);
        try {
            Invariants.check(state);
            Assert.fail("Expected an invariant violation");
        } catch (StateInvariantViolationException e) {
            Assert.assertEquals(e.getKind(), ErrorKind.STATE_INVARIANT_VIOLATION);
            Assert.assertTrue(e instanceof BattleException);
        }
    }
}
