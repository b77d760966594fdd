package pokeai.engine.turn;

import org.testng.Assert;
import org.testng.annotations.Test;
import pokeai.data.Stat;
import pokeai.data.StatusCondition;
import pokeai.engine.AdvanceRequest;
import pokeai.engine.AdvanceResult;
import pokeai.engine.BattleFixtures;
import pokeai.engine.action.BattleAction;
import pokeai.engine.error.InvalidActionException;
import pokeai.model.BattleEvent;
import pokeai.model.BattlePhase;
import pokeai.model.BattleState;
import pokeai.model.EventType;
import pokeai.model.Pokemon;
import pokeai.model.SideId;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static pokeai.engine.BattleFixtures.ENGINE;
import static pokeai.engine.BattleFixtures.FORMAT;
import static pokeai.engine.BattleFixtures.spec;
import static pokeai.engine.BattleFixtures.team;

public class TurnResolverTest {

    private static AdvanceResult advance(BattleState state, String p1, String p2) {
        return ENGINE.advance(new AdvanceRequest(FORMAT, state, BattleAction.parse(p1), BattleAction.parse(p2)));
    }

    private static BattleEvent first(List<BattleEvent> events, EventType type) {
        for (BattleEvent event : events) {
            if (event.getType() == type) {
                return event;
            }
        }
        return null;
    }

    private static int indexOf(List<BattleEvent> events, EventType type, SideId side) {
        for (int i = 0; i < events.size(); i++) {
            if (events.get(i).getType() == type && events.get(i).getSide() == side) {
                return i;
            }
        }
        return -1;
    }

    private static List<String> enabled(BattleState state, SideId side) {
        List<String> notations = new ArrayList<>();
        for (BattleAction action : ENGINE.enabledActions(FORMAT, state, side)) {
            notations.add(action.notation());
        }
        return notations;
    }

    @Test
    public void testMoveIntoFaintedTargetIsNoOp() {
        BattleState state = BattleFixtures.dragapultVsGarchomp(11);
        state.getP1().getActive().setHp(1);

        AdvanceResult result = advance(state, "move bravebird", "move earthquake");
        BattleState next = result.getNextState();
        Assert.assertTrue(next.getP1().getActive().isFainted(), "Recoil and Rough Skin knock out Dragapult");
        BattleEvent noOp = first(result.getEvents(), EventType.NO_OP);
        Assert.assertNotNull(noOp, result.getEvents().toString());
        Assert.assertEquals(noOp.getSide(), SideId.P2);
        Assert.assertEquals(noOp.getDetail(), "no target");

        Assert.assertTrue(next.isAwaitingReplacement());
        Assert.assertEquals(enabled(next, SideId.P1), Arrays.asList("switch 1"));
        Assert.assertEquals(enabled(next, SideId.P2), Arrays.asList("pass"));
    }

    @Test
    public void testReplacementWindowDoesNotStartATurn() {
        BattleState state = BattleFixtures.dragapultVsGarchomp(12);
        state.getP1().getActive().setHp(1);
        BattleState fainted = advance(state, "move bravebird", "move earthquake").getNextState();

        AdvanceResult result = advance(fainted, "switch 1", "pass");
        BattleState next = result.getNextState();
        Assert.assertEquals(next.getTurn(), fainted.getTurn());
        Assert.assertEquals(next.getP1().getActiveIndex(), 1);
        Assert.assertFalse(next.isAwaitingReplacement());
        Assert.assertNull(first(result.getEvents(), EventType.TURN_START));
    }

    @Test(expectedExceptions = InvalidActionException.class)
    public void testWaitingSideMustPass() {
        BattleState state = BattleFixtures.dragapultVsGarchomp(13);
        state.getP1().getActive().setHp(1);
        BattleState fainted = advance(state, "move bravebird", "move earthquake").getNextState();
        advance(fainted, "switch 1", "move earthquake");
    }

    @Test
    public void testInputStateIsNotModified() {
        BattleState state = BattleFixtures.dragapultVsGarchomp(14);
        int turn = state.getTurn();
        int p2Hp = state.getP2().getActive().getHp();
        int logSize = state.getLog().size();

        BattleState next = advance(state, "move shadowball", "move earthquake").getNextState();
        Assert.assertNotSame(next, state);
        Assert.assertEquals(state.getTurn(), turn);
        Assert.assertEquals(state.getP2().getActive().getHp(), p2Hp);
        Assert.assertEquals(state.getLog().size(), logSize);
        Assert.assertEquals(next.getTurn(), turn + 1);
    }

    @Test
    public void testSameStateAndActionsGiveSameResult() {
        BattleState state = BattleFixtures.dragapultVsGarchomp(15);
        AdvanceResult a = advance(state, "move dracometeor", "move stoneedge");
        AdvanceResult b = advance(state, "move dracometeor", "move stoneedge");
        Assert.assertEquals(a.getEvents().toString(), b.getEvents().toString());
        Assert.assertEquals(a.getNextState().getRngState(), b.getNextState().getRngState());
        Assert.assertEquals(a.getNextState().getP2().getActive().getHp(), b.getNextState().getP2().getActive().getHp());
    }

    @Test
    public void testSwitchesResolveBeforeMoves() {
        BattleState state = BattleFixtures.dragapultVsGarchomp(16);
        List<BattleEvent> events = advance(state, "switch 1", "move earthquake").getEvents();
        int switched = indexOf(events, EventType.SWITCH, SideId.P1);
        int moved = indexOf(events, EventType.MOVE, SideId.P2);
        Assert.assertTrue(switched >= 0 && moved > switched, events.toString());
        BattleEvent hit = events.get(indexOf(events, EventType.DAMAGE, SideId.P1));
        Assert.assertEquals(hit.getPokemon(), state.getP1().getTeam().get(1).getName(),
                "Earthquake lands on the incoming Pokemon");
    }

    @Test
    public void testPriorityBeatsSpeed() {
        BattleState state = BattleFixtures.started(team(BattleFixtures.garchomp()),
                team(spec("Dragonite", null, "Multiscale", "Extreme Speed", "Earthquake")), 17);
        state.getP1().getActive().setStat(Stat.SPE, 333);
        state.getP2().getActive().setStat(Stat.SPE, 200);

        List<BattleEvent> events = advance(state, "move swordsdance", "move extremespeed").getEvents();
        Assert.assertTrue(indexOf(events, EventType.MOVE, SideId.P2) < indexOf(events, EventType.MOVE, SideId.P1),
                events.toString());
    }

    @Test
    public void testFasterMovesFirst() {
        BattleState state = BattleFixtures.dragapultVsGarchomp(18);
        List<BattleEvent> events = advance(state, "move shadowball", "move swordsdance").getEvents();
        Assert.assertTrue(indexOf(events, EventType.MOVE, SideId.P1) < indexOf(events, EventType.MOVE, SideId.P2));
    }

    @Test
    public void testKnockingOutLastPokemonWins() {
        BattleState state = BattleFixtures.started(team(BattleFixtures.dragapult()),
                team(BattleFixtures.garchomp()), 19);
        state.getP2().getActive().setHp(1);

        AdvanceResult result = advance(state, "move shadowball", "move earthquake");
        Assert.assertTrue(result.isFinished());
        Assert.assertEquals(result.getNextState().getPhase(), BattlePhase.FINISHED);
        Assert.assertEquals(result.getNextState().getWinner(), SideId.P1);
        Assert.assertEquals(first(result.getEvents(), EventType.WIN).getSide(), SideId.P1);
    }

    @Test(expectedExceptions = InvalidActionException.class)
    public void testFinishedBattleRejectsAdvance() {
        BattleState state = BattleFixtures.started(team(BattleFixtures.dragapult()),
                team(BattleFixtures.garchomp()), 20);
        Pokemon garchomp = state.getP2().getActive();
        garchomp.setHp(0);
        garchomp.setStatus(StatusCondition.FAINTED);
        state.setPhase(BattlePhase.FINISHED);
        state.setWinner(SideId.P1);
        advance(state, "move shadowball", "pass");
    }

    @Test(expectedExceptions = InvalidActionException.class)
    public void testMoveNotKnownIsRejected() {
        advance(BattleFixtures.dragapultVsGarchomp(21), "move earthquake", "move earthquake");
    }

    @Test(expectedExceptions = InvalidActionException.class)
    public void testUnstartedBattleRejectsAdvance() {
        BattleState prepared = BattleFixtures.prepared(team(BattleFixtures.dragapult()),
                team(BattleFixtures.garchomp()), 22);
        advance(prepared, "move shadowball", "move earthquake");
    }

    @Test
    public void testLeftoversHealAtEndOfTurn() {
        BattleState state = BattleFixtures.started(team(BattleFixtures.corviknight()),
                team(BattleFixtures.garchomp()), 23);
        Pokemon corviknight = state.getP1().getActive();
        corviknight.setHp(corviknight.getMaxHp() / 2);

        BattleState next = advance(state, "move defog", "move swordsdance").getNextState();
        Pokemon healed = next.getP1().getActive();
        Assert.assertEquals(healed.getHp(), corviknight.getMaxHp() / 2 + corviknight.getMaxHp() / 16);
    }
}
