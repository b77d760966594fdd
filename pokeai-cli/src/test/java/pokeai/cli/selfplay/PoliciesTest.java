package pokeai.cli.selfplay;

import org.testng.Assert;
import org.testng.annotations.Test;
import pokeai.engine.BattleEngine;
import pokeai.engine.action.BattleAction;
import pokeai.model.BattleState;
import pokeai.model.SideId;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

public class PoliciesTest {
    private static final BattleEngine ENGINE = new BattleEngine();

    private static Matchup matchup() {
        return SelfPlayFixtures.matchup(ENGINE);
    }

    private static Decision decision(BattleState state, SideId side, long seed) {
        return new Decision(ENGINE, state.getFormat(), state, side,
                ENGINE.enabledActions(state.getFormat(), state, side), new Random(seed));
    }

    @Test
    public void testSafeDefaultSkipsStruggleAndSwitches() {
        List<BattleAction> candidates = Arrays.asList(BattleAction.switchTo(1), BattleAction.move("struggle"),
                BattleAction.move("earthquake"));
        Assert.assertEquals(SafeDefault.choose(candidates), BattleAction.move("earthquake"));
        Assert.assertEquals(SafeDefault.choose(Arrays.asList(BattleAction.move("struggle"), BattleAction.switchTo(2))),
                BattleAction.move("struggle"));
        Assert.assertEquals(SafeDefault.choose(Collections.singletonList(BattleAction.pass())), BattleAction.pass());
    }

    @Test
    public void testByName() {
        Assert.assertEquals(Policies.byName("Random", 0).getName(), "random");
        Assert.assertEquals(Policies.byName("greedy", 0).getName(), "greedy");
        Assert.assertEquals(Policies.byName("greedy", 0.25).getName(), "greedy(eps=0.25)");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnknownPolicy() {
        Policies.byName("minimax", 0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testEpsilonOutOfRange() {
        new EpsilonGreedyPolicy(new GreedyPolicy(), 1.5);
    }

    @Test
    public void testRandomPolicyIsSeeded() {
        BattleState state = matchup().start("policies", 3);
        RandomPolicy policy = new RandomPolicy();
        BattleAction first = policy.choose(decision(state, SideId.P1, 42));
        BattleAction second = policy.choose(decision(state, SideId.P1, 42));
        Assert.assertEquals(first, second);
        Assert.assertTrue(ENGINE.enabledActions(state.getFormat(), state, SideId.P1).contains(first));
    }

    @Test
    public void testGreedyIsDeterministic() {
        BattleState state = matchup().start("policies", 4);
        BattleAction choice = new GreedyPolicy().choose(decision(state, SideId.P1, 1));
        Assert.assertTrue(ENGINE.enabledActions(state.getFormat(), state, SideId.P1).contains(choice));
        Assert.assertEquals(new GreedyPolicy().choose(decision(state, SideId.P1, 2)), choice,
                "Greedy ignores the random source");
    }

    @Test
    public void testGreedyWithOneCandidate() {
        BattleState state = matchup().start("policies", 5);
        Decision only = new Decision(ENGINE, state.getFormat(), state, SideId.P1,
                Collections.singletonList(BattleAction.switchTo(1)), new Random(1));
        Assert.assertEquals(new GreedyPolicy().choose(only), BattleAction.switchTo(1));
    }

    @Test
    public void testFullExplorationIgnoresInnerPolicy() {
        BattleState state = matchup().start("policies", 6);
        ActionPolicy refusing = new ActionPolicy() {
            @Override
            public BattleAction choose(Decision decision) {
                throw new AssertionError("inner policy must not be asked");
            }

            @Override
            public String getName() {
                return "refusing";
            }
        };
        BattleAction choice = new EpsilonGreedyPolicy(refusing, 1.0).choose(decision(state, SideId.P2, 7));
        Assert.assertTrue(ENGINE.enabledActions(state.getFormat(), state, SideId.P2).contains(choice));
    }
}
