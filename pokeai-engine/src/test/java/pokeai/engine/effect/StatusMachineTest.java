package pokeai.engine.effect;

import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import pokeai.data.EffectTable;
import pokeai.data.FormatRules;
import pokeai.data.StatusCondition;
import pokeai.engine.BattleFixtures;
import pokeai.model.BattleEvent;
import pokeai.model.BattleState;
import pokeai.model.EventType;
import pokeai.model.Pokemon;
import pokeai.model.SideId;

import static pokeai.engine.BattleFixtures.spec;
import static pokeai.engine.BattleFixtures.team;

public class StatusMachineTest {
    private StatusMachine status;
    private BattleState state;
    private BattleContext ctx;
    private FormatRules format;

    @BeforeMethod
    public void setUp() {
        status = new StatusMachine(new EffectLookup(EffectTable.standard()));
        state = BattleFixtures.started(
                team(BattleFixtures.garchomp(), BattleFixtures.corviknight(),
                        spec("Heatran", null, "Flash Fire", "Flamethrower"),
                        spec("Zapdos", null, "Pressure", "Thunderbolt")),
                team(BattleFixtures.dragapult()), 21);
        ctx = new BattleContext(state, new EffectLookup(EffectTable.standard()));
        format = BattleFixtures.ENGINE.format(BattleFixtures.FORMAT);
    }

    private Pokemon p1(int slot) {
        return state.getP1().getTeam().get(slot);
    }

    private Pokemon foe() {
        return state.getP2().getActive();
    }

    @Test
    public void testBurnTakesASixteenth() {
        Pokemon garchomp = p1(0);
        Assert.assertTrue(status.inflict(ctx, SideId.P1, garchomp, StatusCondition.BURN, foe(), format));
        status.endOfTurn(ctx, SideId.P1, garchomp);
        Assert.assertEquals(garchomp.getHp(), garchomp.getMaxHp() - garchomp.getMaxHp() / 16);
    }

    @Test
    public void testToxicDamageEscalates() {
        Pokemon garchomp = p1(0);
        status.inflict(ctx, SideId.P1, garchomp, StatusCondition.TOXIC, foe(), format);
        int max = garchomp.getMaxHp();
        int expected = max;
        for (int turn = 1; turn <= 3; turn++) {
            status.endOfTurn(ctx, SideId.P1, garchomp);
            expected -= (int) Math.floor(max * turn / 16.0);
            Assert.assertEquals(garchomp.getToxicCounter(), turn);
            Assert.assertEquals(garchomp.getHp(), expected, "after turn " + turn);
        }
    }

    @Test
    public void testTypeImmunities() {
        Assert.assertFalse(status.inflict(ctx, SideId.P1, p1(1), StatusCondition.TOXIC, foe(), format),
                "Steel types cannot be poisoned");
        Assert.assertFalse(status.inflict(ctx, SideId.P1, p1(2), StatusCondition.BURN, foe(), format),
                "Fire types cannot be burned");
        Assert.assertFalse(status.inflict(ctx, SideId.P1, p1(3), StatusCondition.PARALYSIS, foe(), format),
                "Electric types cannot be paralyzed");
        Assert.assertEquals(ctx.getEvents().get(ctx.getEvents().size() - 1).getType(), EventType.FAIL);
    }

    @Test
    public void testOnlyOneStatusAtATime() {
        Pokemon garchomp = p1(0);
        Assert.assertTrue(status.inflict(ctx, SideId.P1, garchomp, StatusCondition.PARALYSIS, foe(), format));
        Assert.assertFalse(status.inflict(ctx, SideId.P1, garchomp, StatusCondition.BURN, foe(), format));
        Assert.assertEquals(garchomp.getStatus(), StatusCondition.PARALYSIS);
    }

    @Test
    public void testSleepClauseBlocksSecondSleeper() {
        Assert.assertTrue(status.inflict(ctx, SideId.P1, p1(0), StatusCondition.SLEEP, foe(), format));
        int turns = p1(0).getSleepTurns();
        Assert.assertTrue(turns >= 1 && turns <= 3, "Sleep lasts 1 to 3 turns, got " + turns);
        Assert.assertFalse(status.inflict(ctx, SideId.P1, p1(1), StatusCondition.SLEEP, foe(), format));
        Assert.assertTrue(status.inflict(ctx, SideId.P1, p1(1), StatusCondition.SLEEP, foe(), null),
                "Without a format there is no sleep clause");
    }

    /** Calls the pre-move check until the Pokemon acts and returns the number of turns it lost. */
    private int turnsLost(Pokemon pokemon) {
        int lost = 0;
        while (!status.beforeMove(ctx, SideId.P1, pokemon)) {
            lost++;
            Assert.assertTrue(lost <= 10, "Never woke up");
        }
        return lost;
    }

    private int events(EventType type, String detail) {
        int count = 0;
        for (BattleEvent event : ctx.getEvents()) {
            if (event.getType() == type && detail.equals(event.getDetail())) {
                count++;
            }
        }
        return count;
    }

    private void reseed(long seed) {
        state.setRngState(seed);
        ctx = new BattleContext(state, new EffectLookup(EffectTable.standard()));
    }

    @Test
    public void testSleepLastsUpToItsCounter() {
        Pokemon garchomp = p1(0);
        int[] lost = new int[4];
        for (long seed = 1; seed <= 300; seed++) {
            reseed(seed);
            garchomp.setStatus(StatusCondition.NONE);
            Assert.assertTrue(status.inflict(ctx, SideId.P1, garchomp, StatusCondition.SLEEP, foe(), null));
            int counter = garchomp.getSleepTurns();
            int turns = turnsLost(garchomp);
            Assert.assertTrue(turns <= counter, turns + " turns asleep with a counter of " + counter);
            Assert.assertEquals(events(EventType.CANT_MOVE, "asleep"), turns);
            Assert.assertEquals(garchomp.getStatus(), StatusCondition.NONE);
            lost[turns]++;
        }
        Assert.assertTrue(lost[3] > 0, "Some sleeps last the full three turns");
        Assert.assertTrue(lost[0] < 150, "An early wake on the first turn is the exception");
    }

    @Test
    public void testRestSleepIsNeverCutShort() {
        Pokemon garchomp = p1(0);
        for (long seed = 1; seed <= 100; seed++) {
            reseed(seed);
            garchomp.setHp(10);
            Assert.assertTrue(status.rest(ctx, SideId.P1, garchomp));
            Assert.assertEquals(turnsLost(garchomp), 2, "seed " + seed);
            Assert.assertEquals(events(EventType.CANT_MOVE, "asleep"), 2);
            Assert.assertEquals(garchomp.getStatus(), StatusCondition.NONE);
        }
    }

    @Test
    public void testFreezeThawsOneTurnInFive() {
        Pokemon heatran = p1(2);
        heatran.setStatus(StatusCondition.FREEZE);
        int thawed = 0;
        for (int turn = 0; turn < 1000; turn++) {
            if (status.beforeMove(ctx, SideId.P1, heatran)) {
                thawed++;
                heatran.setStatus(StatusCondition.FREEZE);
            }
        }
        Assert.assertTrue(thawed > 150 && thawed < 250, "Thawed " + thawed + " times in 1000 turns");
        Assert.assertEquals(events(EventType.CANT_MOVE, "frozen"), 1000 - thawed);
    }

    @Test
    public void testFireHitThawsTarget() {
        Pokemon garchomp = p1(0);
        garchomp.setStatus(StatusCondition.FREEZE);
        status.onHitBy(ctx, SideId.P1, garchomp, BattleFixtures.ENGINE.getDex().move("earthquake"));
        Assert.assertEquals(garchomp.getStatus(), StatusCondition.FREEZE);
        status.onHitBy(ctx, SideId.P1, garchomp, BattleFixtures.ENGINE.getDex().move("flamethrower"));
        Assert.assertEquals(garchomp.getStatus(), StatusCondition.NONE);
        Assert.assertEquals(events(EventType.CURE, "freeze"), 1);
    }

    @Test
    public void testFullParalysisOneTurnInFour() {
        Pokemon garchomp = p1(0);
        Assert.assertTrue(status.inflict(ctx, SideId.P1, garchomp, StatusCondition.PARALYSIS, foe(), format));
        int skipped = 0;
        for (int turn = 0; turn < 1000; turn++) {
            if (!status.beforeMove(ctx, SideId.P1, garchomp)) {
                skipped++;
            }
        }
        Assert.assertTrue(skipped > 200 && skipped < 300, "Fully paralyzed " + skipped + " times in 1000 turns");
        Assert.assertEquals(events(EventType.CANT_MOVE, "paralyzed"), skipped);
        Assert.assertEquals(garchomp.getStatus(), StatusCondition.PARALYSIS);
    }

    @Test
    public void testRestSleepsExactlyTwoTurnsAndHeals() {
        Pokemon garchomp = p1(0);
        garchomp.setHp(10);
        status.inflict(ctx, SideId.P1, garchomp, StatusCondition.BURN, foe(), format);
        Assert.assertTrue(status.rest(ctx, SideId.P1, garchomp));
        Assert.assertEquals(garchomp.getHp(), garchomp.getMaxHp());
        Assert.assertEquals(garchomp.getStatus(), StatusCondition.SLEEP);
        Assert.assertEquals(garchomp.getSleepTurns(), 2);
        Assert.assertTrue(garchomp.isSelfInflictedSleep());
        Assert.assertFalse(status.getRules().sleepClauseBlocks(state.getP1()),
                "Self-inflicted sleep does not count for sleep clause");
    }

    @Test
    public void testStatusDamageCanFaint() {
        Pokemon garchomp = p1(0);
        status.inflict(ctx, SideId.P1, garchomp, StatusCondition.POISON, foe(), format);
        garchomp.setHp(1);
        status.endOfTurn(ctx, SideId.P1, garchomp);
        Assert.assertTrue(garchomp.isFainted());
        Assert.assertEquals(garchomp.getHp(), 0);
        Assert.assertEquals(garchomp.getStatus(), StatusCondition.FAINTED);
    }
}
