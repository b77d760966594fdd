package pokeai.engine.effect;

import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import pokeai.data.EffectTable;
import pokeai.data.Move;
import pokeai.data.Stat;
import pokeai.data.VolatileKind;
import pokeai.engine.BattleFixtures;
import pokeai.model.BattleEvent;
import pokeai.model.BattleState;
import pokeai.model.EventType;
import pokeai.model.Pokemon;
import pokeai.model.SideId;

import static pokeai.engine.BattleFixtures.spec;
import static pokeai.engine.BattleFixtures.team;

public class VolatileMachineTest {
    private VolatileMachine volatiles;
    private BattleState state;
    private BattleContext ctx;
    private Pokemon garchomp;
    private Pokemon foe;

    @BeforeMethod
    public void setUp() {
        volatiles = new VolatileMachine(new EffectLookup(EffectTable.standard()));
        state = BattleFixtures.started(team(BattleFixtures.garchomp()),
                team(spec("Rillaboom", null, null, "Grassy Glide", "U-turn")), 5);
        ctx = new BattleContext(state, new EffectLookup(EffectTable.standard()));
        garchomp = state.getP1().getActive();
        foe = state.getP2().getActive();
    }

    @Test
    public void testSubstituteCostsAQuarter() {
        int max = garchomp.getMaxHp();
        Assert.assertTrue(volatiles.start(ctx, SideId.P1, garchomp, VolatileKind.SUBSTITUTE, garchomp));
        Assert.assertEquals(garchomp.getHp(), max - max / 4);
        Assert.assertEquals(garchomp.getVolatiles().get(VolatileKind.SUBSTITUTE).getCounter(), max / 4);
        Assert.assertFalse(volatiles.start(ctx, SideId.P1, garchomp, VolatileKind.SUBSTITUTE, garchomp),
                "A second substitute fails");
        Assert.assertEquals(garchomp.getHp(), max - max / 4, "A failed substitute costs nothing");
    }

    @Test
    public void testSubstituteNeedsEnoughHp() {
        garchomp.setHp(garchomp.getMaxHp() / 4);
        Assert.assertFalse(volatiles.start(ctx, SideId.P1, garchomp, VolatileKind.SUBSTITUTE, garchomp));
        Assert.assertFalse(garchomp.getVolatiles().has(VolatileKind.SUBSTITUTE));
    }

    @Test
    public void testSubstituteBreaks() {
        volatiles.start(ctx, SideId.P1, garchomp, VolatileKind.SUBSTITUTE, garchomp);
        int subHp = garchomp.getMaxHp() / 4;
        Assert.assertEquals(volatiles.hitSubstitute(ctx, SideId.P1, garchomp, 10_000), subHp);
        Assert.assertFalse(garchomp.getVolatiles().has(VolatileKind.SUBSTITUTE));
    }

    @Test
    public void testGrassTypesCannotBeSeeded() {
        Assert.assertFalse(volatiles.start(ctx, SideId.P2, foe, VolatileKind.LEECH_SEED, garchomp));
        Assert.assertTrue(volatiles.start(ctx, SideId.P1, garchomp, VolatileKind.LEECH_SEED, foe));
    }

    @Test
    public void testLeechSeedDrainsToFoe() {
        volatiles.start(ctx, SideId.P1, garchomp, VolatileKind.LEECH_SEED, foe);
        foe.setHp(foe.getMaxHp() / 2);
        int foeHp = foe.getHp();
        volatiles.endOfTurn(ctx, SideId.P1, garchomp);
        int drained = garchomp.getMaxHp() / 8;
        Assert.assertEquals(garchomp.getHp(), garchomp.getMaxHp() - drained);
        Assert.assertEquals(foe.getHp(), foeHp + drained);
    }

    @Test
    public void testEncoreNeedsALastMove() {
        Assert.assertFalse(volatiles.start(ctx, SideId.P1, garchomp, VolatileKind.ENCORE, foe));
        garchomp.setLastMove("earthquake");
        Assert.assertTrue(volatiles.start(ctx, SideId.P1, garchomp, VolatileKind.ENCORE, foe));
        Assert.assertEquals(garchomp.getVolatiles().get(VolatileKind.ENCORE).getMoveId(), "earthquake");
    }

    @Test
    public void testPerishSongFaintsAfterThreeTurns() {
        volatiles.start(ctx, SideId.P1, garchomp, VolatileKind.PERISH_SONG, foe);
        for (int turn = 1; turn <= 2; turn++) {
            volatiles.endOfTurn(ctx, SideId.P1, garchomp);
            volatiles.decay(ctx, SideId.P1, garchomp);
            Assert.assertFalse(garchomp.isFainted(), "still standing after turn " + turn);
        }
        volatiles.endOfTurn(ctx, SideId.P1, garchomp);
        Assert.assertTrue(garchomp.isFainted());
    }

    @Test
    public void testTimedVolatilesExpire() {
        volatiles.start(ctx, SideId.P1, garchomp, VolatileKind.TAUNT, foe);
        for (int i = 0; i < VolatileKind.TAUNT.getDefaultTurns(); i++) {
            Assert.assertTrue(garchomp.getVolatiles().has(VolatileKind.TAUNT));
            volatiles.decay(ctx, SideId.P1, garchomp);
        }
        Assert.assertFalse(garchomp.getVolatiles().has(VolatileKind.TAUNT));
    }

    @Test
    public void testSwitchOutClearsVolatilesAndBoosts() {
        volatiles.start(ctx, SideId.P1, garchomp, VolatileKind.CONFUSION, foe);
        garchomp.getBoosts().set(Stat.ATK, 2);
        volatiles.clearOnSwitchOut(ctx, SideId.P1, garchomp);
        Assert.assertTrue(garchomp.getVolatiles().isEmpty());
        Assert.assertTrue(garchomp.getBoosts().isEmpty());
    }

    @Test
    public void testConfusionHitsItselfOneTurnInThree() {
        Move earthquake = BattleFixtures.ENGINE.getDex().move("earthquake");
        Assert.assertTrue(volatiles.start(ctx, SideId.P1, garchomp, VolatileKind.CONFUSION, foe));
        int counter = garchomp.getVolatiles().get(VolatileKind.CONFUSION).getCounter();
        Assert.assertTrue(counter >= 2 && counter <= 5, "Confusion lasts 2 to 5 turns, got " + counter);

        long base = (2L * garchomp.getLevel() / 5 + 2) * 40 * garchomp.getStat(Stat.ATK)
                / garchomp.getStat(Stat.DEF) / 50 + 2;
        int hits = 0;
        for (int turn = 0; turn < 900; turn++) {
            garchomp.getVolatiles().get(VolatileKind.CONFUSION).setCounter(10);
            garchomp.setHp(garchomp.getMaxHp());
            if (!volatiles.beforeMove(ctx, SideId.P1, garchomp, earthquake)) {
                hits++;
                int lost = garchomp.getMaxHp() - garchomp.getHp();
                Assert.assertTrue(lost >= base * 85 / 100 && lost <= base, lost + " outside 40 power self-hit range");
            }
        }
        Assert.assertTrue(hits > 240 && hits < 360, "Hit itself " + hits + " times in 900 turns");
        int selfHits = 0;
        for (BattleEvent event : ctx.getEvents()) {
            if (event.getType() == EventType.CANT_MOVE && "confusion".equals(event.getDetail())) {
                selfHits++;
            }
        }
        Assert.assertEquals(selfHits, hits);
    }

    @Test
    public void testConfusionWearsOff() {
        volatiles.start(ctx, SideId.P1, garchomp, VolatileKind.CONFUSION, foe);
        garchomp.getVolatiles().get(VolatileKind.CONFUSION).setCounter(1);
        Move earthquake = BattleFixtures.ENGINE.getDex().move("earthquake");
        Assert.assertTrue(volatiles.beforeMove(ctx, SideId.P1, garchomp, earthquake));
        Assert.assertFalse(garchomp.getVolatiles().has(VolatileKind.CONFUSION));
        Assert.assertEquals(garchomp.getHp(), garchomp.getMaxHp());
    }
}
