package pokeai.engine.calc;

import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import pokeai.data.HazardKind;
import pokeai.data.StatusCondition;
import pokeai.engine.BattleFixtures;
import pokeai.model.BattleState;
import pokeai.model.Pokemon;
import pokeai.model.Side;

import static pokeai.engine.BattleFixtures.spec;
import static pokeai.engine.BattleFixtures.team;

public class HazardCalculatorTest {
    private HazardCalculator hazards;
    private BattleState state;
    private Side side;

    @BeforeMethod
    public void setUp() {
        hazards = BattleFixtures.ENGINE.getCalculator().getHazardCalculator();
        state = BattleFixtures.started(
                team(BattleFixtures.dragapult(), BattleFixtures.garchomp(), BattleFixtures.corviknight(),
                        spec("Garchomp", "Heavy-Duty Boots", null, "Earthquake"),
                        spec("Toxapex", null, "Regenerator", "Scald")),
                team(BattleFixtures.greatTusk()), 1);
        side = state.getP1();
    }

    private Pokemon member(int slot) {
        return side.getTeam().get(slot);
    }

    @Test
    public void testNoHazardsNoDamage() {
        Assert.assertEquals(hazards.onEntry(state, side, member(1)).getDamagePercent(), 0.0, 1e-9);
    }

    @Test
    public void testStealthRockNeutral() {
        side.getHazards().add(HazardKind.STEALTH_ROCK);
        Assert.assertEquals(hazards.onEntry(state, side, member(1)).getDamagePercent(), 12.5, 1e-9);
    }

    @Test
    public void testThreeSpikesAddAQuarter() {
        side.getHazards().add(HazardKind.STEALTH_ROCK);
        for (int i = 0; i < 3; i++) {
            side.getHazards().add(HazardKind.SPIKES);
        }
        Assert.assertFalse(side.getHazards().add(HazardKind.SPIKES), "A fourth layer of Spikes is rejected");
        Assert.assertEquals(hazards.onEntry(state, side, member(1)).getDamagePercent(), 37.5, 1e-9);
    }

    @Test
    public void testFlyingTypeIgnoresSpikes() {
        for (int i = 0; i < 3; i++) {
            side.getHazards().add(HazardKind.SPIKES);
        }
        side.getHazards().add(HazardKind.TOXIC_SPIKES);
        side.getHazards().add(HazardKind.STICKY_WEB);
        HazardOutcome outcome = hazards.onEntry(state, side, member(2));
        Assert.assertEquals(outcome.getDamagePercent(), 0.0, 1e-9);
        Assert.assertEquals(outcome.getStatus(), StatusCondition.NONE);
        Assert.assertFalse(outcome.isSpeedDrop());
    }

    @Test
    public void testHeavyDutyBootsIgnoreEverything() {
        side.getHazards().add(HazardKind.STEALTH_ROCK);
        side.getHazards().add(HazardKind.SPIKES);
        side.getHazards().add(HazardKind.TOXIC_SPIKES);
        HazardOutcome outcome = hazards.onEntry(state, side, member(3));
        Assert.assertEquals(outcome.getDamagePercent(), 0.0, 1e-9);
        Assert.assertEquals(outcome.getStatus(), StatusCondition.NONE);
    }

    @Test
    public void testToxicSpikesLayers() {
        side.getHazards().add(HazardKind.TOXIC_SPIKES);
        Assert.assertEquals(hazards.onEntry(state, side, member(1)).getStatus(), StatusCondition.POISON);
        side.getHazards().add(HazardKind.TOXIC_SPIKES);
        Assert.assertEquals(hazards.onEntry(state, side, member(1)).getStatus(), StatusCondition.TOXIC);
        Assert.assertTrue(hazards.onEntry(state, side, member(4)).isAbsorbsToxicSpikes(),
                "A grounded Poison type absorbs Toxic Spikes");
    }
}
