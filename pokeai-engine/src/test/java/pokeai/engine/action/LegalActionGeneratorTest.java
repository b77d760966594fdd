package pokeai.engine.action;

import org.testng.Assert;
import org.testng.annotations.Test;
import pokeai.data.StatusCondition;
import pokeai.data.VolatileKind;
import pokeai.engine.AdvanceRequest;
import pokeai.engine.BattleFactory;
import pokeai.engine.BattleFixtures;
import pokeai.model.BattleState;
import pokeai.model.MoveSlot;
import pokeai.model.Pokemon;
import pokeai.model.SideId;
import pokeai.model.VolatileState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static pokeai.engine.BattleFixtures.ENGINE;
import static pokeai.engine.BattleFixtures.FORMAT;
import static pokeai.engine.BattleFixtures.spec;
import static pokeai.engine.BattleFixtures.team;

public class LegalActionGeneratorTest {

    private static List<String> enabled(BattleState state, SideId side) {
        return enabled(FORMAT, state, side);
    }

    private static List<String> enabled(String format, BattleState state, SideId side) {
        List<String> notations = new ArrayList<>();
        for (BattleAction action : ENGINE.enabledActions(format, state, side)) {
            notations.add(action.notation());
        }
        return notations;
    }

    private static LegalAction find(BattleState state, SideId side, String notation) {
        for (LegalAction legal : ENGINE.legalActions(FORMAT, state, side)) {
            if (legal.getAction().notation().equals(notation)) {
                return legal;
            }
        }
        Assert.fail("No option " + notation);
        return null;
    }

    private static BattleState advance(BattleState state, String p1, String p2) {
        return ENGINE.advance(new AdvanceRequest(FORMAT, state,
                BattleAction.parse(p1), BattleAction.parse(p2))).getNextState();
    }

    @Test
    public void testFreshBattleOffersMovesTeraAndSwitches() {
        BattleState state = BattleFixtures.dragapultVsGarchomp(1);
        List<String> options = enabled(state, SideId.P1);
        Assert.assertEquals(options, Arrays.asList(
                "move shadowball", "move dracometeor", "move bravebird", "move uturn",
                "tera shadowball", "tera dracometeor", "tera bravebird", "tera uturn",
                "switch 1"));
    }

    @Test
    public void testEveryOptionIsLegalForAdvance() {
        BattleState state = BattleFixtures.dragapultVsGarchomp(2);
        for (BattleAction action : ENGINE.enabledActions(FORMAT, state, SideId.P1)) {
            ENGINE.advance(new AdvanceRequest(FORMAT, state, action, BattleAction.move("swordsdance")));
        }
    }

    @Test
    public void testChoiceLockHoldsUntilSwitchOut() {
        BattleState state = BattleFixtures.started(
                team(spec("Dragapult", "Choice Specs", "Clear Body", "Shadow Ball", "Draco Meteor", "Brave Bird", "U-turn"),
                        BattleFixtures.greatTusk()),
                team(BattleFixtures.garchomp(), BattleFixtures.corviknight()), 3);

        state = advance(state, "move shadowball", "move swordsdance");
        Assert.assertEquals(enabled(state, SideId.P1),
                Arrays.asList("move shadowball", "tera shadowball", "switch 1"));
        Assert.assertEquals(find(state, SideId.P1, "move dracometeor").getReason(), "locked into shadowball");

        state = advance(state, "switch 1", "move swordsdance");
        state = advance(state, "switch 0", "move swordsdance");
        Assert.assertTrue(enabled(state, SideId.P1).containsAll(Arrays.asList(
                "move shadowball", "move dracometeor", "move bravebird", "move uturn")));
    }

    @Test
    public void testStruggleWhenOutOfPp() {
        BattleState state = BattleFixtures.dragapultVsGarchomp(4);
        for (MoveSlot slot : state.getP1().getActive().getMoves()) {
            slot.deductPp(slot.getMaxPp());
        }
        Assert.assertEquals(enabled(state, SideId.P1), Arrays.asList("move struggle", "switch 1"));
    }

    @Test
    public void testFaintedActiveMustBeReplaced() {
        BattleState state = BattleFixtures.dragapultVsGarchomp(5);
        Pokemon dragapult = state.getP1().getActive();
        dragapult.setHp(0);
        dragapult.setStatus(StatusCondition.FAINTED);
        Assert.assertEquals(enabled(state, SideId.P1), Arrays.asList("switch 1"));
        Assert.assertEquals(enabled(state, SideId.P2), Arrays.asList("pass"),
                "The other side waits while a replacement comes in");
    }

    @Test
    public void testLastPokemonStandingPasses() {
        BattleState state = BattleFixtures.dragapultVsGarchomp(6);
        Pokemon tusk = state.getP1().getTeam().get(1);
        tusk.setHp(0);
        tusk.setStatus(StatusCondition.FAINTED);
        LegalAction benchSwitch = find(state, SideId.P1, "switch 1");
        Assert.assertTrue(benchSwitch.isDisabled());
        Assert.assertEquals(benchSwitch.getReason(), "fainted");
    }

    @Test
    public void testTauntDisablesStatusMoves() {
        BattleState state = BattleFixtures.dragapultVsGarchomp(7);
        state.getP2().getActive().getVolatiles().add(new VolatileState(VolatileKind.TAUNT, 3));
        LegalAction swordsDance = find(state, SideId.P2, "move swordsdance");
        Assert.assertTrue(swordsDance.isDisabled());
        Assert.assertEquals(swordsDance.getReason(), "taunted");
        Assert.assertTrue(find(state, SideId.P2, "move earthquake").isEnabled());
    }

    @Test
    public void testTeraOncePerBattle() {
        BattleState state = BattleFixtures.dragapultVsGarchomp(8);
        state = advance(state, "tera shadowball", "move swordsdance");
        Assert.assertTrue(state.getP1().isTeraUsed());
        LegalAction tera = find(state, SideId.P1, "tera dracometeor");
        Assert.assertTrue(tera.isDisabled());
        Assert.assertEquals(tera.getReason(), "already terastallized");

        state = advance(state, "switch 1", "move swordsdance");
        Assert.assertEquals(find(state, SideId.P1, "tera earthquake").getReason(), "tera already used");
    }

    @Test
    public void testArenaTrapBlocksGroundedSwitches() {
        BattleState state = BattleFixtures.started(
                team(BattleFixtures.garchomp(), BattleFixtures.corviknight()),
                team(spec("Dugtrio", null, "Arena Trap", "Earthquake", "Stone Edge"), BattleFixtures.dragapult()), 9);
        LegalAction escape = find(state, SideId.P1, "switch 1");
        Assert.assertTrue(escape.isDisabled());
        Assert.assertTrue(escape.getReason().startsWith("trapped by"), escape.getReason());
    }

    @Test
    public void testMegaAndZMoveVariantsInGen7() {
        List<Pokemon> p1 = team(spec("Metagross", "Metagrossite", "Clear Body", "Zen Headbutt", "Bullet Punch", "Earthquake"));
        List<Pokemon> p2 = team(spec("Garchomp", "Dragonium Z", "Rough Skin", "Dragon Claw", "Earthquake", "Swords Dance"));
        BattleState state = ENGINE.start(BattleFactory.create("gen7", ENGINE.format("gen7ou"),
                "p1", p1, "p2", p2, 10)).getNextState();

        List<String> metagross = enabled("gen7ou", state, SideId.P1);
        Assert.assertTrue(metagross.contains("mega zenheadbutt"), metagross.toString());
        Assert.assertFalse(metagross.contains("tera zenheadbutt"), "No tera before generation 9");

        List<String> garchomp = enabled("gen7ou", state, SideId.P2);
        Assert.assertTrue(garchomp.contains("zmove dragonclaw"), garchomp.toString());
        Assert.assertFalse(garchomp.contains("zmove earthquake"), "Z-moves need the matching crystal type");
        Assert.assertFalse(garchomp.contains("zmove swordsdance"));

        state.getP1().setMegaUsed(true);
        Assert.assertFalse(enabled("gen7ou", state, SideId.P1).contains("mega zenheadbutt"));
    }
}
