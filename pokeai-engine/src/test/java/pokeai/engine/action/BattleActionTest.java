package pokeai.engine.action;

import org.testng.Assert;
import org.testng.annotations.Test;

public class BattleActionTest {

    @Test
    public void testParseNormalizesMoveNames() {
        Assert.assertEquals(BattleAction.parse("move Draco Meteor"), BattleAction.move("dracometeor"));
        Assert.assertEquals(BattleAction.parse("TERA U-turn").notation(), "tera uturn");
        Assert.assertEquals(BattleAction.parse("  switch 3 ").notation(), "switch 3");
        Assert.assertSame(BattleAction.parse("pass"), BattleAction.pass());
    }

    @Test
    public void testVisitorDispatch() {
        ActionVisitor<String> kind = new ActionVisitor<String>() {
            @Override
            public String visitMove(MoveAction action) {
                return "move";
            }

            @Override
            public String visitSwitch(SwitchAction action) {
                return "switch:" + action.getSlot();
            }

            @Override
            public String visitTera(TeraAction action) {
                return "tera";
            }

            @Override
            public String visitMega(MegaAction action) {
                return "mega";
            }

            @Override
            public String visitZMove(ZMoveAction action) {
                return "zmove";
            }

            @Override
            public String visitDynamax(DynamaxAction action) {
                return "dynamax";
            }

            @Override
            public String visitPass(PassAction action) {
                return "pass";
            }
        };
        Assert.assertEquals(BattleAction.parse("switch 2").accept(kind), "switch:2");
        Assert.assertEquals(BattleAction.parse("zmove dragonclaw").accept(kind), "zmove");
        Assert.assertEquals(BattleAction.parse("dynamax earthquake").accept(kind), "dynamax");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testSwitchNeedsANumber() {
        BattleAction.parse("switch garchomp");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnknownVerb() {
        BattleAction.parse("run away");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testMoveNeedsAName() {
        BattleAction.parse("move");
    }
}
