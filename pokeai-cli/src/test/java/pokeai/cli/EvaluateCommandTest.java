package pokeai.cli;

import org.testng.Assert;
import org.testng.annotations.Test;
import pokeai.model.SideId;
import picocli.CommandLine;

/**
 * Tests for EvaluateCommand and AdvanceCommand option parsing.
 */
public class EvaluateCommandTest {

    private EvaluateCommand parseEvaluate(String... args) {
        EvaluateCommand cmd = new EvaluateCommand();
        new CommandLine(cmd).parseArgs(args);
        return cmd;
    }

    private AdvanceCommand parseAdvance(String... args) {
        AdvanceCommand cmd = new AdvanceCommand();
        new CommandLine(cmd).parseArgs(args);
        return cmd;
    }

    @Test
    public void testSideDefaultsToP1() {
        EvaluateCommand cmd = parseEvaluate("-s", "state.json");
        Assert.assertEquals(cmd.getSide(), SideId.P1);
        Assert.assertNull(cmd.getActionsFile(), "Without -a every legal action is evaluated");
    }

    @Test
    public void testSideIsCaseInsensitive() {
        Assert.assertEquals(parseEvaluate("-s", "state.json", "--side", "P2").getSide(), SideId.P2);
    }

    @Test(expectedExceptions = CommandLine.ParameterException.class)
    public void testBadSide() {
        parseEvaluate("-s", "state.json", "--side", "p3").getSide();
    }

    @Test
    public void testAdvanceActions() {
        AdvanceCommand cmd = parseAdvance("-s", "state.json", "--p1", "move earthquake", "--p2", "switch 2");
        Assert.assertEquals(cmd.getP1Action(), "move earthquake");
        Assert.assertEquals(cmd.getP2Action(), "switch 2");
        Assert.assertFalse(cmd.isPrintEvents());
        Assert.assertTrue(parseAdvance("-s", "state.json", "--events").isPrintEvents());
    }
}
