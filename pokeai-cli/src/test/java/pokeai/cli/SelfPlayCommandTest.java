package pokeai.cli;

import org.testng.Assert;
import org.testng.annotations.Test;
import picocli.CommandLine;

/**
 * Tests for SelfPlayCommand option parsing.
 */
public class SelfPlayCommandTest {

    private SelfPlayCommand parseArgs(String... args) {
        SelfPlayCommand cmd = new SelfPlayCommand();
        new CommandLine(cmd).parseArgs(args);
        return cmd;
    }

    @Test
    public void testDefaults() {
        SelfPlayCommand cmd = parseArgs("-t", "a.json", "-t", "b.json");
        Assert.assertEquals(cmd.getTeams().size(), 2);
        Assert.assertEquals(cmd.getFormat(), "gen9ou");
        Assert.assertEquals(cmd.getNumBattles(), 1, "Default battle count should be 1");
        Assert.assertEquals(cmd.getSeed(), 1L);
        Assert.assertEquals(cmd.getMaxTurns(), 500);
        Assert.assertEquals(cmd.getPolicy(), "greedy");
        Assert.assertEquals(cmd.getEpsilon(), 0.0);
        Assert.assertEquals(cmd.getDecisionTimeoutMs(), 0L);
        Assert.assertEquals(cmd.getNumJobs(), 1);
        Assert.assertFalse(cmd.isQuiet());
        Assert.assertFalse(cmd.isJsonOutput());
        Assert.assertNull(cmd.getTraceDir());
    }

    @Test
    public void testP2PolicyFollowsPolicyUnlessGiven() {
        Assert.assertEquals(parseArgs("-t", "a", "-t", "b", "--policy", "random").getP2Policy(), "random");
        SelfPlayCommand cmd = parseArgs("-t", "a", "-t", "b", "--policy", "random", "--p2-policy", "greedy");
        Assert.assertEquals(cmd.getPolicy(), "random");
        Assert.assertEquals(cmd.getP2Policy(), "greedy");
    }

    @Test
    public void testRunOptions() {
        SelfPlayCommand cmd = parseArgs("-t", "a", "-t", "b", "-n", "50", "-j", "4", "--seed", "99",
                "--max-turns", "200", "--epsilon", "0.1", "--decision-timeout", "250");
        Assert.assertEquals(cmd.getNumBattles(), 50);
        Assert.assertEquals(cmd.getNumJobs(), 4);
        Assert.assertEquals(cmd.getSeed(), 99L);
        Assert.assertEquals(cmd.getMaxTurns(), 200);
        Assert.assertEquals(cmd.getEpsilon(), 0.1);
        Assert.assertEquals(cmd.getDecisionTimeoutMs(), 250L);
    }

    @Test
    public void testOutputFlags() {
        SelfPlayCommand cmd = parseArgs("-t", "a", "-t", "b", "-q", "--json", "--trace-dir", "traces");
        Assert.assertTrue(cmd.isQuiet(), "-q should enable quiet mode");
        Assert.assertTrue(cmd.isJsonOutput(), "--json should enable JSON output");
        Assert.assertEquals(cmd.getTraceDir().getName(), "traces");
    }

    @Test(expectedExceptions = CommandLine.MissingParameterException.class)
    public void testTeamsAreRequired() {
        parseArgs("-n", "3");
    }
}
