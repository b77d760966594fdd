package pokeai.cli;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import pokeai.io.BattleStateJson;
import pokeai.model.BattlePhase;
import pokeai.model.BattleState;
import picocli.CommandLine;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * Runs the subcommands end to end through {@link Main#commandLine()} and checks exit codes.
 */
public class CliExecutionTest {
    private Path dir;
    private StringWriter out;
    private StringWriter err;

    @BeforeMethod
    public void setUp() throws IOException {
        dir = Files.createTempDirectory("pokeai-cli");
    }

    @AfterMethod(alwaysRun = true)
    public void tearDown() {
        TestFiles.deleteTree(dir);
    }

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine cmd = Main.commandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private static String team(String name) {
        return TestFiles.team(name).getPath();
    }

    private String created(String... extra) {
        String state = dir.resolve("state.json").toString();
        String[] base = {"create", "-t", team("offense.json"), "-t", team("balance.json"), "--seed", "7", "-o", state};
        String[] args = new String[base.length + extra.length];
        System.arraycopy(base, 0, args, 0, base.length);
        System.arraycopy(extra, 0, args, base.length, extra.length);
        Assert.assertEquals(run(args), ExitCode.SUCCESS, err.toString());
        return state;
    }

    @Test
    public void testNoArgumentsPrintsUsage() {
        Assert.assertEquals(run(), ExitCode.SUCCESS);
        Assert.assertTrue(out.toString().contains("selfplay"), out.toString());
    }

    @Test
    public void testFormats() {
        Assert.assertEquals(run("formats"), ExitCode.SUCCESS);
        Assert.assertTrue(out.toString().contains("gen9ou"));
        Assert.assertTrue(out.toString().contains("gen7ou"));
    }

    @Test
    public void testCreateStartsTheBattle() throws IOException {
        BattleState state = BattleStateJson.read(new File(created()).toPath());
        Assert.assertEquals(state.getPhase(), BattlePhase.BATTLE);
        Assert.assertEquals(state.getTurn(), 0);
        Assert.assertEquals(state.getP1().getName(), "offense");
        Assert.assertEquals(state.getP2().getName(), "balance", "Array documents are named after the file");
    }

    @Test
    public void testPreviewStateIsStartedByAdvance() throws IOException {
        String preview = created("--preview");
        Assert.assertEquals(BattleStateJson.read(new File(preview).toPath()).getPhase(), BattlePhase.PREPARATION);

        Assert.assertEquals(run("advance", "-s", preview), ExitCode.SUCCESS, err.toString());
        BattleState started = BattleStateJson.fromJson(out.toString());
        Assert.assertEquals(started.getPhase(), BattlePhase.BATTLE);
        Assert.assertEquals(started.getTurn(), 0);
    }

    @Test
    public void testAdvanceWritesNextState() throws IOException {
        String state = created();
        Path next = dir.resolve("next.json");
        int code = run("advance", "-s", state, "--p1", "move shadowball", "--p2", "move earthquake",
                "-o", next.toString(), "--events");
        Assert.assertEquals(code, ExitCode.SUCCESS, err.toString());
        Assert.assertEquals(BattleStateJson.read(next).getTurn(), 1);
        Assert.assertTrue(err.toString().contains("MOVE"), "--events prints the turn's events");
    }

    @Test
    public void testAdvanceWithoutActionsOnStartedBattle() {
        Assert.assertEquals(run("advance", "-s", created()), ExitCode.ARGS_ERROR);
    }

    @Test
    public void testAdvanceMalformedAction() {
        Assert.assertEquals(run("advance", "-s", created(), "--p1", "fly away", "--p2", "pass"), ExitCode.ARGS_ERROR);
    }

    @Test
    public void testAdvanceIllegalAction() {
        int code = run("advance", "-s", created(), "--p1", "move earthquake", "--p2", "move earthquake");
        Assert.assertEquals(code, ExitCode.RUNTIME_ERROR);
        Assert.assertTrue(err.toString().contains("INVALID_ACTION"), err.toString());
    }

    @Test
    public void testEvaluateAllLegalActions() {
        Assert.assertEquals(run("evaluate", "-s", created()), ExitCode.SUCCESS, err.toString());
        JsonObject result = JsonParser.parseString(out.toString()).getAsJsonObject();
        Assert.assertEquals(result.get("side").getAsString(), "P1");
        Assert.assertEquals(result.get("format").getAsString(), "gen9ou");
        Assert.assertTrue(result.getAsJsonArray("results").size() > 4, result.toString());
    }

    @Test
    public void testEvaluateGivenActions() throws IOException {
        Path actions = dir.resolve("actions.json");
        Files.write(actions, "[\"move Earthquake\", \"switch 1\"]".getBytes(StandardCharsets.UTF_8));
        Assert.assertEquals(run("evaluate", "-s", created(), "-a", actions.toString(), "--side", "p2"),
                ExitCode.SUCCESS, err.toString());
        JsonObject result = JsonParser.parseString(out.toString()).getAsJsonObject();
        Assert.assertEquals(result.getAsJsonArray("results").size(), 2);
    }

    @Test
    public void testEvaluateBadSide() {
        Assert.assertEquals(run("evaluate", "-s", created(), "--side", "p3"), ExitCode.ARGS_ERROR);
    }

    @Test
    public void testMissingStateFile() {
        Assert.assertEquals(run("evaluate", "-s", dir.resolve("missing.json").toString()), ExitCode.INPUT_ERROR);
    }

    @Test
    public void testCorruptStateFile() throws IOException {
        Path broken = dir.resolve("broken.json");
        Files.write(broken, "{not json".getBytes(StandardCharsets.UTF_8));
        Assert.assertEquals(run("evaluate", "-s", broken.toString()), ExitCode.INPUT_ERROR);
    }

    @Test
    public void testUnknownSpeciesIsAnInputError() {
        int code = run("create", "-t", team("offense.json"), "-t", team("unknown-species.json"));
        Assert.assertEquals(code, ExitCode.INPUT_ERROR);
        Assert.assertTrue(err.toString().contains("Missingno"), err.toString());
    }

    @Test
    public void testUnsupportedFormat() {
        Assert.assertEquals(run("create", "-t", team("offense.json"), "-t", team("balance.json"), "-f", "gen1ou"),
                ExitCode.ARGS_ERROR);
    }

    @Test
    public void testCreateNeedsTwoTeams() {
        Assert.assertEquals(run("create", "-t", team("offense.json")), ExitCode.ARGS_ERROR);
    }

    @Test
    public void testSelfPlayJsonAndTraces() throws IOException {
        Path traces = dir.resolve("traces");
        int code = run("selfplay", "-t", team("offense.json"), "-t", team("balance.json"), "-n", "2", "-j", "2",
                "--policy", "random", "--max-turns", "40", "-q", "--json", "--trace-dir", traces.toString());
        Assert.assertEquals(code, ExitCode.SUCCESS, err.toString());

        JsonObject result = JsonParser.parseString(out.toString()).getAsJsonObject();
        JsonObject summary = result.getAsJsonObject("summary");
        Assert.assertEquals(summary.get("totalBattles").getAsInt(), 2);
        Assert.assertEquals(summary.get("errors").getAsInt(), 0);
        Assert.assertEquals(result.getAsJsonArray("battles").size(), 2);
        Assert.assertTrue(err.toString().contains("Self-Play Summary"), "JSON mode prints the summary to stderr");
        try (Stream<Path> files = Files.list(traces)) {
            Assert.assertEquals(files.count(), 2L);
        }
    }
}
