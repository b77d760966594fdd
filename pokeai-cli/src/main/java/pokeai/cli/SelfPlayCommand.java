package pokeai.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.apache.commons.lang3.time.StopWatch;
import pokeai.cli.json.SelfPlayResult;
import pokeai.cli.selfplay.ActionPolicy;
import pokeai.cli.selfplay.BattleRecord;
import pokeai.cli.selfplay.Matchup;
import pokeai.cli.selfplay.Policies;
import pokeai.cli.selfplay.SelfPlayRunner;
import pokeai.cli.stats.WilsonInterval;
import pokeai.data.FormatRules;
import pokeai.engine.BattleEngine;
import pokeai.model.SideId;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Self-play subcommand: seeded policy vs policy battles in parallel.
 */
@Command(
    name = "selfplay",
    description = "Run seeded policy vs policy battles and report win rates",
    mixinStandardHelpOptions = true,
    sortOptions = false
)
public class SelfPlayCommand implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    // === Battle Options ===

    @Option(
        names = {"-t", "--team"},
        description = "Team file (JSON). Give exactly two: p1 then p2.",
        paramLabel = "FILE",
        required = true
    )
    private List<File> teams = new ArrayList<>();

    @Option(
        names = {"-f", "--format"},
        description = "Format id. Default: ${DEFAULT-VALUE}",
        defaultValue = "gen9ou",
        paramLabel = "FORMAT"
    )
    private String format;

    @Option(
        names = {"-n", "--battles"},
        description = "Number of battles. Default: ${DEFAULT-VALUE}",
        defaultValue = "1",
        paramLabel = "N"
    )
    private int numBattles;

    @Option(
        names = {"--seed"},
        description = "Seed of the first battle; battle i uses seed + i. Default: ${DEFAULT-VALUE}",
        defaultValue = "1",
        paramLabel = "SEED"
    )
    private long seed;

    @Option(
        names = {"--max-turns"},
        description = "Turn limit after which a battle is stopped undecided. Default: ${DEFAULT-VALUE}",
        defaultValue = "500",
        paramLabel = "T"
    )
    private int maxTurns;

    // === Policy Options ===

    @Option(
        names = {"--policy"},
        description = "Policy of both sides: random or greedy. Default: ${DEFAULT-VALUE}",
        defaultValue = "greedy",
        paramLabel = "POLICY"
    )
    private String policy;

    @Option(
        names = {"--p2-policy"},
        description = "Policy of p2 when it differs from --policy.",
        paramLabel = "POLICY"
    )
    private String p2Policy;

    @Option(
        names = {"--epsilon"},
        description = "Chance of a random legal action instead of the policy's (0.0 to 1.0). Default: ${DEFAULT-VALUE}",
        defaultValue = "0.0",
        paramLabel = "FLOAT"
    )
    private double epsilon;

    @Option(
        names = {"--decision-timeout"},
        description = "Per-decision time budget in milliseconds; 0 disables it. Default: ${DEFAULT-VALUE}",
        defaultValue = "0",
        paramLabel = "MS"
    )
    private long decisionTimeoutMs;

    // === Performance Options ===

    @Option(
        names = {"-j", "--jobs"},
        description = "Number of parallel threads. Default: ${DEFAULT-VALUE}",
        defaultValue = "1",
        paramLabel = "N"
    )
    private int numJobs;

    // === Output Options ===

    @Option(
        names = {"-q", "--quiet"},
        description = "Suppress the progress bar."
    )
    private boolean quiet;

    @Option(
        names = {"--json"},
        description = "Print the results as JSON to stdout."
    )
    private boolean jsonOutput;

    @Option(
        names = {"--trace-dir"},
        description = "Directory to write one JSONL decision trace per battle to.",
        paramLabel = "DIR"
    )
    private File traceDir;

    // === Getters ===

    public List<File> getTeams() {
        return teams;
    }

    public String getFormat() {
        return format;
    }

    public int getNumBattles() {
        return numBattles;
    }

    public long getSeed() {
        return seed;
    }

    public int getMaxTurns() {
        return maxTurns;
    }

    public String getPolicy() {
        return policy;
    }

    public String getP2Policy() {
        return p2Policy != null ? p2Policy : policy;
    }

    public double getEpsilon() {
        return epsilon;
    }

    public long getDecisionTimeoutMs() {
        return decisionTimeoutMs;
    }

    public int getNumJobs() {
        return numJobs;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public boolean isJsonOutput() {
        return jsonOutput;
    }

    public File getTraceDir() {
        return traceDir;
    }

    @Override
    public Integer call() throws InterruptedException {
        validate();
        ActionPolicy p1 = policy(policy);
        ActionPolicy p2 = policy(getP2Policy());

        BattleEngine engine = new BattleEngine();
        FormatRules rules = engine.format(format);
        Matchup matchup = CreateCommand.matchup(engine, rules, teams.get(0), teams.get(1));
        SelfPlayRunner runner = new SelfPlayRunner(engine, matchup, p1, p2)
                .withDecisionTimeout(decisionTimeoutMs)
                .withMaxTurns(maxTurns)
                .withTraceDir(traceDir == null ? null : traceDir.toPath());

        PrintWriter err = spec.commandLine().getErr();
        ProgressBar progress = quiet ? null : new ProgressBar(err, numBattles);
        StopWatch sw = StopWatch.createStarted();
        List<BattleRecord> records = runner.run(numBattles, numJobs, seed,
                progress == null ? null : record -> progress.increment());
        sw.stop();
        if (progress != null) {
            progress.finish();
        }

        SelfPlayResult result = summarize(matchup, p1, p2, records, sw.getTime());
        // In JSON mode the summary goes to stderr to keep stdout clean
        printSummary(jsonOutput ? err : spec.commandLine().getOut(), result);
        if (jsonOutput) {
            Gson gson = new GsonBuilder().setPrettyPrinting().serializeSpecialFloatingPointValues().create();
            spec.commandLine().getOut().println(gson.toJson(result));
            spec.commandLine().getOut().flush();
        }
        return result.summary.errors > 0 ? ExitCode.RUNTIME_ERROR : ExitCode.SUCCESS;
    }

    private void validate() {
        if (teams.size() != 2) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Exactly two teams are required, got " + teams.size());
        }
        if (numBattles < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--battles must be at least 1");
        }
        if (numJobs < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--jobs must be at least 1");
        }
        if (maxTurns < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--max-turns must be at least 1");
        }
        if (epsilon < 0 || epsilon > 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--epsilon must be in [0, 1]");
        }
    }

    private ActionPolicy policy(String name) {
        try {
            return Policies.byName(name, epsilon);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }
    }

    SelfPlayResult summarize(Matchup matchup, ActionPolicy p1, ActionPolicy p2, List<BattleRecord> records,
                             long totalTimeMs) {
        SelfPlayResult result = new SelfPlayResult();
        result.version = PokeAiCli.version();

        SelfPlayResult.SelfPlayConfig config = new SelfPlayResult.SelfPlayConfig();
        config.format = matchup.getFormat().getId();
        config.teams.add(matchup.getP1Name());
        config.teams.add(matchup.getP2Name());
        config.policies.add(p1.getName());
        config.policies.add(p2.getName());
        config.battlesRequested = numBattles;
        config.threads = numJobs;
        config.seed = seed;
        config.decisionTimeoutMs = decisionTimeoutMs;
        config.maxTurns = maxTurns;
        config.traceDir = traceDir == null ? null : traceDir.getPath();
        result.config = config;

        SelfPlayResult.SelfPlaySummary summary = new SelfPlayResult.SelfPlaySummary();
        int p1Wins = 0;
        int p2Wins = 0;
        long battleTime = 0;
        long turns = 0;
        for (BattleRecord record : records) {
            SelfPlayResult.BattleResult battle = new SelfPlayResult.BattleResult();
            battle.battleNumber = record.getBattleNumber();
            battle.seed = record.getSeed();
            battle.winner = record.getWinner() == null ? null : record.getWinner().name().toLowerCase();
            battle.endReason = record.getEndReason().name();
            battle.turns = record.getTurns();
            battle.durationMs = record.getDurationMs();
            battle.decisions = record.getDecisions();
            battle.fallbacks = record.getFallbacks();
            battle.error = record.getError();
            result.battles.add(battle);

            switch (record.getEndReason()) {
                case WIN:
                    if (record.getWinner() == SideId.P1) {
                        p1Wins++;
                    } else {
                        p2Wins++;
                    }
                    summary.completedBattles++;
                    break;
                case TIE:
                    summary.ties++;
                    summary.completedBattles++;
                    break;
                case TURN_LIMIT:
                    summary.turnLimits++;
                    break;
                case ERROR:
                    summary.errors++;
                    break;
                default:
                    break;
            }
            battleTime += record.getDurationMs();
            turns += record.getTurns();
            summary.fallbackDecisions += record.getFallbacks();
        }
        summary.totalBattles = records.size();
        summary.totalTimeMs = totalTimeMs;
        summary.averageBattleTimeMs = records.isEmpty() ? 0 : (double) battleTime / records.size();
        summary.averageTurns = records.isEmpty() ? 0 : (double) turns / records.size();
        summary.sides.add(side(SideId.P1, matchup.getP1Name(), p1, p1Wins, p2Wins, records.size()));
        summary.sides.add(side(SideId.P2, matchup.getP2Name(), p2, p2Wins, p1Wins, records.size()));
        result.summary = summary;
        return result;
    }

    private static SelfPlayResult.SideSummary side(SideId id, String team, ActionPolicy policy, int wins,
                                                   int losses, int total) {
        SelfPlayResult.SideSummary side = new SelfPlayResult.SideSummary();
        side.side = id.name().toLowerCase();
        side.team = team;
        side.policy = policy.getName();
        side.wins = wins;
        side.losses = losses;
        side.winRate = total == 0 ? 0 : 100.0 * wins / total;
        double[] ci = WilsonInterval.calculate95(wins, total);
        side.winRateLower = ci[0];
        side.winRateUpper = ci[1];
        return side;
    }

    private static void printSummary(PrintWriter out, SelfPlayResult result) {
        SelfPlayResult.SelfPlaySummary summary = result.summary;
        out.println("=== Self-Play Summary ===");
        out.printf("Format: %s, policies: %s vs %s%n", result.config.format, result.config.policies.get(0),
                result.config.policies.get(1));
        out.printf("Total battles: %d%n", summary.totalBattles);
        for (SelfPlayResult.SideSummary side : summary.sides) {
            out.printf("%s (%s) wins: %d (%s)%n", side.side, side.team, side.wins,
                    WilsonInterval.format(side.winRate, new double[]{side.winRateLower, side.winRateUpper}));
        }
        out.printf("Ties: %d, turn limit: %d, errors: %d%n", summary.ties, summary.turnLimits, summary.errors);
        if (summary.fallbackDecisions > 0) {
            out.printf("Decisions replaced by the safe default: %d%n", summary.fallbackDecisions);
        }
        out.printf("Total time: %d ms (%.1f ms/battle avg, %.1f turns avg)%n", summary.totalTimeMs,
                summary.averageBattleTimeMs, summary.averageTurns);
        out.flush();
    }
}
