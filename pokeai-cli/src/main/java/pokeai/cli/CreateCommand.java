package pokeai.cli;

import pokeai.cli.selfplay.Matchup;
import pokeai.data.FormatRules;
import pokeai.engine.BattleEngine;
import pokeai.engine.error.MissingEntityException;
import pokeai.io.BattleStateJson;
import pokeai.model.BattleState;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Creates a battle state from two team files.
 */
@Command(
    name = "create",
    description = "Create a battle state from two teams",
    mixinStandardHelpOptions = true,
    sortOptions = false
)
public class CreateCommand implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

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
        names = {"--seed"},
        description = "Seed of the battle's random source. Default: ${DEFAULT-VALUE}",
        defaultValue = "1",
        paramLabel = "SEED"
    )
    private long seed;

    @Option(
        names = {"--id"},
        description = "Battle id. Default: ${DEFAULT-VALUE}",
        defaultValue = "battle-1",
        paramLabel = "ID"
    )
    private String battleId;

    @Option(
        names = {"--preview"},
        description = "Stop at team preview instead of sending out the leads."
    )
    private boolean preview;

    @Option(
        names = {"-o", "--output"},
        description = "Write the state here instead of stdout.",
        paramLabel = "FILE"
    )
    private File output;

    public List<File> getTeams() {
        return teams;
    }

    public String getFormat() {
        return format;
    }

    public long getSeed() {
        return seed;
    }

    public boolean isPreview() {
        return preview;
    }

    @Override
    public Integer call() throws IOException {
        if (teams.size() != 2) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Exactly two teams are required, got " + teams.size());
        }
        BattleEngine engine = new BattleEngine();
        FormatRules rules = engine.format(format);
        Matchup matchup = matchup(engine, rules, teams.get(0), teams.get(1));
        BattleState state = preview ? matchup.prepare(battleId, seed) : matchup.start(battleId, seed);
        if (output != null) {
            BattleStateJson.write(state, output.toPath());
        } else {
            spec.commandLine().getOut().println(BattleStateJson.toJson(state));
            spec.commandLine().getOut().flush();
        }
        return ExitCode.SUCCESS;
    }

    /**
     * Team errors (unknown species or moves, bad sizes) are input errors.
     */
    static Matchup matchup(BattleEngine engine, FormatRules rules, File p1, File p2) {
        try {
            return new Matchup(engine, rules, CliInput.readTeam(p1), CliInput.readTeam(p2));
        } catch (MissingEntityException | IllegalArgumentException e) {
            throw new InputFileException("Bad team: " + e.getMessage(), e);
        }
    }
}
