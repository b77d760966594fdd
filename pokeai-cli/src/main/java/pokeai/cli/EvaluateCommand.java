package pokeai.cli;

import com.google.gson.Gson;
import pokeai.engine.BattleEngine;
import pokeai.engine.EvaluateRequest;
import pokeai.engine.action.BattleAction;
import pokeai.engine.calc.CalcResult;
import pokeai.io.BattleStateJson;
import pokeai.model.BattleState;
import pokeai.model.SideId;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Scores candidate actions for one side without changing the state.
 */
@Command(
    name = "evaluate",
    description = "Evaluate candidate actions of one side and print the results as JSON",
    mixinStandardHelpOptions = true,
    sortOptions = false
)
public class EvaluateCommand implements Callable<Integer> {

    static final Gson OUTPUT = BattleStateJson.builder()
            .setPrettyPrinting()
            .serializeSpecialFloatingPointValues()
            .create();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Option(
        names = {"-s", "--state"},
        description = "Battle state file (JSON).",
        paramLabel = "FILE",
        required = true
    )
    private File stateFile;

    @Option(
        names = {"-a", "--actions"},
        description = "JSON array of actions such as \"move earthquake\" or \"switch 2\". "
            + "Default: every legal action.",
        paramLabel = "FILE"
    )
    private File actionsFile;

    @Option(
        names = {"--side"},
        description = "Side to evaluate: p1 or p2. Default: ${DEFAULT-VALUE}",
        defaultValue = "p1",
        paramLabel = "SIDE"
    )
    private String side;

    @Option(
        names = {"-f", "--format"},
        description = "Format id. Default: the state's format.",
        paramLabel = "FORMAT"
    )
    private String format;

    @Option(
        names = {"--belief"},
        description = "Opponent belief file (JSON with items and teraTypes by species).",
        paramLabel = "FILE"
    )
    private File beliefFile;

    public File getStateFile() {
        return stateFile;
    }

    public File getActionsFile() {
        return actionsFile;
    }

    public SideId getSide() {
        try {
            return SideId.parse(side);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid side '" + side + "' (expected p1 or p2)");
        }
    }

    @Override
    public Integer call() {
        SideId sideId = getSide();
        BattleState state = CliInput.readState(stateFile);
        List<BattleAction> actions = actionsFile == null
                ? Collections.emptyList() : CliInput.readActions(actionsFile);
        String formatId = format != null ? format : state.getFormat();

        List<CalcResult> results = new BattleEngine().evaluate(
                new EvaluateRequest(formatId, state, sideId, actions, CliInput.readBelief(beliefFile)));

        Output output = new Output();
        output.battle = state.getId();
        output.format = formatId;
        output.turn = state.getTurn();
        output.side = sideId.name();
        output.results = results;
        spec.commandLine().getOut().println(OUTPUT.toJson(output));
        spec.commandLine().getOut().flush();
        return ExitCode.SUCCESS;
    }

    static final class Output {
        String battle;
        String format;
        int turn;
        String side;
        List<CalcResult> results;
    }
}
