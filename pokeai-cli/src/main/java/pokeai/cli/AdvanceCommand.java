package pokeai.cli;

import pokeai.engine.AdvanceRequest;
import pokeai.engine.AdvanceResult;
import pokeai.engine.BattleEngine;
import pokeai.engine.action.BattleAction;
import pokeai.io.BattleStateJson;
import pokeai.model.BattleEvent;
import pokeai.model.BattlePhase;
import pokeai.model.BattleState;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Resolves one turn from a state file and both sides' actions.
 */
@Command(
    name = "advance",
    description = "Resolve one turn and write the next state",
    mixinStandardHelpOptions = true,
    sortOptions = false
)
public class AdvanceCommand implements Callable<Integer> {

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
        names = {"--p1"},
        description = "Action of p1, e.g. \"move earthquake\", \"tera moonblast\", \"switch 2\" or \"pass\".",
        paramLabel = "ACTION"
    )
    private String p1Action;

    @Option(
        names = {"--p2"},
        description = "Action of p2.",
        paramLabel = "ACTION"
    )
    private String p2Action;

    @Option(
        names = {"-f", "--format"},
        description = "Format id. Default: the state's format.",
        paramLabel = "FORMAT"
    )
    private String format;

    @Option(
        names = {"-o", "--output"},
        description = "Write the next state here instead of stdout.",
        paramLabel = "FILE"
    )
    private File output;

    @Option(
        names = {"--events"},
        description = "Print the turn's events, one per line, to stderr."
    )
    private boolean printEvents;

    public String getP1Action() {
        return p1Action;
    }

    public String getP2Action() {
        return p2Action;
    }

    public boolean isPrintEvents() {
        return printEvents;
    }

    /**
     * A battle still at preview has its leads sent out first. Without actions that is all that
     * happens.
     */
    @Override
    public Integer call() throws IOException {
        BattleState state = CliInput.readState(stateFile);
        BattleEngine engine = new BattleEngine();
        String formatId = format != null ? format : state.getFormat();
        List<BattleEvent> events = new ArrayList<>();

        if (state.getPhase() == BattlePhase.PREPARATION || state.getPhase() == BattlePhase.TEAM_PREVIEW) {
            AdvanceResult started = engine.start(state);
            state = started.getNextState();
            events.addAll(started.getEvents());
        }
        if (p1Action != null || p2Action != null) {
            AdvanceResult result = engine.advance(new AdvanceRequest(formatId, state, action("--p1", p1Action),
                    action("--p2", p2Action)));
            state = result.getNextState();
            events.addAll(result.getEvents());
        } else if (events.isEmpty()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Both --p1 and --p2 are required");
        }

        if (printEvents) {
            PrintWriter err = spec.commandLine().getErr();
            for (BattleEvent event : events) {
                err.println(event);
            }
            err.flush();
        }
        if (output != null) {
            BattleStateJson.write(state, output.toPath());
        } else {
            spec.commandLine().getOut().println(BattleStateJson.toJson(state));
            spec.commandLine().getOut().flush();
        }
        return ExitCode.SUCCESS;
    }

    private BattleAction action(String option, String notation) {
        if (notation == null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing " + option + " action");
        }
        try {
            return BattleAction.parse(notation);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), option + ": " + e.getMessage());
        }
    }
}
