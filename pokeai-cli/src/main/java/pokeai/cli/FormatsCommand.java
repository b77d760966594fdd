package pokeai.cli;

import pokeai.data.FormatRules;
import pokeai.engine.BattleEngine;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Lists the formats the engine accepts.
 */
@Command(
    name = "formats",
    description = "List supported battle formats",
    mixinStandardHelpOptions = true
)
public class FormatsCommand implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<FormatRules> formats = new ArrayList<>(new BattleEngine().getFormats().all());
        formats.sort(Comparator.comparing(FormatRules::getId));
        for (FormatRules format : formats) {
            out.printf("%-20s %-28s gen %d  %s%n", format.getId(), format.getName(), format.getGeneration(),
                    mechanics(format));
        }
        out.flush();
        return ExitCode.SUCCESS;
    }

    private static String mechanics(FormatRules format) {
        List<String> parts = new ArrayList<>();
        if (format.allowsTera()) parts.add("tera");
        if (format.allowsMega()) parts.add("mega");
        if (format.allowsZMove()) parts.add("zmove");
        if (format.allowsDynamax()) parts.add("dynamax");
        if (format.hasSleepClause()) parts.add("sleep-clause");
        return String.join(", ", parts);
    }
}
