package pokeai.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;

/**
 * Main CLI command for the battle engine.
 */
@Command(
    name = "pokeai",
    description = "PokeAI: deterministic battle mechanics engine",
    mixinStandardHelpOptions = true,
    versionProvider = PokeAiCli.VersionProvider.class,
    subcommands = {
        CommandLine.HelpCommand.class,
        CreateCommand.class,
        EvaluateCommand.class,
        AdvanceCommand.class,
        SelfPlayCommand.class,
        FormatsCommand.class
    }
)
public class PokeAiCli implements Runnable {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /**
     * Without a subcommand there is nothing to run, so show help.
     */
    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    static String version() {
        String version = PokeAiCli.class.getPackage().getImplementationVersion();
        return version != null ? version : "development build";
    }

    public static class VersionProvider implements IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[] {
                "PokeAI " + version(),
                "Java: " + System.getProperty("java.version"),
                "OS: " + System.getProperty("os.name") + " " + System.getProperty("os.version")
            };
        }
    }
}
