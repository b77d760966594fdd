package pokeai.cli;

import com.google.gson.JsonParseException;
import pokeai.engine.error.BattleException;
import pokeai.engine.error.UnsupportedFormatException;
import picocli.CommandLine;

/**
 * Command-line entry point.
 */
public final class Main {

    public static void main(final String[] args) {
        System.exit(commandLine().execute(args));
    }

    /**
     * The root command with the exit-code mapping installed.
     */
    public static CommandLine commandLine() {
        return new CommandLine(new PokeAiCli())
            .setExecutionExceptionHandler(new ExecutionExceptionHandler())
            .setParameterExceptionHandler(new ParameterExceptionHandler());
    }

    /**
     * Handle execution exceptions (runtime errors during command execution).
     */
    private static class ExecutionExceptionHandler implements CommandLine.IExecutionExceptionHandler {
        @Override
        public int handleExecutionException(Exception ex, CommandLine cmd,
                CommandLine.ParseResult parseResult) {
            if (ex instanceof BattleException) {
                cmd.getErr().println("Error: " + ((BattleException) ex).getKind() + ": " + ex.getMessage());
            } else {
                cmd.getErr().println("Error: " + ex.getMessage());
            }
            if (System.getProperty("pokeai.debug") != null) {
                ex.printStackTrace(cmd.getErr());
            }
            cmd.getErr().flush();
            if (ex instanceof UnsupportedFormatException) {
                return ExitCode.ARGS_ERROR;
            }
            if (ex instanceof InputFileException || ex instanceof JsonParseException) {
                return ExitCode.INPUT_ERROR;
            }
            return ExitCode.RUNTIME_ERROR;
        }
    }

    /**
     * Handle parameter/parsing exceptions (invalid arguments).
     */
    private static class ParameterExceptionHandler implements CommandLine.IParameterExceptionHandler {
        @Override
        public int handleParseException(CommandLine.ParameterException ex, String[] args) {
            CommandLine cmd = ex.getCommandLine();
            cmd.getErr().println("Error: " + ex.getMessage());
            cmd.getErr().println();
            cmd.usage(cmd.getErr());
            cmd.getErr().flush();
            return ExitCode.ARGS_ERROR;
        }
    }

    private Main() {
    }
}
