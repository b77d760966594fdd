package pokeai.cli;

/**
 * Exit codes of the pokeai command.
 */
public final class ExitCode {
    /** Successful execution */
    public static final int SUCCESS = 0;

    /** Invalid arguments or usage error */
    public static final int ARGS_ERROR = 1;

    /** State, team, action or belief file could not be read */
    public static final int INPUT_ERROR = 2;

    /** Engine or execution error */
    public static final int RUNTIME_ERROR = 3;

    private ExitCode() {
    }
}
