package pokeai.cli;

/**
 * An input document is missing, unreadable or malformed. Reported with {@link ExitCode#INPUT_ERROR}.
 */
public class InputFileException extends RuntimeException {

    public InputFileException(String message) {
        super(message);
    }

    public InputFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
