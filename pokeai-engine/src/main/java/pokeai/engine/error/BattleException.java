package pokeai.engine.error;

/**
 * Base class of every error the engine raises on purpose.
 */
public class BattleException extends RuntimeException {
    private final ErrorKind kind;

    public BattleException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BattleException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
