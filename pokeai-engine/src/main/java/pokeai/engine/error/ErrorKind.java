package pokeai.engine.error;

public enum ErrorKind {
    /** The action names a move or team slot that does not exist or cannot be used. */
    INVALID_ACTION,
    /** A side has no active Pokemon. */
    MISSING_ENTITY,
    /** The format id is unknown or disagrees with the battle state. */
    UNSUPPORTED_FORMAT,
    /** An internal consistency check failed; always a bug. */
    STATE_INVARIANT_VIOLATION
}
