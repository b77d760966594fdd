package pokeai.engine.turn;

/**
 * Steps of one Advance, in order.
 */
public enum ResolutionPhase {
    QUEUED,
    PRIORITY_SORTED,
    RESOLVING,
    END_OF_TURN,
    ADVANCED
}
