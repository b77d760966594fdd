package pokeai.data;

/**
 * The closed set of effect functions an ability or item can have.
 */
public enum EffectKind {
    /** Multiply the quantity the trigger phase computes by {@code value}. */
    MULTIPLIER,
    /** Ignore moves of {@code type}; heal {@code value} of max HP when absorbing. */
    IMMUNITY,
    /** Change {@code stat} by {@code value} stages on {@code target}. */
    STAT_CHANGE,
    /** Restore {@code value} of the holder's max HP. */
    HEAL,
    /** Deal {@code value} of max HP to {@code target}. */
    DAMAGE,
    SET_WEATHER,
    SET_TERRAIN,
    /** Add {@code value} to the move's priority. */
    PRIORITY_BONUS,
    /** Grant {@code capability}. */
    CAPABILITY,
    /** Inflict {@code status} on the holder. */
    INFLICT_STATUS,
    /** Total duration becomes {@code value} turns. */
    EXTEND_DURATION
}
