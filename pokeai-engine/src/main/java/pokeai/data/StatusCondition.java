package pokeai.data;

/**
 * Primary (non-volatile) status. A Pokemon holds at most one at a time.
 */
public enum StatusCondition {
    NONE,
    BURN,
    POISON,
    TOXIC,
    PARALYSIS,
    SLEEP,
    FREEZE,
    FAINTED;

    public boolean isPoison() {
        return this == POISON || this == TOXIC;
    }

    /** A status that can be cured or replaced by nothing but fainting. */
    public boolean isAilment() {
        return this != NONE && this != FAINTED;
    }
}
