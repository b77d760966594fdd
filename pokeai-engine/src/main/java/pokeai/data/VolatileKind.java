package pokeai.data;

/**
 * Per-Pokemon temporary conditions. All of them are cleared when the holder switches out.
 * A default duration of -1 means "until removed by its own rule".
 */
public enum VolatileKind {
    CONFUSION(-1),
    TAUNT(3),
    ENCORE(3),
    DISABLE(4),
    PERISH_SONG(3),
    LEECH_SEED(-1),
    SUBSTITUTE(-1),
    PROTECT(1),
    PROTECT_STREAK(-1),
    FLINCH(1),
    RECHARGE(2),
    CHARGING(2),
    CHOICE_LOCK(-1),
    FLASH_FIRE(-1),
    DYNAMAX(3);

    private final int defaultTurns;

    VolatileKind(int defaultTurns) {
        this.defaultTurns = defaultTurns;
    }

    public int getDefaultTurns() {
        return defaultTurns;
    }
}
