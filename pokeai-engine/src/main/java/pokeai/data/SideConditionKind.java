package pokeai.data;

/**
 * Timed conditions kept on a side. Tailwind only helps its own side; the rooms and gravity
 * are stored on the side that set them but affect the whole field.
 */
public enum SideConditionKind {
    TAILWIND(4, false),
    TRICK_ROOM(5, true),
    GRAVITY(5, true),
    WONDER_ROOM(5, true),
    MAGIC_ROOM(5, true);

    private final int defaultTurns;
    private final boolean fieldWide;

    SideConditionKind(int defaultTurns, boolean fieldWide) {
        this.defaultTurns = defaultTurns;
        this.fieldWide = fieldWide;
    }

    public int getDefaultTurns() {
        return defaultTurns;
    }

    public boolean isFieldWide() {
        return fieldWide;
    }
}
