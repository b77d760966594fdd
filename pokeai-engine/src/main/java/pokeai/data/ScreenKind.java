package pokeai.data;

public enum ScreenKind {
    REFLECT,
    LIGHT_SCREEN,
    AURORA_VEIL
}
