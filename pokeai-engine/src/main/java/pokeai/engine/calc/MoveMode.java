package pokeai.engine.calc;

public enum MoveMode {
    NORMAL,
    Z_MOVE,
    MAX_MOVE
}
