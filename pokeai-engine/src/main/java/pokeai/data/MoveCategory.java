package pokeai.data;

public enum MoveCategory {
    PHYSICAL,
    SPECIAL,
    STATUS
}
