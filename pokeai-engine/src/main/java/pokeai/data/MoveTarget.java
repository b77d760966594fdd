package pokeai.data;

/**
 * Who a move acts upon. Only single battles are modelled, so "adjacent" means the opposing active.
 */
public enum MoveTarget {
    NORMAL,
    SELF,
    ALL_ADJACENT_FOES,
    FOE_SIDE,
    ALLY_SIDE,
    FIELD;

    public boolean targetsFoe() {
        return this == NORMAL || this == ALL_ADJACENT_FOES;
    }
}
