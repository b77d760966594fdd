package pokeai.model;

import pokeai.data.VolatileKind;

/**
 * One active volatile effect. {@code turnsLeft} of -1 means it has no countdown.
 */
public class VolatileState {
    private VolatileKind kind;
    private int turnsLeft;
    /** Kind-specific counter: substitute HP, consecutive protects, confusion turns. */
    private int counter;
    /** Move the effect is bound to: encore, disable, choice lock, charging. */
    private String moveId;

    private VolatileState() {
    }

    public VolatileState(VolatileKind kind, int turnsLeft) {
        this.kind = kind;
        this.turnsLeft = turnsLeft;
    }

    public VolatileState copy() {
        VolatileState copy = new VolatileState(kind, turnsLeft);
        copy.counter = counter;
        copy.moveId = moveId;
        return copy;
    }

    public VolatileKind getKind() {
        return kind;
    }

    public int getTurnsLeft() {
        return turnsLeft;
    }

    public boolean hasCountdown() {
        return turnsLeft >= 0;
    }

    /** Decrements the countdown and returns true when the effect has run out. */
    public boolean tick() {
        if (!hasCountdown()) {
            return false;
        }
        turnsLeft = Math.max(0, turnsLeft - 1);
        return turnsLeft == 0;
    }

    public int getCounter() {
        return counter;
    }

    public void setCounter(int counter) {
        this.counter = counter;
    }

    public String getMoveId() {
        return moveId;
    }

    public VolatileState withMove(String moveId) {
        this.moveId = moveId;
        return this;
    }

    public VolatileState withCounter(int counter) {
        this.counter = counter;
        return this;
    }

    @Override
    public String toString() {
        return kind + (hasCountdown() ? "(" + turnsLeft + ")" : "") + (moveId != null ? "[" + moveId + "]" : "");
    }
}
