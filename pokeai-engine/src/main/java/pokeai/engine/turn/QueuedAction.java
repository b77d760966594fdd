package pokeai.engine.turn;

import pokeai.engine.action.BattleAction;
import pokeai.model.SideId;

/**
 * One side's action with the keys it is ordered by. Lower bracket goes first; within a bracket
 * higher priority, then the faster Pokemon, then the random draw.
 */
public final class QueuedAction {
    static final int BRACKET_SWITCH = 0;
    static final int BRACKET_MOVE = 1;
    static final int BRACKET_PASS = 2;

    private final SideId side;
    private final BattleAction action;
    private final int bracket;
    private final int priority;
    private final int speed;
    private final long tieBreak;

    QueuedAction(SideId side, BattleAction action, int bracket, int priority, int speed, long tieBreak) {
        this.side = side;
        this.action = action;
        this.bracket = bracket;
        this.priority = priority;
        this.speed = speed;
        this.tieBreak = tieBreak;
    }

    public SideId getSide() {
        return side;
    }

    public BattleAction getAction() {
        return action;
    }

    public int getBracket() {
        return bracket;
    }

    public int getPriority() {
        return priority;
    }

    public int getSpeed() {
        return speed;
    }

    long getTieBreak() {
        return tieBreak;
    }

    @Override
    public String toString() {
        return side + ":" + action.notation() + " (prio " + priority + ", spe " + speed + ")";
    }
}
