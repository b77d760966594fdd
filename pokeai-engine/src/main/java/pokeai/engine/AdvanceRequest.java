package pokeai.engine;

import org.apache.commons.lang3.Validate;
import pokeai.engine.action.BattleAction;
import pokeai.model.BattleState;

/**
 * One action per side for the next turn, or for the forced-switch window.
 */
public final class AdvanceRequest {
    private final String format;
    private final BattleState state;
    private final BattleAction p1Action;
    private final BattleAction p2Action;

    public AdvanceRequest(String format, BattleState state, BattleAction p1Action, BattleAction p2Action) {
        this.format = Validate.notBlank(format, "format is required");
        this.state = Validate.notNull(state, "state is required");
        this.p1Action = Validate.notNull(p1Action, "p1 action is required");
        this.p2Action = Validate.notNull(p2Action, "p2 action is required");
    }

    public String getFormat() {
        return format;
    }

    public BattleState getState() {
        return state;
    }

    public BattleAction getP1Action() {
        return p1Action;
    }

    public BattleAction getP2Action() {
        return p2Action;
    }
}
