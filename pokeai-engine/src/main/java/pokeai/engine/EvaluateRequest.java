package pokeai.engine;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.Validate;
import pokeai.engine.action.BattleAction;
import pokeai.engine.calc.OpponentBelief;
import pokeai.model.BattleState;
import pokeai.model.SideId;

import java.util.List;

/**
 * Candidate actions for one side to score against a state. An empty action list asks for every
 * enabled legal action.
 */
public final class EvaluateRequest {
    private final String format;
    private final BattleState state;
    private final SideId side;
    private final List<BattleAction> actions;
    private final OpponentBelief belief;

    public EvaluateRequest(String format, BattleState state, SideId side, List<BattleAction> actions,
                           OpponentBelief belief) {
        this.format = Validate.notBlank(format, "format is required");
        this.state = Validate.notNull(state, "state is required");
        this.side = Validate.notNull(side, "side is required");
        this.actions = actions == null ? ImmutableList.of() : ImmutableList.copyOf(actions);
        this.belief = belief == null ? OpponentBelief.NONE : belief;
    }

    public String getFormat() {
        return format;
    }

    public BattleState getState() {
        return state;
    }

    public SideId getSide() {
        return side;
    }

    public List<BattleAction> getActions() {
        return actions;
    }

    public OpponentBelief getBelief() {
        return belief;
    }
}
