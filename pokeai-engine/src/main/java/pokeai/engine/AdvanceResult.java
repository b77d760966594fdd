package pokeai.engine;

import com.google.common.collect.ImmutableList;
import pokeai.model.BattleEvent;
import pokeai.model.BattleState;

import java.util.List;

public final class AdvanceResult {
    private final BattleState nextState;
    private final List<BattleEvent> events;

    public AdvanceResult(BattleState nextState, List<BattleEvent> events) {
        this.nextState = nextState;
        this.events = ImmutableList.copyOf(events);
    }

    public BattleState getNextState() {
        return nextState;
    }

    /** Events of this advance only; the state's log holds the whole battle. */
    public List<BattleEvent> getEvents() {
        return events;
    }

    public boolean isFinished() {
        return nextState.isFinished();
    }
}
