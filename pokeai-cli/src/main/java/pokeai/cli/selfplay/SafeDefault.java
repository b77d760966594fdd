package pokeai.cli.selfplay;

import pokeai.data.Move;
import pokeai.engine.action.BattleAction;
import pokeai.engine.action.MoveAction;

import java.util.List;

/**
 * The action taken when a policy fails or runs out of time: the first legal move that is not
 * Struggle, otherwise the first candidate.
 */
public final class SafeDefault {

    private SafeDefault() {
    }

    public static BattleAction choose(List<BattleAction> candidates) {
        for (BattleAction action : candidates) {
            if (action instanceof MoveAction && !Move.STRUGGLE.equals(((MoveAction) action).getMoveId())) {
                return action;
            }
        }
        return candidates.get(0);
    }
}
