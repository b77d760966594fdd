package pokeai.cli.selfplay;

import pokeai.engine.action.BattleAction;

public interface ActionPolicy {

    /**
     * Picks one of the decision's candidates. The candidate list is never empty.
     */
    BattleAction choose(Decision decision);

    String getName();
}
