package pokeai.cli.selfplay;

import pokeai.engine.action.BattleAction;

import java.util.List;

/**
 * Uniformly random legal action. Used for data generation and as a baseline opponent.
 */
public class RandomPolicy implements ActionPolicy {

    @Override
    public BattleAction choose(Decision decision) {
        List<BattleAction> candidates = decision.getCandidates();
        return candidates.get(decision.getRandom().nextInt(candidates.size()));
    }

    @Override
    public String getName() {
        return "random";
    }
}
