package pokeai.cli.selfplay;

import pokeai.engine.action.BattleAction;

import java.util.List;

/**
 * Wraps a policy with epsilon-greedy exploration: with probability epsilon a random legal
 * action, otherwise the inner policy's choice.
 */
public class EpsilonGreedyPolicy implements ActionPolicy {
    private final ActionPolicy inner;
    private final double epsilon;

    public EpsilonGreedyPolicy(ActionPolicy inner, double epsilon) {
        if (epsilon < 0 || epsilon > 1) {
            throw new IllegalArgumentException("epsilon must be in [0, 1], got " + epsilon);
        }
        this.inner = inner;
        this.epsilon = epsilon;
    }

    @Override
    public BattleAction choose(Decision decision) {
        if (decision.getRandom().nextDouble() < epsilon) {
            List<BattleAction> candidates = decision.getCandidates();
            return candidates.get(decision.getRandom().nextInt(candidates.size()));
        }
        return inner.choose(decision);
    }

    @Override
    public String getName() {
        return inner.getName() + "(eps=" + epsilon + ")";
    }
}
