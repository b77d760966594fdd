package pokeai.cli.selfplay;

import pokeai.engine.EvaluateRequest;
import pokeai.engine.action.BattleAction;
import pokeai.engine.calc.CalcResult;
import pokeai.engine.calc.OpponentBelief;

import java.util.List;

/**
 * Takes the candidate with the highest expected gain according to the calculator. Error results
 * are never picked; when every result is an error it falls back to {@link SafeDefault}.
 */
public class GreedyPolicy implements ActionPolicy {

    @Override
    public BattleAction choose(Decision decision) {
        List<BattleAction> candidates = decision.getCandidates();
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        List<CalcResult> results = decision.getEngine().evaluate(new EvaluateRequest(decision.getFormat(),
                decision.getState(), decision.getSide(), candidates, OpponentBelief.NONE));

        int best = -1;
        double bestGain = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < results.size(); i++) {
            CalcResult result = results.get(i);
            if (!result.isError() && result.getExpectedGain() > bestGain) {
                best = i;
                bestGain = result.getExpectedGain();
            }
        }
        return best < 0 ? SafeDefault.choose(candidates) : candidates.get(best);
    }

    @Override
    public String getName() {
        return "greedy";
    }
}
