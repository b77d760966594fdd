package pokeai.cli.selfplay;

import java.util.Locale;

/**
 * Policy lookup by command-line name.
 */
public final class Policies {

    private Policies() {
    }

    /**
     * @throws IllegalArgumentException for an unknown name
     */
    public static ActionPolicy byName(String name, double epsilon) {
        ActionPolicy policy;
        switch (name.toLowerCase(Locale.ROOT)) {
            case "random":
                policy = new RandomPolicy();
                break;
            case "greedy":
                policy = new GreedyPolicy();
                break;
            default:
                throw new IllegalArgumentException("Unknown policy '" + name + "' (expected random or greedy)");
        }
        return epsilon > 0 ? new EpsilonGreedyPolicy(policy, epsilon) : policy;
    }
}
