package pokeai.cli.stats;

import java.util.Locale;

/**
 * Wilson score confidence interval for a win rate. Stays inside [0, 100] and behaves for small
 * samples and rates near 0 or 1.
 */
public final class WilsonInterval {

    /** z-score of a two-sided 95% interval. */
    public static final double Z_95 = 1.96;

    private WilsonInterval() {}

    /**
     * @param successes number of wins
     * @param total     number of battles
     * @param z         z-score of the confidence level
     * @return {lower, upper} as percentages
     */
    public static double[] calculate(int successes, int total, double z) {
        if (total == 0) {
            return new double[]{0.0, 100.0};
        }

        double n = total;
        double p = successes / n;
        double z2 = z * z;

        double denominator = 1.0 + z2 / n;
        double center = (p + z2 / (2.0 * n)) / denominator;
        double spread = (z / denominator) * Math.sqrt(p * (1.0 - p) / n + z2 / (4.0 * n * n));

        return new double[]{Math.max(0.0, center - spread) * 100.0, Math.min(1.0, center + spread) * 100.0};
    }

    public static double[] calculate95(int successes, int total) {
        return calculate(successes, total, Z_95);
    }

    /**
     * Formats as {@code "52.3% [45.1%, 59.4%]"}.
     */
    public static String format(double winRate, double[] ci) {
        return String.format(Locale.ROOT, "%.1f%% [%.1f%%, %.1f%%]", winRate, ci[0], ci[1]);
    }
}
