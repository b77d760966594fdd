package pokeai.engine.calc;

/**
 * Damage of one hit as a percentage of the defender's max HP, plus the raw HP rolls.
 */
public final class DamageSummary {
    private static final DamageSummary ZERO = new DamageSummary(0, 0, 0, new int[0]);

    private final double min;
    private final double max;
    private final double average;
    private final int[] rolls;

    private DamageSummary(double min, double max, double average, int[] rolls) {
        this.min = min;
        this.max = max;
        this.average = average;
        this.rolls = rolls;
    }

    public static DamageSummary zero() {
        return ZERO;
    }

    public static DamageSummary of(DamageRoll roll) {
        return new DamageSummary(roll.percentOfMax(roll.min()), roll.percentOfMax(roll.max()),
                roll.percentOfMax(roll.average()), roll.getRolls());
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getAverage() {
        return average;
    }

    public int[] getRolls() {
        return rolls.clone();
    }

    @Override
    public String toString() {
        return String.format("%.1f%%-%.1f%% (avg %.1f%%)", min, max, average);
    }
}
