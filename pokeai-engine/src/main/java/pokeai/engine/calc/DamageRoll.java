package pokeai.engine.calc;

import java.util.Arrays;

/**
 * The sixteen equally likely damage values of one hit (random factor 85..100 %), against a
 * defender with the given HP.
 */
public final class DamageRoll {
    public static final int ROLLS = 16;

    private final int[] rolls;
    private final int defenderHp;
    private final int defenderMaxHp;
    private final double effectiveness;
    private final boolean survivesFromFull;

    DamageRoll(int[] rolls, int defenderHp, int defenderMaxHp, double effectiveness, boolean survivesFromFull) {
        this.rolls = rolls;
        this.defenderHp = defenderHp;
        this.defenderMaxHp = defenderMaxHp;
        this.effectiveness = effectiveness;
        this.survivesFromFull = survivesFromFull;
    }

    static DamageRoll zero(int defenderHp, int defenderMaxHp, double effectiveness) {
        return new DamageRoll(new int[ROLLS], defenderHp, defenderMaxHp, effectiveness, false);
    }

    public int[] getRolls() {
        return rolls.clone();
    }

    public int roll(int index) {
        return rolls[index];
    }

    public int min() {
        return rolls[0];
    }

    public int max() {
        return rolls[ROLLS - 1];
    }

    public double average() {
        double sum = 0;
        for (int r : rolls) {
            sum += r;
        }
        return sum / ROLLS;
    }

    public double getEffectiveness() {
        return effectiveness;
    }

    public boolean isImmune() {
        return effectiveness == 0;
    }

    public boolean isZero() {
        return max() == 0;
    }

    public int getDefenderHp() {
        return defenderHp;
    }

    public int getDefenderMaxHp() {
        return defenderMaxHp;
    }

    public double percentOfMax(double damage) {
        return defenderMaxHp <= 0 ? 0 : 100.0 * damage / defenderMaxHp;
    }

    /** Fraction of rolls that reduce the defender's current HP to zero in one hit. */
    public double ohkoProbability() {
        if (defenderHp <= 0) {
            return 0;
        }
        if (survivesFromFull && defenderHp == defenderMaxHp && defenderHp > 1) {
            return 0;
        }
        int kills = 0;
        for (int r : rolls) {
            if (r >= defenderHp) {
                kills++;
            }
        }
        return (double) kills / ROLLS;
    }

    /**
     * Fraction of the 256 two-hit roll combinations whose total reaches the defender's current HP.
     * Every one-hit kill is also a two-hit kill, so this is never below {@link #ohkoProbability()}.
     */
    public double twoHkoProbability() {
        if (defenderHp <= 0) {
            return 0;
        }
        int kills = 0;
        for (int first : rolls) {
            for (int second : rolls) {
                if (first + second >= defenderHp) {
                    kills++;
                }
            }
        }
        return (double) kills / (ROLLS * ROLLS);
    }

    @Override
    public String toString() {
        return Arrays.toString(rolls) + " vs " + defenderHp + "/" + defenderMaxHp;
    }
}
