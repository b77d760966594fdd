package pokeai.data;

/**
 * Natures raise one core stat by 10% and lower another by 10%; neutral natures have equal stats.
 */
public enum Nature {
    HARDY(Stat.ATK, Stat.ATK), LONELY(Stat.ATK, Stat.DEF), BRAVE(Stat.ATK, Stat.SPE),
    ADAMANT(Stat.ATK, Stat.SPA), NAUGHTY(Stat.ATK, Stat.SPD),
    BOLD(Stat.DEF, Stat.ATK), DOCILE(Stat.DEF, Stat.DEF), RELAXED(Stat.DEF, Stat.SPE),
    IMPISH(Stat.DEF, Stat.SPA), LAX(Stat.DEF, Stat.SPD),
    TIMID(Stat.SPE, Stat.ATK), HASTY(Stat.SPE, Stat.DEF), SERIOUS(Stat.SPE, Stat.SPE),
    JOLLY(Stat.SPE, Stat.SPA), NAIVE(Stat.SPE, Stat.SPD),
    MODEST(Stat.SPA, Stat.ATK), MILD(Stat.SPA, Stat.DEF), QUIET(Stat.SPA, Stat.SPE),
    BASHFUL(Stat.SPA, Stat.SPA), RASH(Stat.SPA, Stat.SPD),
    CALM(Stat.SPD, Stat.ATK), GENTLE(Stat.SPD, Stat.DEF), SASSY(Stat.SPD, Stat.SPE),
    CAREFUL(Stat.SPD, Stat.SPA), QUIRKY(Stat.SPD, Stat.SPD);

    private final Stat plus;
    private final Stat minus;

    Nature(Stat plus, Stat minus) {
        this.plus = plus;
        this.minus = minus;
    }

    public double multiplier(Stat stat) {
        if (plus == minus) {
            return 1.0;
        }
        if (stat == plus) {
            return 1.1;
        }
        if (stat == minus) {
            return 0.9;
        }
        return 1.0;
    }
}
