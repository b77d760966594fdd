package pokeai.data;

/**
 * Battle stats. HP is never boosted; accuracy and evasion exist only as boost stages.
 */
public enum Stat {
    HP,
    ATK,
    DEF,
    SPA,
    SPD,
    SPE,
    ACCURACY,
    EVASION;

    public boolean isBoostable() {
        return this != HP;
    }

    /** True for the five stats that come from base stats, EVs and IVs (HP excluded). */
    public boolean isCoreStat() {
        return this == ATK || this == DEF || this == SPA || this == SPD || this == SPE;
    }
}
