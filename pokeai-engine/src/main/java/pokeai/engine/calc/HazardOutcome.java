package pokeai.engine.calc;

import pokeai.data.StatusCondition;

/**
 * What entry hazards do to one incoming Pokemon.
 */
public final class HazardOutcome {
    private final double damageFraction;
    private final StatusCondition status;
    private final boolean speedDrop;
    private final boolean absorbsToxicSpikes;

    HazardOutcome(double damageFraction, StatusCondition status, boolean speedDrop, boolean absorbsToxicSpikes) {
        this.damageFraction = damageFraction;
        this.status = status;
        this.speedDrop = speedDrop;
        this.absorbsToxicSpikes = absorbsToxicSpikes;
    }

    public static HazardOutcome none() {
        return new HazardOutcome(0, StatusCondition.NONE, false, false);
    }

    /** Fraction of max HP lost, in [0, 1]. */
    public double getDamageFraction() {
        return damageFraction;
    }

    public double getDamagePercent() {
        return 100.0 * damageFraction;
    }

    public int damageHp(int maxHp) {
        if (damageFraction <= 0) {
            return 0;
        }
        return Math.max(1, (int) Math.floor(maxHp * damageFraction));
    }

    /** Status inflicted by toxic spikes, or NONE. */
    public StatusCondition getStatus() {
        return status;
    }

    public boolean isSpeedDrop() {
        return speedDrop;
    }

    /** A grounded Poison type removes toxic spikes on entry. */
    public boolean isAbsorbsToxicSpikes() {
        return absorbsToxicSpikes;
    }
}
