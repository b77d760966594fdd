package pokeai.engine.calc;

import pokeai.engine.error.ErrorKind;

/**
 * Evaluation of one candidate action. Percentages are of the relevant Pokemon's max HP;
 * probabilities are in [0, 1].
 * <p>
 * An error result has {@link #getError()} set, zero accuracy and zero survival. Callers must not
 * select such an action.
 */
public class CalcResult {
    private String action;
    private String format;
    private String error;
    private ErrorKind errorKind;
    private DamageSummary damage = DamageSummary.zero();
    private double accuracy;
    private double ohko;
    private double twoHko;
    private SpeedCheck speedCheck = SpeedCheck.none();
    private double hazardDamage;
    private double statusChance;
    private double expectedSurvival;
    private double expectedGain;
    private int priority;
    private double effectiveness = 1.0;
    private TeraImpact tera;

    CalcResult(String action, String format) {
        this.action = action;
        this.format = format;
    }

    public static CalcResult error(String action, String format, ErrorKind kind, String message) {
        CalcResult result = new CalcResult(action, format);
        result.error = message;
        result.errorKind = kind;
        result.effectiveness = 0;
        return result;
    }

    public boolean isError() {
        return error != null;
    }

    public String getAction() {
        return action;
    }

    public String getFormat() {
        return format;
    }

    public String getError() {
        return error;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public DamageSummary getDamage() {
        return damage;
    }

    public double getAccuracy() {
        return accuracy;
    }

    public double getOhko() {
        return ohko;
    }

    public double getTwoHko() {
        return twoHko;
    }

    public SpeedCheck getSpeedCheck() {
        return speedCheck;
    }

    /** Percentage of max HP lost to entry hazards. */
    public double getHazardDamage() {
        return hazardDamage;
    }

    public double getStatusChance() {
        return statusChance;
    }

    public double getExpectedSurvival() {
        return expectedSurvival;
    }

    public double getExpectedGain() {
        return expectedGain;
    }

    public int getPriority() {
        return priority;
    }

    public double getEffectiveness() {
        return effectiveness;
    }

    public TeraImpact getTera() {
        return tera;
    }

    CalcResult damage(DamageSummary damage, double ohko, double twoHko) {
        this.damage = damage;
        this.ohko = ohko;
        this.twoHko = twoHko;
        return this;
    }

    CalcResult accuracy(double accuracy) {
        this.accuracy = accuracy;
        return this;
    }

    CalcResult speedCheck(SpeedCheck speedCheck) {
        this.speedCheck = speedCheck;
        return this;
    }

    CalcResult hazardDamage(double hazardDamage) {
        this.hazardDamage = hazardDamage;
        return this;
    }

    CalcResult statusChance(double statusChance) {
        this.statusChance = statusChance;
        return this;
    }

    CalcResult expected(double survival, double gain) {
        this.expectedSurvival = survival;
        this.expectedGain = gain;
        return this;
    }

    CalcResult priority(int priority) {
        this.priority = priority;
        return this;
    }

    CalcResult effectiveness(double effectiveness) {
        this.effectiveness = effectiveness;
        return this;
    }

    CalcResult tera(TeraImpact tera) {
        this.tera = tera;
        return this;
    }

    @Override
    public String toString() {
        if (isError()) {
            return action + ": error " + errorKind + " (" + error + ")";
        }
        return String.format("%s: dmg %s acc %.2f ohko %.2f 2hko %.2f %s gain %.1f", action, damage, accuracy, ohko,
                twoHko, speedCheck, expectedGain);
    }
}
