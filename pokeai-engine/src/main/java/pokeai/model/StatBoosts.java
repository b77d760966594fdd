package pokeai.model;

import pokeai.data.Stat;

import java.util.EnumMap;
import java.util.Map;

/**
 * Stat stages, each clamped to [-6, +6]. Stats at stage 0 are not stored.
 */
public class StatBoosts {
    public static final int MAX_STAGE = 6;

    private EnumMap<Stat, Integer> stages = new EnumMap<>(Stat.class);

    public StatBoosts() {
    }

    public StatBoosts copy() {
        StatBoosts copy = new StatBoosts();
        copy.stages.putAll(stages);
        return copy;
    }

    public int get(Stat stat) {
        Integer stage = stages.get(stat);
        return stage == null ? 0 : stage;
    }

    /**
     * Applies a relative change and returns the change actually made, which is smaller than
     * {@code delta} when the stage hits a bound.
     */
    public int apply(Stat stat, int delta) {
        if (!stat.isBoostable()) {
            throw new IllegalArgumentException("HP cannot be boosted");
        }
        int before = get(stat);
        int after = Math.max(-MAX_STAGE, Math.min(MAX_STAGE, before + delta));
        set(stat, after);
        return after - before;
    }

    public void set(Stat stat, int stage) {
        if (stage == 0) {
            stages.remove(stat);
        } else {
            stages.put(stat, stage);
        }
    }

    public void clear() {
        stages.clear();
    }

    public Map<Stat, Integer> asMap() {
        return stages;
    }

    public boolean isEmpty() {
        return stages.isEmpty();
    }

    /** Multiplier for ATK/DEF/SPA/SPD/SPE: (2+n)/2 or 2/(2-n). */
    public static double statMultiplier(int stage) {
        return stage >= 0 ? (2.0 + stage) / 2.0 : 2.0 / (2.0 - stage);
    }

    /** Multiplier for a combined accuracy-minus-evasion stage: (3+n)/3 or 3/(3-n). */
    public static double accuracyMultiplier(int stage) {
        int clamped = Math.max(-MAX_STAGE, Math.min(MAX_STAGE, stage));
        return clamped >= 0 ? (3.0 + clamped) / 3.0 : 3.0 / (3.0 - clamped);
    }

    @Override
    public String toString() {
        return stages.toString();
    }
}
