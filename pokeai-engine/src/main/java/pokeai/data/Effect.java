package pokeai.data;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * One row of the ability/item effect table. Instances are read from JSON by Gson and never
 * mutated afterwards.
 */
public class Effect {
    private TriggerPhase trigger;
    private EffectKind kind;
    /** All must hold; empty means always. */
    private List<EffectCondition> conditions;
    private EffectTarget target = EffectTarget.SELF;
    private PokemonType type;
    private Weather weather;
    private Terrain terrain;
    private Stat stat;
    private StatusCondition status;
    private Capability capability;
    private double value;
    private double threshold;
    /** Item is used up when this effect fires (Focus Sash, Air Balloon). */
    private boolean consumed;

    public Effect() {
    }

    public Effect(TriggerPhase trigger, EffectKind kind, double value) {
        this.trigger = trigger;
        this.kind = kind;
        this.value = value;
    }

    public TriggerPhase getTrigger() {
        return trigger;
    }

    public EffectKind getKind() {
        return kind;
    }

    public List<EffectCondition> getConditions() {
        return conditions == null ? ImmutableList.of() : conditions;
    }

    public EffectTarget getTarget() {
        return target == null ? EffectTarget.SELF : target;
    }

    public PokemonType getType() {
        return type;
    }

    public Weather getWeather() {
        return weather;
    }

    public Terrain getTerrain() {
        return terrain;
    }

    public Stat getStat() {
        return stat;
    }

    public StatusCondition getStatus() {
        return status;
    }

    public Capability getCapability() {
        return capability;
    }

    public double getValue() {
        return value;
    }

    public double getThreshold() {
        return threshold;
    }

    public boolean isConsumed() {
        return consumed;
    }

    public Effect withConditions(EffectCondition... conditions) {
        this.conditions = ImmutableList.copyOf(conditions);
        return this;
    }

    public Effect withThreshold(double threshold) {
        this.threshold = threshold;
        return this;
    }

    public Effect withTarget(EffectTarget target) {
        this.target = target;
        return this;
    }

    public Effect withType(PokemonType type) {
        this.type = type;
        return this;
    }

    public Effect withStat(Stat stat) {
        this.stat = stat;
        return this;
    }

    public Effect withCapability(Capability capability) {
        this.capability = capability;
        return this;
    }

    @Override
    public String toString() {
        return trigger + "/" + kind + (capability != null ? "/" + capability : "") + "(" + value + ")";
    }
}
