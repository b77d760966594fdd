package pokeai.data;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * A primary (chance 1) or secondary (chance below 1) effect of a move. Only the payload
 * field matching {@link #getKind()} is set.
 */
public class MoveEffect {
    private MoveEffectKind kind;
    private double chance = 1.0;
    private EffectTarget target = EffectTarget.FOE;
    private StatusCondition status;
    private Map<Stat, Integer> boosts;
    private VolatileKind volatileKind;
    private HazardKind hazard;
    private ScreenKind screen;
    private SideConditionKind sideCondition;
    private Weather weather;
    private Terrain terrain;
    /** Fraction of max HP for HEAL. */
    private double fraction;

    public MoveEffect() {
    }

    public MoveEffect(MoveEffectKind kind, EffectTarget target, double chance) {
        this.kind = kind;
        this.target = target;
        this.chance = chance;
    }

    public MoveEffectKind getKind() {
        return kind;
    }

    public double getChance() {
        return chance;
    }

    public boolean isGuaranteed() {
        return chance >= 1.0;
    }

    public EffectTarget getTarget() {
        return target == null ? EffectTarget.FOE : target;
    }

    public StatusCondition getStatus() {
        return status;
    }

    public Map<Stat, Integer> getBoosts() {
        return boosts == null ? ImmutableMap.of() : boosts;
    }

    public VolatileKind getVolatileKind() {
        return volatileKind;
    }

    public HazardKind getHazard() {
        return hazard;
    }

    public ScreenKind getScreen() {
        return screen;
    }

    public SideConditionKind getSideCondition() {
        return sideCondition;
    }

    public Weather getWeather() {
        return weather;
    }

    public Terrain getTerrain() {
        return terrain;
    }

    public double getFraction() {
        return fraction;
    }

    public MoveEffect withStatus(StatusCondition status) {
        this.status = status;
        return this;
    }

    public MoveEffect withBoosts(Map<Stat, Integer> boosts) {
        this.boosts = ImmutableMap.copyOf(boosts);
        return this;
    }

    public MoveEffect withWeather(Weather weather) {
        this.weather = weather;
        return this;
    }

    public MoveEffect withTerrain(Terrain terrain) {
        this.terrain = terrain;
        return this;
    }

    public MoveEffect withVolatile(VolatileKind volatileKind) {
        this.volatileKind = volatileKind;
        return this;
    }
}
