package pokeai.data;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Immutable move definition from the move dex.
 */
public class Move {
    public static final String STRUGGLE = "struggle";

    private String id;
    private String name;
    private PokemonType type;
    private MoveCategory category;
    private int basePower;
    /** In (0,1]. Ignored when {@link #alwaysHits} is set. */
    private double accuracy = 1.0;
    private boolean alwaysHits;
    private int pp;
    private int priority;
    private MoveTarget target = MoveTarget.NORMAL;
    private boolean contact;
    private boolean sound;
    private boolean charge;
    private boolean recharge;
    private boolean highCrit;
    /** Fraction of damage dealt recovered by the user. */
    private double drain;
    /** Fraction of damage dealt taken back as recoil. */
    private double recoil;
    private List<MoveEffect> effects;

    public Move() {
    }

    void assignId(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name == null ? id : name;
    }

    public PokemonType getType() {
        return type;
    }

    public MoveCategory getCategory() {
        return category;
    }

    public boolean isStatus() {
        return category == MoveCategory.STATUS;
    }

    public boolean isDamaging() {
        return category != MoveCategory.STATUS && basePower > 0;
    }

    public int getBasePower() {
        return basePower;
    }

    public double getAccuracy() {
        return accuracy;
    }

    public boolean isAlwaysHits() {
        return alwaysHits;
    }

    public int getPp() {
        return pp;
    }

    public int getPriority() {
        return priority;
    }

    public MoveTarget getTarget() {
        return target == null ? MoveTarget.NORMAL : target;
    }

    public boolean isContact() {
        return contact;
    }

    public boolean isSound() {
        return sound;
    }

    public boolean isCharge() {
        return charge;
    }

    public boolean isRecharge() {
        return recharge;
    }

    public boolean isHighCrit() {
        return highCrit;
    }

    public double getDrain() {
        return drain;
    }

    public double getRecoil() {
        return recoil;
    }

    public List<MoveEffect> getEffects() {
        return effects == null ? ImmutableList.of() : effects;
    }

    public boolean isStruggle() {
        return STRUGGLE.equals(id);
    }

    @Override
    public String toString() {
        return getName();
    }
}
