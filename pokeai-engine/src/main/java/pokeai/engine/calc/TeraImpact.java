package pokeai.engine.calc;

import com.google.common.collect.ImmutableList;
import pokeai.data.PokemonType;

import java.util.List;

/**
 * How terastallizing changes the next exchange: offence through STAB, defence through typing.
 * Damage figures are average percentages of the target's max HP.
 */
public final class TeraImpact {
    private final PokemonType teraType;
    private final List<String> stabGained;
    private final List<String> stabLost;
    private final double bestDamageBefore;
    private final double bestDamageAfter;
    private final double incomingDamageBefore;
    private final double incomingDamageAfter;

    TeraImpact(PokemonType teraType, List<String> stabGained, List<String> stabLost, double bestDamageBefore,
               double bestDamageAfter, double incomingDamageBefore, double incomingDamageAfter) {
        this.teraType = teraType;
        this.stabGained = ImmutableList.copyOf(stabGained);
        this.stabLost = ImmutableList.copyOf(stabLost);
        this.bestDamageBefore = bestDamageBefore;
        this.bestDamageAfter = bestDamageAfter;
        this.incomingDamageBefore = incomingDamageBefore;
        this.incomingDamageAfter = incomingDamageAfter;
    }

    public PokemonType getTeraType() {
        return teraType;
    }

    public List<String> getStabGained() {
        return stabGained;
    }

    public List<String> getStabLost() {
        return stabLost;
    }

    public double getBestDamageBefore() {
        return bestDamageBefore;
    }

    public double getBestDamageAfter() {
        return bestDamageAfter;
    }

    public double getIncomingDamageBefore() {
        return incomingDamageBefore;
    }

    public double getIncomingDamageAfter() {
        return incomingDamageAfter;
    }

    /** Offensive gain plus defensive gain, in percentage points. */
    public double netGain() {
        return (bestDamageAfter - bestDamageBefore) + (incomingDamageBefore - incomingDamageAfter);
    }
}
