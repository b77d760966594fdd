package pokeai.engine.effect;

import pokeai.data.Species;
import pokeai.data.VolatileKind;
import pokeai.engine.calc.StatCalculator;
import pokeai.model.Pokemon;
import pokeai.model.VolatileState;

/**
 * In-battle forme changes: mega evolution and dynamax.
 */
public final class FormeChanges {

    private FormeChanges() {}

    /** Takes the mega forme's types, ability and stats. HP is unchanged. */
    public static void megaEvolve(Pokemon pokemon, Species mega) {
        pokemon.setSpecies(mega.getId());
        pokemon.setName(mega.getName());
        pokemon.setTypes(mega.getTypes());
        if (!mega.getAbilities().isEmpty()) {
            pokemon.setAbility(mega.getAbilities().get(0));
        }
        StatCalculator.applySpecies(pokemon, mega);
        pokemon.setMegaEvolved(true);
    }

    /** Doubles current and max HP for the dynamax duration; the original max HP is kept on the volatile. */
    public static void dynamax(Pokemon pokemon) {
        int originalMax = pokemon.getMaxHp();
        pokemon.getVolatiles().put(new VolatileState(VolatileKind.DYNAMAX, VolatileKind.DYNAMAX.getDefaultTurns())
                .withCounter(originalMax));
        pokemon.setMaxHp(originalMax * 2);
        pokemon.setHp(pokemon.getHp() * 2);
    }

    /** Restores the original max HP, keeping the HP ratio. A living Pokemon keeps at least 1 HP. */
    public static void endDynamax(Pokemon pokemon, int originalMax) {
        int current = pokemon.getMaxHp();
        int hp = pokemon.getHp();
        pokemon.getVolatiles().remove(VolatileKind.DYNAMAX);
        if (originalMax <= 0 || current == originalMax) {
            return;
        }
        int scaled = (int) Math.round((double) hp * originalMax / current);
        if (hp > 0) {
            scaled = Math.max(1, scaled);
        }
        pokemon.setMaxHp(originalMax);
        pokemon.setHp(Math.min(originalMax, scaled));
    }
}
