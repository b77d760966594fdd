package pokeai.engine.calc;

import pokeai.data.PokemonType;

/**
 * Read-only view of what the policy layer believes about hidden opponent information. The engine
 * only reads it; it is owned and updated outside the engine.
 */
public interface OpponentBelief {

    OpponentBelief NONE = new OpponentBelief() {
        @Override
        public String likelyItem(String species) {
            return null;
        }

        @Override
        public PokemonType likelyTeraType(String species) {
            return null;
        }
    };

    /** Most likely held item of an opposing species whose item is unrevealed, or null. */
    String likelyItem(String species);

    /** Most likely tera type of an opposing species, or null. */
    PokemonType likelyTeraType(String species);
}
