package pokeai.data;

public enum Terrain {
    NONE(null),
    ELECTRIC(PokemonType.ELECTRIC),
    GRASSY(PokemonType.GRASS),
    MISTY(null),
    PSYCHIC(PokemonType.PSYCHIC);

    private final PokemonType boostedType;

    Terrain(PokemonType boostedType) {
        this.boostedType = boostedType;
    }

    /** Move type powered up for grounded attackers, or null. */
    public PokemonType getBoostedType() {
        return boostedType;
    }
}
