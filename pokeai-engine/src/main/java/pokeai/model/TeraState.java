package pokeai.model;

import pokeai.data.PokemonType;

/**
 * One-time terastallization resource. Once used it is never available again.
 */
public class TeraState {
    private boolean available;
    private boolean used;
    private PokemonType type;

    private TeraState() {
    }

    public TeraState(boolean available, boolean used, PokemonType type) {
        this.available = available;
        this.used = used;
        this.type = type;
    }

    public static TeraState none() {
        return new TeraState(false, false, null);
    }

    public static TeraState of(PokemonType type) {
        return new TeraState(type != null, false, type);
    }

    public TeraState copy() {
        return new TeraState(available, used, type);
    }

    public boolean isAvailable() {
        return available && !used;
    }

    public boolean isUsed() {
        return used;
    }

    public PokemonType getType() {
        return type;
    }

    public void consume() {
        this.used = true;
        this.available = false;
    }

    /** Another team member terastallized; this one keeps its tera type but loses the option. */
    public void forfeit() {
        this.available = false;
    }
}
