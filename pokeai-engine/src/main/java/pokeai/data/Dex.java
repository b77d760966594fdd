package pokeai.data;

import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Move and species dex. Immutable once loaded and shared across battles.
 */
public final class Dex {
    private static final Logger log = LoggerFactory.getLogger(Dex.class);

    private static final String MOVES_RESOURCE = "/pokeai/data/moves.json";
    private static final String SPECIES_RESOURCE = "/pokeai/data/species.json";

    private static final Type MOVE_MAP = new TypeToken<LinkedHashMap<String, Move>>() { }.getType();
    private static final Type SPECIES_MAP = new TypeToken<LinkedHashMap<String, Species>>() { }.getType();

    private final ImmutableMap<String, Move> moves;
    private final ImmutableMap<String, Species> species;
    private final ImmutableMap<String, Species> megaByStone;

    private Dex(Map<String, Move> moves, Map<String, Species> species) {
        ImmutableMap.Builder<String, Move> moveBuilder = ImmutableMap.builder();
        for (Map.Entry<String, Move> e : moves.entrySet()) {
            String id = Ids.normalize(e.getKey());
            e.getValue().assignId(id);
            moveBuilder.put(id, e.getValue());
        }
        ImmutableMap.Builder<String, Species> speciesBuilder = ImmutableMap.builder();
        ImmutableMap.Builder<String, Species> megaBuilder = ImmutableMap.builder();
        for (Map.Entry<String, Species> e : species.entrySet()) {
            String id = Ids.normalize(e.getKey());
            Species entry = e.getValue();
            entry.assignId(id);
            speciesBuilder.put(id, entry);
            if (entry.isMegaForme()) {
                megaBuilder.put(Ids.normalize(entry.getRequiredItem()), entry);
            }
        }
        this.moves = moveBuilder.build();
        this.species = speciesBuilder.build();
        this.megaByStone = megaBuilder.build();
    }

    private static final class Holder {
        private static final Dex STANDARD = loadStandard();
    }

    public static Dex standard() {
        return Holder.STANDARD;
    }

    private static Dex loadStandard() {
        try (InputStream movesIn = DataResources.open(MOVES_RESOURCE);
             InputStream speciesIn = DataResources.open(SPECIES_RESOURCE)) {
            Dex dex = load(movesIn, speciesIn);
            log.debug("Loaded dex: {} moves, {} species", dex.moves.size(), dex.species.size());
            return dex;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load dex", e);
        }
    }

    public static Dex load(InputStream movesIn, InputStream speciesIn) throws IOException {
        Gson gson = new Gson();
        try (Reader moveReader = new InputStreamReader(movesIn, StandardCharsets.UTF_8);
             Reader speciesReader = new InputStreamReader(speciesIn, StandardCharsets.UTF_8)) {
            Map<String, Move> moves = gson.fromJson(moveReader, MOVE_MAP);
            Map<String, Species> species = gson.fromJson(speciesReader, SPECIES_MAP);
            return new Dex(moves, species);
        }
    }

    /** Returns the move or null when the id is unknown. */
    public Move move(String id) {
        return id == null ? null : moves.get(Ids.normalize(id));
    }

    public Species species(String id) {
        return id == null ? null : species.get(Ids.normalize(id));
    }

    /** Mega forme unlocked by {@code stone} for {@code baseSpecies}, or null. */
    public Species megaForme(String baseSpecies, String stone) {
        if (stone == null) {
            return null;
        }
        Species mega = megaByStone.get(Ids.normalize(stone));
        if (mega == null || !Ids.same(mega.getBaseSpecies(), baseSpecies)) {
            return null;
        }
        return mega;
    }

    public Collection<Move> allMoves() {
        return moves.values();
    }

    public Collection<Species> allSpecies() {
        return species.values();
    }
}
