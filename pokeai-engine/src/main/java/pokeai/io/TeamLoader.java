package pokeai.io;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pokeai.data.Dex;
import pokeai.data.Ids;
import pokeai.data.Move;
import pokeai.data.Nature;
import pokeai.data.PokemonType;
import pokeai.data.Species;
import pokeai.data.Stat;
import pokeai.engine.calc.StatCalculator;
import pokeai.engine.error.MissingEntityException;
import pokeai.model.MoveSlot;
import pokeai.model.Pokemon;
import pokeai.model.TeraState;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns team documents into battle-ready Pokemon, computing stats with the standard formula.
 * A document is either an array of members or an object with a {@code team} array and an
 * optional {@code name}.
 */
public final class TeamLoader {
    private static final Logger log = LoggerFactory.getLogger(TeamLoader.class);
    private static final Gson GSON = new Gson();

    public static final int MAX_TEAM_SIZE = 6;
    static final int DEFAULT_IV = 31;

    private final Dex dex;

    public TeamLoader(Dex dex) {
        this.dex = dex;
    }

    /** A named team read from a file. */
    public static final class Team {
        private final String name;
        private final List<TeamSpec> members;

        public Team(String name, List<TeamSpec> members) {
            this.name = name;
            this.members = members;
        }

        public String getName() {
            return name;
        }

        public List<TeamSpec> getMembers() {
            return members;
        }
    }

    public static Team read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String fallbackName = StringUtils.substringBeforeLast(path.getFileName().toString(), ".");
            return read(reader, fallbackName);
        }
    }

    public static Team read(Reader reader, String fallbackName) {
        JsonElement root = JsonParser.parseReader(reader);
        JsonArray members;
        String name = fallbackName;
        if (root.isJsonArray()) {
            members = root.getAsJsonArray();
        } else if (root.isJsonObject() && root.getAsJsonObject().has("team")) {
            JsonObject object = root.getAsJsonObject();
            members = object.getAsJsonArray("team");
            if (object.has("name")) {
                name = object.get("name").getAsString();
            }
        } else {
            throw new JsonParseException("A team document is an array of members or an object with a team array");
        }
        List<TeamSpec> specs = new ArrayList<>();
        for (JsonElement member : members) {
            specs.add(GSON.fromJson(member, TeamSpec.class));
        }
        return new Team(name, specs);
    }

    /**
     * @throws MissingEntityException for an unknown species or move
     * @throws IllegalArgumentException for an empty or oversized team or a bad spread
     */
    public List<Pokemon> build(List<TeamSpec> specs, int defaultLevel) {
        if (specs.isEmpty() || specs.size() > MAX_TEAM_SIZE) {
            throw new IllegalArgumentException("A team has 1 to " + MAX_TEAM_SIZE + " members, got " + specs.size());
        }
        List<Pokemon> team = new ArrayList<>(specs.size());
        for (TeamSpec spec : specs) {
            team.add(build(spec, defaultLevel));
        }
        return team;
    }

    public Pokemon build(TeamSpec spec, int defaultLevel) {
        Species species = dex.species(spec.getSpecies());
        if (species == null) {
            throw new MissingEntityException("Unknown species " + spec.getSpecies());
        }
        int level = spec.getLevel() == null ? defaultLevel : spec.getLevel();
        if (level < 1 || level > 100) {
            throw new IllegalArgumentException("Level out of range for " + species.getName() + ": " + level);
        }
        Map<Stat, Integer> evs = spread(spec.getEvs(), 0, 252, species);
        Map<Stat, Integer> ivs = spread(spec.getIvs(), DEFAULT_IV, 31, species);
        Nature nature = parseNature(spec.getNature());

        int maxHp = StatCalculator.hp(species.getBaseStat(Stat.HP), ivs.getOrDefault(Stat.HP, DEFAULT_IV),
                evs.getOrDefault(Stat.HP, 0), level);
        Pokemon pokemon = new Pokemon(species.getId(), level, maxHp, species.getTypes());
        pokemon.setName(StringUtils.defaultIfBlank(spec.getName(), species.getName()));
        pokemon.setSpread(evs, ivs, nature);
        StatCalculator.applySpecies(pokemon, species);
        pokemon.setItem(StringUtils.isBlank(spec.getItem()) ? null : Ids.normalize(spec.getItem()));
        String ability = StringUtils.isBlank(spec.getAbility()) && !species.getAbilities().isEmpty()
                ? species.getAbilities().get(0) : spec.getAbility();
        pokemon.setAbility(ability == null ? null : Ids.normalize(ability));

        for (String moveName : spec.getMoves()) {
            Move move = dex.move(moveName);
            if (move == null) {
                throw new MissingEntityException("Unknown move " + moveName + " on " + species.getName());
            }
            pokemon.addMove(new MoveSlot(move.getId(), move.getPp()));
        }
        if (pokemon.getMoves().isEmpty()) {
            throw new IllegalArgumentException(species.getName() + " has no moves");
        }
        PokemonType teraType = PokemonType.fromName(spec.getTeraType());
        if (teraType == null && !species.getTypes().isEmpty()) {
            teraType = species.getTypes().get(0);
        }
        pokemon.setTera(teraType == null ? TeraState.none() : TeraState.of(teraType));
        log.trace("Built {} with {} HP", pokemon.getName(), maxHp);
        return pokemon;
    }

    private static Map<Stat, Integer> spread(Map<String, Integer> raw, int defaultValue, int max, Species species) {
        Map<Stat, Integer> result = new EnumMap<>(Stat.class);
        for (Stat stat : Stat.values()) {
            if (stat == Stat.HP || stat.isCoreStat()) {
                result.put(stat, defaultValue);
            }
        }
        for (Map.Entry<String, Integer> entry : raw.entrySet()) {
            Stat stat = parseStat(entry.getKey());
            int value = entry.getValue() == null ? defaultValue : entry.getValue();
            if (value < 0 || value > max) {
                throw new IllegalArgumentException(species.getName() + " " + stat + " value out of range: " + value);
            }
            result.put(stat, value);
        }
        return result;
    }

    static Stat parseStat(String name) {
        String key = Ids.normalize(name);
        switch (key) {
            case "hp":
                return Stat.HP;
            case "atk":
            case "attack":
                return Stat.ATK;
            case "def":
            case "defense":
                return Stat.DEF;
            case "spa":
            case "spatk":
            case "specialattack":
                return Stat.SPA;
            case "spd":
            case "spdef":
            case "specialdefense":
                return Stat.SPD;
            case "spe":
            case "speed":
                return Stat.SPE;
            default:
                throw new IllegalArgumentException("Unknown stat " + name);
        }
    }

    static Nature parseNature(String name) {
        if (StringUtils.isBlank(name)) {
            return Nature.SERIOUS;
        }
        try {
            return Nature.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown nature " + name, e);
        }
    }
}
