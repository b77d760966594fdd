package pokeai.cli;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import pokeai.data.PokemonType;
import pokeai.engine.action.BattleAction;
import pokeai.engine.calc.OpponentBelief;
import pokeai.engine.calc.StaticOpponentBelief;
import pokeai.io.BattleStateJson;
import pokeai.io.TeamLoader;
import pokeai.model.BattleState;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;

/**
 * Reads the documents the subcommands take as input. Every failure becomes an
 * {@link InputFileException} naming the file.
 */
final class CliInput {

    private CliInput() {
    }

    static BattleState readState(File file) {
        requireReadable(file, "State");
        try {
            return BattleStateJson.read(file.toPath());
        } catch (IOException | JsonParseException e) {
            throw new InputFileException("Cannot read state " + file + ": " + e.getMessage(), e);
        }
    }

    static TeamLoader.Team readTeam(File file) {
        requireReadable(file, "Team");
        try {
            return TeamLoader.read(file.toPath());
        } catch (IOException | JsonParseException e) {
            throw new InputFileException("Cannot read team " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * An actions file is a JSON array of action notations such as {@code "move earthquake"}.
     */
    static List<BattleAction> readActions(File file) {
        requireReadable(file, "Actions");
        List<String> notations;
        try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            notations = BattleStateJson.gson().fromJson(reader, new TypeToken<List<String>>() { }.getType());
        } catch (IOException | JsonParseException e) {
            throw new InputFileException("Cannot read actions " + file + ": " + e.getMessage(), e);
        }
        if (notations == null) {
            throw new InputFileException("Actions file " + file + " is empty");
        }
        ImmutableList.Builder<BattleAction> actions = ImmutableList.builder();
        for (String notation : notations) {
            try {
                actions.add(BattleAction.parse(notation));
            } catch (IllegalArgumentException e) {
                throw new InputFileException("Bad action in " + file + ": " + e.getMessage(), e);
            }
        }
        return actions.build();
    }

    /**
     * A belief file holds {@code {"items": {species: item}, "teraTypes": {species: TYPE}}}.
     */
    static OpponentBelief readBelief(File file) {
        if (file == null) {
            return OpponentBelief.NONE;
        }
        requireReadable(file, "Belief");
        BeliefDocument doc;
        try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            doc = BattleStateJson.gson().fromJson(reader, BeliefDocument.class);
        } catch (IOException | JsonParseException e) {
            throw new InputFileException("Cannot read belief " + file + ": " + e.getMessage(), e);
        }
        if (doc == null) {
            return OpponentBelief.NONE;
        }
        return new StaticOpponentBelief(doc.items, doc.teraTypes);
    }

    private static void requireReadable(File file, String what) {
        if (!file.isFile() || !file.canRead()) {
            throw new InputFileException(what + " file not found: " + file);
        }
    }

    static final class BeliefDocument {
        Map<String, String> items;
        Map<String, PokemonType> teraTypes;
    }
}
