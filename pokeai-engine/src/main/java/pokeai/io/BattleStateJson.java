package pokeai.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import pokeai.engine.action.BattleAction;
import pokeai.model.BattleState;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A battle state as one JSON document. Reading a document written by {@link #write} gives back an
 * equal state, random source included.
 */
public final class BattleStateJson {
    private static final Gson GSON = builder().setPrettyPrinting().create();
    private static final Gson COMPACT = builder().create();

    private BattleStateJson() {}

    /** The shared configuration: enum maps and actions as notation strings. */
    public static GsonBuilder builder() {
        return new GsonBuilder()
                .registerTypeAdapterFactory(new EnumMapAdapterFactory())
                .registerTypeHierarchyAdapter(BattleAction.class, new BattleActionAdapter().nullSafe())
                .disableHtmlEscaping();
    }

    public static Gson gson() {
        return GSON;
    }

    public static String toJson(BattleState state) {
        return GSON.toJson(state);
    }

    public static String toCompactJson(BattleState state) {
        return COMPACT.toJson(state);
    }

    /**
     * @throws JsonParseException when the document is not a battle state
     */
    public static BattleState fromJson(String json) {
        return validate(GSON.fromJson(json, BattleState.class));
    }

    public static BattleState read(Reader reader) {
        return validate(GSON.fromJson(reader, BattleState.class));
    }

    public static BattleState read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static void write(BattleState state, Writer writer) {
        GSON.toJson(state, writer);
    }

    public static void write(BattleState state, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(state, writer);
        }
    }

    private static BattleState validate(BattleState state) {
        if (state == null) {
            throw new JsonParseException("Empty battle state document");
        }
        if (state.getP1() == null || state.getP2() == null) {
            throw new JsonParseException("Battle state " + state.getId() + " needs both p1 and p2");
        }
        return state;
    }
}
