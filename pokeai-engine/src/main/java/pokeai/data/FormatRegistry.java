package pokeai.data;

import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;

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
 * Supported formats, read from {@code /pokeai/formats.json}. Anything not listed is unsupported.
 */
public final class FormatRegistry {
    private static final String FORMATS_RESOURCE = "/pokeai/formats.json";
    private static final Type FORMAT_MAP = new TypeToken<LinkedHashMap<String, FormatRules>>() { }.getType();

    private final ImmutableMap<String, FormatRules> formats;

    private FormatRegistry(Map<String, FormatRules> formats) {
        ImmutableMap.Builder<String, FormatRules> builder = ImmutableMap.builder();
        for (Map.Entry<String, FormatRules> e : formats.entrySet()) {
            String id = Ids.normalize(e.getKey());
            e.getValue().assignId(id);
            builder.put(id, e.getValue());
        }
        this.formats = builder.build();
    }

    private static final class Holder {
        private static final FormatRegistry STANDARD = loadStandard();
    }

    public static FormatRegistry standard() {
        return Holder.STANDARD;
    }

    private static FormatRegistry loadStandard() {
        try (InputStream in = DataResources.open(FORMATS_RESOURCE)) {
            return load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load formats", e);
        }
    }

    public static FormatRegistry load(InputStream in) throws IOException {
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            Map<String, FormatRules> formats = new Gson().fromJson(reader, FORMAT_MAP);
            return new FormatRegistry(formats);
        }
    }

    /** Returns the rules or null when the format is not supported. */
    public FormatRules find(String formatId) {
        return formatId == null ? null : formats.get(Ids.normalize(formatId));
    }

    public boolean isSupported(String formatId) {
        return find(formatId) != null;
    }

    public Collection<FormatRules> all() {
        return formats.values();
    }
}
