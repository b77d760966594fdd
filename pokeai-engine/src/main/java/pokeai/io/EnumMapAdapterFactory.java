package pokeai.io;

import com.google.gson.Gson;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.EnumMap;
import java.util.Map;

/**
 * Reads and writes {@code EnumMap} fields as JSON objects keyed by constant name.
 */
final class EnumMapAdapterFactory implements TypeAdapterFactory {

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> typeToken) {
        if (!EnumMap.class.isAssignableFrom(typeToken.getRawType())
                || !(typeToken.getType() instanceof ParameterizedType)) {
            return null;
        }
        Type[] args = ((ParameterizedType) typeToken.getType()).getActualTypeArguments();
        Class<? extends Enum> keyType = (Class<? extends Enum>) TypeToken.get(args[0]).getRawType();
        TypeAdapter<?> valueAdapter = gson.getAdapter(TypeToken.get(args[1]));
        return (TypeAdapter<T>) new Adapter(keyType, valueAdapter);
    }

    private static final class Adapter<K extends Enum<K>, V> extends TypeAdapter<EnumMap<K, V>> {
        private final Class<K> keyType;
        private final TypeAdapter<V> valueAdapter;

        Adapter(Class<K> keyType, TypeAdapter<V> valueAdapter) {
            this.keyType = keyType;
            this.valueAdapter = valueAdapter;
        }

        @Override
        public void write(JsonWriter out, EnumMap<K, V> map) throws IOException {
            if (map == null) {
                out.nullValue();
                return;
            }
            out.beginObject();
            for (Map.Entry<K, V> entry : map.entrySet()) {
                out.name(entry.getKey().name());
                valueAdapter.write(out, entry.getValue());
            }
            out.endObject();
        }

        @Override
        public EnumMap<K, V> read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            EnumMap<K, V> map = new EnumMap<>(keyType);
            in.beginObject();
            while (in.hasNext()) {
                map.put(Enum.valueOf(keyType, in.nextName()), valueAdapter.read(in));
            }
            in.endObject();
            return map;
        }
    }
}
