package pokeai.engine.calc;

import com.google.common.collect.ImmutableMap;
import pokeai.data.Ids;
import pokeai.data.PokemonType;

import java.util.HashMap;
import java.util.Map;

/**
 * Fixed belief table keyed by species, e.g. loaded from a JSON file by the CLI.
 */
public final class StaticOpponentBelief implements OpponentBelief {
    private final ImmutableMap<String, String> items;
    private final ImmutableMap<String, PokemonType> teraTypes;

    public StaticOpponentBelief(Map<String, String> items, Map<String, PokemonType> teraTypes) {
        this.items = normalizeKeys(items);
        this.teraTypes = normalizeKeys(teraTypes);
    }

    private static <V> ImmutableMap<String, V> normalizeKeys(Map<String, V> source) {
        Map<String, V> normalized = new HashMap<>();
        if (source != null) {
            for (Map.Entry<String, V> e : source.entrySet()) {
                if (e.getValue() != null) {
                    normalized.put(Ids.normalize(e.getKey()), e.getValue());
                }
            }
        }
        return ImmutableMap.copyOf(normalized);
    }

    @Override
    public String likelyItem(String species) {
        return items.get(Ids.normalize(species));
    }

    @Override
    public PokemonType likelyTeraType(String species) {
        return teraTypes.get(Ids.normalize(species));
    }
}
