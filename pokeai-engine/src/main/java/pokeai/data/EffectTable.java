package pokeai.data;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lookup of ability and item effects keyed by (trigger phase, normalised id).
 * Adding an ability or item is a change to {@code abilities.json} / {@code items.json} only.
 */
public final class EffectTable {
    private static final String ABILITIES_RESOURCE = "/pokeai/data/abilities.json";
    private static final String ITEMS_RESOURCE = "/pokeai/data/items.json";

    private static final Type ENTRY_TYPE = new TypeToken<Map<String, List<Effect>>>() { }.getType();

    private final ImmutableTable<TriggerPhase, String, ImmutableList<Effect>> abilities;
    private final ImmutableTable<TriggerPhase, String, ImmutableList<Effect>> items;
    private final Set<String> knownAbilities;
    private final Set<String> knownItems;

    private EffectTable(Map<String, List<Effect>> abilityRows, Map<String, List<Effect>> itemRows) {
        this.abilities = index(abilityRows);
        this.items = index(itemRows);
        this.knownAbilities = normalizedKeys(abilityRows);
        this.knownItems = normalizedKeys(itemRows);
    }

    private static final class Holder {
        private static final EffectTable STANDARD = loadStandard();
    }

    /** The table shipped on the classpath. Loaded once, shared by every battle. */
    public static EffectTable standard() {
        return Holder.STANDARD;
    }

    private static EffectTable loadStandard() {
        try (InputStream abilities = DataResources.open(ABILITIES_RESOURCE);
             InputStream items = DataResources.open(ITEMS_RESOURCE)) {
            return load(abilities, items);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load effect tables", e);
        }
    }

    public static EffectTable load(InputStream abilities, InputStream items) throws IOException {
        Gson gson = new Gson();
        try (Reader abilityReader = new InputStreamReader(abilities, StandardCharsets.UTF_8);
             Reader itemReader = new InputStreamReader(items, StandardCharsets.UTF_8)) {
            Map<String, List<Effect>> abilityRows = gson.fromJson(abilityReader, ENTRY_TYPE);
            Map<String, List<Effect>> itemRows = gson.fromJson(itemReader, ENTRY_TYPE);
            return new EffectTable(abilityRows, itemRows);
        }
    }

    private static ImmutableTable<TriggerPhase, String, ImmutableList<Effect>> index(Map<String, List<Effect>> rows) {
        // group per (phase, id) first; ImmutableTable rejects duplicate cells
        ImmutableTable.Builder<TriggerPhase, String, ImmutableList<Effect>> builder = ImmutableTable.builder();
        if (rows == null) {
            return builder.build();
        }
        for (Map.Entry<String, List<Effect>> row : rows.entrySet()) {
            String id = Ids.normalize(row.getKey());
            for (TriggerPhase phase : TriggerPhase.values()) {
                ImmutableList.Builder<Effect> cell = ImmutableList.builder();
                boolean any = false;
                for (Effect effect : row.getValue()) {
                    if (effect.getTrigger() == phase) {
                        cell.add(effect);
                        any = true;
                    }
                }
                if (any) {
                    builder.put(phase, id, cell.build());
                }
            }
        }
        return builder.build();
    }

    private static Set<String> normalizedKeys(Map<String, List<Effect>> rows) {
        ImmutableSet.Builder<String> keys = ImmutableSet.builder();
        if (rows != null) {
            for (String key : rows.keySet()) {
                keys.add(Ids.normalize(key));
            }
        }
        return keys.build();
    }

    public List<Effect> abilityEffects(TriggerPhase phase, String ability) {
        return lookup(abilities, phase, ability);
    }

    public List<Effect> itemEffects(TriggerPhase phase, String item) {
        return lookup(items, phase, item);
    }

    public boolean isKnownAbility(String ability) {
        return knownAbilities.contains(Ids.normalize(ability));
    }

    public boolean isKnownItem(String item) {
        return knownItems.contains(Ids.normalize(item));
    }

    private static List<Effect> lookup(ImmutableTable<TriggerPhase, String, ImmutableList<Effect>> table,
                                       TriggerPhase phase, String id) {
        if (id == null || id.isEmpty()) {
            return ImmutableList.of();
        }
        ImmutableList<Effect> effects = table.get(phase, Ids.normalize(id));
        return effects == null ? ImmutableList.of() : effects;
    }
}
