package pokeai.data;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * Species dex entry. Mega formes carry the base species and the stone that unlocks them.
 */
public class Species {
    private String id;
    private String name;
    private List<PokemonType> types;
    private Map<Stat, Integer> baseStats;
    private List<String> abilities;
    private String baseSpecies;
    private String requiredItem;
    private double weightKg;

    public Species() {
    }

    void assignId(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name == null ? id : name;
    }

    public List<PokemonType> getTypes() {
        return types == null ? ImmutableList.of() : types;
    }

    public int getBaseStat(Stat stat) {
        Integer value = baseStats == null ? null : baseStats.get(stat);
        return value == null ? 0 : value;
    }

    public Map<Stat, Integer> getBaseStats() {
        return baseStats == null ? ImmutableMap.of() : baseStats;
    }

    public List<String> getAbilities() {
        return abilities == null ? ImmutableList.of() : abilities;
    }

    public String getBaseSpecies() {
        return baseSpecies;
    }

    public String getRequiredItem() {
        return requiredItem;
    }

    public boolean isMegaForme() {
        return baseSpecies != null && requiredItem != null;
    }

    public double getWeightKg() {
        return weightKg;
    }

    @Override
    public String toString() {
        return getName();
    }
}
