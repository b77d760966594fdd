package pokeai.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One team member as written in a team file. Names are matched loosely ("Heavy-Duty Boots" and
 * "heavydutyboots" are the same item).
 */
public class TeamSpec {
    private String species;
    private String name;
    private Integer level;
    private String item;
    private String ability;
    private List<String> moves = new ArrayList<>();
    private String teraType;
    private String nature;
    private Map<String, Integer> evs = new LinkedHashMap<>();
    private Map<String, Integer> ivs = new LinkedHashMap<>();

    public TeamSpec() {
    }

    public TeamSpec(String species, String item, String ability, List<String> moves) {
        this.species = species;
        this.item = item;
        this.ability = ability;
        this.moves = new ArrayList<>(moves);
    }

    public String getSpecies() {
        return species;
    }

    public String getName() {
        return name;
    }

    public Integer getLevel() {
        return level;
    }

    public String getItem() {
        return item;
    }

    public String getAbility() {
        return ability;
    }

    public List<String> getMoves() {
        return moves == null ? new ArrayList<>() : moves;
    }

    public String getTeraType() {
        return teraType;
    }

    public TeamSpec withTeraType(String teraType) {
        this.teraType = teraType;
        return this;
    }

    public String getNature() {
        return nature;
    }

    public TeamSpec withNature(String nature) {
        this.nature = nature;
        return this;
    }

    public Map<String, Integer> getEvs() {
        return evs == null ? new LinkedHashMap<>() : evs;
    }

    public TeamSpec withEvs(Map<String, Integer> evs) {
        this.evs = new LinkedHashMap<>(evs);
        return this;
    }

    public Map<String, Integer> getIvs() {
        return ivs == null ? new LinkedHashMap<>() : ivs;
    }
}
