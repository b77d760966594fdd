package pokeai.model;

import com.google.common.collect.ImmutableList;
import pokeai.data.Nature;
import pokeai.data.PokemonType;
import pokeai.data.Stat;
import pokeai.data.StatusCondition;
import pokeai.data.VolatileKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A battler. Mutable only through the turn resolution engine, which always works on a copy.
 */
public class Pokemon {
    private String species;
    private String name;
    private int level = 100;
    private int hp;
    private int maxHp;
    private EnumMap<Stat, Integer> stats = new EnumMap<>(Stat.class);
    private EnumMap<Stat, Integer> evs = new EnumMap<>(Stat.class);
    private EnumMap<Stat, Integer> ivs = new EnumMap<>(Stat.class);
    private Nature nature;
    private List<PokemonType> types = new ArrayList<>();
    private StatusCondition status = StatusCondition.NONE;
    private int sleepTurns;
    private int toxicCounter;
    /** Sleep came from Rest, which the sleep clause ignores. */
    private boolean selfInflictedSleep;
    private StatBoosts boosts = new StatBoosts();
    private String item;
    private String ability;
    private List<MoveSlot> moves = new ArrayList<>();
    private TeraState tera = TeraState.none();
    private boolean terastallized;
    private boolean megaEvolved;
    private VolatileEffects volatiles = new VolatileEffects();
    private String lastMove;
    private boolean revealed;

    private Pokemon() {
    }

    public Pokemon(String species, int level, int maxHp, List<PokemonType> types) {
        this.species = species;
        this.name = species;
        this.level = level;
        this.maxHp = maxHp;
        this.hp = maxHp;
        this.types = new ArrayList<>(types);
        this.stats.put(Stat.HP, maxHp);
    }

    public Pokemon copy() {
        Pokemon copy = new Pokemon();
        copy.species = species;
        copy.name = name;
        copy.level = level;
        copy.hp = hp;
        copy.maxHp = maxHp;
        copy.stats = new EnumMap<>(Stat.class);
        copy.stats.putAll(stats);
        copy.evs = new EnumMap<>(Stat.class);
        copy.evs.putAll(evs);
        copy.ivs = new EnumMap<>(Stat.class);
        copy.ivs.putAll(ivs);
        copy.nature = nature;
        copy.types = new ArrayList<>(types);
        copy.status = status;
        copy.sleepTurns = sleepTurns;
        copy.toxicCounter = toxicCounter;
        copy.selfInflictedSleep = selfInflictedSleep;
        copy.boosts = boosts.copy();
        copy.item = item;
        copy.ability = ability;
        copy.moves = new ArrayList<>();
        for (MoveSlot slot : moves) {
            copy.moves.add(slot.copy());
        }
        copy.tera = tera.copy();
        copy.terastallized = terastallized;
        copy.megaEvolved = megaEvolved;
        copy.volatiles = volatiles.copy();
        copy.lastMove = lastMove;
        copy.revealed = revealed;
        return copy;
    }

    public String getSpecies() {
        return species;
    }

    public void setSpecies(String species) {
        this.species = species;
    }

    public String getName() {
        return name == null ? species : name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getLevel() {
        return level;
    }

    public int getHp() {
        return hp;
    }

    public void setHp(int hp) {
        this.hp = hp;
    }

    public int getMaxHp() {
        return maxHp;
    }

    public void setMaxHp(int maxHp) {
        this.maxHp = maxHp;
        this.stats.put(Stat.HP, maxHp);
    }

    public double getHpFraction() {
        return maxHp <= 0 ? 0 : (double) hp / maxHp;
    }

    public boolean isFullHp() {
        return hp == maxHp;
    }

    public boolean isFainted() {
        return hp <= 0 || status == StatusCondition.FAINTED;
    }

    /** Raw stat before boosts; HP returns max HP. */
    public int getStat(Stat stat) {
        if (stat == Stat.HP) {
            return maxHp;
        }
        Integer value = stats.get(stat);
        return value == null ? 0 : value;
    }

    public void setStat(Stat stat, int value) {
        if (stat == Stat.HP) {
            setMaxHp(value);
        } else {
            stats.put(stat, value);
        }
    }

    public int getEv(Stat stat) {
        Integer ev = evs.get(stat);
        return ev == null ? 0 : ev;
    }

    public int getIv(Stat stat) {
        Integer iv = ivs.get(stat);
        return iv == null ? 31 : iv;
    }

    public void setSpread(Map<Stat, Integer> evs, Map<Stat, Integer> ivs, Nature nature) {
        this.evs.clear();
        this.evs.putAll(evs);
        this.ivs.clear();
        this.ivs.putAll(ivs);
        this.nature = nature;
    }

    public Nature getNature() {
        return nature == null ? Nature.SERIOUS : nature;
    }

    /** Types before terastallization. */
    public List<PokemonType> getOriginalTypes() {
        return ImmutableList.copyOf(types);
    }

    public void setTypes(List<PokemonType> types) {
        this.types = new ArrayList<>(types);
    }

    /** Defensive typing currently in effect. */
    public List<PokemonType> getTypes() {
        if (terastallized && tera.getType() != null) {
            return ImmutableList.of(tera.getType());
        }
        return ImmutableList.copyOf(types);
    }

    public boolean hasType(PokemonType type) {
        return getTypes().contains(type);
    }

    public StatusCondition getStatus() {
        return status;
    }

    public void setStatus(StatusCondition status) {
        this.status = status == null ? StatusCondition.NONE : status;
        if (this.status != StatusCondition.SLEEP) {
            sleepTurns = 0;
            selfInflictedSleep = false;
        }
        if (this.status != StatusCondition.TOXIC) {
            toxicCounter = 0;
        }
    }

    public int getSleepTurns() {
        return sleepTurns;
    }

    public void setSleepTurns(int sleepTurns) {
        this.sleepTurns = sleepTurns;
    }

    public int getToxicCounter() {
        return toxicCounter;
    }

    public void setToxicCounter(int toxicCounter) {
        this.toxicCounter = toxicCounter;
    }

    public boolean isSelfInflictedSleep() {
        return selfInflictedSleep;
    }

    public void setSelfInflictedSleep(boolean selfInflictedSleep) {
        this.selfInflictedSleep = selfInflictedSleep;
    }

    public StatBoosts getBoosts() {
        return boosts;
    }

    public String getItem() {
        return item;
    }

    public void setItem(String item) {
        this.item = item;
    }

    public String getAbility() {
        return ability;
    }

    public void setAbility(String ability) {
        this.ability = ability;
    }

    public List<MoveSlot> getMoves() {
        return moves;
    }

    public void addMove(MoveSlot slot) {
        if (moves.size() >= 4) {
            throw new IllegalStateException(getName() + " already knows four moves");
        }
        moves.add(slot);
    }

    public MoveSlot findMove(String moveId) {
        for (MoveSlot slot : moves) {
            if (slot.getMoveId().equals(moveId)) {
                return slot;
            }
        }
        return null;
    }

    public boolean hasUsableMove() {
        for (MoveSlot slot : moves) {
            if (slot.hasPp()) {
                return true;
            }
        }
        return false;
    }

    public TeraState getTera() {
        return tera;
    }

    public void setTera(TeraState tera) {
        this.tera = tera;
    }

    public boolean isTerastallized() {
        return terastallized;
    }

    public void terastallize() {
        tera.consume();
        terastallized = true;
    }

    public boolean isMegaEvolved() {
        return megaEvolved;
    }

    public void setMegaEvolved(boolean megaEvolved) {
        this.megaEvolved = megaEvolved;
    }

    public boolean isDynamaxed() {
        return volatiles.has(VolatileKind.DYNAMAX);
    }

    public VolatileEffects getVolatiles() {
        return volatiles;
    }

    public String getLastMove() {
        return lastMove;
    }

    public void setLastMove(String lastMove) {
        this.lastMove = lastMove;
    }

    public boolean isRevealed() {
        return revealed;
    }

    public void setRevealed(boolean revealed) {
        this.revealed = revealed;
    }

    @Override
    public String toString() {
        return getName() + " " + hp + "/" + maxHp + (status != StatusCondition.NONE ? " " + status : "");
    }
}
