package pokeai.data;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Gen 6+ (18-type) effectiveness chart.
 * Only non-neutral entries are stored; lookups default to 1.0.
 */
public final class TypeChart {

    private static final Map<PokemonType, Map<PokemonType, Double>> CHART = new EnumMap<>(PokemonType.class);

    static {
        nve(PokemonType.NORMAL, PokemonType.ROCK, PokemonType.STEEL);
        imm(PokemonType.NORMAL, PokemonType.GHOST);

        se(PokemonType.FIRE, PokemonType.GRASS, PokemonType.ICE, PokemonType.BUG, PokemonType.STEEL);
        nve(PokemonType.FIRE, PokemonType.FIRE, PokemonType.WATER, PokemonType.ROCK, PokemonType.DRAGON);

        se(PokemonType.WATER, PokemonType.FIRE, PokemonType.GROUND, PokemonType.ROCK);
        nve(PokemonType.WATER, PokemonType.WATER, PokemonType.GRASS, PokemonType.DRAGON);

        se(PokemonType.ELECTRIC, PokemonType.WATER, PokemonType.FLYING);
        nve(PokemonType.ELECTRIC, PokemonType.ELECTRIC, PokemonType.GRASS, PokemonType.DRAGON);
        imm(PokemonType.ELECTRIC, PokemonType.GROUND);

        se(PokemonType.GRASS, PokemonType.WATER, PokemonType.GROUND, PokemonType.ROCK);
        nve(PokemonType.GRASS, PokemonType.FIRE, PokemonType.GRASS, PokemonType.POISON, PokemonType.FLYING,
                PokemonType.BUG, PokemonType.DRAGON, PokemonType.STEEL);

        se(PokemonType.ICE, PokemonType.GRASS, PokemonType.GROUND, PokemonType.FLYING, PokemonType.DRAGON);
        nve(PokemonType.ICE, PokemonType.FIRE, PokemonType.WATER, PokemonType.ICE, PokemonType.STEEL);

        se(PokemonType.FIGHTING, PokemonType.NORMAL, PokemonType.ICE, PokemonType.ROCK, PokemonType.DARK,
                PokemonType.STEEL);
        nve(PokemonType.FIGHTING, PokemonType.POISON, PokemonType.FLYING, PokemonType.PSYCHIC, PokemonType.BUG,
                PokemonType.FAIRY);
        imm(PokemonType.FIGHTING, PokemonType.GHOST);

        se(PokemonType.POISON, PokemonType.GRASS, PokemonType.FAIRY);
        nve(PokemonType.POISON, PokemonType.POISON, PokemonType.GROUND, PokemonType.ROCK, PokemonType.GHOST);
        imm(PokemonType.POISON, PokemonType.STEEL);

        se(PokemonType.GROUND, PokemonType.FIRE, PokemonType.ELECTRIC, PokemonType.POISON, PokemonType.ROCK,
                PokemonType.STEEL);
        nve(PokemonType.GROUND, PokemonType.GRASS, PokemonType.BUG);
        imm(PokemonType.GROUND, PokemonType.FLYING);

        se(PokemonType.FLYING, PokemonType.GRASS, PokemonType.FIGHTING, PokemonType.BUG);
        nve(PokemonType.FLYING, PokemonType.ELECTRIC, PokemonType.ROCK, PokemonType.STEEL);

        se(PokemonType.PSYCHIC, PokemonType.FIGHTING, PokemonType.POISON);
        nve(PokemonType.PSYCHIC, PokemonType.PSYCHIC, PokemonType.STEEL);
        imm(PokemonType.PSYCHIC, PokemonType.DARK);

        se(PokemonType.BUG, PokemonType.GRASS, PokemonType.PSYCHIC, PokemonType.DARK);
        nve(PokemonType.BUG, PokemonType.FIRE, PokemonType.FIGHTING, PokemonType.POISON, PokemonType.FLYING,
                PokemonType.GHOST, PokemonType.STEEL, PokemonType.FAIRY);

        se(PokemonType.ROCK, PokemonType.FIRE, PokemonType.ICE, PokemonType.FLYING, PokemonType.BUG);
        nve(PokemonType.ROCK, PokemonType.FIGHTING, PokemonType.GROUND, PokemonType.STEEL);

        se(PokemonType.GHOST, PokemonType.PSYCHIC, PokemonType.GHOST);
        nve(PokemonType.GHOST, PokemonType.DARK);
        imm(PokemonType.GHOST, PokemonType.NORMAL);

        se(PokemonType.DRAGON, PokemonType.DRAGON);
        nve(PokemonType.DRAGON, PokemonType.STEEL);
        imm(PokemonType.DRAGON, PokemonType.FAIRY);

        se(PokemonType.DARK, PokemonType.PSYCHIC, PokemonType.GHOST);
        nve(PokemonType.DARK, PokemonType.FIGHTING, PokemonType.DARK, PokemonType.FAIRY);

        se(PokemonType.STEEL, PokemonType.ICE, PokemonType.ROCK, PokemonType.FAIRY);
        nve(PokemonType.STEEL, PokemonType.FIRE, PokemonType.WATER, PokemonType.ELECTRIC, PokemonType.STEEL);

        se(PokemonType.FAIRY, PokemonType.FIGHTING, PokemonType.DRAGON, PokemonType.DARK);
        nve(PokemonType.FAIRY, PokemonType.FIRE, PokemonType.POISON, PokemonType.STEEL);
    }

    private TypeChart() {}

    private static void put(PokemonType attacker, double value, PokemonType... defenders) {
        Map<PokemonType, Double> row = CHART.computeIfAbsent(attacker, k -> new EnumMap<>(PokemonType.class));
        for (PokemonType defender : defenders) {
            row.put(defender, value);
        }
    }

    private static void se(PokemonType attacker, PokemonType... defenders) {
        put(attacker, 2.0, defenders);
    }

    private static void nve(PokemonType attacker, PokemonType... defenders) {
        put(attacker, 0.5, defenders);
    }

    private static void imm(PokemonType attacker, PokemonType... defenders) {
        put(attacker, 0.0, defenders);
    }

    /**
     * Multiplier of a single attacking type against a single defending type.
     */
    public static double effectiveness(PokemonType attacker, PokemonType defender) {
        if (attacker == null || defender == null) {
            return 1.0;
        }
        Map<PokemonType, Double> row = CHART.get(attacker);
        if (row == null) {
            return 1.0;
        }
        Double value = row.get(defender);
        return value == null ? 1.0 : value;
    }

    /**
     * Combined multiplier against every defending type: one of 0, 0.25, 0.5, 1, 2 or 4.
     */
    public static double effectiveness(PokemonType attacker, Collection<PokemonType> defenders) {
        double result = 1.0;
        for (PokemonType defender : defenders) {
            result *= effectiveness(attacker, defender);
        }
        return result;
    }
}
