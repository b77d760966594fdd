package pokeai.model;

import pokeai.data.HazardKind;

import java.util.EnumMap;

/**
 * Entry hazards laid on one side. Layer counts are capped per kind.
 */
public class Hazards {
    private EnumMap<HazardKind, Integer> layers = new EnumMap<>(HazardKind.class);

    public Hazards copy() {
        Hazards copy = new Hazards();
        copy.layers.putAll(layers);
        return copy;
    }

    public int layers(HazardKind kind) {
        Integer count = layers.get(kind);
        return count == null ? 0 : count;
    }

    public boolean has(HazardKind kind) {
        return layers(kind) > 0;
    }

    /** Adds a layer; returns false when the hazard is already at its maximum. */
    public boolean add(HazardKind kind) {
        int current = layers(kind);
        if (current >= kind.getMaxLayers()) {
            return false;
        }
        layers.put(kind, current + 1);
        return true;
    }

    public void set(HazardKind kind, int count) {
        if (count < 0 || count > kind.getMaxLayers()) {
            throw new IllegalArgumentException(kind + " layers out of range: " + count);
        }
        if (count == 0) {
            layers.remove(kind);
        } else {
            layers.put(kind, count);
        }
    }

    public void remove(HazardKind kind) {
        layers.remove(kind);
    }

    public boolean isEmpty() {
        return layers.isEmpty();
    }

    public void clear() {
        layers.clear();
    }

    @Override
    public String toString() {
        return layers.toString();
    }
}
