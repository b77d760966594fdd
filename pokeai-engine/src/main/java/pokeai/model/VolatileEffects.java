package pokeai.model;

import pokeai.data.VolatileKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Ordered map of active volatile effects on one Pokemon. Insertion order is the order in
 * which end-of-turn processing visits them.
 */
public class VolatileEffects {
    private LinkedHashMap<VolatileKind, VolatileState> active = new LinkedHashMap<>();

    public VolatileEffects copy() {
        VolatileEffects copy = new VolatileEffects();
        for (VolatileState state : active.values()) {
            copy.active.put(state.getKind(), state.copy());
        }
        return copy;
    }

    public boolean has(VolatileKind kind) {
        return active.containsKey(kind);
    }

    public VolatileState get(VolatileKind kind) {
        return active.get(kind);
    }

    /** Adds the effect with its default duration; returns false if it was already active. */
    public boolean add(VolatileKind kind) {
        return add(new VolatileState(kind, kind.getDefaultTurns()));
    }

    public boolean add(VolatileState state) {
        if (active.containsKey(state.getKind())) {
            return false;
        }
        active.put(state.getKind(), state);
        return true;
    }

    public void put(VolatileState state) {
        active.put(state.getKind(), state);
    }

    public VolatileState remove(VolatileKind kind) {
        return active.remove(kind);
    }

    public void clear() {
        active.clear();
    }

    /** Counts every countdown down by one turn and removes the ones that reach zero. */
    public List<VolatileKind> decay() {
        List<VolatileKind> expired = new ArrayList<>();
        Iterator<VolatileState> it = active.values().iterator();
        while (it.hasNext()) {
            VolatileState state = it.next();
            if (state.tick()) {
                expired.add(state.getKind());
                it.remove();
            }
        }
        return expired;
    }

    public Collection<VolatileState> all() {
        return active.values();
    }

    public boolean isEmpty() {
        return active.isEmpty();
    }

    @Override
    public String toString() {
        return active.values().toString();
    }
}
