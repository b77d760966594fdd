package pokeai.engine.turn;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Sorts the queued actions of a turn. Exact ties are settled by the random draw taken when each
 * action was queued, never by which side submitted first.
 */
public final class ActionOrdering {

    private ActionOrdering() {}

    public static List<QueuedAction> order(List<QueuedAction> queue, boolean trickRoom) {
        List<QueuedAction> sorted = new ArrayList<>(queue);
        sorted.sort(comparator(trickRoom));
        return sorted;
    }

    static Comparator<QueuedAction> comparator(boolean trickRoom) {
        return (a, b) -> {
            if (a.getBracket() != b.getBracket()) {
                return Integer.compare(a.getBracket(), b.getBracket());
            }
            if (a.getPriority() != b.getPriority()) {
                return Integer.compare(b.getPriority(), a.getPriority());
            }
            if (a.getSpeed() != b.getSpeed()) {
                return trickRoom ? Integer.compare(a.getSpeed(), b.getSpeed())
                        : Integer.compare(b.getSpeed(), a.getSpeed());
            }
            return Long.compare(a.getTieBreak(), b.getTieBreak());
        };
    }
}
