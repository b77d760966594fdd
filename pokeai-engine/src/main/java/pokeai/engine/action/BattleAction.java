package pokeai.engine.action;

import pokeai.data.Ids;

import java.util.Locale;

/**
 * A decision one side submits for a turn. The set of variants is closed: the constructors are
 * package-private and dispatch goes through {@link ActionVisitor}.
 */
public abstract class BattleAction {

    BattleAction() {
    }

    public abstract <R> R accept(ActionVisitor<R> visitor);

    /** Text form accepted by {@link #parse(String)}, e.g. {@code "move earthquake"} or {@code "switch 2"}. */
    public abstract String notation();

    @Override
    public String toString() {
        return notation();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BattleAction && ((BattleAction) o).notation().equals(notation());
    }

    @Override
    public int hashCode() {
        return notation().hashCode();
    }

    public static MoveAction move(String moveId) {
        return new MoveAction(moveId);
    }

    public static SwitchAction switchTo(int slot) {
        return new SwitchAction(slot);
    }

    public static TeraAction tera(String moveId) {
        return new TeraAction(moveId);
    }

    public static MegaAction mega(String moveId) {
        return new MegaAction(moveId);
    }

    public static ZMoveAction zMove(String moveId) {
        return new ZMoveAction(moveId);
    }

    public static DynamaxAction dynamax(String moveId) {
        return new DynamaxAction(moveId);
    }

    public static PassAction pass() {
        return PassAction.INSTANCE;
    }

    /**
     * Parses the text form of an action. Switch slots are team indices starting at 0.
     *
     * @throws IllegalArgumentException for malformed input
     */
    public static BattleAction parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Empty action");
        }
        String[] parts = text.trim().split("\\s+", 2);
        String verb = parts[0].toLowerCase(Locale.ROOT);
        if ("pass".equals(verb)) {
            return pass();
        }
        if (parts.length < 2) {
            throw new IllegalArgumentException("Action '" + text + "' needs an argument");
        }
        String arg = parts[1].trim();
        switch (verb) {
            case "move":
                return move(Ids.normalize(arg));
            case "switch":
                try {
                    return switchTo(Integer.parseInt(arg));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Switch slot must be a number: " + arg, e);
                }
            case "tera":
                return tera(Ids.normalize(arg));
            case "mega":
                return mega(Ids.normalize(arg));
            case "zmove":
                return zMove(Ids.normalize(arg));
            case "dynamax":
                return dynamax(Ids.normalize(arg));
            default:
                throw new IllegalArgumentException("Unknown action '" + verb + "'");
        }
    }
}
