package pokeai.engine.action;

/**
 * A candidate action and, when it cannot be chosen, the reason why.
 */
public class LegalAction {
    private final BattleAction action;
    private final boolean disabled;
    private final String reason;

    private LegalAction(BattleAction action, boolean disabled, String reason) {
        this.action = action;
        this.disabled = disabled;
        this.reason = reason;
    }

    public static LegalAction enabled(BattleAction action) {
        return new LegalAction(action, false, null);
    }

    public static LegalAction disabled(BattleAction action, String reason) {
        return new LegalAction(action, true, reason);
    }

    public BattleAction getAction() {
        return action;
    }

    public boolean isDisabled() {
        return disabled;
    }

    public boolean isEnabled() {
        return !disabled;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return disabled ? action + " (disabled: " + reason + ")" : action.toString();
    }
}
