package pokeai.engine.action;

/**
 * An action that uses one of the active Pokemon's moves this turn.
 */
public abstract class MoveBasedAction extends BattleAction {
    private final String moveId;

    MoveBasedAction(String moveId) {
        if (moveId == null || moveId.isEmpty()) {
            throw new IllegalArgumentException("Move id is required");
        }
        this.moveId = moveId;
    }

    public String getMoveId() {
        return moveId;
    }

    protected abstract String verb();

    @Override
    public String notation() {
        return verb() + " " + moveId;
    }
}
