package pokeai.engine.action;

/**
 * Mega evolve, then use a move.
 */
public final class MegaAction extends MoveBasedAction {

    MegaAction(String moveId) {
        super(moveId);
    }

    @Override
    public <R> R accept(ActionVisitor<R> visitor) {
        return visitor.visitMega(this);
    }

    @Override
    protected String verb() {
        return "mega";
    }
}
