package pokeai.engine.action;

/**
 * Use a move.
 */
public final class MoveAction extends MoveBasedAction {

    MoveAction(String moveId) {
        super(moveId);
    }

    @Override
    public <R> R accept(ActionVisitor<R> visitor) {
        return visitor.visitMove(this);
    }

    @Override
    protected String verb() {
        return "move";
    }
}
