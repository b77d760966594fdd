package pokeai.engine.action;

/**
 * Use the Z-powered version of a move.
 */
public final class ZMoveAction extends MoveBasedAction {

    ZMoveAction(String moveId) {
        super(moveId);
    }

    @Override
    public <R> R accept(ActionVisitor<R> visitor) {
        return visitor.visitZMove(this);
    }

    @Override
    protected String verb() {
        return "zmove";
    }
}
