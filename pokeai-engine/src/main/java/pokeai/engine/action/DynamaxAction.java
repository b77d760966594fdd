package pokeai.engine.action;

/**
 * Dynamax, then use the max version of a move.
 */
public final class DynamaxAction extends MoveBasedAction {

    DynamaxAction(String moveId) {
        super(moveId);
    }

    @Override
    public <R> R accept(ActionVisitor<R> visitor) {
        return visitor.visitDynamax(this);
    }

    @Override
    protected String verb() {
        return "dynamax";
    }
}
