package pokeai.engine.action;

/**
 * Terastallize into the Pokemon's tera type, then use a move.
 */
public final class TeraAction extends MoveBasedAction {

    TeraAction(String moveId) {
        super(moveId);
    }

    @Override
    public <R> R accept(ActionVisitor<R> visitor) {
        return visitor.visitTera(this);
    }

    @Override
    protected String verb() {
        return "tera";
    }
}
