package pokeai.engine.action;

/**
 * No action: recharging, waiting for the opponent's replacement, or nothing else is possible.
 */
public final class PassAction extends BattleAction {
    static final PassAction INSTANCE = new PassAction();

    private PassAction() {
    }

    @Override
    public <R> R accept(ActionVisitor<R> visitor) {
        return visitor.visitPass(this);
    }

    @Override
    public String notation() {
        return "pass";
    }
}
