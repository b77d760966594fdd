package pokeai.engine.action;

public final class SwitchAction extends BattleAction {
    private final int slot;

    SwitchAction(int slot) {
        this.slot = slot;
    }

    /** Team index of the incoming Pokemon. */
    public int getSlot() {
        return slot;
    }

    @Override
    public <R> R accept(ActionVisitor<R> visitor) {
        return visitor.visitSwitch(this);
    }

    @Override
    public String notation() {
        return "switch " + slot;
    }
}
