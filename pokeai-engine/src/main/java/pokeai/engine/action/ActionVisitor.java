package pokeai.engine.action;

/**
 * One handler per action variant. Every component that dispatches on actions implements this,
 * so a new variant does not compile until each of them handles it.
 */
public interface ActionVisitor<R> {

    R visitMove(MoveAction action);

    R visitSwitch(SwitchAction action);

    R visitTera(TeraAction action);

    R visitMega(MegaAction action);

    R visitZMove(ZMoveAction action);

    R visitDynamax(DynamaxAction action);

    R visitPass(PassAction action);
}
