package pokeai.engine.error;

public class InvalidActionException extends BattleException {

    public InvalidActionException(String message) {
        super(ErrorKind.INVALID_ACTION, message);
    }
}
