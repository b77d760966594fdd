package pokeai.engine.error;

public class StateInvariantViolationException extends BattleException {

    public StateInvariantViolationException(String message) {
        super(ErrorKind.STATE_INVARIANT_VIOLATION, message);
    }
}
