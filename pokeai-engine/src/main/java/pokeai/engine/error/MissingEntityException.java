package pokeai.engine.error;

public class MissingEntityException extends BattleException {

    public MissingEntityException(String message) {
        super(ErrorKind.MISSING_ENTITY, message);
    }
}
