package pokeai.engine.error;

public class UnsupportedFormatException extends BattleException {

    public UnsupportedFormatException(String message) {
        super(ErrorKind.UNSUPPORTED_FORMAT, message);
    }
}
