package confetti.lang;

public class SerializeException extends MapperException {

    public SerializeException(String message) {
        super(message);
    }
}
