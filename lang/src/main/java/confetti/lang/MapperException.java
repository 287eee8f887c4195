package confetti.lang;

/**
 * Failure while converting between directives and typed values.
 */
public class MapperException extends ConfettiException {

    public MapperException(String message) {
        super(message);
    }

    public MapperException(String message, Throwable cause) {
        super(message, cause);
    }
}
