package confetti.lang;

/**
 * Base class of every failure raised by the lexer, parser, mapper and serializer.
 */
public class ConfettiException extends RuntimeException {

    public ConfettiException(String message) {
        super(message);
    }

    public ConfettiException(String message, Throwable cause) {
        super(message, cause);
    }
}
