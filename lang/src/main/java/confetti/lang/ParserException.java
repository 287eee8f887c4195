package confetti.lang;

/**
 * Structural grammar violation.
 */
public class ParserException extends LocatedException {

    ParserException(Token token, String reason) {
        this(reason, token.line(), token.column(), token.offset());
    }

    ParserException(String reason, int line, int column, int offset) {
        super(reason, line, column, offset);
    }
}
