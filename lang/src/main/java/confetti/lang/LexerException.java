package confetti.lang;

/**
 * Malformed token: unterminated string or comment, bad escape, forbidden or
 * unexpected character.
 */
public class LexerException extends LocatedException {

    LexerException(String reason, int line, int column, int offset) {
        super(reason, line, column, offset);
    }
}
