package confetti.lang;

import lombok.Getter;

/**
 * A failure tied to a position in the source text.
 */
@Getter
public abstract class LocatedException extends ConfettiException {

    private final String reason;
    private final int line;
    private final int column;
    private final int offset;

    protected LocatedException(String reason, int line, int column, int offset) {
        super(reason + " [line " + line + ", col " + column + "]");
        this.reason = reason;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }
}
