package confetti.lang;

import lombok.Getter;

/**
 * Nesting depth, directive count or argument count went over the configured
 * {@link ParserOptions} limit.
 */
@Getter
public class ResourceLimitExceededException extends ParserException {

    private final String limit;
    private final int maximum;

    ResourceLimitExceededException(Token token, String limit, int maximum) {
        super(token, "Maximum " + limit + " of " + maximum + " exceeded");
        this.limit = limit;
        this.maximum = maximum;
    }
}
