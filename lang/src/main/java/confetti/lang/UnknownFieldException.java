package confetti.lang;

import lombok.Getter;

/**
 * Raised for an unrecognized child directive, in strict mode only.
 */
public class UnknownFieldException extends MapperException {

    @Getter
    private final String field;

    public UnknownFieldException(String field, String owner) {
        super("Unknown field '" + field + "' in " + owner);
        this.field = field;
    }
}
