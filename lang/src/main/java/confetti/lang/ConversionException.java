package confetti.lang;

import lombok.Getter;

/**
 * A textual value could not be converted to its target type.
 *
 * <p>Converters throw it without a field; the mapper rethrows it with the
 * field that was being read.
 */
public class ConversionException extends MapperException {

    @Getter
    private final String field;

    public ConversionException(String message) {
        super(message);
        this.field = null;
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
        this.field = null;
    }

    public ConversionException(String field, ConversionException cause) {
        super("Conversion error in field '" + field + "': " + cause.getMessage(), cause);
        this.field = field;
    }
}
