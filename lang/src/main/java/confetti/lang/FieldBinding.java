package confetti.lang;

import java.util.List;
import java.util.Optional;

/**
 * How one record component is read from, and written into, the directive of
 * its record.
 */
interface FieldBinding {

    /** The directive name of the field, as used in text and in errors. */
    String name();

    /**
     * Whether a child directive with the given name belongs to this field.
     */
    default boolean claims(String childName) {
        return name().equals(childName);
    }

    /**
     * @param owner the directive of the record that declares the field
     * @return the component value, wrapped in an {@link Optional} for optional fields
     */
    Object read(Directive owner, ConfMapper mapper);

    /**
     * Appends the representation of {@code value} to the record's directive.
     */
    void write(Object value, List<Argument> arguments, List<Directive> children, ConfMapper mapper);

    //// shared helpers ////

    /**
     * Converts {@code text}, naming {@code field} in any failure.
     */
    static <T> T convert(String field, ValueConverter<T> converter, String text) {
        try {
            return converter.fromConfValue(text);
        } catch (ConversionException ex) {
            throw new ConversionException(field, ex);
        } catch (IllegalArgumentException ex) {
            throw new ConversionException(field, new ConversionException(ex.getMessage(), ex));
        }
    }

    static <T> Argument render(ValueConverter<T> converter, T value) {
        var text = converter.toConfValue(value);
        return new Argument(text, converter.requiresQuotes() ? Argument.Style.QUOTED : Argument.Style.BARE);
    }

    /**
     * Unwraps an optional field value, failing on {@code null} in a required one.
     *
     * @return the value, or {@code null} for an empty optional
     */
    static Object unwrap(String field, boolean optional, Object value) {
        if (optional) {
            return value == null ? null : ((Optional<?>) value).orElse(null);
        }
        if (value == null) {
            throw new SerializeException("Required field '" + field + "' is null");
        }
        return value;
    }
}
