package confetti.lang;

import java.util.function.Function;

/**
 * Converts one argument's text to and from a value of type {@code T}.
 *
 * <p>{@link #toConfValue} must produce text that {@link #fromConfValue} reads
 * back as an equal value.
 */
public interface ValueConverter<T> {

    /**
     * @throws ConversionException if {@code text} is not a valid {@code T}
     */
    T fromConfValue(String text);

    String toConfValue(T value);

    /**
     * Whether rendered values are written as quoted strings. Text types quote
     * so that a value such as {@code "8080"} stays text; numbers and booleans
     * are written bare.
     */
    default boolean requiresQuotes() {
        return true;
    }

    static <T> ValueConverter<T> of(Function<String, T> parse, Function<T, String> render, boolean quoted) {
        return new ValueConverter<>() {
            @Override
            public T fromConfValue(String text) {
                return parse.apply(text);
            }

            @Override
            public String toConfValue(T value) {
                return render.apply(value);
            }

            @Override
            public boolean requiresQuotes() {
                return quoted;
            }
        };
    }
}
