package confetti.lang;

import lombok.NonNull;

/**
 * One decoded argument of a directive, or a directive's name.
 *
 * <p>The {@link Style} records how the value was written. It is a rendering
 * hint for the {@link Serializer} and plays no part in the value itself.
 */
public record Argument(@NonNull String value, @NonNull Style style) {

    public static Argument bare(String value) {
        return new Argument(value, Style.BARE);
    }

    public static Argument quoted(String value) {
        return new Argument(value, Style.QUOTED);
    }

    @Override
    public String toString() {
        return style == Style.BARE ? value : style + "(" + value + ")";
    }

    public enum Style {
        BARE,
        QUOTED,
        TRIPLE_QUOTED,
        EXPRESSION,
        PUNCTUATOR
    }
}
