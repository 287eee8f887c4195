package confetti.lang;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import lombok.NonNull;

/**
 * Registry of {@link ValueConverter}s by target class, with the built-in
 * scalar types registered up front and enums handled by constant name.
 */
public final class ValueConverters {

    private final Map<Class<?>, ValueConverter<?>> converters;
    private final NamingPolicy namingPolicy;

    private ValueConverters(Map<Class<?>, ValueConverter<?>> converters, NamingPolicy namingPolicy) {
        this.converters = converters;
        this.namingPolicy = namingPolicy;
    }

    public static ValueConverters builtIn() {
        return builtIn(NamingPolicy.AS_DECLARED);
    }

    /**
     * @param namingPolicy also accepted, and used for rendering, when converting enum constants
     */
    public static ValueConverters builtIn(@NonNull NamingPolicy namingPolicy) {
        var map = new HashMap<Class<?>, ValueConverter<?>>();

        map.put(String.class, ValueConverter.of(Function.identity(), Function.identity(), true));
        var character = ValueConverter.of(ValueConverters::parseChar, String::valueOf, true);
        map.put(Character.class, character);
        map.put(char.class, character);

        var bool = ValueConverter.of(ValueConverters::parseBoolean, String::valueOf, false);
        map.put(Boolean.class, bool);
        map.put(boolean.class, bool);

        numeric(map, Integer.class, int.class, Integer::valueOf, "integer");
        numeric(map, Long.class, long.class, Long::valueOf, "long");
        numeric(map, Short.class, short.class, Short::valueOf, "short");
        numeric(map, Byte.class, byte.class, Byte::valueOf, "byte");
        numeric(map, Double.class, double.class, Double::valueOf, "double");
        numeric(map, Float.class, float.class, Float::valueOf, "float");
        map.put(BigInteger.class, number(BigInteger::new, "integer"));
        map.put(BigDecimal.class, number(BigDecimal::new, "decimal"));

        return new ValueConverters(map, namingPolicy);
    }

    /**
     * A copy of this registry with {@code converter} registered for {@code type}.
     */
    public <T> ValueConverters with(@NonNull Class<T> type, @NonNull ValueConverter<T> converter) {
        var map = new HashMap<>(converters);
        map.put(type, converter);
        return new ValueConverters(map, namingPolicy);
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<ValueConverter<T>> find(@NonNull Class<T> type) {
        var converter = (ValueConverter<T>) converters.get(type);
        if (converter == null && type.isEnum()) {
            converter = (ValueConverter<T>) enumConverter(type);
        }
        return Optional.ofNullable(converter);
    }

    public boolean supports(Class<?> type) {
        return converters.containsKey(type) || type.isEnum();
    }

    //// built-ins ////

    private static <T> void numeric(
            Map<Class<?>, ValueConverter<?>> map, Class<T> boxed, Class<?> primitive,
            Function<String, T> parse, String typeName) {
        var converter = number(parse, typeName);
        map.put(boxed, converter);
        map.put(primitive, converter);
    }

    private static <T> ValueConverter<T> number(Function<String, T> parse, String typeName) {
        return ValueConverter.of(text -> {
            try {
                return parse.apply(text.trim());
            } catch (NumberFormatException ex) {
                throw new ConversionException("Cannot convert '" + text + "' to " + typeName, ex);
            }
        }, String::valueOf, false);
    }

    private static Boolean parseBoolean(String text) {
        switch (text.trim().toLowerCase(Locale.ROOT)) {
        case "true":
        case "yes":
        case "on":
        case "1":
            return true;
        case "false":
        case "no":
        case "off":
        case "0":
            return false;
        default:
            throw new ConversionException("Cannot convert '" + text + "' to boolean");
        }
    }

    private static Character parseChar(String text) {
        if (text.length() != 1) {
            throw new ConversionException("Cannot convert '" + text + "' to a single character");
        }
        return text.charAt(0);
    }

    private ValueConverter<Enum<?>> enumConverter(Class<?> type) {
        var constants = (Enum<?>[]) type.getEnumConstants();
        return ValueConverter.of(text -> {
            for (var constant : constants) {
                if (constant.name().equalsIgnoreCase(text) || enumName(constant).equals(text)) {
                    return constant;
                }
            }
            throw new ConversionException("Cannot convert '" + text + "' to " + type.getSimpleName());
        }, this::enumName, false);
    }

    private String enumName(Enum<?> constant) {
        if (namingPolicy == NamingPolicy.AS_DECLARED) {
            return constant.name();
        }
        return namingPolicy.apply(constant.name().toLowerCase(Locale.ROOT).replace('_', '-'));
    }
}
