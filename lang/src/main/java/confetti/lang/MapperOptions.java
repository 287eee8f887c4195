package confetti.lang;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings for {@link ConfMapper} and {@link Serializer}.
 */
@Value
@Builder(toBuilder = true)
public class MapperOptions {

    public static final MapperOptions DEFAULT = MapperOptions.builder().build();

    /** Applied to record component names without a {@link ConfName} override. */
    @Default @NonNull NamingPolicy namingPolicy = NamingPolicy.AS_DECLARED;

    /** Written once per nesting level by the serializer. */
    @Default @NonNull String indent = "  ";

    /** Used when reading text, and by the serializer to decide what must be quoted. */
    @Default @NonNull ParserOptions parserOptions = ParserOptions.DEFAULT;

    /**
     * Fail with {@link UnknownFieldException} on child directives that match
     * no field, instead of ignoring them.
     */
    @Default boolean strict = false;
}
