package confetti.lang;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.Getter;
import lombok.NonNull;

/**
 * Maps between directive trees and Java records.
 *
 * <p>A record maps to a block directive named after its type; each component
 * maps to a child directive, or to a positional argument when annotated with
 * {@link ConfArgument}. Derived mappings are cached, so one mapper may be
 * shared between threads; registration is serialized.
 *
 * <pre>{@code
 * record Config(String host, int port) {}
 *
 * var config = new ConfMapper().fromText("Config { host localhost; port 8080; }", Config.class);
 * }</pre>
 */
public final class ConfMapper {

    private static final Logger log = LoggerFactory.getLogger(ConfMapper.class);

    @Getter
    private final MapperOptions options;

    @Getter
    private volatile ValueConverters converters;

    private final Map<Class<?>, DirectiveMapping<?>> registered = new ConcurrentHashMap<>();
    private final Map<Class<?>, DirectiveMapping<?>> derived = new ConcurrentHashMap<>();

    public ConfMapper() {
        this(MapperOptions.DEFAULT);
    }

    public ConfMapper(@NonNull MapperOptions options) {
        this.options = options;
        this.converters = ValueConverters.builtIn(options.getNamingPolicy());
    }

    /**
     * Uses {@code converter} for every field of type {@code type}.
     */
    public synchronized <T> ConfMapper registerConverter(@NonNull Class<T> type, @NonNull ValueConverter<T> converter) {
        converters = converters.with(type, converter);
        derived.clear();
        return this;
    }

    /**
     * Uses {@code mapping} for {@code type}, in place of deriving one from
     * its record components.
     */
    public synchronized <T> ConfMapper register(@NonNull Class<T> type, @NonNull DirectiveMapping<T> mapping) {
        registered.put(type, mapping);
        derived.clear();
        return this;
    }

    boolean hasMapping(Class<?> type) {
        return registered.containsKey(type);
    }

    @SuppressWarnings("unchecked")
    <T> DirectiveMapping<T> mappingFor(Class<T> type) {
        var mapping = (DirectiveMapping<T>) registered.get(type);
        if (mapping != null) {
            return mapping;
        }
        mapping = (DirectiveMapping<T>) derived.get(type);
        if (mapping == null) {
            mapping = RecordMapping.of(type, this);
            var raced = (DirectiveMapping<T>) derived.putIfAbsent(type, mapping);
            if (raced != null) {
                mapping = raced;
            } else {
                log.debug("Derived directive mapping for {}", type.getName());
            }
        }
        return mapping;
    }

    //// reading ////

    /**
     * Reads the first top-level directive named after {@code type}, or the
     * first top-level directive when none has that name.
     */
    public <T> T fromTree(@NonNull DirectiveTree tree, @NonNull Class<T> type) {
        var name = directiveName(type);
        if (tree.isEmpty()) {
            throw new MissingFieldException(name);
        }
        var directive = tree.directives().stream()
            .filter(candidate -> candidate.nameValue().equals(name))
            .findFirst()
            .orElse(tree.directives().get(0));
        return fromDirective(directive, type);
    }

    public <T> T fromDirective(@NonNull Directive directive, @NonNull Class<T> type) {
        return mappingFor(type).fromDirective(directive, this);
    }

    public <T> T fromText(@NonNull String text, @NonNull Class<T> type) {
        return fromTree(Confetti.parse(text, options.getParserOptions()), type);
    }

    //// writing ////

    @SuppressWarnings("unchecked")
    public <T> Directive toDirective(@NonNull T value) {
        var type = (Class<T>) value.getClass();
        return mappingFor(type).toDirective(directiveName(type), value, this);
    }

    public DirectiveTree toTree(@NonNull Object value) {
        return new DirectiveTree(List.of(toDirective(value)));
    }

    public String toText(@NonNull Object value) {
        return Confetti.serialize(toTree(value), options);
    }

    //// naming ////

    /**
     * The directive name of a type: its {@link ConfName}, or its simple name.
     */
    String directiveName(Class<?> type) {
        var override = type.getAnnotation(ConfName.class);
        return override != null ? override.value() : type.getSimpleName();
    }
}
