package confetti.lang;

import java.util.List;
import java.util.Optional;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * A scalar field stored as the first argument of a child directive:
 * {@code port 8080;}.
 */
@RequiredArgsConstructor
final class ScalarBinding implements FieldBinding {

    private final @NonNull String name;
    private final @NonNull ValueConverter<Object> converter;
    private final boolean optional;

    @Override
    public String name() {
        return name;
    }

    @Override
    public Object read(Directive owner, ConfMapper mapper) {
        var argument = owner.child(name).flatMap(child -> child.argument(0));
        if (argument.isEmpty()) {
            if (optional) {
                return Optional.empty();
            }
            throw new MissingFieldException(name);
        }
        var value = FieldBinding.convert(name, converter, argument.get().value());
        return optional ? Optional.of(value) : value;
    }

    @Override
    public void write(Object value, List<Argument> arguments, List<Directive> children, ConfMapper mapper) {
        var actual = FieldBinding.unwrap(name, optional, value);
        if (actual == null) {
            return;
        }
        var argument = FieldBinding.render(converter, actual);
        children.add(new Directive(Argument.bare(name), List.of(argument), false, List.of()));
    }
}
