package confetti.lang;

import java.util.List;
import java.util.Optional;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * A scalar field stored as a positional argument of the record's own directive.
 */
@RequiredArgsConstructor
final class ArgumentBinding implements FieldBinding {

    private final @NonNull String name;
    @Getter
    private final int index;
    private final @NonNull ValueConverter<Object> converter;
    private final boolean optional;

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean claims(String childName) {
        return false;
    }

    @Override
    public Object read(Directive owner, ConfMapper mapper) {
        var argument = owner.argument(index);
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
        if (arguments.size() != index) {
            throw new SerializeException("Argument '" + name + "' cannot follow an absent argument");
        }
        arguments.add(FieldBinding.render(converter, actual));
    }
}
