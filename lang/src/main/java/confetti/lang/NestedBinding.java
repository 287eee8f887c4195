package confetti.lang;

import java.util.List;
import java.util.Optional;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * A nested record stored as a child block directive.
 */
@RequiredArgsConstructor
final class NestedBinding implements FieldBinding {

    private final @NonNull String name;
    private final @NonNull Lazy<DirectiveMapping<Object>> mapping;
    private final boolean optional;

    @Override
    public String name() {
        return name;
    }

    @Override
    public Object read(Directive owner, ConfMapper mapper) {
        var child = owner.child(name);
        if (child.isEmpty()) {
            if (optional) {
                return Optional.empty();
            }
            throw new MissingFieldException(name);
        }
        var value = mapping.get().fromDirective(child.get(), mapper);
        return optional ? Optional.of(value) : value;
    }

    @Override
    public void write(Object value, List<Argument> arguments, List<Directive> children, ConfMapper mapper) {
        var actual = FieldBinding.unwrap(name, optional, value);
        if (actual != null) {
            children.add(mapping.get().toDirective(name, actual, mapper));
        }
    }
}
