package confetti.lang;

import java.util.ArrayList;
import java.util.List;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * A homogeneous list. Scalars are either the arguments of one child directive
 * or, when repeated, the first arguments of one child directive each; records
 * are always one child block directive each. An absent list reads as empty.
 */
@RequiredArgsConstructor
final class ListBinding implements FieldBinding {

    private final @NonNull String name;
    private final ValueConverter<Object> converter;
    private final Lazy<DirectiveMapping<Object>> mapping;
    private final boolean repeated;

    static ListBinding ofScalars(String name, ValueConverter<Object> converter, boolean repeated) {
        return new ListBinding(name, converter, null, repeated);
    }

    static ListBinding ofRecords(String name, Lazy<DirectiveMapping<Object>> mapping) {
        return new ListBinding(name, null, mapping, true);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Object read(Directive owner, ConfMapper mapper) {
        var values = new ArrayList<>();
        if (mapping != null) {
            for (var child : owner.children(name)) {
                values.add(mapping.get().fromDirective(child, mapper));
            }
        } else if (repeated) {
            for (var child : owner.children(name)) {
                var argument = child.argument(0).orElseThrow(() -> new MissingFieldException(name));
                values.add(FieldBinding.convert(name, converter, argument.value()));
            }
        } else {
            owner.child(name).ifPresent(child -> {
                for (var argument : child.arguments()) {
                    values.add(FieldBinding.convert(name, converter, argument.value()));
                }
            });
        }
        return List.copyOf(values);
    }

    @Override
    public void write(Object value, List<Argument> arguments, List<Directive> children, ConfMapper mapper) {
        var list = (List<?>) FieldBinding.unwrap(name, false, value);
        if (mapping != null) {
            for (var element : list) {
                children.add(mapping.get().toDirective(name, FieldBinding.unwrap(name, false, element), mapper));
            }
        } else if (repeated) {
            for (var element : list) {
                var argument = FieldBinding.render(converter, FieldBinding.unwrap(name, false, element));
                children.add(new Directive(Argument.bare(name), List.of(argument), false, List.of()));
            }
        } else {
            var rendered = new ArrayList<Argument>();
            for (var element : list) {
                rendered.add(FieldBinding.render(converter, FieldBinding.unwrap(name, false, element)));
            }
            children.add(new Directive(Argument.bare(name), rendered, false, List.of()));
        }
    }
}
