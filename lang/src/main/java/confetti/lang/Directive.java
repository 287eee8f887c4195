package confetti.lang;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.NonNull;

/**
 * A named configuration entry: ordered arguments and, if it opened a block,
 * ordered children.
 *
 * <p>{@code block} distinguishes {@code name {}} from {@code name;}. A
 * directive without a block never has children.
 */
public record Directive(
    @NonNull Argument name,
    @NonNull List<Argument> arguments,
    boolean block,
    @NonNull List<Directive> children) {

    public Directive {
        arguments = List.copyOf(arguments);
        children = List.copyOf(children);
        if (!block && !children.isEmpty()) {
            throw new IllegalArgumentException("directive without a block cannot have children: " + name.value());
        }
    }

    public static Directive of(String name, String... arguments) {
        var args = new ArrayList<Argument>();
        for (var argument : arguments) {
            args.add(Argument.bare(argument));
        }
        return new Directive(Argument.bare(name), args, false, List.of());
    }

    public static Directive block(String name, List<Argument> arguments, List<Directive> children) {
        return new Directive(Argument.bare(name), arguments, true, children);
    }

    public String nameValue() {
        return name.value();
    }

    public Optional<Argument> argument(int index) {
        return index < arguments.size() ? Optional.of(arguments.get(index)) : Optional.empty();
    }

    public List<String> argumentValues() {
        return arguments.stream().map(Argument::value).collect(Collectors.toUnmodifiableList());
    }

    /**
     * The first child with the given name.
     */
    public Optional<Directive> child(String name) {
        return children.stream().filter(child -> child.nameValue().equals(name)).findFirst();
    }

    public List<Directive> children(String name) {
        return children.stream()
            .filter(child -> child.nameValue().equals(name))
            .collect(Collectors.toUnmodifiableList());
    }
}
