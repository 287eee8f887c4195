package confetti.lang;

import java.util.List;

import lombok.NonNull;

/**
 * A parsed document: the top-level directives in source order, plus the
 * comments that were skipped while parsing them.
 *
 * <p>Immutable and free of references to the source text, so it can be kept,
 * copied or shared between threads independently of the parse.
 */
public record DirectiveTree(@NonNull List<Directive> directives, @NonNull List<Comment> comments) {

    public DirectiveTree {
        directives = List.copyOf(directives);
        comments = List.copyOf(comments);
    }

    public DirectiveTree(List<Directive> directives) {
        this(directives, List.of());
    }

    public static DirectiveTree empty() {
        return new DirectiveTree(List.of(), List.of());
    }

    public boolean isEmpty() {
        return directives.isEmpty();
    }

    /**
     * The document as the implicit unnamed directive whose block holds the
     * top-level directives.
     */
    public Directive root() {
        return new Directive(Argument.bare(""), List.of(), true, directives);
    }
}
