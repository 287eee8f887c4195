package confetti.lang;

import static confetti.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Recursive-descent parser from tokens to a {@link DirectiveTree}.
 *
 * <p>Each open block or expression group takes one stack frame, bounded by
 * {@link ParserOptions#getMaxDepth()}.
 */
@RequiredArgsConstructor
final class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private final @NonNull TokenStream tokens;
    private final @NonNull ParserOptions options;

    private int depth = 0;
    private int directiveCount = 0;

    DirectiveTree parse() {
        var directives = document();
        var comments = tokens.comments().stream().map(Comment::of).toList();
        log.debug("Parsed {} top-level directives ({} in total, {} comments)",
            directives.size(), directiveCount, comments.size());
        return new DirectiveTree(directives, comments);
    }

    //// grammar rules ////

    /**
     * <pre>
     * document    :: terminator* ( directive terminator* )* EOF
     * </pre>
     */
    private List<Directive> document() {
        var directives = new ArrayList<Directive>();
        skipTerminators();
        while (!isAtEnd()) {
            if (check(BRACE_RIGHT)) {
                throw error(peek(), "Unexpected '}' without an open block.");
            }
            directives.add(directive());
            skipTerminators();
        }
        return directives;
    }

    /**
     * <pre>
     * directive   :: name argument* ( block | terminator | &amp;"}" | &amp;EOF )
     * </pre>
     */
    private Directive directive() {
        if (++directiveCount > options.getMaxDirectives()) {
            throw new ResourceLimitExceededException(peek(), "directive count", options.getMaxDirectives());
        }

        var name = name();
        var arguments = new ArrayList<Argument>();
        while (isArgumentStart()) {
            if (match(COMMA)) {
                continue; // cosmetic
            }
            if (arguments.size() >= options.getMaxArguments()) {
                throw new ResourceLimitExceededException(peek(), "argument count", options.getMaxArguments());
            }
            arguments.add(argument());
        }

        if (check(BRACE_LEFT)) {
            var children = block();
            return new Directive(name, arguments, true, children);
        }
        if (!match(EOL, SEMICOLON) && !check(BRACE_RIGHT) && !isAtEnd()) {
            throw error(peek(), "Expect ';', '{' or newline after directive.");
        }
        return new Directive(name, arguments, false, List.of());
    }

    /**
     * <pre>
     * name        :: WORD | QUOTED_STRING | TRIPLE_QUOTED_STRING
     * </pre>
     */
    private Argument name() {
        if (match(WORD, QUOTED_STRING, TRIPLE_QUOTED_STRING)) {
            return toArgument(previous());
        }
        throw error(peek(), "Expect directive name.");
    }

    /**
     * <pre>
     * argument    :: WORD | QUOTED_STRING | TRIPLE_QUOTED_STRING | PUNCTUATOR | expression
     * </pre>
     */
    private Argument argument() {
        if (match(PAREN_LEFT)) {
            return expression(previous());
        }
        return toArgument(advance());
    }

    /**
     * <pre>
     * block       :: "{" terminator* ( directive terminator* )* "}"
     * </pre>
     */
    private List<Directive> block() {
        var open = advance(); // BRACE_LEFT
        enter(open);

        var children = new ArrayList<Directive>();
        skipTerminators();
        while (!check(BRACE_RIGHT)) {
            if (isAtEnd()) {
                throw error(open, "Expect '}' to close block.");
            }
            children.add(directive());
            skipTerminators();
        }
        advance(); // BRACE_RIGHT

        depth--;
        return children;
    }

    /**
     * <pre>
     * expression  :: "(" ( argument | "," | EOL )* ")"
     * </pre>
     *
     * Flattened into one argument: the inner values joined by single spaces,
     * nested groups kept in parentheses.
     */
    private Argument expression(Token open) {
        enter(open);

        var parts = new ArrayList<String>();
        while (!match(PAREN_RIGHT)) {
            if (isAtEnd()) {
                throw error(open, "Expect ')' to close expression.");
            }
            if (match(EOL, COMMA)) {
                continue;
            }
            if (match(PAREN_LEFT)) {
                parts.add("(" + expression(previous()).value() + ")");
            } else if (match(WORD, QUOTED_STRING, TRIPLE_QUOTED_STRING, PUNCTUATOR)) {
                parts.add(previous().value());
            } else {
                throw error(peek(), "Unexpected '" + peek().lexeme() + "' in expression.");
            }
        }

        depth--;
        return new Argument(String.join(" ", parts), Argument.Style.EXPRESSION);
    }

    //// utility methods ////

    private static Argument toArgument(Token token) {
        switch (token.type()) {
        case QUOTED_STRING:
            return new Argument(token.value(), Argument.Style.QUOTED);
        case TRIPLE_QUOTED_STRING:
            return new Argument(token.value(), Argument.Style.TRIPLE_QUOTED);
        case PUNCTUATOR:
            return new Argument(token.value(), Argument.Style.PUNCTUATOR);
        default:
            return new Argument(token.value(), Argument.Style.BARE);
        }
    }

    private void enter(Token open) {
        if (depth >= options.getMaxDepth()) {
            throw new ResourceLimitExceededException(open, "nesting depth", options.getMaxDepth());
        }
        depth++;
    }

    private boolean isArgumentStart() {
        var type = peek().type();
        return type == WORD
            || type == QUOTED_STRING
            || type == TRIPLE_QUOTED_STRING
            || type == PUNCTUATOR
            || type == PAREN_LEFT
            || type == COMMA;
    }

    private void skipTerminators() {
        while (match(EOL, SEMICOLON)) {
            // collapse
        }
    }

    private ParserException error(Token token, String message) {
        return new ParserException(token, message);
    }

    private boolean match(Token.Type... types) {
        for (var type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }

        return false;
    }

    private boolean check(Token.Type type) {
        return peek().type() == type;
    }

    private Token advance() {
        return tokens.advance();
    }

    private boolean isAtEnd() {
        return tokens.isAtEnd();
    }

    private Token peek() {
        return tokens.peek();
    }

    private Token previous() {
        return tokens.previous();
    }
}
