package confetti.lang;

import lombok.NonNull;

/**
 * A comment kept from the source, including its delimiters.
 */
public record Comment(@NonNull String text, int line, int column, boolean multiLine) {

    static Comment of(Token token) {
        return new Comment(token.lexeme(), token.line(), token.column(), token.lexeme().startsWith("/*"));
    }
}
