package confetti.lang;

import lombok.NonNull;

/**
 * A lexeme with its decoded value and source position.
 *
 * @param value the decoded text for strings, the lexeme otherwise
 * @param offset 0-based char offset of the first character
 */
public record Token(
    @NonNull Type type,
    @NonNull String lexeme,
    @NonNull String value,
    int line,
    int column,
    int offset,
    boolean hidden) {

    @Override
    public String toString() {
        var hiddenTag = hidden ? " HIDDEN" : "";
        return "(Token " + type + " \"" + escape(lexeme) + "\" " + line + ":" + column + hiddenTag + ")";
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\n", "\\n").replace("\r", "\\r");
    }

    public enum Type {
        BRACE_LEFT,
        BRACE_RIGHT,
        PAREN_LEFT,
        PAREN_RIGHT,
        COMMA,
        PUNCTUATOR,

        // arguments
        WORD,
        QUOTED_STRING,
        TRIPLE_QUOTED_STRING,

        // hidden
        COMMENT,
        LINE_CONTINUATION,

        // end-of-directive
        EOL,
        SEMICOLON,

        // end-of-file
        EOF;

        boolean isTerminator() {
            return this == EOL || this == SEMICOLON;
        }
    }
}
