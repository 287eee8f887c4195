package confetti.lang;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Renders directives back to text that the {@link Parser} reads as the same tree.
 *
 * <p>Whether a value can be written bare is decided with the scanner's own
 * character classes, so quoting stays in step with tokenization.
 */
@RequiredArgsConstructor
public final class Serializer {

    private final @NonNull MapperOptions options;

    public Serializer() {
        this(MapperOptions.DEFAULT);
    }

    public String serialize(DirectiveTree tree) {
        var out = new StringBuilder();
        for (var directive : tree.directives()) {
            write(directive, out, 0);
        }
        return out.toString();
    }

    public String serialize(Directive directive) {
        var out = new StringBuilder();
        write(directive, out, 0);
        return out.toString();
    }

    private void write(Directive directive, StringBuilder out, int depth) {
        var indent = indent(depth);
        out.append(indent).append(renderName(directive.name()));
        for (var argument : directive.arguments()) {
            out.append(' ').append(render(argument));
        }

        if (!directive.block()) {
            out.append(";\n");
            return;
        }
        out.append(" {\n");
        for (var child : directive.children()) {
            write(child, out, depth + 1);
        }
        out.append(indent).append("}\n");
    }

    private String indent(int depth) {
        var unit = options.getIndent();
        for (var i = 0; i < unit.length(); i++) {
            if (!Scanner.isBlank(unit.charAt(i))) {
                throw new SerializeException("Indent must consist of blanks: \"" + unit + "\"");
            }
        }
        return unit.repeat(depth);
    }

    private String renderName(Argument name) {
        switch (name.style()) {
        case QUOTED:
        case TRIPLE_QUOTED:
            return render(name);
        default:
            return renderBare(name.value());
        }
    }

    String render(Argument argument) {
        var parserOptions = options.getParserOptions();
        var value = argument.value();
        switch (argument.style()) {
        case QUOTED:
            return quote(value);
        case TRIPLE_QUOTED:
            return parserOptions.isAllowTripleQuotes() ? tripleQuote(value) : quote(value);
        case EXPRESSION:
            if (parserOptions.isAllowExpressionArguments() && isCanonicalExpression(value, parserOptions)) {
                return "(" + value + ")";
            }
            return quote(value);
        case PUNCTUATOR:
            if (value.length() == 1 && isStandalonePunctuator(value.charAt(0), parserOptions)) {
                return value;
            }
            return renderBare(value);
        default:
            return renderBare(value);
        }
    }

    private String renderBare(String value) {
        return requiresQuotes(value, options.getParserOptions()) ? quote(value) : value;
    }

    //// quoting ////

    /**
     * Whether {@code value} would not read back as one word with the same text.
     */
    public static boolean requiresQuotes(String value, ParserOptions options) {
        if (value.isEmpty() || value.startsWith("//") || value.startsWith("/*")) {
            return true;
        }
        for (var i = 0; i < value.length(); i++) {
            var c = value.charAt(i);
            if (!Scanner.isWordChar(c, options) || c == ',') {
                return true;
            }
        }
        return value.codePoints().anyMatch(Serializer::needsEscape);
    }

    public static String quote(String value) {
        var out = new StringBuilder(value.length() + 2);
        out.append('"');
        appendEscaped(value, out, false);
        out.append('"');
        return out.toString();
    }

    static String tripleQuote(String value) {
        var out = new StringBuilder(value.length() + 6);
        out.append("\"\"\"");
        appendEscaped(value, out, true);
        out.append("\"\"\"");
        return out.toString();
    }

    private static void appendEscaped(String value, StringBuilder out, boolean keepNewlines) {
        value.codePoints().forEach(codePoint -> {
            switch (codePoint) {
            case '"':
                out.append("\\\"");
                return;
            case '\\':
                out.append("\\\\");
                return;
            case '\t':
                out.append("\\t");
                return;
            case '\b':
                out.append("\\b");
                return;
            case '\0':
                out.append("\\0");
                return;
            default:
                break;
            }
            if (codePoint < Character.MIN_SUPPLEMENTARY_CODE_POINT && Scanner.isLineTerminator((char) codePoint)) {
                if (keepNewlines) {
                    out.appendCodePoint(codePoint);
                } else if (codePoint == '\n') {
                    out.append("\\n");
                } else if (codePoint == '\r') {
                    out.append("\\r");
                } else if (codePoint == '\f') {
                    out.append("\\f");
                } else {
                    appendUnicodeEscape(codePoint, out);
                }
            } else if (needsEscape(codePoint)) {
                appendUnicodeEscape(codePoint, out);
            } else {
                out.appendCodePoint(codePoint);
            }
        });
    }

    private static void appendUnicodeEscape(int codePoint, StringBuilder out) {
        for (var c : Character.toChars(codePoint)) {
            out.append(String.format("\\u%04X", (int) c));
        }
    }

    private static boolean needsEscape(int codePoint) {
        return Scanner.isForbidden(codePoint, true);
    }

    private static boolean isStandalonePunctuator(char c, ParserOptions options) {
        return options.isPunctuator(c)
            && !Scanner.isBlank(c)
            && !Scanner.isLineTerminator(c)
            && "{};\"#\\".indexOf(c) < 0
            && !(c == ',' && options.isAllowCommaSeparators())
            && !((c == '(' || c == ')') && options.isAllowExpressionArguments());
    }

    /**
     * Whether writing {@code value} in parentheses reads back as the same
     * flattened expression: single spaces between items, balanced groups, and
     * only plain words inside.
     */
    static boolean isCanonicalExpression(String value, ParserOptions options) {
        if (value.startsWith(" ") || value.endsWith(" ") || value.contains("  ")) {
            return false;
        }
        var depth = 0;
        var word = new StringBuilder();
        for (var i = 0; i < value.length(); i++) {
            var c = value.charAt(i);
            var previous = i > 0 ? value.charAt(i - 1) : '(';
            var next = i + 1 < value.length() ? value.charAt(i + 1) : ')';
            if (c == '(' || c == ')' || c == ' ') {
                if (word.length() > 0 && requiresQuotes(word.toString(), options)) {
                    return false;
                }
                word.setLength(0);
            }
            if (c == '(') {
                if (previous != ' ' && previous != '(') {
                    return false;
                }
                depth++;
            } else if (c == ')') {
                if ((next != ' ' && next != ')') || --depth < 0) {
                    return false;
                }
            } else if (c != ' ') {
                word.append(c);
            }
        }
        return depth == 0 && (word.length() == 0 || !requiresQuotes(word.toString(), options));
    }
}
