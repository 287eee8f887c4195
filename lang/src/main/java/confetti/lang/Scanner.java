package confetti.lang;

import static confetti.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Turns source text into tokens on demand.
 *
 * <p>A scanner is single-use: tokens are produced front to back, and scanning
 * the same text again takes a new instance.
 */
@RequiredArgsConstructor
final class Scanner {

    private static final Set<Integer> BIDI_CONTROLS = Set.of(
        0x061C, 0x200E, 0x200F,
        0x202A, 0x202B, 0x202C, 0x202D, 0x202E,
        0x2066, 0x2067, 0x2068, 0x2069);

    private final @NonNull String source;
    private final @NonNull ParserOptions options;

    private int start = 0;
    private int current = 0;
    private int lineStart = 0;
    private int line = 1;

    private int startLine = 1;
    private int startColumn = 1;

    private Token lastVisible = null;
    private Token eof = null;

    Scanner(String source) {
        this(source, ParserOptions.DEFAULT);
    }

    List<Token> getTokens() {
        var tokens = new ArrayList<Token>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != EOF);
        return tokens;
    }

    Token nextToken() {
        if (eof != null) {
            return eof;
        }
        for (;;) {
            skipBlanks();
            markStart();
            if (isAtEnd()) {
                eof = addToken(EOF, "", false);
                return eof;
            }
            var token = scanToken();
            if (token != null) {
                return token;
            }
        }
    }

    //// character classes, shared with the serializer ////

    static boolean isLineTerminator(char c) {
        switch (c) {
        case '\n':
        case '\u000B':
        case '\f':
        case '\r':
        case '\u0085':
        case '\u2028':
        case '\u2029':
            return true;
        default:
            return false;
        }
    }

    static boolean isBlank(char c) {
        return !isLineTerminator(c) && (Character.isWhitespace(c) || Character.isSpaceChar(c));
    }

    /**
     * Whether {@code c} may appear inside an unquoted word under {@code options}.
     */
    static boolean isWordChar(char c, ParserOptions options) {
        if (isBlank(c) || isLineTerminator(c)) {
            return false;
        }
        switch (c) {
        case ';':
        case '{':
        case '}':
        case '"':
        case '#':
        case '\\':
        case '(':
        case ')':
        case '[':
        case ']':
            return false;
        case ',':
            return !options.isAllowCommaSeparators();
        default:
            return !options.isPunctuator(c);
        }
    }

    /**
     * Whether a code point may not appear literally in the source.
     */
    static boolean isForbidden(int codePoint, boolean forbidBidi) {
        var type = Character.getType(codePoint);
        return type == Character.UNASSIGNED
            || type == Character.SURROGATE
            || (type == Character.CONTROL && !Character.isWhitespace(codePoint) && codePoint != 0x85)
            || (forbidBidi && BIDI_CONTROLS.contains(codePoint));
    }

    //// scanning ////

    private Token scanToken() {
        var c = peek();
        switch (c) {
        case '{':
            advance();
            return addToken(BRACE_LEFT);
        case '}':
            advance();
            return addToken(BRACE_RIGHT);
        case ';':
            advance();
            return terminator(SEMICOLON);
        case '"':
            return string();
        case '#':
            return lineComment();
        case '\\':
            return continuation();
        case ',':
            if (options.isAllowCommaSeparators()) {
                advance();
                return addToken(COMMA);
            }
            break;
        case '(':
        case ')':
            if (options.isAllowExpressionArguments()) {
                advance();
                return addToken(c == '(' ? PAREN_LEFT : PAREN_RIGHT);
            }
            break;
        default:
            break;
        }

        if (isLineTerminator(c)) {
            lineTerminator();
            return terminator(EOL);
        }
        if (c == '/' && options.isAllowCStyleComments()) {
            if (peekNext() == '/') {
                return lineComment();
            }
            if (peekNext() == '*') {
                return blockComment();
            }
        }
        if (options.isPunctuator(c)) {
            advance();
            return addToken(PUNCTUATOR);
        }
        if (c == '[' || c == ']' || c == '(' || c == ')') {
            throw error("Unexpected character '" + c + "'");
        }
        return word();
    }

    private Token word() {
        while (!isAtEnd() && isWordChar(peek(), options)) {
            advance();
        }
        return addToken(WORD);
    }

    private Token terminator(Token.Type type) {
        // squash subsequent terminators
        if (lastVisible != null && lastVisible.type().isTerminator()) {
            return null;
        }
        return addToken(type);
    }

    private Token continuation() {
        advance(); // backslash
        if (isAtEnd() || !isLineTerminator(peek())) {
            throw error("Unexpected '\\' outside a string");
        }
        lineTerminator();
        return addToken(LINE_CONTINUATION, "", true);
    }

    private Token string() {
        advance(); // opening quote
        var triple = options.isAllowTripleQuotes() && peek() == '"' && peekNext() == '"';
        if (triple) {
            advance();
            advance();
        }

        var value = new StringBuilder();
        for (;;) {
            if (isAtEnd()) {
                throw unterminated(triple ? "Unterminated triple-quoted string" : "Unterminated string");
            }
            var c = peek();
            if (c == '\\') {
                escape(value, triple);
            } else if (c == '"') {
                if (!triple) {
                    advance();
                    break;
                }
                if (peekAt(1) == '"' && peekAt(2) == '"') {
                    advance();
                    advance();
                    advance();
                    break;
                }
                value.append(advance());
            } else if (isLineTerminator(c)) {
                if (!triple) {
                    throw unterminated("Unterminated string");
                }
                value.append(lineTerminator());
            } else {
                value.append(advance());
            }
        }
        return addToken(triple ? TRIPLE_QUOTED_STRING : QUOTED_STRING, value.toString(), false);
    }

    private void escape(StringBuilder value, boolean triple) {
        var escLine = line;
        var escColumn = column(current);
        var escOffset = current;
        advance(); // skip escape character
        if (isAtEnd()) {
            throw unterminated(triple ? "Unterminated triple-quoted string" : "Unterminated string");
        }
        var c = peek();
        if (isLineTerminator(c)) {
            lineTerminator(); // elided
            return;
        }
        advance();
        switch (c) {
        case '"':
        case '\\':
            value.append(c);
            break;
        case 'n':
            value.append('\n');
            break;
        case 't':
            value.append('\t');
            break;
        case 'r':
            value.append('\r');
            break;
        case 'b':
            value.append('\b');
            break;
        case 'f':
            value.append('\f');
            break;
        case '0':
            value.append('\0');
            break;
        case 'u':
            var code = 0;
            for (var i = 0; i < 4; i++) {
                var digit = isHexDigit(peek()) ? Character.digit(peek(), 16) : -1;
                if (isAtEnd() || digit < 0) {
                    throw new LexerException("Invalid unicode escape", escLine, escColumn, escOffset);
                }
                advance();
                code = code * 16 + digit;
            }
            value.append((char) code);
            break;
        default:
            throw new LexerException("Invalid escape sequence '\\" + c + "'", escLine, escColumn, escOffset);
        }
    }

    private static boolean isHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private Token lineComment() {
        while (!isAtEnd() && !isLineTerminator(peek())) {
            advance();
        }
        return addToken(COMMENT, source.substring(start, current), true);
    }

    private Token blockComment() {
        // discard the `/*`
        advance();
        advance();
        while (!(peek() == '*' && peekNext() == '/')) {
            if (isAtEnd()) {
                throw unterminated("Unterminated comment");
            }
            if (isLineTerminator(peek())) {
                lineTerminator();
            } else {
                advance();
            }
        }
        advance();
        advance();
        return addToken(COMMENT, source.substring(start, current), true);
    }

    private void skipBlanks() {
        while (!isAtEnd() && isBlank(peek())) {
            advance();
        }
    }

    /**
     * Consumes one line terminator, CRLF counting as one, and returns its text.
     */
    private String lineTerminator() {
        var from = current;
        var c = advance();
        if (c == '\r' && peek() == '\n') {
            advance();
        }
        line++;
        lineStart = current;
        return source.substring(from, current);
    }

    //// input ////

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        checkAllowed(current);
        return source.charAt(current++);
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int distance) {
        var index = current + distance;
        if (index >= source.length()) {
            return '\0';
        }
        return source.charAt(index);
    }

    private void checkAllowed(int index) {
        var c = source.charAt(index);
        int codePoint = c;
        if (Character.isHighSurrogate(c)) {
            if (index + 1 >= source.length() || !Character.isLowSurrogate(source.charAt(index + 1))) {
                throw forbidden(index, c);
            }
            codePoint = source.codePointAt(index);
        } else if (Character.isLowSurrogate(c)) {
            if (index > 0 && Character.isHighSurrogate(source.charAt(index - 1))) {
                return; // checked with its high half
            }
            throw forbidden(index, c);
        }

        if (isForbidden(codePoint, options.isForbidBidiCharacters())) {
            throw forbidden(index, codePoint);
        }
    }

    //// tokens and errors ////

    private void markStart() {
        start = current;
        startLine = line;
        startColumn = column(current);
    }

    private int column(int index) {
        return 1 + index - lineStart;
    }

    private Token addToken(Token.Type type) {
        var text = source.substring(start, current);
        return addToken(type, text, false);
    }

    private Token addToken(Token.Type type, String value, boolean hidden) {
        var text = source.substring(start, current);
        var token = new Token(type, text, value, startLine, startColumn, start, hidden);
        if (!hidden) {
            lastVisible = token;
        }
        return token;
    }

    private LexerException error(String message) {
        return new LexerException(message, startLine, startColumn, start);
    }

    private LexerException unterminated(String message) {
        // reported at the opening delimiter
        return error(message);
    }

    private LexerException forbidden(int index, int codePoint) {
        var message = String.format("Forbidden character U+%04X", codePoint);
        return new LexerException(message, line, column(index), index);
    }
}
