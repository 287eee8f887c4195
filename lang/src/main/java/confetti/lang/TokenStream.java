package confetti.lang;

import static confetti.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Cursor over the tokens of a {@link Scanner}, pulled from it only as far as
 * the parser looks ahead.
 */
@RequiredArgsConstructor
public final class TokenStream {

    private final @NonNull Scanner scanner;
    private final List<Token> tokens = new ArrayList<>();

    private int current = 0;
    private Token previous = null;

    public Token previous() {
        return previous != null ? previous : peek();
    }

    public boolean isAtEnd() {
        return isAtEnd(false);
    }

    public boolean isAtEnd(boolean includeHidden) {
        return peek(includeHidden).type() == EOF;
    }

    public Token peek() {
        return peek(false);
    }

    public Token peek(boolean includeHidden) {
        return peekFrom(current, includeHidden);
    }

    public Token peekNext() {
        return peekNext(false);
    }

    public Token peekNext(boolean includeHidden) {
        if (isAtEnd(includeHidden)) {
            return peek(includeHidden);
        }
        var index = includeHidden ? current : nextVisible(current);
        return peekFrom(index + 1, includeHidden);
    }

    public Token advance() {
        return advance(false);
    }

    public Token advance(boolean includeHidden) {
        if (!includeHidden) {
            current = nextVisible(current);
        }
        previous = get(current);
        if (previous.type() != EOF) {
            current++;
        }
        return previous;
    }

    /**
     * The comments scanned so far, in source order.
     */
    public List<Token> comments() {
        return tokens.stream()
            .filter(token -> token.type() == COMMENT)
            .collect(Collectors.toUnmodifiableList());
    }

    private Token get(int index) {
        while (tokens.size() <= index) {
            tokens.add(scanner.nextToken());
        }
        return tokens.get(index);
    }

    private int nextVisible(int index) {
        var token = get(index);
        while (token.hidden() && EOF != token.type()) {
            index++;
            token = get(index);
        }
        return index;
    }

    private Token peekFrom(int index, boolean includeHidden) {
        if (!includeHidden) {
            index = nextVisible(index);
        }
        return get(index);
    }
}
