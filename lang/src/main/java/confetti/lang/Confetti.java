package confetti.lang;

import java.util.List;

import lombok.NonNull;

/**
 * Entry points for reading and writing Confetti text.
 *
 * <pre>{@code
 * var tree = Confetti.parse("server { port 8080; }");
 * var text = Confetti.serialize(tree);
 * }</pre>
 */
public final class Confetti {

    private Confetti() {
    }

    public static DirectiveTree parse(@NonNull String text) {
        return parse(text, ParserOptions.DEFAULT);
    }

    /**
     * @throws LexerException on malformed tokens or forbidden characters
     * @throws ParserException on grammar violations and exceeded limits
     */
    public static DirectiveTree parse(@NonNull String text, @NonNull ParserOptions options) {
        var tokens = new TokenStream(new Scanner(text, options));
        return new Parser(tokens, options).parse();
    }

    public static String serialize(@NonNull DirectiveTree tree) {
        return serialize(tree, MapperOptions.DEFAULT);
    }

    public static String serialize(@NonNull DirectiveTree tree, @NonNull MapperOptions options) {
        return new Serializer(options).serialize(tree);
    }

    /**
     * Every token of {@code text}, hidden ones included, ending with
     * {@link Token.Type#EOF}.
     */
    public static List<Token> tokenize(@NonNull String text, @NonNull ParserOptions options) {
        return List.copyOf(new Scanner(text, options).getTokens());
    }
}
