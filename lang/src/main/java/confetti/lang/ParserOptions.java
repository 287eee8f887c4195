package confetti.lang;

import java.util.Set;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

/**
 * Syntax extensions and resource limits applied by {@link Scanner} and {@link Parser}.
 */
@Value
@Builder(toBuilder = true)
public class ParserOptions {

    public static final ParserOptions DEFAULT = ParserOptions.builder().build();

    /** Accept C-style {@code //} line comments and block comments. */
    @Default boolean allowCStyleComments = false;

    @Default boolean allowTripleQuotes = true;

    /** Treat {@code ( ... )} as a single flattened argument. */
    @Default boolean allowExpressionArguments = false;

    /**
     * Treat {@code ,} as a cosmetic argument separator.
     * When off, a comma is an ordinary word character.
     */
    @Default boolean allowCommaSeparators = true;

    /**
     * Characters lexed as one-character punctuator arguments. Reserved
     * characters such as {@code [} and {@code ]} are rejected unless listed here.
     */
    @Default Set<Character> customPunctuators = Set.of();

    /** Reject Unicode bidirectional formatting characters anywhere in the input. */
    @Default boolean forbidBidiCharacters = true;

    /** Maximum number of simultaneously open blocks and expression groups. */
    @Default int maxDepth = 100;

    /** Maximum number of directives in one document, at any depth. */
    @Default int maxDirectives = 1_000_000;

    /** Maximum number of arguments of a single directive. */
    @Default int maxArguments = 65_536;

    public boolean isPunctuator(char c) {
        return customPunctuators.contains(c);
    }
}
