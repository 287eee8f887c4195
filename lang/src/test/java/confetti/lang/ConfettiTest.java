package confetti.lang;

import static confetti.lang.Token.Type.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

public class ConfettiTest {

    @Test
    void tokenizeIncludesHiddenTokens() {
        var types = Confetti.tokenize("a # note\nb \\\n c", ParserOptions.DEFAULT).stream()
            .map(Token::type)
            .collect(Collectors.toList());
        assertEquals(List.of(WORD, COMMENT, EOL, WORD, LINE_CONTINUATION, WORD, EOF), types);
    }

    @Test
    void tokenizeReportsLexerErrors() {
        assertThrows(LexerException.class, () -> Confetti.tokenize("\"open", ParserOptions.DEFAULT));
    }

    @Test
    void parseThenSerialize() {
        var text = "# header\nserver {\n  listen 80 443;\n}\n";
        assertEquals("server {\n  listen 80 443;\n}\n", Confetti.serialize(Confetti.parse(text)));
    }

    @Test
    void errorMessagesCarryPosition() {
        var ex = assertThrows(ParserException.class, () -> Confetti.parse("a {\n}\n}"));
        assertEquals("Unexpected '}' without an open block. [line 3, col 1]", ex.getMessage());
    }
}
