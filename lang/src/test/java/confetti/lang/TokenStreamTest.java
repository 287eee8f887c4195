package confetti.lang;

import static confetti.lang.Token.Type.COMMENT;
import static confetti.lang.Token.Type.EOF;
import static confetti.lang.Token.Type.EOL;
import static confetti.lang.Token.Type.SEMICOLON;
import static confetti.lang.Token.Type.WORD;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TokenStreamTest {

    TokenStream stream;

    boolean expectAtEnd;
    boolean includeHidden;

    private void assertNextToken(Token expect) {
        if (includeHidden) {
            assertEquals(expectAtEnd, stream.isAtEnd(true));
            assertEquals(expect, stream.peek(true));
            assertEquals(expect, stream.advance(true));
        } else {
            assertEquals(expectAtEnd, stream.isAtEnd());
            assertEquals(expect, stream.peek());
            assertEquals(expect, stream.advance());
        }
        assertEquals(expect, stream.previous());
    }

    private static Token token(Token.Type type, String lexeme, int line, int column, int offset, boolean hidden) {
        return new Token(type, lexeme, lexeme, line, column, offset, hidden);
    }

    @BeforeEach
    void setUp() {
        var source = "hello; # hi\nworld;42\n";
        stream = new TokenStream(new Scanner(source));
        includeHidden = false;
        expectAtEnd = false;
    }

    @Test
    void hidden() {
        includeHidden = true;
        assertNextToken(token(WORD, "hello", 1, 1, 0, false));
        assertNextToken(token(SEMICOLON, ";", 1, 6, 5, false));
        assertNextToken(token(COMMENT, "# hi", 1, 8, 7, true));
        assertNextToken(token(WORD, "world", 2, 1, 12, false));
        assertNextToken(token(SEMICOLON, ";", 2, 6, 17, false));
        assertNextToken(token(WORD, "42", 2, 7, 18, false));
        assertNextToken(token(EOL, "\n", 2, 9, 20, false));
        expectAtEnd = true;
        assertNextToken(token(EOF, "", 3, 1, 21, false));
    }

    @Test
    void visible() {
        includeHidden = false;
        assertNextToken(token(WORD, "hello", 1, 1, 0, false));
        assertNextToken(token(SEMICOLON, ";", 1, 6, 5, false));
        assertNextToken(token(WORD, "world", 2, 1, 12, false));
        assertNextToken(token(SEMICOLON, ";", 2, 6, 17, false));
        assertNextToken(token(WORD, "42", 2, 7, 18, false));
        assertNextToken(token(EOL, "\n", 2, 9, 20, false));
        expectAtEnd = true;
        assertNextToken(token(EOF, "", 3, 1, 21, false));
    }

    @Test
    void peekNextSkipsHidden() {
        stream.advance();
        assertEquals(SEMICOLON, stream.peek().type());
        assertEquals(WORD, stream.peekNext().type());
        assertEquals(COMMENT, stream.peekNext(true).type());
    }

    @Test
    void advancePastEndStaysAtEof() {
        while (!stream.isAtEnd()) {
            stream.advance();
        }
        assertEquals(EOF, stream.advance().type());
        assertEquals(EOF, stream.advance().type());
        assertTrue(stream.isAtEnd(true));
    }

    @Test
    void comments() {
        while (!stream.isAtEnd()) {
            stream.advance();
        }
        assertEquals(1, stream.comments().size());
        assertEquals("# hi", stream.comments().get(0).lexeme());
    }
}
