package flatkv.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    private final Lexer lexer = new Lexer();

    @Test
    void splitsOnAnyWhitespaceRun() {
        assertEquals(List.of("SET", "a", "1"), lexer.tokenize("  SET \t a    1 \r\n"));
    }

    @Test
    void blankInputHasNoTokens() {
        assertTrue(lexer.tokenize("").isEmpty());
        assertTrue(lexer.tokenize("   \t ").isEmpty());
        assertTrue(lexer.tokenize(null).isEmpty());
    }
}
