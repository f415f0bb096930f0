package flatkv.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    private final Parser parser = new Parser();

    @Test
    void parsesEachVerbCaseInsensitively() {
        assertEquals(new Request(Command.SET, "a", "1"), parser.parse(List.of("set", "a", "1")).request());
        assertEquals(new Request(Command.GET, "a", null), parser.parse(List.of("Get", "a")).request());
        assertEquals(new Request(Command.REMOVE, "a", null), parser.parse(List.of("REMOVE", "a")).request());
        assertEquals(new Request(Command.PRINT, null, null), parser.parse(List.of("print")).request());
    }

    @Test
    void rejectsWrongArity() {
        ParseResult set = parser.parse(List.of("SET", "onlykey"));
        assertFalse(set.isOk());
        assertEquals("ERROR: SET command requires 2 arguments: key and value\n", set.error());

        assertEquals("ERROR: SET command requires 2 arguments: key and value\n",
                parser.parse(List.of("SET", "a", "1", "2")).error());
        assertEquals("ERROR: GET command requires 1 argument: key\n", parser.parse(List.of("GET")).error());
        assertEquals("ERROR: REMOVE command requires 1 argument: key\n",
                parser.parse(List.of("REMOVE", "a", "b")).error());
    }

    @Test
    void printIgnoresTrailingTokens() {
        ParseResult result = parser.parse(List.of("PRINT", "everything"));
        assertTrue(result.isOk());
        assertEquals(Command.PRINT, result.request().command());
    }

    @Test
    void unknownVerbKeepsOriginalSpelling() {
        assertEquals("ERROR: Unknown command 'Foo'\n", parser.parse(List.of("Foo", "bar")).error());
    }

    @Test
    void emptyTokenList() {
        assertEquals("ERROR: Empty command\n", parser.parse(List.of()).error());
    }
}
