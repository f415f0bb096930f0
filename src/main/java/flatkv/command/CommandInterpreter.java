package flatkv.command;

import flatkv.datastore.KeyValueStore;
import flatkv.lexer.Lexer;
import flatkv.parser.ParseResult;
import flatkv.parser.Parser;
import flatkv.parser.Request;

/**
 * Turns one raw command line into a call on the shared {@link KeyValueStore}.
 * Holds no per-connection state, so one instance serves every session.
 */
public class CommandInterpreter {

    private final KeyValueStore store;
    private final Lexer lexer = new Lexer();
    private final Parser parser = new Parser();

    public CommandInterpreter(KeyValueStore store) {
        this.store = store;
    }

    public CommandResult execute(String line) {
        ParseResult parsed = parser.parse(lexer.tokenize(line));
        if (!parsed.isOk()) {
            return CommandResult.error(parsed.error());
        }

        Request request = parsed.request();
        return switch (request.command()) {
            case SET -> store.set(request.key(), request.value());
            case GET -> store.get(request.key());
            case REMOVE -> store.remove(request.key());
            case PRINT -> store.print();
        };
    }
}
