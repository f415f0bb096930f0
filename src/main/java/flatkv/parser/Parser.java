package flatkv.parser;

import java.util.List;
import java.util.Optional;

public class Parser {

    public ParseResult parse(List<String> tokens) {
        if (tokens.isEmpty()) {
            return ParseResult.failure("ERROR: Empty command\n");
        }

        Optional<Command> verb = Command.fromToken(tokens.get(0));
        if (verb.isEmpty()) {
            return ParseResult.failure("ERROR: Unknown command '" + tokens.get(0) + "'\n");
        }

        Command command = verb.get();
        return switch (command) {
            case SET -> {
                if (tokens.size() != command.tokenCount()) {
                    yield ParseResult.failure(command.arityError());
                }
                yield ParseResult.of(new Request(Command.SET, tokens.get(1), tokens.get(2)));
            }
            case GET, REMOVE -> {
                if (tokens.size() != command.tokenCount()) {
                    yield ParseResult.failure(command.arityError());
                }
                yield ParseResult.of(new Request(command, tokens.get(1), null));
            }
            // extra tokens after PRINT are ignored
            case PRINT -> ParseResult.of(new Request(Command.PRINT, null, null));
        };
    }
}
