package flatkv.parser;

import java.util.Locale;
import java.util.Optional;

public enum Command {
    SET(3, "ERROR: SET command requires 2 arguments: key and value\n"),
    GET(2, "ERROR: GET command requires 1 argument: key\n"),
    REMOVE(2, "ERROR: REMOVE command requires 1 argument: key\n"),
    PRINT(1, null);

    private final int tokenCount;
    private final String arityError;

    Command(int tokenCount, String arityError) {
        this.tokenCount = tokenCount;
        this.arityError = arityError;
    }

    /** Number of tokens including the verb itself. */
    public int tokenCount() {
        return tokenCount;
    }

    public String arityError() {
        return arityError;
    }

    public static Optional<Command> fromToken(String token) {
        String verb = token.toUpperCase(Locale.ROOT);
        for (Command command : values()) {
            if (command.name().equals(verb)) {
                return Optional.of(command);
            }
        }
        return Optional.empty();
    }
}
