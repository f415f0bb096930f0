package flatkv.command;

/**
 * Reply to a single command. {@code ok} is false for protocol errors and lookups of
 * absent keys; either way {@code message} is the text written back to the client.
 */
public record CommandResult(boolean ok, String message) {

    public static CommandResult ok(String message) {
        return new CommandResult(true, message);
    }

    public static CommandResult error(String message) {
        return new CommandResult(false, message);
    }
}
