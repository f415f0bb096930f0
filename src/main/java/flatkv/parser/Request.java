package flatkv.parser;

public record Request(Command command, String key, String value) {
}
