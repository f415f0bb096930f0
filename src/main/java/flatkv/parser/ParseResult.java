package flatkv.parser;

/**
 * Outcome of parsing one command line: either a {@link Request} ready for dispatch
 * or the error text to send back to the client.
 */
public record ParseResult(Request request, String error) {

    public static ParseResult of(Request request) {
        return new ParseResult(request, null);
    }

    public static ParseResult failure(String error) {
        return new ParseResult(null, error);
    }

    public boolean isOk() {
        return request != null;
    }
}
