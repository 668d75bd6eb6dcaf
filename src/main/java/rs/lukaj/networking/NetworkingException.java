package rs.lukaj.networking;

/**
 * Base class for every failure delivered to a request's completion. Each failure has exactly one
 * {@link Kind}, so callers can switch over it instead of checking instanceof chains.
 */
public abstract class NetworkingException extends Exception {

    /**
     * Kinds of failures a request can end with.
     */
    public enum Kind {
        /** Parameters, parts or path couldn't be turned into a request. Nothing was sent. */
        ENCODING,
        /** Network failure, or the server answered with a non-2xx status. */
        TRANSPORT,
        /** Request was cancelled by the caller. */
        CANCELLED,
        /** Response body doesn't match the expected response type. */
        DECODING
    }

    private final Kind kind;

    protected NetworkingException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected NetworkingException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
