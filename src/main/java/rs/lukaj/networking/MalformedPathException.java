package rs.lukaj.networking;

/**
 * Thrown when a path can't be composed with the base url into a valid URL.
 */
public class MalformedPathException extends EncodingException {
    public MalformedPathException(String message) {
        super(message);
    }
    public MalformedPathException(String message, Throwable cause) {
        super(message, cause);
    }
}
