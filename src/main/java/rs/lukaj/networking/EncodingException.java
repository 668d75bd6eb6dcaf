package rs.lukaj.networking;

/**
 * Thrown when parameters or form data parts can't be encoded (e.g. an unsupported parameter type,
 * or a part without any data).
 */
public class EncodingException extends NetworkingException {
    public EncodingException(String message) {
        super(Kind.ENCODING, message);
    }
    public EncodingException(String message, Throwable cause) {
        super(Kind.ENCODING, message, cause);
    }
}
