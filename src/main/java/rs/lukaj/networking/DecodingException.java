package rs.lukaj.networking;

/**
 * Response body couldn't be decoded as the expected {@link ResponseType}.
 */
public class DecodingException extends NetworkingException {
    public DecodingException(String message) {
        super(Kind.DECODING, message);
    }
    public DecodingException(String message, Throwable cause) {
        super(Kind.DECODING, message, cause);
    }
}
