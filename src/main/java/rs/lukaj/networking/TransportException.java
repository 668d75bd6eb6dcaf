package rs.lukaj.networking;

/**
 * Network failure, or a response with a status code outside of 2xx. In the latter case, status code
 * and the response body (as text) are available; otherwise status is {@link #NO_STATUS}.
 */
public class TransportException extends NetworkingException {
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String responseBody;

    public TransportException(int statusCode, String responseBody) {
        super(Kind.TRANSPORT, "Server responded with status " + statusCode);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public TransportException(String message, Throwable cause) {
        super(Kind.TRANSPORT, message, cause);
        this.statusCode = NO_STATUS;
        this.responseBody = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean hasStatus() {
        return statusCode != NO_STATUS;
    }

    /**
     * @return body of the error response, or null if the request didn't get a response at all
     */
    public String getResponseBody() {
        return responseBody;
    }
}
