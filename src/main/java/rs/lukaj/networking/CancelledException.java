package rs.lukaj.networking;

/**
 * Delivered to every completion waiting on a request which has been cancelled.
 */
public class CancelledException extends NetworkingException {
    private final String requestId;

    public CancelledException(String requestId) {
        super(Kind.CANCELLED, "Request cancelled: " + requestId);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
