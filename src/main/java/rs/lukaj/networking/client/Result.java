package rs.lukaj.networking.client;

import rs.lukaj.networking.NetworkingException;
import rs.lukaj.networking.connections.Headers;

/**
 * Outcome of a request. There cannot be both a body and an error; use {@link #isSuccess()} to figure
 * out which one is present. Status code and headers are those of the transport response, if there was one.
 */
public class Result<T> {
    public static final int NO_STATUS = -1;

    private final String requestId;
    private final T body;
    private final NetworkingException error;
    private final int statusCode;
    private final Headers headers;
    private final boolean fromCache;

    private Result(String requestId, T body, NetworkingException error, int statusCode, Headers headers,
                   boolean fromCache) {
        this.requestId = requestId;
        this.body = body;
        this.error = error;
        this.statusCode = statusCode;
        this.headers = headers == null ? new Headers() : headers;
        this.fromCache = fromCache;
    }

    static <T> Result<T> success(String requestId, T body, int statusCode, Headers headers) {
        return new Result<>(requestId, body, null, statusCode, headers, false);
    }

    static <T> Result<T> cached(String requestId, T body) {
        return new Result<>(requestId, body, null, NO_STATUS, null, true);
    }

    static <T> Result<T> failure(String requestId, NetworkingException error, int statusCode, Headers headers) {
        return new Result<>(requestId, null, error, statusCode, headers, false);
    }

    static <T> Result<T> failure(String requestId, NetworkingException error) {
        return failure(requestId, error, NO_STATUS, null);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isCancelled() {
        return error != null && error.getKind() == NetworkingException.Kind.CANCELLED;
    }

    /**
     * @return decoded response, or null if request failed
     */
    public T getBody() {
        return body;
    }

    /**
     * @return decoded response
     * @throws NetworkingException the failure, if request failed
     */
    public T getBodyOrThrow() throws NetworkingException {
        if(error != null) throw error;
        return body;
    }

    public NetworkingException getError() {
        return error;
    }

    /**
     * @return identifier returned when the request was dispatched
     */
    public String getRequestId() {
        return requestId;
    }

    /**
     * @return status code of the transport response, or {@link #NO_STATUS} if there wasn't one (e.g. the
     * result came from cache or request couldn't be sent)
     */
    public int getStatusCode() {
        return statusCode;
    }

    public Headers getHeaders() {
        return headers;
    }

    /**
     * @return whether body was served from cache, without going to the network
     */
    public boolean isFromCache() {
        return fromCache;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success(" + statusCode + (fromCache ? ", cached" : "") + ")"
                           : "Failure(" + error.getKind() + ": " + error.getMessage() + ")";
    }
}
