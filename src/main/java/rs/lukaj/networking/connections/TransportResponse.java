package rs.lukaj.networking.connections;

import java.nio.charset.StandardCharsets;

/**
 * Raw response as received by the {@link Transport}: status code, headers and body, which is already
 * decompressed.
 */
public class TransportResponse {
    private final int statusCode;
    private final Headers headers;
    private final byte[] body;

    public TransportResponse(int statusCode, Headers headers, byte[] body) {
        this.statusCode = statusCode;
        this.headers = headers == null ? new Headers() : headers;
        this.body = body == null ? new byte[0] : body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isSuccess() {
        return Http.isSuccess(statusCode);
    }

    public Headers getHeaders() {
        return headers;
    }

    public byte[] getBody() {
        return body;
    }

    public String getBodyString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
