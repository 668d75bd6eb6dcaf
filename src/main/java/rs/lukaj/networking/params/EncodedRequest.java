package rs.lukaj.networking.params;

import rs.lukaj.networking.connections.Headers;

import java.net.URI;
import java.util.Arrays;

/**
 * Request after parameters have been encoded: final url (with query, if any), headers describing
 * the body, and the body itself.
 */
public class EncodedRequest {
    private final URI url;
    private final Headers headers;
    private final byte[] body;

    public EncodedRequest(URI url, Headers headers, byte[] body) {
        this.url = url;
        this.headers = headers;
        this.body = body;
    }

    public URI getUrl() {
        return url;
    }

    public Headers getHeaders() {
        return headers;
    }

    /**
     * @return request body, or null if request has none
     */
    public byte[] getBody() {
        return body;
    }

    public boolean hasBody() {
        return body != null;
    }

    /**
     * Two encoded requests are equivalent if sending either of them would produce the same bytes on the wire.
     * @param other other request
     * @return whether requests are interchangeable
     */
    public boolean isEquivalentTo(EncodedRequest other) {
        return url.equals(other.url) && headers.equals(other.headers) && Arrays.equals(body, other.body);
    }
}
