package rs.lukaj.networking.connections;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;


/**
 * Represents headers which are received from server or sent as a part of the request.
 * Header names are case-insensitive and are stored lowercase.
 */
public class Headers {
    private final Map<String, String> headers = new LinkedHashMap<>();

    public Headers() {
    }

    public Headers(Headers other) {
        headers.putAll(other.headers);
    }

    /**
     * Get value of the header identified by the name passed
     * @param header name of the header
     * @return value of the header, or null if it doesn't exist
     */
    public String getHeader(String header) {
        return headers.get(header.toLowerCase());
    }

    /**
     * Put a new header, replacing the existing one if it exists.
     * @param header name of the header
     * @param value value of the header
     * @return this, to allow chaining
     */
    public Headers setHeader(String header, String value) {
        headers.put(header.toLowerCase(), value);
        return this;
    }

    /**
     * Append header value if the header with the same name already exists, or put a new header
     * if it doesn't. Header values are separated by a comma.
     * @param header name of the header
     * @param value value of the header
     * @return this, to allow chaining
     */
    public Headers appendHeader(String header, String value) {
        String name = header.toLowerCase();
        if(headers.containsKey(name)) headers.put(name, headers.get(name) + ", " + value);
        else headers.put(name, value);
        return this;
    }

    /**
     * Copies all headers from other, replacing the ones with the same name.
     * @param other headers to copy
     * @return this, to allow chaining
     */
    public Headers setAll(Headers other) {
        headers.putAll(other.headers);
        return this;
    }

    /**
     * Remove a header if it exists.
     * @param header header name
     * @return previous value of the header, or null if it didn't exist
     */
    public String removeHeader(String header) {
        return headers.remove(header.toLowerCase());
    }

    public boolean hasHeader(String header) {
        return headers.containsKey(header.toLowerCase());
    }

    public String getContentType() {
        return getHeader("Content-Type");
    }

    public String getContentEncoding() {
        return getHeader("Content-Encoding");
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(headers);
    }

    public boolean isEmpty() {
        return headers.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if(!(obj instanceof Headers)) return false;
        return headers.equals(((Headers) obj).headers);
    }

    @Override
    public int hashCode() {
        return headers.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(headers.size() * 32);
        for(Map.Entry<String, String> header : headers.entrySet()) {
            builder.append(header.getKey()).append(": ").append(header.getValue()).append("\r\n");
        }
        return builder.toString();
    }
}
