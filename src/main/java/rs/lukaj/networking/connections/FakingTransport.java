package rs.lukaj.networking.connections;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves registered fake responses instead of going to the network, and passes every other request
 * to the wrapped transport. Fakes are matched by method and url, ignoring the query string.
 */
public class FakingTransport implements Transport {
    private static final Logger logger = LoggerFactory.getLogger(FakingTransport.class);

    private volatile Transport delegate;
    private final Map<String, TransportResponse> fakes = new ConcurrentHashMap<>();

    public FakingTransport(Transport delegate) {
        this.delegate = delegate;
    }

    /**
     * Registers a fake response. Any previous fake for the same method and url is replaced.
     * @param verb http method
     * @param url url, query is ignored
     * @param response response returned for every matching request
     */
    public void fake(Http.Verb verb, URI url, TransportResponse response) {
        fakes.put(key(verb, url), response);
    }

    /**
     * @return true if fake existed
     */
    public boolean removeFake(Http.Verb verb, URI url) {
        return fakes.remove(key(verb, url)) != null;
    }

    public boolean hasFake(Http.Verb verb, URI url) {
        return fakes.containsKey(key(verb, url));
    }

    public Transport getDelegate() {
        return delegate;
    }

    /**
     * Sets the transport used for requests without a fake. Calls already made on the old one are unaffected.
     */
    public void setDelegate(Transport delegate) {
        this.delegate = delegate;
    }

    @Override
    public TransportCall execute(Http.Verb verb, URI url, Headers headers, byte[] body, Callbacks callbacks) {
        TransportResponse fake = fakes.get(key(verb, url));
        if(fake == null) return delegate.execute(verb, url, headers, body, callbacks);

        logger.debug("Serving fake response {} for {} {}", fake.getStatusCode(), verb, url);
        callbacks.onResponse(fake);
        return TransportCall.DONE;
    }

    private static String key(Http.Verb verb, URI url) {
        try {
            URI withoutQuery = new URI(url.getScheme(), url.getAuthority(), url.getPath(), null, null);
            return verb + " " + withoutQuery;
        } catch (URISyntaxException e) {
            return verb + " " + url;
        }
    }

    @Override
    public void close() throws IOException {
        fakes.clear();
        delegate.close();
    }
}
