package rs.lukaj.networking.connections;

import java.io.Closeable;
import java.net.URI;

/**
 * Sends a single request over the network. Implementations should not retry, cache or follow any
 * application-level logic; they report exactly one outcome for each executed request, unless the
 * call is cancelled, in which case reporting anything is optional.
 */
public interface Transport extends Closeable {

    /**
     * Starts the request and returns immediately. Callbacks may be called on any thread, including
     * the calling one, before this method returns.
     * @param verb http method
     * @param url absolute url of the request, including query
     * @param headers request headers
     * @param body request body, or null if request has no body
     * @param callbacks notified when request is finished
     * @return handle which can be used to cancel the request
     */
    TransportCall execute(Http.Verb verb, URI url, Headers headers, byte[] body, Callbacks callbacks);

    /**
     * Callbacks which are used to report outcome of the request.
     */
    interface Callbacks {
        /**
         * Signals that request is finished and passes the response, whatever its status code.
         * @param response response from the server
         */
        void onResponse(TransportResponse response);

        /**
         * Called when any exception is thrown. Request won't proceed.
         * @param t thrown exception
         */
        void onExceptionThrown(Throwable t);
    }
}
