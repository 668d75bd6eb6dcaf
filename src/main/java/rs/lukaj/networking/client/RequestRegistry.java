package rs.lukaj.networking.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rs.lukaj.networking.CancelledException;
import rs.lukaj.networking.connections.Http;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps track of requests which are in flight, by their identifier, so they can be cancelled later.
 * <br/>
 * Identifier is made from the method and the url, so every request for the same resource using the same
 * method has the same identifier. At most one request is registered under an identifier: an equivalent
 * request joins the registered one (one transport call, every caller gets the result), a different one
 * replaces it and the replaced request runs to completion on its own, without being cancellable by
 * identifier.
 * <br/>
 * Whether a request completes or gets cancelled is decided under a single lock, so a cancelled
 * request never delivers its response, and a completed one can't be cancelled anymore.
 */
public class RequestRegistry {
    private static final Logger logger = LoggerFactory.getLogger(RequestRegistry.class);

    private final Map<String, InFlightRequest> registered = new HashMap<>();
    private final Set<InFlightRequest> live = new LinkedHashSet<>(); //including the replaced ones
    private final Object lock = new Object();

    /**
     * Makes the identifier for a request. Same inputs always give the same identifier.
     * @param verb http method
     * @param url composed url, without the query added by parameters
     * @return request identifier
     */
    public static String identifierFor(Http.Verb verb, URI url) {
        return verb + " " + url;
    }

    /**
     * Register a new request. If an equivalent request is already registered, the candidate joins it
     * instead and shouldn't be executed.
     * @param candidate request about to be executed
     * @return the candidate, if it should be executed, or the request it joined
     */
    InFlightRequest register(InFlightRequest candidate) {
        synchronized (lock) {
            InFlightRequest existing = registered.get(candidate.getId());
            if(existing != null && existing.canJoin(candidate)) {
                existing.join(candidate);
                logger.debug("{} joined the request in flight ({} waiting)", candidate, existing.getWaiterCount());
                return existing;
            }
            if(existing != null) logger.debug("{} replaces a different request with the same identifier", candidate);
            registered.put(candidate.getId(), candidate);
            live.add(candidate);
            return candidate;
        }
    }

    /**
     * Removes the request from the registry once its transport call has finished, and marks it completed.
     * If a newer request has replaced it in the meantime, the newer one stays registered.
     * @param request request whose transport call has finished
     * @return true if request was pending and its result should be delivered, false if it's been cancelled
     */
    boolean deregister(InFlightRequest request) {
        synchronized (lock) {
            live.remove(request);
            registered.remove(request.getId(), request);
            if(request.getState() != InFlightRequest.State.PENDING) return false;
            request.setState(InFlightRequest.State.COMPLETED);
            return true;
        }
    }

    /**
     * Cancels the request currently registered under the identifier. Every completion waiting for it
     * receives a {@link CancelledException}.
     * @param id request identifier
     * @return true if a request was found and cancelled, false if there's nothing in flight under this id
     */
    public boolean cancel(String id) {
        InFlightRequest request;
        synchronized (lock) {
            request = registered.remove(id);
            if(request == null) return false;
            live.remove(request);
            request.setState(InFlightRequest.State.CANCELLED);
        }
        finishCancelled(request);
        return true;
    }

    /**
     * Cancels every request in flight, including the ones replaced by a newer request with the same
     * identifier.
     * @return number of cancelled requests
     */
    public int cancelAll() {
        List<InFlightRequest> cancelled;
        synchronized (lock) {
            cancelled = new ArrayList<>(live);
            for(InFlightRequest request : cancelled) request.setState(InFlightRequest.State.CANCELLED);
            live.clear();
            registered.clear();
        }
        for(InFlightRequest request : cancelled) finishCancelled(request);
        return cancelled.size();
    }

    public boolean isRegistered(String id) {
        synchronized (lock) {
            return registered.containsKey(id);
        }
    }

    /**
     * @return number of identifiers with a request in flight
     */
    public int size() {
        synchronized (lock) {
            return registered.size();
        }
    }

    private static void finishCancelled(InFlightRequest request) {
        logger.debug("Cancelling {}", request);
        request.cancelTransport();
        request.deliver(Result.failure(request.getId(), new CancelledException(request.getId())));
    }
}
