package rs.lukaj.networking.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rs.lukaj.networking.ResponseType;
import rs.lukaj.networking.cache.CachingPolicy;
import rs.lukaj.networking.connections.TransportCall;
import rs.lukaj.networking.params.EncodedRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A request which has been handed to the transport and hasn't finished yet, together with every
 * completion waiting for it. State and waiters are guarded by the {@link RequestRegistry} lock; the
 * transport call has its own.
 */
class InFlightRequest {
    private static final Logger logger = LoggerFactory.getLogger(InFlightRequest.class);

    enum State {
        PENDING, COMPLETED, CANCELLED
    }

    private final String id;
    private final EncodedRequest request;
    private final ResponseType responseType;
    private final String cacheName;
    private final CachingPolicy cachingPolicy;
    private final Executor delivery;
    private final List<Waiter> waiters = new ArrayList<>();
    private State state = State.PENDING;

    private TransportCall call;
    private boolean cancelRequested = false;

    InFlightRequest(String id, EncodedRequest request, ResponseType responseType, String cacheName,
                    CachingPolicy cachingPolicy, Completion<Object> completion, Executor delivery) {
        this.id = id;
        this.request = request;
        this.responseType = responseType;
        this.cacheName = cacheName;
        this.cachingPolicy = cachingPolicy;
        this.delivery = delivery;
        this.waiters.add(new Waiter(completion));
    }

    String getId() {
        return id;
    }

    EncodedRequest getRequest() {
        return request;
    }

    ResponseType getResponseType() {
        return responseType;
    }

    String getCacheName() {
        return cacheName;
    }

    CachingPolicy getCachingPolicy() {
        return cachingPolicy;
    }

    State getState() {
        return state;
    }

    void setState(State state) {
        this.state = state;
    }

    /**
     * Whether other can be served by this request instead of making its own transport call.
     */
    boolean canJoin(InFlightRequest other) {
        return id.equals(other.id) && responseType == other.responseType && cacheName.equals(other.cacheName)
                && cachingPolicy == other.cachingPolicy && request.isEquivalentTo(other.request);
    }

    void join(InFlightRequest other) {
        waiters.addAll(other.waiters);
    }

    int getWaiterCount() {
        return waiters.size();
    }

    /**
     * Sets the transport call backing this request. If the request was cancelled before the call was
     * made, the call is cancelled right away.
     */
    void attach(TransportCall call) {
        boolean cancelNow;
        synchronized (this) {
            cancelNow = cancelRequested;
            if(!cancelNow) this.call = call;
        }
        if(cancelNow) call.cancel();
    }

    void cancelTransport() {
        TransportCall current;
        synchronized (this) {
            cancelRequested = true;
            current = call;
            call = null;
        }
        if(current != null) current.cancel();
    }

    /**
     * Posts the result to every waiter. Only called once the state has left PENDING, after which
     * waiters don't change.
     */
    void deliver(Result<Object> result) {
        for(Waiter waiter : waiters) {
            try {
                delivery.execute(() -> waiter.deliver(result));
            } catch (RejectedExecutionException e) {
                logger.warn("Delivery executor is shut down, dropping result of {}", id);
            }
        }
    }

    @Override
    public String toString() {
        return id;
    }


    //guards against a completion being invoked twice
    private static class Waiter {
        private final Completion<Object> completion;
        private final AtomicBoolean delivered = new AtomicBoolean(false);

        private Waiter(Completion<Object> completion) {
            this.completion = completion;
        }

        private void deliver(Result<Object> result) {
            if(!delivered.compareAndSet(false, true)) {
                logger.warn("Result already delivered, ignoring {}", result);
                return;
            }
            try {
                completion.onCompleted(result);
            } catch (RuntimeException e) {
                logger.error("Completion threw an exception", e);
            }
        }
    }
}
