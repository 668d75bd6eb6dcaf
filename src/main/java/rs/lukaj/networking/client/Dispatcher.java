package rs.lukaj.networking.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rs.lukaj.networking.DecodingException;
import rs.lukaj.networking.EncodingException;
import rs.lukaj.networking.MalformedPathException;
import rs.lukaj.networking.TransportException;
import rs.lukaj.networking.cache.CacheStore;
import rs.lukaj.networking.cache.CachingPolicy;
import rs.lukaj.networking.connections.Headers;
import rs.lukaj.networking.connections.Transport;
import rs.lukaj.networking.connections.TransportCall;
import rs.lukaj.networking.connections.TransportResponse;
import rs.lukaj.networking.connections.UrlComposer;
import rs.lukaj.networking.params.EncodedRequest;
import rs.lukaj.networking.params.ParameterEncoder;
import rs.lukaj.networking.params.ParameterType;

import java.io.IOException;
import java.net.URI;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs requests: looks in the cache, encodes the request, registers and executes it, decodes the
 * response, caches it and delivers the result. Every dispatched request gets exactly one result.
 * <br/>
 * Requests run concurrently on the transport; results are always delivered on the delivery executor.
 */
public class Dispatcher {
    private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

    private final String baseUrl;
    private final RequestRegistry registry = new RequestRegistry();
    private final ParameterEncoder encoder;
    private final Headers defaultHeaders = new Headers();
    private final Transport transport;
    private volatile CacheStore cache;
    private volatile Executor delivery;
    private volatile boolean closed = false;

    public Dispatcher(String baseUrl, Transport transport, CacheStore cache, ParameterEncoder encoder, Executor delivery) {
        this.baseUrl = baseUrl;
        this.transport = transport;
        this.cache = cache;
        this.encoder = encoder;
        this.delivery = delivery;
    }

    /**
     * Dispatch the request. Returns immediately; completion is called later, on the delivery executor.
     * @param request request to run
     * @param completion called with the result
     * @return request identifier, which can be used for cancelling; a random one if no network request
     * has been made (cache hit, or request couldn't be made)
     * @throws IllegalStateException if the dispatcher has been closed
     */
    @SuppressWarnings("unchecked") //result type is decided by ResponseType, which Completion's type follows
    public <T> String dispatch(RequestDescriptor request, Completion<T> completion) {
        ensureOpen();
        Completion<Object> callback = (Completion<Object>) completion;
        String cacheName = request.getCacheName();
        CachingPolicy policy = request.getCachingPolicy();

        if(policy.shouldLookInCache()) {
            Object cached = cache.get(cacheName, request.getResponseType(), policy);
            if(cached != null) {
                String id = UUID.randomUUID().toString();
                logger.debug("{} served from cache {}", request, cacheName);
                post(callback, Result.cached(id, cached));
                return id;
            }
        }

        URI url;
        try {
            url = UrlComposer.compose(baseUrl, request.getPath());
        } catch (MalformedPathException e) {
            String id = UUID.randomUUID().toString();
            post(callback, Result.failure(id, e));
            return id;
        }
        String id = RequestRegistry.identifierFor(request.getVerb(), url);

        EncodedRequest encoded;
        try {
            ParameterType type = ParameterType.resolve(request.getVerb(), request.getParameterType(),
                    request.getParameters(), request.getParts());
            encoded = encoder.encode(request.getVerb(), url, type, request.getParameters(), request.getParts());
        } catch (EncodingException e) {
            logger.debug("Cannot encode {}: {}", request, e.getMessage());
            post(callback, Result.failure(id, e));
            return id;
        }
        Headers headers = new Headers();
        synchronized (defaultHeaders) {
            headers.setAll(defaultHeaders);
        }
        headers.setHeader("Accept", request.getResponseType().getAccept()).setAll(encoded.getHeaders());
        encoded = new EncodedRequest(encoded.getUrl(), headers, encoded.getBody());

        InFlightRequest inFlight = new InFlightRequest(id, encoded, request.getResponseType(), cacheName, policy,
                callback, this::deliver);
        if(registry.register(inFlight) != inFlight) return id;

        logger.debug("Executing {} {}", request.getVerb(), encoded.getUrl());
        TransportCall call;
        try {
            call = transport.execute(request.getVerb(), encoded.getUrl(), headers, encoded.getBody(),
                    new Transport.Callbacks() {
                        @Override
                        public void onResponse(TransportResponse response) {
                            handleResponse(inFlight, response);
                        }

                        @Override
                        public void onExceptionThrown(Throwable t) {
                            handleException(inFlight, t);
                        }
                    });
        } catch (RuntimeException e) {
            handleException(inFlight, e);
            return id;
        }
        inFlight.attach(call);
        return id;
    }

    private void handleResponse(InFlightRequest request, TransportResponse response) {
        if(!registry.deregister(request)) return; //cancelled; callers already know

        Result<Object> result;
        if(!response.isSuccess()) {
            result = Result.failure(request.getId(), new TransportException(response.getStatusCode(),
                    response.getBodyString()), response.getStatusCode(), response.getHeaders());
        } else {
            try {
                Object decoded = request.getResponseType().decode(response.getBody());
                cache.put(request.getCacheName(), decoded, request.getResponseType(), request.getCachingPolicy());
                result = Result.success(request.getId(), decoded, response.getStatusCode(), response.getHeaders());
            } catch (DecodingException e) {
                result = Result.failure(request.getId(), e, response.getStatusCode(), response.getHeaders());
            }
        }
        request.deliver(result);
    }

    private void handleException(InFlightRequest request, Throwable t) {
        if(!registry.deregister(request)) return;
        logger.debug("{} failed", request, t);
        String message = t instanceof IOException ? "Network error: " + t.getMessage() : "Request failed: " + t;
        request.deliver(Result.failure(request.getId(), new TransportException(message, t)));
    }

    /**
     * Cancel the request registered under the identifier.
     * @see RequestRegistry#cancel(String)
     */
    public boolean cancel(String id) {
        return registry.cancel(id);
    }

    public int cancelAll() {
        return registry.cancelAll();
    }

    public RequestRegistry getRegistry() {
        return registry;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public CacheStore getCache() {
        return cache;
    }

    public Transport getTransport() {
        return transport;
    }

    void setCache(CacheStore cache) {
        this.cache = cache;
    }

    void setDelivery(Executor delivery) {
        this.delivery = delivery;
    }

    void setDefaultHeader(String name, String value) {
        synchronized (defaultHeaders) {
            if(value == null) defaultHeaders.removeHeader(name);
            else defaultHeaders.setHeader(name, value);
        }
    }

    private void post(Completion<Object> completion, Result<Object> result) {
        try {
            deliver(() -> completion.onCompleted(result));
        } catch (RejectedExecutionException e) {
            logger.warn("Delivery executor is shut down, dropping {}", result);
        }
    }

    /**
     * Runs the task on the delivery executor set at this moment, not the one set when the request was
     * dispatched. If the executor is replaced (and the old one shut down) while submitting, the task
     * goes to the new one.
     */
    private void deliver(Runnable task) {
        Executor executor = delivery;
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            Executor current = delivery;
            if(current == executor) throw e;
            current.execute(task);
        }
    }

    private void ensureOpen() {
        if(closed) throw new IllegalStateException("Cannot use closed client!");
    }

    /**
     * Cancels everything in flight and closes the transport. Results of cancelled requests are still delivered.
     */
    public void close() {
        if(closed) return;
        closed = true;
        int cancelled = registry.cancelAll();
        if(cancelled > 0) logger.debug("Cancelled {} requests on close", cancelled);
        try {
            transport.close();
        } catch (IOException e) {
            logger.warn("Cannot close transport", e);
        }
    }
}
