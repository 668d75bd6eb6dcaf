package rs.lukaj.networking.client;

import rs.lukaj.networking.ResponseType;
import rs.lukaj.networking.cache.CachingPolicy;
import rs.lukaj.networking.connections.Http;
import rs.lukaj.networking.params.FormDataPart;
import rs.lukaj.networking.params.ParameterType;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Builds a network request. Requests are always executed in the background; this provides a way to
 * wait for them using callbacks ({@link #async(Completion)}) or by blocking the current thread
 * ({@link #blocking(Duration)}). Avoid making blocking requests on UI thread at all costs.
 * <br/>
 * All methods allow chaining.
 * @param <T> type of the decoded response; must match the {@link ResponseType}
 */
public class NetworkRequestBuilder<T> {
    private final Dispatcher dispatcher;
    private final Http.Verb verb;
    private final String path;
    private final ResponseType responseType;

    private ParameterType parameterType = ParameterType.JSON;
    private Object parameters;
    private final List<FormDataPart> parts = new ArrayList<>();
    private String cacheName;
    private CachingPolicy cachingPolicy = CachingPolicy.NONE;

    public NetworkRequestBuilder(Dispatcher dispatcher, Http.Verb verb, String path, ResponseType responseType) {
        this.dispatcher = dispatcher;
        this.verb = verb;
        this.path = path;
        this.responseType = responseType;
        if(verb.sendsParametersInUrl()) parameterType = ParameterType.FORM_URL_ENCODED;
    }

    /**
     * Sets parameters of the request, encoded according to the parameter type. Accepts maps with string
     * keys, lists, arrays, strings, numbers, booleans, Jackson trees and {@link FormDataPart}s, nested freely
     * (as far as the parameter type allows).
     */
    public NetworkRequestBuilder<T> sendParameters(Object parameters) {
        this.parameters = parameters;
        return this;
    }

    /**
     * Sets how parameters are encoded. Defaults to form for GET and DELETE and to JSON otherwise.
     * Ignored if any parts are added.
     */
    public NetworkRequestBuilder<T> setParameterType(ParameterType parameterType) {
        this.parameterType = parameterType;
        return this;
    }

    /**
     * Adds a part to a multipart request. Adding parts makes the request multipart, regardless of the
     * parameter type.
     */
    public NetworkRequestBuilder<T> addPart(FormDataPart part) {
        this.parts.add(part);
        return this;
    }

    public NetworkRequestBuilder<T> addParts(List<FormDataPart> parts) {
        if(parts != null) this.parts.addAll(parts);
        return this;
    }

    /**
     * Sets name under which the response is cached. By default, it's the path.
     */
    public NetworkRequestBuilder<T> setCacheName(String cacheName) {
        this.cacheName = cacheName;
        return this;
    }

    public NetworkRequestBuilder<T> setCachingPolicy(CachingPolicy cachingPolicy) {
        this.cachingPolicy = cachingPolicy;
        return this;
    }

    public RequestDescriptor build() {
        return new RequestDescriptor(verb, path, cacheName, parameterType, parameters, parts, responseType, cachingPolicy);
    }

    /**
     * Executes this request asynchronously and notifies completion of the outcome.
     * @param completion called once request is done
     * @return request identifier
     */
    public String async(Completion<T> completion) {
        return dispatcher.dispatch(build(), completion);
    }

    /**
     * Executes this request in a blocking fashion, but on a separate thread. Nonetheless, current thread
     * will be blocked for the duration. If request isn't finished before the timeout is reached,
     * TimeoutException is thrown and the request is left running.
     * @param timeout maximum time to wait
     * @return result of the request
     * @throws TimeoutException timeout has been reached, and request hasn't completed
     * @throws InterruptedException thread has been interrupted while waiting
     */
    public Result<T> blocking(Duration timeout) throws TimeoutException, InterruptedException {
        CompletableFuture<Result<T>> future = new CompletableFuture<>();
        async(future::complete);
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            //future is only ever completed normally
            throw new IllegalStateException(e.getCause());
        }
    }
}
