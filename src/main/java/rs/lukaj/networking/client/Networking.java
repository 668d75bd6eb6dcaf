package rs.lukaj.networking.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rs.lukaj.networking.InvalidConfigException;
import rs.lukaj.networking.MalformedPathException;
import rs.lukaj.networking.ResponseType;
import rs.lukaj.networking.Utils;
import rs.lukaj.networking.cache.CacheStore;
import rs.lukaj.networking.cache.CachingPolicy;
import rs.lukaj.networking.cache.DiskCache;
import rs.lukaj.networking.cache.FileDiskCache;
import rs.lukaj.networking.connections.FakingTransport;
import rs.lukaj.networking.connections.Headers;
import rs.lukaj.networking.connections.Http;
import rs.lukaj.networking.connections.JdkTransport;
import rs.lukaj.networking.connections.Transport;
import rs.lukaj.networking.connections.TransportResponse;
import rs.lukaj.networking.connections.UrlComposer;
import rs.lukaj.networking.params.FormDataPart;
import rs.lukaj.networking.params.ParameterEncoder;
import rs.lukaj.networking.params.ParameterType;

import java.awt.image.BufferedImage;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Top-level class for making HTTP requests. There is one transport, one cache and one registry of
 * requests in flight per client; they live as long as the client does and are released by {@link #close()}.
 * <br/>
 * Every request method returns the request identifier immediately and calls the completion later,
 * on the delivery executor (by default, a single background thread shared by all requests of this client).
 * <br/>
 * Example with default values:
 * <br/>
 * <pre>
 *     Networking networking = Networking.create("https://api.example.com");
 *     networking.get("/users", result -&gt; {
 *         if(result.isSuccess()) show(result.getBody());
 *     });
 * </pre>
 * <br/>
 * More customized example:
 * <br/>
 * <pre>
 *     Networking.Config config = new Networking.Config();
 *     config.setRequestTimeout(Duration.ofSeconds(5));
 *     Networking networking = Networking.create("https://api.example.com", config)
 *                                       .withHeader("User-Agent", "my-app")
 *                                       .withCallbackExecutor(uiExecutor);
 *     networking.downloadImage("/avatars/1.png", result -&gt; ...);
 *     BufferedImage cached = networking.imageFromCache("/avatars/1.png");
 * </pre>
 */
public class Networking implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(Networking.class);

    private final Config config;
    private final FakingTransport fakes;
    private final Dispatcher dispatcher;
    private Transport ownTransport;
    private ExecutorService ownDelivery;

    private Networking(String baseUrl, Config config) {
        this.config = config;
        this.ownTransport = new JdkTransport(config.connectTimeout, config.requestTimeout);
        this.fakes = new FakingTransport(ownTransport);
        DiskCache disk = config.fileCacheEnabled ? new FileDiskCache(config.cacheDirectory) : new DiskCache.Empty();
        this.ownDelivery = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "networking-delivery");
            thread.setDaemon(true);
            return thread;
        });
        this.dispatcher = new Dispatcher(baseUrl, fakes, new CacheStore(disk), new ParameterEncoder(), ownDelivery);
    }

    /**
     * Create a client with default configuration.
     * @param baseUrl url which request paths are relative to; may be null if only absolute urls are used
     * @return a new client
     */
    public static Networking create(String baseUrl) {
        return new Networking(baseUrl, new Config());
    }

    public static Networking create(String baseUrl, Config config) {
        return new Networking(baseUrl, config);
    }

    /**
     * Set the transport used for all new requests. Registered fakes are kept. The default transport is closed
     * when replaced; closing any other is up to the caller. The new transport is closed along with the client.
     * @return this instance, to allow chaining
     */
    public Networking withTransport(Transport transport) {
        Transport old = fakes.getDelegate();
        fakes.setDelegate(transport);
        logger.debug("Transport {} replaced with {}", old.getClass().getSimpleName(), transport.getClass().getSimpleName());
        if(old == ownTransport) {
            ownTransport = null;
            try {
                old.close();
            } catch (IOException e) {
                logger.warn("Cannot close default transport", e);
            }
        }
        return this;
    }

    /**
     * Set the storage of the file cache tier. Objects cached in memory so far are dropped.
     * @return this instance, to allow chaining
     */
    public Networking withDiskCache(DiskCache diskCache) {
        dispatcher.setCache(new CacheStore(diskCache));
        return this;
    }

    /**
     * Set the executor on which completions are called, e.g. the UI thread. It should run tasks in order
     * of submission, one at a time. Requests already in flight complete on the new executor.
     * @return this instance, to allow chaining
     */
    public Networking withCallbackExecutor(Executor executor) {
        dispatcher.setDelivery(executor);
        if(ownDelivery != null) {
            ownDelivery.shutdown();
            ownDelivery = null;
        }
        return this;
    }

    /**
     * Add a header sent with every request. Null value removes the header.
     * @return this instance, to allow chaining
     */
    public Networking withHeader(String name, String value) {
        dispatcher.setDefaultHeader(name, value);
        return this;
    }

    public Config getConfig() {
        return config;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public CacheStore getCache() {
        return dispatcher.getCache();
    }

    /**
     * Create a builder for a custom request.
     * @param verb http method
     * @param path request path, relative to base url, or absolute
     * @param responseType what the response body should be decoded into; T should match it
     */
    public <T> NetworkRequestBuilder<T> newRequest(Http.Verb verb, String path, ResponseType responseType) {
        return new NetworkRequestBuilder<>(dispatcher, verb, path, responseType);
    }

    // ===== GET =====

    public String get(String path, Completion<JsonNode> completion) {
        return get(path, null, CachingPolicy.NONE, completion);
    }

    public String get(String path, Object parameters, Completion<JsonNode> completion) {
        return get(path, parameters, CachingPolicy.NONE, completion);
    }

    /**
     * GET request to the specified path.
     * @param path path of the request
     * @param parameters parameters, percent-encoded and appended to the url; may be null
     * @param cachingPolicy whether the response is looked up in and stored to cache
     * @param completion called with the result
     * @return request identifier
     */
    public String get(String path, Object parameters, CachingPolicy cachingPolicy, Completion<JsonNode> completion) {
        return this.<JsonNode>newRequest(Http.Verb.GET, path, ResponseType.JSON)
                .sendParameters(parameters)
                .setCachingPolicy(cachingPolicy)
                .async(completion);
    }

    /**
     * Cancels the GET request for the specified path. This causes the request to complete with
     * {@link rs.lukaj.networking.CancelledException}.
     * @return true if a request was in flight
     */
    public boolean cancelGET(String path) {
        return cancel(Http.Verb.GET, path);
    }

    // ===== POST =====

    public String post(String path, Object parameters, Completion<JsonNode> completion) {
        return post(path, ParameterType.JSON, parameters, completion);
    }

    /**
     * POST request to the specified path, using the provided parameters.
     * @param path path of the request
     * @param parameterType how parameters are encoded
     * @param parameters parameters; may be null
     * @param completion called with the result
     * @return request identifier
     */
    public String post(String path, ParameterType parameterType, Object parameters, Completion<JsonNode> completion) {
        return send(Http.Verb.POST, path, parameterType, parameters, completion);
    }

    /**
     * Multipart POST request, sending parameters as form fields along with the parts.
     * @param path path of the request
     * @param parameters scalar form fields; may be null
     * @param parts binary parts
     * @param completion called with the result
     * @return request identifier
     */
    public String post(String path, Object parameters, List<FormDataPart> parts, Completion<JsonNode> completion) {
        return this.<JsonNode>newRequest(Http.Verb.POST, path, ResponseType.JSON)
                .setParameterType(ParameterType.MULTIPART_FORM_DATA)
                .sendParameters(parameters)
                .addParts(parts)
                .async(completion);
    }

    public boolean cancelPOST(String path) {
        return cancel(Http.Verb.POST, path);
    }

    // ===== PUT =====

    public String put(String path, Object parameters, Completion<JsonNode> completion) {
        return put(path, ParameterType.JSON, parameters, completion);
    }

    public String put(String path, ParameterType parameterType, Object parameters, Completion<JsonNode> completion) {
        return send(Http.Verb.PUT, path, parameterType, parameters, completion);
    }

    public boolean cancelPUT(String path) {
        return cancel(Http.Verb.PUT, path);
    }

    // ===== PATCH =====

    public String patch(String path, Object parameters, Completion<JsonNode> completion) {
        return patch(path, ParameterType.JSON, parameters, completion);
    }

    public String patch(String path, ParameterType parameterType, Object parameters, Completion<JsonNode> completion) {
        return send(Http.Verb.PATCH, path, parameterType, parameters, completion);
    }

    public boolean cancelPATCH(String path) {
        return cancel(Http.Verb.PATCH, path);
    }

    // ===== DELETE =====

    public String delete(String path, Completion<JsonNode> completion) {
        return delete(path, null, completion);
    }

    /**
     * DELETE request to the specified path.
     * @param path path of the request
     * @param parameters parameters, percent-encoded and appended to the url; may be null
     * @param completion called with the result
     * @return request identifier
     */
    public String delete(String path, Object parameters, Completion<JsonNode> completion) {
        return this.<JsonNode>newRequest(Http.Verb.DELETE, path, ResponseType.JSON)
                .sendParameters(parameters)
                .async(completion);
    }

    public boolean cancelDELETE(String path) {
        return cancel(Http.Verb.DELETE, path);
    }

    // ===== Downloads =====

    public String downloadImage(String path, Completion<BufferedImage> completion) {
        return downloadImage(path, null, CachingPolicy.MEMORY_AND_FILE, completion);
    }

    /**
     * Downloads an image, or takes it from the cache if it's there.
     * @param path path of the image
     * @param cacheName name under which the image is cached; path if null
     * @param cachingPolicy cache tiers to use
     * @param completion called with the result
     * @return request identifier
     */
    public String downloadImage(String path, String cacheName, CachingPolicy cachingPolicy,
                                Completion<BufferedImage> completion) {
        return download(path, cacheName, cachingPolicy, ResponseType.IMAGE, completion);
    }

    public boolean cancelImageDownload(String path) {
        return cancel(Http.Verb.GET, path);
    }

    /**
     * Retrieves an image from memory or file cache, without going to the network. The returned image is
     * the cached instance itself, shared with later lookups; don't modify it.
     * @param path path the image was downloaded from
     * @return the cached image, or null if there is none
     */
    public BufferedImage imageFromCache(String path) {
        return imageFromCache(path, null);
    }

    public BufferedImage imageFromCache(String path, String cacheName) {
        return (BufferedImage) getCache().get(cacheName == null ? path : cacheName, ResponseType.IMAGE);
    }

    public String downloadData(String path, Completion<byte[]> completion) {
        return downloadData(path, null, CachingPolicy.MEMORY_AND_FILE, completion);
    }

    /**
     * Downloads raw data, or takes it from the cache if it's there.
     * @param path path of the resource
     * @param cacheName name under which the data is cached; path if null
     * @param cachingPolicy cache tiers to use
     * @param completion called with the result
     * @return request identifier
     */
    public String downloadData(String path, String cacheName, CachingPolicy cachingPolicy, Completion<byte[]> completion) {
        return download(path, cacheName, cachingPolicy, ResponseType.DATA, completion);
    }

    public boolean cancelDataDownload(String path) {
        return cancel(Http.Verb.GET, path);
    }

    /**
     * Retrieves data from memory or file cache, without going to the network. The returned array is the
     * cached instance itself, shared with later lookups; don't modify it.
     * @param path path the data was downloaded from
     * @return the cached data, or null if there is none
     */
    public byte[] dataFromCache(String path) {
        return dataFromCache(path, null);
    }

    public byte[] dataFromCache(String path, String cacheName) {
        return (byte[]) getCache().get(cacheName == null ? path : cacheName, ResponseType.DATA);
    }

    // ===== Fakes =====

    /**
     * Makes every request with this method and path return the given JSON instead of going to the network.
     * @param json object serialized as response body
     * @throws IllegalArgumentException if path is malformed or json can't be serialized
     */
    public void fake(Http.Verb verb, String path, int statusCode, Object json) {
        byte[] body;
        try {
            body = Utils.jsonMapper().writeValueAsBytes(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize fake response", e);
        }
        fake(verb, path, new TransportResponse(statusCode, new Headers().setHeader("Content-Type", "application/json"), body));
    }

    public void fakeImageDownload(String path, byte[] image) {
        fake(Http.Verb.GET, path, new TransportResponse(200, new Headers(), image));
    }

    public void fake(Http.Verb verb, String path, TransportResponse response) {
        fakes.fake(verb, composeOrThrow(path), response);
    }

    public boolean removeFake(Http.Verb verb, String path) {
        return fakes.removeFake(verb, composeOrThrow(path));
    }

    // ===== Cache and lifecycle =====

    /**
     * Removes the object cached under the name (path, unless a custom cache name was used) from all tiers.
     */
    public void invalidateCache(String cacheName) {
        getCache().invalidate(cacheName);
    }

    public void clearMemoryCache() {
        getCache().clearMemory();
    }

    public void clearCache() {
        getCache().clear();
    }

    /**
     * Cancels every request in flight.
     * @return number of cancelled requests
     */
    public int cancelAllRequests() {
        return dispatcher.cancelAll();
    }

    /**
     * Cancels requests in flight and releases the transport. Completions of the cancelled requests are
     * still called. Client can't be used afterwards.
     */
    @Override
    public void close() {
        dispatcher.close();
        if(ownDelivery != null) ownDelivery.shutdown();
        getCache().clearMemory();
    }

    private String send(Http.Verb verb, String path, ParameterType parameterType, Object parameters,
                        Completion<JsonNode> completion) {
        return this.<JsonNode>newRequest(verb, path, ResponseType.JSON)
                .setParameterType(parameterType)
                .sendParameters(parameters)
                .async(completion);
    }

    private <T> String download(String path, String cacheName, CachingPolicy cachingPolicy, ResponseType type,
                                Completion<T> completion) {
        return this.<T>newRequest(Http.Verb.GET, path, type)
                .setParameterType(ParameterType.NONE)
                .setCacheName(cacheName)
                .setCachingPolicy(cachingPolicy)
                .async(completion);
    }

    private boolean cancel(Http.Verb verb, String path) {
        URI url;
        try {
            url = UrlComposer.compose(dispatcher.getBaseUrl(), path);
        } catch (MalformedPathException e) {
            logger.warn("Nothing to cancel for malformed path {}", path, e);
            return false;
        }
        return dispatcher.cancel(RequestRegistry.identifierFor(verb, url));
    }

    private URI composeOrThrow(String path) {
        try {
            return UrlComposer.compose(dispatcher.getBaseUrl(), path);
        } catch (MalformedPathException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }


    /**
     * Configuration of a client. Values are read when the client is created.
     */
    public static class Config {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private File cacheDirectory = new File(System.getProperty("java.io.tmpdir"), "networking-cache");
        private boolean fileCacheEnabled = true;

        public Config() {
        }

        /**
         * Sets maximum time for establishing a connection to the server.
         * @param connectTimeout maximum connect time
         */
        public void setConnectTimeout(Duration connectTimeout) {
            if(connectTimeout.isNegative() || connectTimeout.isZero()) throw new InvalidConfigException("connectTimeout must be positive!");
            this.connectTimeout = connectTimeout;
        }

        /**
         * Sets maximum time from sending the request to receiving the response. Requests exceeding it fail
         * with {@link rs.lukaj.networking.TransportException}.
         * @param requestTimeout maximum request time
         */
        public void setRequestTimeout(Duration requestTimeout) {
            if(requestTimeout.isNegative() || requestTimeout.isZero()) throw new InvalidConfigException("requestTimeout must be positive!");
            this.requestTimeout = requestTimeout;
        }

        /**
         * Sets directory of the file cache. It's created when the first entry is written.
         * @param cacheDirectory root of the file cache
         */
        public void setCacheDirectory(File cacheDirectory) {
            if(cacheDirectory == null) throw new InvalidConfigException("cacheDirectory can't be null!");
            if(cacheDirectory.exists() && !cacheDirectory.isDirectory())
                throw new InvalidConfigException(cacheDirectory + " is not a directory!");
            this.cacheDirectory = cacheDirectory;
        }

        /**
         * If disabled, {@link CachingPolicy#MEMORY_AND_FILE} behaves as {@link CachingPolicy#MEMORY}.
         */
        public void setFileCacheEnabled(boolean fileCacheEnabled) {
            this.fileCacheEnabled = fileCacheEnabled;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public File getCacheDirectory() {
            return cacheDirectory;
        }

        public boolean isFileCacheEnabled() {
            return fileCacheEnabled;
        }
    }
}
