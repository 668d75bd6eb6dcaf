package rs.lukaj.networking.connections;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rs.lukaj.networking.Utils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * {@link Transport} backed by {@link HttpClient} from the standard library. Requests are executed on a
 * cached thread pool owned by this transport, which is shut down on {@link #close()}.
 */
public class JdkTransport implements Transport {
    private static final Logger logger = LoggerFactory.getLogger(JdkTransport.class);
    //HttpClient refuses to set these itself
    private static final Set<String> restrictedHeaders = Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final ExecutorService executor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "networking-transport");
        thread.setDaemon(true);
        return thread;
    });
    private final HttpClient client;
    private final Duration requestTimeout;

    public JdkTransport(Duration connectTimeout, Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .executor(executor)
                .build();
    }

    @Override
    public TransportCall execute(Http.Verb verb, URI url, Headers headers, byte[] body, Callbacks callbacks) {
        HttpRequest request;
        try {
            request = buildRequest(verb, url, headers, body);
        } catch (IllegalArgumentException e) {
            callbacks.onExceptionThrown(e);
            return TransportCall.DONE;
        }
        CompletableFuture<HttpResponse<byte[]>> future = client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        future.whenComplete((response, ex) -> {
            if(ex != null) {
                Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                if(cause instanceof CancellationException) logger.debug("{} {} cancelled", verb, url);
                callbacks.onExceptionThrown(cause);
                return;
            }
            try {
                callbacks.onResponse(toTransportResponse(response));
            } catch (IOException e) {
                callbacks.onExceptionThrown(e);
            }
        });
        return () -> future.cancel(true);
    }

    private HttpRequest buildRequest(Http.Verb verb, URI url, Headers headers, byte[] body) {
        HttpRequest.BodyPublisher publisher = body == null ? HttpRequest.BodyPublishers.noBody()
                                                           : HttpRequest.BodyPublishers.ofByteArray(body);
        HttpRequest.Builder builder = HttpRequest.newBuilder(url)
                .method(verb.toString(), publisher)
                .timeout(requestTimeout)
                .header("Accept-Encoding", "gzip, deflate");
        for(Map.Entry<String, String> header : headers.asMap().entrySet()) {
            if(restrictedHeaders.contains(header.getKey())) {
                logger.warn("Ignoring restricted header {}", header.getKey());
                continue;
            }
            builder.setHeader(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private static TransportResponse toTransportResponse(HttpResponse<byte[]> response) throws IOException {
        Headers headers = new Headers();
        for(Map.Entry<String, List<String>> header : response.headers().map().entrySet()) {
            for(String value : header.getValue()) headers.appendHeader(header.getKey(), value);
        }
        byte[] body = Utils.decompress(response.body(), headers.getContentEncoding());
        return new TransportResponse(response.statusCode(), headers, body);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
