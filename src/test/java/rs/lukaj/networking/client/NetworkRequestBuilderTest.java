package rs.lukaj.networking.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import rs.lukaj.networking.ResponseType;
import rs.lukaj.networking.cache.CachingPolicy;
import rs.lukaj.networking.connections.Http;
import rs.lukaj.networking.connections.ScriptedTransport;
import rs.lukaj.networking.params.FormDataPart;
import rs.lukaj.networking.params.ParameterType;

import java.io.File;
import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

public class NetworkRequestBuilderTest {
    @TempDir
    File cacheDir;

    private ScriptedTransport transport;
    private Networking networking;

    @BeforeEach
    public void setUp() {
        Networking.Config config = new Networking.Config();
        config.setCacheDirectory(cacheDir);
        transport = new ScriptedTransport();
        networking = Networking.create("https://api.example.com", config).withTransport(transport);
    }

    @AfterEach
    public void tearDown() {
        networking.close();
    }

    @Test
    public void defaults() {
        RequestDescriptor get = networking.newRequest(Http.Verb.GET, "/users", ResponseType.JSON).build();
        assertEquals(ParameterType.FORM_URL_ENCODED, get.getParameterType());
        assertEquals(CachingPolicy.NONE, get.getCachingPolicy());
        assertEquals("/users", get.getCacheName());
        assertTrue(get.getParts().isEmpty());

        RequestDescriptor post = networking.newRequest(Http.Verb.POST, "/users", ResponseType.JSON).build();
        assertEquals(ParameterType.JSON, post.getParameterType());
    }

    @Test
    public void customized() {
        RequestDescriptor request = networking.<byte[]>newRequest(Http.Verb.PATCH, "/files/1", ResponseType.DATA)
                .setParameterType(ParameterType.FORM_URL_ENCODED)
                .sendParameters(Collections.singletonMap("name", "x"))
                .addParts(Collections.singletonList(FormDataPart.png("file", null, new byte[]{1})))
                .setCacheName("file-1")
                .setCachingPolicy(CachingPolicy.MEMORY)
                .build();

        assertEquals(Http.Verb.PATCH, request.getVerb());
        assertEquals("file-1", request.getCacheName());
        assertEquals("/files/1", request.getPath());
        assertEquals(1, request.getParts().size());
        assertEquals(ResponseType.DATA, request.getResponseType());
        assertEquals(CachingPolicy.MEMORY, request.getCachingPolicy());
    }

    @Test
    public void blockingWaitsForResult() throws Exception {
        transport.respondWith(200, "{\"ok\":true}");
        Result<JsonNode> result = networking.<JsonNode>newRequest(Http.Verb.GET, "/status", ResponseType.JSON)
                .blocking(Duration.ofSeconds(5));
        assertTrue(result.isSuccess());
        assertTrue(result.getBody().get("ok").asBoolean());
    }

    @Test
    public void blockingTimesOut() throws Exception {
        assertThrows(TimeoutException.class, () -> networking.<JsonNode>newRequest(Http.Verb.GET, "/slow", ResponseType.JSON)
                .blocking(Duration.ofMillis(100)));
        //request is left running
        assertFalse(transport.awaitCall().isCancelled());
        assertTrue(networking.cancelGET("/slow"));
    }

    @Test
    public void completionRunsOnDeliveryThread() throws Exception {
        transport.respondWith(200, "[]");
        Thread caller = Thread.currentThread();
        CompletableFuture<Thread> deliveredOn = new CompletableFuture<>();
        networking.get("/users", result -> deliveredOn.complete(Thread.currentThread()));

        Thread delivery = deliveredOn.get(5, TimeUnit.SECONDS);
        assertNotSame(caller, delivery);
        assertEquals("networking-delivery", delivery.getName());
    }
}
