package rs.lukaj.networking.connections;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class FakingTransportTest {
    private static final URI USERS = URI.create("https://api.example.com/users");

    @Test
    public void servesFakeIgnoringQuery() {
        ScriptedTransport network = new ScriptedTransport();
        FakingTransport transport = new FakingTransport(network);
        transport.fake(Http.Verb.GET, USERS, new TransportResponse(200, new Headers(), "[]".getBytes(StandardCharsets.UTF_8)));

        AtomicReference<TransportResponse> received = new AtomicReference<>();
        TransportCall call = transport.execute(Http.Verb.GET, URI.create(USERS + "?page=2"), new Headers(), null,
                new Transport.Callbacks() {
                    @Override
                    public void onResponse(TransportResponse response) {
                        received.set(response);
                    }

                    @Override
                    public void onExceptionThrown(Throwable t) {
                        fail(t);
                    }
                });

        assertSame(TransportCall.DONE, call);
        assertEquals(200, received.get().getStatusCode());
        assertEquals("[]", received.get().getBodyString());
        assertEquals(0, network.getCallCount());
    }

    @Test
    public void otherRequestsGoToDelegate() {
        ScriptedTransport network = new ScriptedTransport().respondWith(201, "{}");
        FakingTransport transport = new FakingTransport(network);
        transport.fake(Http.Verb.GET, USERS, new TransportResponse(200, new Headers(), new byte[0]));

        AtomicReference<TransportResponse> received = new AtomicReference<>();
        transport.execute(Http.Verb.POST, USERS, new Headers(), new byte[]{1}, new Transport.Callbacks() {
            @Override
            public void onResponse(TransportResponse response) {
                received.set(response);
            }

            @Override
            public void onExceptionThrown(Throwable t) {
                fail(t);
            }
        });

        assertEquals(201, received.get().getStatusCode());
        assertEquals(1, network.getCallCount());
        assertEquals(Http.Verb.POST, network.getLastCall().verb);
    }

    @Test
    public void removeAndClose() throws Exception {
        ScriptedTransport network = new ScriptedTransport();
        FakingTransport transport = new FakingTransport(network);
        transport.fake(Http.Verb.DELETE, USERS, new TransportResponse(204, new Headers(), new byte[0]));
        assertTrue(transport.hasFake(Http.Verb.DELETE, USERS));
        assertFalse(transport.hasFake(Http.Verb.GET, USERS));

        assertTrue(transport.removeFake(Http.Verb.DELETE, USERS));
        assertFalse(transport.removeFake(Http.Verb.DELETE, USERS));

        transport.fake(Http.Verb.DELETE, USERS, new TransportResponse(204, new Headers(), new byte[0]));
        transport.close();
        assertTrue(network.isClosed());
        assertFalse(transport.hasFake(Http.Verb.DELETE, USERS));
    }
}
