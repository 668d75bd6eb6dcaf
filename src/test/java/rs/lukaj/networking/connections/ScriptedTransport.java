package rs.lukaj.networking.connections;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Transport which never goes to the network. Every executed request is recorded and stays pending until
 * the test completes it, unless an automatic response is set.
 */
public class ScriptedTransport implements Transport {
    private final List<Call> calls = new ArrayList<>();
    private final BlockingQueue<Call> pending = new LinkedBlockingQueue<>();
    private volatile TransportResponse autoResponse;
    private volatile boolean closed = false;

    /**
     * Every following request is answered with this response as soon as it's executed.
     */
    public ScriptedTransport respondWith(int status, String body) {
        autoResponse = new TransportResponse(status, new Headers(), body.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    public ScriptedTransport respondWith(int status, byte[] body) {
        autoResponse = new TransportResponse(status, new Headers(), body);
        return this;
    }

    @Override
    public TransportCall execute(Http.Verb verb, URI url, Headers headers, byte[] body, Callbacks callbacks) {
        Call call = new Call(verb, url, headers, body, callbacks);
        synchronized (calls) {
            calls.add(call);
        }
        TransportResponse response = autoResponse;
        if(response != null) {
            call.respond(response);
        } else {
            pending.add(call);
        }
        return call::cancel;
    }

    /**
     * Waits for the next request which wasn't answered automatically.
     */
    public Call awaitCall() throws InterruptedException {
        Call call = pending.poll(5, TimeUnit.SECONDS);
        if(call == null) throw new AssertionError("No request made in 5 seconds");
        return call;
    }

    /**
     * Waits for the next request which wasn't answered automatically.
     * @return the request, or null if none was made in time
     */
    public Call pollCall(long millis) throws InterruptedException {
        return pending.poll(millis, TimeUnit.MILLISECONDS);
    }

    public int getCallCount() {
        synchronized (calls) {
            return calls.size();
        }
    }

    public Call getCall(int index) {
        synchronized (calls) {
            return calls.get(index);
        }
    }

    public Call getLastCall() {
        synchronized (calls) {
            return calls.get(calls.size() - 1);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }


    public static class Call {
        public final Http.Verb verb;
        public final URI url;
        public final Headers headers;
        public final byte[] body;
        private final Callbacks callbacks;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        private Call(Http.Verb verb, URI url, Headers headers, byte[] body, Callbacks callbacks) {
            this.verb = verb;
            this.url = url;
            this.headers = headers;
            this.body = body;
            this.callbacks = callbacks;
        }

        public void respond(int status, String body) {
            respond(new TransportResponse(status, new Headers(), body.getBytes(StandardCharsets.UTF_8)));
        }

        public void respond(TransportResponse response) {
            callbacks.onResponse(response);
        }

        public void fail(Throwable t) {
            callbacks.onExceptionThrown(t);
        }

        public String getBodyString() {
            return body == null ? null : new String(body, StandardCharsets.UTF_8);
        }

        public boolean isCancelled() {
            return cancelled.get();
        }

        private void cancel() {
            cancelled.set(true);
        }
    }
}
