/**
 * Classes meant to be used by the programmer to initiate network requests.
 * <br/>
 * <h3>Overview</h3>
 * {@link rs.lukaj.networking.client.Networking} is the entry point. It owns one transport, one cache and
 * one registry of requests in flight, and offers a method per HTTP verb, image and data downloads,
 * cache lookups and fake responses.
 * <br/>
 * {@link rs.lukaj.networking.client.NetworkRequestBuilder} builds a single request, for everything the
 * convenience methods don't cover, and runs it either with a {@link rs.lukaj.networking.client.Completion}
 * or blocking the current thread.
 * <br/>
 * {@link rs.lukaj.networking.client.Dispatcher} does the actual work: cache lookup, encoding, execution,
 * decoding and delivery of the {@link rs.lukaj.networking.client.Result}.
 * <br/>
 * {@link rs.lukaj.networking.client.RequestRegistry} knows which requests are in flight and cancels them.
 * Cancelled requests complete with {@link rs.lukaj.networking.CancelledException}, exactly once, and never
 * with the response that may still arrive.
 */
package rs.lukaj.networking.client;
