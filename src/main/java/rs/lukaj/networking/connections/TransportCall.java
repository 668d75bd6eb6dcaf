package rs.lukaj.networking.connections;

/**
 * Handle to a request started by {@link Transport#execute}.
 */
public interface TransportCall {
    /**
     * Aborts the request if it's still running. Calling this on a finished call does nothing.
     */
    void cancel();

    /**
     * A call which is already done, or never needed the network.
     */
    TransportCall DONE = () -> {};
}
