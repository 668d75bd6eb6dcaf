package rs.lukaj.networking.client;

/**
 * Continuation of a request. Called exactly once per dispatched request, on the client's delivery
 * executor, with either the decoded response or the failure.
 * @param <T> type of the decoded response
 */
public interface Completion<T> {
    void onCompleted(Result<T> result);
}
