package slackauth.domain.timeout;

public interface TimeoutService {
    /**
     * Runs the callback, returning the result of onTimeout if the callback has not completed within the timeout.
     * Exceptions thrown by the callback are rethrown as is.
     */
    <T> T executeWithTimeout(TimeoutFunctionCallback<T> callback, TimeoutFunctionCallback<T> onTimeout, long timeoutSeconds);
}
