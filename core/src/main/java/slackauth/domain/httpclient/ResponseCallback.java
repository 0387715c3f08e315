package slackauth.domain.httpclient;

import jakarta.ws.rs.core.Response;

/**
 * Turns the raw response into a result while the response is still open.
 */
@FunctionalInterface
public interface ResponseCallback<T> {
    T handleResponse(Response response);
}
