package slackauth.domain.response;

import jakarta.ws.rs.core.Response;

public interface ResponseValidation {
    /**
     * Returns the response if it has a success status, otherwise throws.
     */
    Response validate(Response response, String uri);
}
