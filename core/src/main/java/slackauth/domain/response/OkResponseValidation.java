package slackauth.domain.response;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;
import slackauth.domain.exceptions.InvalidResponse;

/**
 * Accepts any 2xx status. Slack reports most API errors as 200 with {@code "ok": false}, which is left to
 * the caller to inspect.
 */
@ApplicationScoped
public class OkResponseValidation implements ResponseValidation {
    private static final String NO_BODY = "No response body available";

    @Override
    public Response validate(final Response response, final String uri) {
        if (response.getStatusInfo().getFamily() == Response.Status.Family.SUCCESSFUL) {
            return response;
        }

        final int status = response.getStatus();
        final String body = Try.of(() -> response.readEntity(String.class)).getOrElse(NO_BODY);
        throw new InvalidResponse(uri + " returned HTTP " + status + " (expected 2xx). " + body, body, status);
    }
}
