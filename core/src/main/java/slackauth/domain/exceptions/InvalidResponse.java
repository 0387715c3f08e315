package slackauth.domain.exceptions;

/**
 * Slack answered with a non 2xx HTTP status. The status and body are kept so callers can report
 * which endpoint failed and how.
 */
public class InvalidResponse extends RuntimeException implements ExternalException {
    private final String body;
    private final int code;

    public InvalidResponse(final String message, final String body, final int code) {
        super(message);
        this.body = body;
        this.code = code;
    }

    public String getBody() {
        return body;
    }

    /**
     * The HTTP status Slack returned.
     */
    public int getCode() {
        return code;
    }
}
