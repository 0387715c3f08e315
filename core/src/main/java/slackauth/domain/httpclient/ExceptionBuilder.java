package slackauth.domain.httpclient;

@FunctionalInterface
public interface ExceptionBuilder {
    RuntimeException buildException(Throwable cause);
}
