package slackauth.domain.exceptionhandling;

/**
 * Renders exceptions into messages suitable for the log.
 */
public interface ExceptionHandler {
    String getExceptionMessage(Throwable e);
}
