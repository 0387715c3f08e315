package slackauth.domain.exceptionhandling;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jspecify.annotations.Nullable;
import slackauth.domain.exceptions.ExternalException;

/**
 * Renders a failed sign in for the log. Problems talking to Slack always get the full stack trace so the
 * failing endpoint can be traced, while rejected requests log a single line unless stack traces are
 * switched on with slackauth.exceptions.printstacktrace.
 */
@ApplicationScoped
public class LoggingExceptionHandler implements ExceptionHandler {

    @Inject
    @ConfigProperty(name = "slackauth.exceptions.printstacktrace", defaultValue = "false")
    private boolean alwaysPrintStackTrace;

    @Override
    public String getExceptionMessage(@Nullable final Throwable e) {
        if (e == null) {
            return "Exception was null";
        }

        final boolean wantsTrace = alwaysPrintStackTrace || e instanceof ExternalException;
        if (wantsTrace) {
            return ExceptionUtils.getStackTrace(e);
        }

        return StringUtils.defaultIfBlank(e.getMessage(), e.toString());
    }
}
