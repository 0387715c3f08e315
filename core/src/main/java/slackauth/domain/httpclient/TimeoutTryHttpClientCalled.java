package slackauth.domain.httpclient;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import slackauth.domain.timeout.TimeoutFunctionCallback;
import slackauth.domain.timeout.TimeoutService;
import slackauth.domain.tryext.TryExtensions;

/**
 * Runs one backchannel request to Slack on a fresh client, closing the client and the response before
 * returning. The whole exchange is bounded by the timeout.
 */
@ApplicationScoped
public class TimeoutTryHttpClientCalled implements TimeoutHttpClientCaller {

    @Inject
    private TimeoutService timeoutService;

    @Override
    public <T> T call(
            final ClientBuilder builder,
            final ClientCallback callback,
            final ResponseCallback<T> responseCallback,
            final ExceptionBuilder exceptionBuilder,
            final TimeoutFunctionCallback<T> timeoutCallback,
            final long timeoutSeconds) {
        return timeoutService.executeWithTimeout(
                () -> exchange(builder, callback, responseCallback, exceptionBuilder),
                timeoutCallback,
                timeoutSeconds);
    }

    private <T> T exchange(
            final ClientBuilder builder,
            final ClientCallback callback,
            final ResponseCallback<T> responseCallback,
            final ExceptionBuilder exceptionBuilder) {
        // JAX-RS clients are not shared between threads
        return TryExtensions.withResources(builder::buildClient, callback::call, responseCallback::handleResponse)
                .getOrElseThrow(exceptionBuilder::buildException);
    }
}
