package slackauth.domain.httpclient;

import slackauth.domain.timeout.TimeoutFunctionCallback;

/**
 * Makes a single bounded HTTP request. The caller supplies how to build the client, what to send, how to
 * read the answer and how to wrap a failure; the timeout callback decides what happens when Slack is too slow.
 * Nothing is retried, since an authorization code can only be redeemed once.
 */
public interface TimeoutHttpClientCaller {
    <T> T call(ClientBuilder builder,
               ClientCallback callback,
               ResponseCallback<T> responseCallback,
               ExceptionBuilder exceptionBuilder,
               TimeoutFunctionCallback<T> timeoutCallback,
               long timeoutSeconds);
}
