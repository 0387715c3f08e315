package slackauth.domain.exceptionhandling;

import io.vavr.API;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import slackauth.domain.exceptions.ExternalException;
import slackauth.domain.exceptions.ExternalFailure;
import slackauth.domain.exceptions.InternalException;
import slackauth.domain.exceptions.InternalFailure;

import java.io.IOException;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Predicates.instanceOf;

/**
 * Maps unexpected exceptions to either InternalFailure or ExternalFailure.
 * Exceptions that already carry one of the marker interfaces pass through untouched, so
 * callers can still recover specific types like ProviderDenied.
 */
@ApplicationScoped
public class StandardExceptionMapping implements ExceptionMapping {
    @Override
    public <T> Try<T> map(final Try<T> result) {
        checkNotNull(result);

        return result.mapFailure(
                API.Case(API.$(instanceOf(InternalException.class)), throwable -> throwable),
                API.Case(API.$(instanceOf(ExternalException.class)), throwable -> throwable),
                // Network errors surfacing from the HTTP client are transient.
                API.Case(API.$(instanceOf(IOException.class)), throwable -> new ExternalFailure(throwable)),
                API.Case(API.$(), throwable -> new InternalFailure(throwable)));
    }
}
