package slackauth.domain.exceptionhandling;

import io.vavr.control.Try;
import org.junit.jupiter.api.Test;
import slackauth.domain.exceptions.ExternalFailure;
import slackauth.domain.exceptions.InternalFailure;
import slackauth.domain.exceptions.ProviderDenied;
import slackauth.domain.exceptions.Timeout;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;

class StandardExceptionMappingTest {
    private final StandardExceptionMapping mapping = new StandardExceptionMapping();

    @Test
    void successPassesThrough() {
        assertEquals("value", mapping.map(Try.success("value")).get());
    }

    @Test
    void markedExceptionsAreUnchanged() {
        final ProviderDenied denied = new ProviderDenied("access_denied");
        final Timeout timeout = new Timeout("slow");

        assertSame(denied, mapping.map(Try.failure(denied)).getCause());
        assertSame(timeout, mapping.map(Try.failure(timeout)).getCause());
    }

    @Test
    void ioExceptionsAreExternal() {
        final Throwable mapped = mapping.map(Try.failure(new IOException("reset"))).getCause();

        assertInstanceOf(ExternalFailure.class, mapped);
        assertInstanceOf(IOException.class, mapped.getCause());
    }

    @Test
    void everythingElseIsInternal() {
        final Throwable mapped = mapping.map(Try.failure(new IllegalStateException("bug"))).getCause();

        assertInstanceOf(InternalFailure.class, mapped);
        assertInstanceOf(IllegalStateException.class, mapped.getCause());
    }
}
