package slackauth.domain.exceptionhandling;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import slackauth.domain.exceptions.CsrfValidationFailed;
import slackauth.domain.exceptions.TokenExchangeFailed;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(LoggingExceptionHandler.class)
class LoggingExceptionHandlerTest {
    @Inject
    private LoggingExceptionHandler exceptionHandler;

    @BeforeEach
    void updateConfig() {
        final var configSource = new PropertiesConfigSource(
                Map.of("slackauth.exceptions.printstacktrace", "false"),
                "TestConfig",
                Integer.MAX_VALUE
        );
        final Config newConfig = new SmallRyeConfigBuilder()
                .withSources(configSource)
                .build();

        final var configProviderResolver = ConfigProviderResolver.instance();
        final var oldConfig = configProviderResolver.getConfig();

        configProviderResolver.releaseConfig(oldConfig);
        configProviderResolver.registerConfig(
                newConfig,
                Thread.currentThread().getContextClassLoader()
        );
    }

    @Test
    void internalExceptionsReturnTheMessage() {
        assertEquals("mismatch", exceptionHandler.getExceptionMessage(new CsrfValidationFailed("mismatch")));
    }

    @Test
    void externalExceptionsReturnTheStackTrace() {
        final String message = exceptionHandler.getExceptionMessage(new TokenExchangeFailed("invalid_code"));

        assertTrue(message.contains(TokenExchangeFailed.class.getName()));
        assertTrue(message.contains("\tat "));
    }

    @Test
    void blankMessagesFallBackToTheExceptionName() {
        assertEquals(IllegalStateException.class.getName(),
                exceptionHandler.getExceptionMessage(new IllegalStateException()));
    }

    @Test
    void nullException() {
        assertEquals("Exception was null", exceptionHandler.getExceptionMessage(null));
    }
}
