package slackauth.domain.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vavr.Lazy;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import slackauth.domain.exceptions.DeserializationFailed;
import slackauth.domain.exceptions.SerializationFailed;

import java.util.Map;
import java.util.logging.Logger;

/**
 * Jackson backed JSON mapping. Slack adds fields to its responses over time, so unknown properties are
 * ignored, and absent optional values are left out of anything we write.
 */
@ApplicationScoped
public class JsonDeserializerJackson implements JsonDeserializer {
    // ObjectMapper is thread safe once configured
    private final Lazy<ObjectMapper> mapper = Lazy.of(JsonDeserializerJackson::buildMapper);

    @Inject
    private Logger logger;

    @Override
    public String serialize(final Object value) {
        return Try.of(() -> mapper.get().writeValueAsString(value))
                .onFailure(ex -> logger.warning("Could not write " + value.getClass().getSimpleName()
                        + " as JSON: " + ex.getMessage()))
                .getOrElseThrow(SerializationFailed::new);
    }

    @Override
    public <T> T deserialize(final String json, final Class<T> type) {
        return Try.of(() -> mapper.get().readValue(json, type))
                .onFailure(ex -> logger.warning("Could not read JSON as " + type.getSimpleName()
                        + ": " + ex.getMessage()))
                .getOrElseThrow(DeserializationFailed::new);
    }

    @Override
    public <U, V> Map<U, V> deserializeMap(final String json, final Class<U> keyType, final Class<V> valueType) {
        final JavaType mapType = mapper.get().getTypeFactory().constructMapType(Map.class, keyType, valueType);

        return Try.of(() -> mapper.get().<Map<U, V>>readValue(json, mapType))
                .onFailure(ex -> logger.warning("Could not read JSON as a map of " + keyType.getSimpleName()
                        + " to " + valueType.getSimpleName() + ": " + ex.getMessage()))
                .getOrElseThrow(DeserializationFailed::new);
    }

    private static ObjectMapper buildMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }
}
