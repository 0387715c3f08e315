package slackauth.domain.json;

import java.util.Map;

/**
 * JSON mapping for Slack responses, the login properties carried in the state and the session cookie.
 * Failures surface as {@code SerializationFailed} or {@code DeserializationFailed}.
 */
public interface JsonDeserializer {
    String serialize(Object value);

    <T> T deserialize(String json, Class<T> type);

    /**
     * Reads a JSON object whose keys and values are all of a single type, such as the state properties.
     */
    <U, V> Map<U, V> deserializeMap(String json, Class<U> keyType, Class<V> valueType);
}
