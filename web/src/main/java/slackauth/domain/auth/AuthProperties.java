package slackauth.domain.auth;

import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The values that travel with a single login attempt. They are serialized into the OAuth state
 * parameter by the challenge and recovered from it by the callback.
 * <p>
 * Everything, including the redirect target, lives in the item map, so the map alone is what gets
 * protected and restored.
 */
public class AuthProperties {
    public static final String REDIRECT_URI_KEY = ".redirect";

    private final Map<String, String> items;

    public AuthProperties() {
        this(new LinkedHashMap<>());
    }

    public AuthProperties(final Map<String, String> items) {
        this.items = new LinkedHashMap<>(Objects.requireNonNull(items));
    }

    /**
     * The live item map. Changes made through it are visible to the properties.
     */
    public Map<String, String> getItems() {
        return items;
    }

    @Nullable
    public String getRedirectUri() {
        return items.get(REDIRECT_URI_KEY);
    }

    public void setRedirectUri(@Nullable final String redirectUri) {
        if (redirectUri == null) {
            items.remove(REDIRECT_URI_KEY);
        } else {
            items.put(REDIRECT_URI_KEY, redirectUri);
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AuthProperties)) {
            return false;
        }
        return items.equals(((AuthProperties) o).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return "AuthProperties" + items.keySet();
    }
}
