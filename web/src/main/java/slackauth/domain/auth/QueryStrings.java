package slackauth.domain.auth;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

public final class QueryStrings {
    private QueryStrings() {
    }

    public static String addQueryString(final String uri, final String name, final String value) {
        return addQueryString(uri, Map.of(name, value));
    }

    /**
     * Appends the parameters in iteration order, keeping any query string and fragment already on the uri.
     */
    public static String addQueryString(final String uri, final Map<String, String> parameters) {
        final int anchorIndex = uri.indexOf('#');
        final String base = anchorIndex < 0 ? uri : uri.substring(0, anchorIndex);
        final String anchor = anchorIndex < 0 ? "" : uri.substring(anchorIndex);

        final StringBuilder sb = new StringBuilder(base);
        boolean hasQuery = base.indexOf('?') >= 0;
        for (final Map.Entry<String, String> parameter : parameters.entrySet()) {
            sb.append(hasQuery ? '&' : '?')
                    .append(URLEncoder.encode(parameter.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(parameter.getValue(), StandardCharsets.UTF_8));
            hasQuery = true;
        }
        return sb.append(anchor).toString();
    }
}
