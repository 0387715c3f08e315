package slackauth.domain.auth;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.MultivaluedHashMap;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.UriInfo;
import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The parts of an incoming request the Slack flow looks at.
 *
 * @param host        host name plus the port, when the URI has one
 * @param pathBase    the application root without a trailing slash, or an empty string
 * @param path        the request path relative to the path base, starting with a slash
 * @param queryString the raw query string without the leading question mark, or an empty string
 * @param query       the decoded query parameters
 */
public record AuthRequest(
        String scheme,
        String host,
        String pathBase,
        String path,
        String queryString,
        MultivaluedMap<String, String> query,
        Map<String, Cookie> cookies) {

    public AuthRequest {
        query = new MultivaluedHashMap<>(query);
        cookies = Map.copyOf(cookies);
    }

    public static AuthRequest fromContext(final ContainerRequestContext requestContext) {
        return fromUriInfo(requestContext.getUriInfo(), requestContext.getCookies());
    }

    public static AuthRequest fromUriInfo(final UriInfo uriInfo, final Map<String, Cookie> cookies) {
        final URI baseUri = uriInfo.getBaseUri();
        final URI requestUri = uriInfo.getRequestUri();

        return new AuthRequest(
                baseUri.getScheme(),
                baseUri.getPort() == -1 ? baseUri.getHost() : baseUri.getHost() + ":" + baseUri.getPort(),
                StringUtils.removeEnd(StringUtils.defaultString(baseUri.getRawPath()), "/"),
                "/" + StringUtils.removeStart(uriInfo.getPath(), "/"),
                StringUtils.defaultString(requestUri.getRawQuery()),
                uriInfo.getQueryParameters(),
                cookies);
    }

    public boolean isHttps() {
        return "https".equalsIgnoreCase(scheme);
    }

    /**
     * scheme://host/pathBase
     */
    public String baseUri() {
        return scheme + "://" + host + pathBase;
    }

    /**
     * The absolute URI of this request, including the query string.
     */
    public String currentUri() {
        return baseUri() + path + (queryString.isEmpty() ? "" : "?" + queryString);
    }

    /**
     * The value of a query parameter that appears exactly once. Repeated parameters are treated as absent.
     */
    public Optional<String> getSingleQueryValue(final String name) {
        final List<String> values = query.get(name);
        if (values == null || values.size() != 1) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(0));
    }

    public Optional<Cookie> getCookie(final String name) {
        return Optional.ofNullable(cookies.get(name));
    }
}
