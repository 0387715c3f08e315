package slackauth.domain.auth;

import jakarta.ws.rs.core.MultivaluedHashMap;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuthRequestTest {

    @Test
    void buildsTheAbsoluteUris() {
        final AuthRequest request = new AuthRequest(
                "https", "example.com:8443", "/app", "/reports", "year=2024",
                new MultivaluedHashMap<>(), Map.of());

        assertTrue(request.isHttps());
        assertEquals("https://example.com:8443/app", request.baseUri());
        assertEquals("https://example.com:8443/app/reports?year=2024", request.currentUri());
    }

    @Test
    void repeatedQueryValuesAreAbsent() {
        final MultivaluedHashMap<String, String> query = new MultivaluedHashMap<>();
        query.add("code", "abc");
        query.add("state", "one");
        query.add("state", "two");

        final AuthRequest request = new AuthRequest("http", "localhost", "", "/signin-slack", "", query, Map.of());

        assertFalse(request.isHttps());
        assertEquals(Optional.of("abc"), request.getSingleQueryValue("code"));
        assertEquals(Optional.empty(), request.getSingleQueryValue("state"));
        assertEquals(Optional.empty(), request.getSingleQueryValue("error"));
    }
}
