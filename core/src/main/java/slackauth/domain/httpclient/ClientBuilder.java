package slackauth.domain.httpclient;

import jakarta.ws.rs.client.Client;

@FunctionalInterface
public interface ClientBuilder {
    Client buildClient();
}
