package com.submissionhub.sync.api;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

public record Credentials(String username, String secret) {
    public Credentials {
        Objects.requireNonNull(username, "username is required");
        Objects.requireNonNull(secret, "secret is required");
    }

    public String basicAuthHeader() {
        String token = username + ":" + secret;
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "Credentials[username=" + username + ", secret=***]";
    }
}
