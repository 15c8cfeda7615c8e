package com.classmonitor.security;

import org.springframework.http.HttpHeaders;

/**
 * Pulls a bearer token out of an {@code Authorization} header.
 */
final class BearerTokens {

    private static final String BEARER_PREFIX = "Bearer ";

    private BearerTokens() {
    }

    /**
     * @return the trimmed token, or null if the header is absent or not a bearer header
     */
    static String fromHeaders(HttpHeaders headers) {
        String authHeader = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            return null;
        }
        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
