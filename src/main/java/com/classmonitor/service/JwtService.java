package com.classmonitor.service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Date;

/**
 * Verifies the HS256 tokens presented by viewers, alert devices and the
 * detection pipeline. Accounts live in the login service; this side only needs
 * the shared secret. {@link #generateAccessToken} exists for operator tooling
 * and tests.
 */
@Service
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    private static final int MIN_SECRET_LENGTH = 32; // HS256 needs 256 bits

    private final SecretKey signingKey;
    private final JwtParser parser;
    private final long accessTokenExpiration;
    private final String issuer;

    public JwtService(
            @Value("${security.jwt.secret:}") String secret,
            @Value("${security.jwt.access-token-expiration:604800000}") long accessTokenExpiration,
            @Value("${security.jwt.issuer:classmonitor}") String issuer) {
        this.signingKey = resolveSigningKey(secret);
        this.accessTokenExpiration = accessTokenExpiration;
        this.issuer = issuer;
        this.parser = Jwts.parser()
                .verifyWith(signingKey)
                .requireIssuer(issuer)
                .build();
        log.info("🔐 Accepting tokens from issuer '{}'", issuer);
    }

    private static SecretKey resolveSigningKey(String secret) {
        if (secret == null || secret.isBlank()) {
            byte[] randomKey = new byte[64];
            new SecureRandom().nextBytes(randomKey);
            log.warn("⚠️ JWT_SECRET not set, using a random per-process key. Tokens from the login service will be rejected.");
            return Keys.hmacShaKeyFor(randomKey);
        }
        if (secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalArgumentException("JWT secret must be at least " + MIN_SECRET_LENGTH + " characters");
        }
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Issue a token for a subject (a teacher id, an admin, the detector).
     */
    public String generateAccessToken(String subject, String role) {
        Date now = new Date();
        return Jwts.builder()
                .subject(subject)
                .claim("role", role)
                .claim("type", "access")
                .issuer(issuer)
                .issuedAt(now)
                .expiration(new Date(now.getTime() + accessTokenExpiration))
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Verify signature, issuer and expiry.
     *
     * @throws JwtException if the token is not acceptable
     */
    public Claims validateToken(String token) {
        return parser.parseSignedClaims(token).getPayload();
    }

    public boolean isTokenValid(String token) {
        try {
            validateToken(token);
            return true;
        } catch (JwtException e) {
            log.debug("Invalid token: {}", e.getMessage());
            return false;
        }
    }
}
