package com.classmonitor.security;

import com.classmonitor.service.JwtService;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Authenticates REST calls from the detection pipeline and admin tools.
 * A valid bearer token becomes an authentication carrying {@code ROLE_<role>};
 * anything else passes through unauthenticated and is left to the
 * authorization rules.
 */
public class JwtAuthenticationFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    // WebSocket handlers authenticate the handshake themselves
    private static final List<String> SKIPPED_PREFIXES = List.of("/actuator/health", "/uploads/", "/api/websocket/");

    private final JwtService jwtService;

    public JwtAuthenticationFilter(JwtService jwtService) {
        this.jwtService = jwtService;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (SKIPPED_PREFIXES.stream().anyMatch(path::startsWith)) {
            return chain.filter(exchange);
        }

        String token = BearerTokens.fromHeaders(exchange.getRequest().getHeaders());
        Authentication authentication = token == null ? null : authenticate(token, path);
        if (authentication == null) {
            return chain.filter(exchange);
        }
        return chain.filter(exchange)
                .contextWrite(ReactiveSecurityContextHolder.withAuthentication(authentication));
    }

    private Authentication authenticate(String token, String path) {
        try {
            Claims claims = jwtService.validateToken(token);
            String caller = claims.getSubject();
            String role = claims.get("role", String.class);
            if (caller == null || role == null) {
                log.debug("Token for {} lacks subject or role", path);
                return null;
            }
            log.debug("{} called by {} ({})", path, caller, role);
            return new UsernamePasswordAuthenticationToken(caller, null,
                    List.of(new SimpleGrantedAuthority("ROLE_" + role)));
        } catch (JwtException e) {
            log.debug("Rejected token on {}: {}", path, e.getMessage());
            return null;
        }
    }
}
