package com.sahayak.dispatch.ws;

import com.sahayak.core.metrics.SahayakMetrics;
import com.sahayak.core.ratelimit.RateLimiter;
import com.sahayak.core.security.JwtTokenService;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Validates the {@code auth_token} query parameter before the WebSocket upgrade.
 * Rejected handshakes never reach the handler, so no connection is registered.
 */
@Component
public class TokenHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger log = LoggerFactory.getLogger(TokenHandshakeInterceptor.class);

    public static final String TOKEN_PARAM = "auth_token";
    public static final String USER_ID_ATTRIBUTE = "userId";

    private final JwtTokenService jwtTokenService;
    private final RateLimiter rateLimiter;
    private final SahayakMetrics metrics;

    public TokenHandshakeInterceptor(JwtTokenService jwtTokenService, RateLimiter rateLimiter,
                                     SahayakMetrics metrics) {
        this.jwtTokenService = jwtTokenService;
        this.rateLimiter = rateLimiter;
        this.metrics = metrics;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String token = UriComponentsBuilder.fromUri(request.getURI())
                .build()
                .getQueryParams()
                .getFirst(TOKEN_PARAM);
        if (token == null || token.isBlank()) {
            log.debug("Handshake without {} rejected", TOKEN_PARAM);
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        String userId;
        try {
            Claims claims = jwtTokenService.validateToken(token);
            userId = claims.getSubject();
        } catch (JwtException | IllegalArgumentException e) {
            log.info("Handshake rejected: invalid token ({})", e.getMessage());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
        if (userId == null || userId.isBlank()) {
            log.info("Handshake rejected: token has no subject");
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        if (!rateLimiter.checkConnection(userId)) {
            log.warn("Connection rate exceeded for user {}", userId);
            metrics.recordRateLimited("connection");
            response.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
            return false;
        }

        attributes.put(USER_ID_ATTRIBUTE, userId);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("WebSocket handshake failed: {}", exception.getMessage());
        }
    }
}
