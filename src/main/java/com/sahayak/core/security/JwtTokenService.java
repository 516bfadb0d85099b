package com.sahayak.core.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Issues and verifies the HS256 access tokens clients present on the agent
 * socket and the admin API. The subject is the user id.
 */
@Service
public class JwtTokenService {

    public static final String ROLE_CLAIM = "role";
    public static final String ROLE_ADMIN = "ADMIN";
    public static final String ROLE_USER = "USER";

    private final SecretKey signingKey;
    private final int expirationSeconds;

    public JwtTokenService(
            @Value("${sahayak.security.jwt.secret}") String secret,
            @Value("${sahayak.security.jwt.expiration-seconds:1800}") int expirationSeconds) {
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expirationSeconds = expirationSeconds;
    }

    public String generateToken(String userId, String role) {
        Date now = new Date();
        Date expiration = new Date(now.getTime() + expirationSeconds * 1000L);

        return Jwts.builder()
                .subject(userId)
                .claim(ROLE_CLAIM, role)
                .issuedAt(now)
                .expiration(expiration)
                .signWith(signingKey)
                .compact();
    }

    /**
     * @throws io.jsonwebtoken.JwtException   when the token is malformed, expired or badly signed
     * @throws IllegalArgumentException       when the token is null or blank
     */
    public Claims validateToken(String token) {
        return Jwts.parser()
                .verifyWith(signingKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    public static boolean isAdmin(Claims claims) {
        return ROLE_ADMIN.equals(claims.get(ROLE_CLAIM, String.class));
    }
}
