package com.sahayak.dispatch.api;

import com.sahayak.core.audit.AuditException;
import com.sahayak.core.audit.AuditRecorder;
import com.sahayak.core.engine.AgentOrchestrator;
import com.sahayak.core.security.JwtTokenService;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;

/**
 * Operator endpoints. Every call needs {@code Authorization: Bearer <jwt>}
 * with {@code role=ADMIN}.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    static final int MAX_AUDIT_LIMIT = 200;
    private static final String BEARER_PREFIX = "Bearer ";

    private final AuditRecorder auditRecorder;
    private final AgentOrchestrator orchestrator;
    private final JwtTokenService jwtTokenService;

    public AdminController(AuditRecorder auditRecorder, AgentOrchestrator orchestrator,
                           JwtTokenService jwtTokenService) {
        this.auditRecorder = auditRecorder;
        this.orchestrator = orchestrator;
        this.jwtTokenService = jwtTokenService;
    }

    /**
     * GET /api/v1/admin/audit-logs?limit=50: Newest audit records first.
     */
    @GetMapping("/audit-logs")
    public ResponseEntity<?> auditLogs(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(defaultValue = "50") int limit) {
        var denied = authorize(authorization);
        if (denied.isPresent()) {
            return denied.get();
        }
        if (limit < 1 || limit > MAX_AUDIT_LIMIT) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "limit must be between 1 and " + MAX_AUDIT_LIMIT));
        }
        try {
            return ResponseEntity.ok(auditRecorder.recent(limit));
        } catch (AuditException e) {
            log.error("Failed to read audit logs", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Audit store unavailable"));
        }
    }

    /**
     * GET /api/v1/admin/connections: Number of live agent connections.
     */
    @GetMapping("/connections")
    public ResponseEntity<?> connections(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        var denied = authorize(authorization);
        if (denied.isPresent()) {
            return denied.get();
        }
        return ResponseEntity.ok(Map.of("active", orchestrator.activeConnections()));
    }

    /**
     * POST /api/v1/admin/announce: Speaks a message to every connected user.
     */
    @PostMapping("/announce")
    public ResponseEntity<?> announce(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody AnnouncementRequest request) {
        var denied = authorize(authorization);
        if (denied.isPresent()) {
            return denied.get();
        }
        if (request.text() == null || request.text().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "text must not be blank"));
        }
        return ResponseEntity.ok(Map.of("delivered", orchestrator.announce(request.text())));
    }

    private Optional<ResponseEntity<?>> authorize(String authorization) {
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            return Optional.of(ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("error", "Bearer token required")));
        }
        Claims claims;
        try {
            claims = jwtTokenService.validateToken(authorization.substring(BEARER_PREFIX.length()).trim());
        } catch (JwtException | IllegalArgumentException e) {
            return Optional.of(ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("error", "Invalid or expired token")));
        }
        if (!JwtTokenService.isAdmin(claims)) {
            log.warn("User {} denied admin access", claims.getSubject());
            return Optional.of(ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .body(Map.of("error", "Admin role required")));
        }
        return Optional.empty();
    }

    public record AnnouncementRequest(String text) {}
}
