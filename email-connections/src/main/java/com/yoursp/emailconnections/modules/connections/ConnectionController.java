package com.yoursp.emailconnections.modules.connections;

import com.yoursp.emailconnections.config.AuthenticatedUser;
import com.yoursp.emailconnections.modules.connections.dto.*;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

/**
 * Connection management for the authenticated user.
 */
@RestController
@RequestMapping("/api/v1/email-connections")
@RequiredArgsConstructor
public class ConnectionController {

    private final ConnectionService connectionService;

    // ================================================================
    // GET /connections: list with summary counts
    // ================================================================

    @GetMapping("/connections")
    public ResponseEntity<ConnectionListResponse> list(@AuthenticationPrincipal Jwt jwt,
            @RequestParam(value = "include_archived", defaultValue = "false") boolean includeArchived) {
        return ResponseEntity.ok(connectionService.list(AuthenticatedUser.id(jwt), includeArchived));
    }

    @GetMapping("/connections/{id}")
    public ResponseEntity<ConnectionResponse> get(@AuthenticationPrincipal Jwt jwt, @PathVariable Long id) {
        return ResponseEntity.ok(connectionService.get(id, AuthenticatedUser.id(jwt)));
    }

    @PutMapping("/connections/{id}")
    public ResponseEntity<ConnectionResponse> update(@AuthenticationPrincipal Jwt jwt, @PathVariable Long id,
            @Valid @RequestBody ConnectionUpdateRequest request) {
        return ResponseEntity.ok(connectionService.update(id, AuthenticatedUser.id(jwt), request));
    }

    // ================================================================
    // DELETE /connections/{id}: delete, or archive when records depend on it
    // ================================================================

    @DeleteMapping("/connections/{id}")
    public ResponseEntity<ConnectionDeleteResponse> delete(@AuthenticationPrincipal Jwt jwt, @PathVariable Long id) {
        return ResponseEntity.ok(connectionService.delete(id, AuthenticatedUser.id(jwt)));
    }

    @GetMapping("/connections/{id}/usage")
    public ResponseEntity<ConnectionUsage> usage(@AuthenticationPrincipal Jwt jwt, @PathVariable Long id) {
        return ResponseEntity.ok(connectionService.checkUsage(id, AuthenticatedUser.id(jwt)));
    }

    // ================================================================
    // Health, refresh and live test
    // ================================================================

    @GetMapping("/connections/{id}/health")
    public ResponseEntity<ConnectionHealthReport> health(@AuthenticationPrincipal Jwt jwt, @PathVariable Long id) {
        return ResponseEntity.ok(connectionService.checkHealth(id, AuthenticatedUser.id(jwt)));
    }

    @PostMapping("/connections/{id}/refresh")
    public ResponseEntity<TokenRefreshResponse> refresh(@AuthenticationPrincipal Jwt jwt, @PathVariable Long id) {
        return ResponseEntity.ok(connectionService.refreshNow(id, AuthenticatedUser.id(jwt)));
    }

    @PostMapping("/connections/{id}/test")
    public ResponseEntity<ConnectionTestResponse> test(@AuthenticationPrincipal Jwt jwt, @PathVariable Long id) {
        return ResponseEntity.ok(connectionService.testConnection(id, AuthenticatedUser.id(jwt)));
    }

    @GetMapping("/status")
    public ResponseEntity<BulkConnectionStatus> status(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(connectionService.bulkStatus(AuthenticatedUser.id(jwt)));
    }
}
