package com.prowl.kgindex.api;

import com.prowl.kgindex.exception.StorageException;
import com.prowl.kgindex.knowledge.GraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Storage reachability check.
 *
 * GET /health
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final GraphStore graphStore;

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        try {
            graphStore.ping();
            return ResponseEntity.ok(HealthResponse.up());
        } catch (StorageException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("⚠️  Health check failed: {}", cause.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(HealthResponse.down(cause.getMessage()));
        }
    }
}
