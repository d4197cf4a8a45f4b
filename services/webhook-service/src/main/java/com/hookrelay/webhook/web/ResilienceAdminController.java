package com.hookrelay.webhook.web;

import com.hookrelay.common.resilience.CircuitStatus;
import com.hookrelay.common.resilience.ErrorRecoveryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operator view of this replica's circuit breakers.
 */
@Slf4j
@RestController
@RequestMapping("/internal/resilience")
@RequiredArgsConstructor
public class ResilienceAdminController {

    private final ErrorRecoveryService errorRecoveryService;

    @GetMapping("/circuits")
    public Map<String, CircuitStatus> getCircuits() {
        return errorRecoveryService.getAllCircuitBreakers();
    }

    @GetMapping("/circuits/{key}")
    public ResponseEntity<CircuitStatus> getCircuit(@PathVariable String key) {
        return ResponseEntity.of(errorRecoveryService.getCircuitBreakerStatus(key));
    }

    @PostMapping("/circuits/{key}/reset")
    public ResponseEntity<Map<String, String>> resetCircuit(@PathVariable String key) {
        if (!errorRecoveryService.resetCircuitBreaker(key)) {
            return ResponseEntity.notFound().build();
        }
        log.info("Circuit breaker reset by operator: key={}", key);
        return ResponseEntity.ok(Map.of("key", key, "phase", "CLOSED"));
    }
}
