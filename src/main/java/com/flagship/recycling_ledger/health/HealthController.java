package com.flagship.recycling_ledger.health;

import com.flagship.recycling_ledger.catalog.MachineRepository;
import com.flagship.recycling_ledger.catalog.MaterialRepository;
import com.flagship.recycling_ledger.deposit.guard.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness probe for machines and load balancers.
 *
 * Only the database decides UP vs DOWN: without it no deposit can be recorded.
 * An unreachable guard store is reported but keeps the service UP, since the
 * guard runs without it. The catalog counts show whether deposits can be
 * accepted at all.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final MaterialRepository materialRepository;
    private final MachineRepository machineRepository;
    private final KeyValueStore guardStore;
    private final Clock clock;

    public HealthController(DataSource dataSource,
                            MaterialRepository materialRepository,
                            MachineRepository machineRepository,
                            KeyValueStore guardStore,
                            Clock clock) {
        this.dataSource = dataSource;
        this.materialRepository = materialRepository;
        this.machineRepository = machineRepository;
        this.guardStore = guardStore;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", clock.instant().toString());

        if (!databaseReachable()) {
            response.put("status", "DOWN");
            response.put("database", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }

        response.put("status", "UP");
        response.put("database", "UP");
        response.put("guardStore", guardStoreReachable() ? "UP" : "DEGRADED");
        response.put("guardStoreBackend", guardStore.backend());
        response.put("activeMaterials", materialRepository.countByActiveTrue());
        response.put("activeMachines", machineRepository.countByActiveTrue());
        return ResponseEntity.ok(response);
    }

    private boolean databaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            log.warn("Health check could not reach the database: {}", e.getMessage());
            return false;
        }
    }

    private boolean guardStoreReachable() {
        try {
            guardStore.ping();
            return true;
        } catch (Exception e) {
            log.warn("Health check could not reach the guard store: {}", e.getMessage());
            return false;
        }
    }
}
