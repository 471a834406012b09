package co.fanki.drivesync.config;

import co.fanki.drivesync.sync.domain.SyncStateRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Map;

/**
 * Health check controller providing endpoints for liveness and readiness probes.
 *
 * <p>Provides /health for basic liveness check and /ready for readiness
 * check that verifies database connectivity and reports whether the
 * mirror was set up.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthCheckController {

    private final DataSource dataSource;
    private final SyncStateRepository stateRepository;

    /**
     * Creates a new HealthCheckController.
     *
     * @param theDataSource the data source for database connectivity checks
     * @param theStateRepository the sync state, for the setup check
     */
    public HealthCheckController(final DataSource theDataSource,
            final SyncStateRepository theStateRepository) {
        this.dataSource = theDataSource;
        this.stateRepository = theStateRepository;
    }

    /**
     * Liveness probe endpoint.
     *
     * @return "ok" string
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("ok");
    }

    /**
     * Readiness probe endpoint.
     *
     * <p>Not ready when the database is unreachable. A mirror that was
     * never set up is still ready: the setup endpoint must be reachable.</p>
     *
     * @return status map with component health information
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        final boolean databaseHealthy = checkDatabaseHealth();

        if (!databaseHealthy) {
            return ResponseEntity.status(503).body(Map.of(
                "status", "not_ready",
                "database", "disconnected"
            ));
        }

        final boolean initialized = stateRepository.findCursor().isPresent();
        return ResponseEntity.ok(Map.of(
            "status", "ready",
            "database", "connected",
            "mirror", initialized ? "initialized" : "not_initialized"
        ));
    }

    private boolean checkDatabaseHealth() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(5);
        } catch (Exception e) {
            return false;
        }
    }

}
