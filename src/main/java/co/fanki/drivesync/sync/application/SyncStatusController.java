package co.fanki.drivesync.sync.application;

import co.fanki.drivesync.change.domain.TrackedFile;
import co.fanki.drivesync.change.domain.TrackedFileRepository;
import co.fanki.drivesync.drive.domain.Subscription;
import co.fanki.drivesync.sync.domain.SyncLock;
import co.fanki.drivesync.sync.domain.SyncLockRepository;
import co.fanki.drivesync.sync.domain.SyncStateRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of the mirror state.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Sync Status", description = "Mirror state and tracked files")
public class SyncStatusController {

    private final SyncStateRepository stateRepository;
    private final SyncLockRepository lockRepository;
    private final TrackedFileRepository trackedFileRepository;

    /**
     * Creates a new SyncStatusController.
     *
     * @param theStateRepository the sync state repository
     * @param theLockRepository the lock repository
     * @param theTrackedFileRepository the tracked file repository
     */
    public SyncStatusController(
            final SyncStateRepository theStateRepository,
            final SyncLockRepository theLockRepository,
            final TrackedFileRepository theTrackedFileRepository) {
        this.stateRepository = theStateRepository;
        this.lockRepository = theLockRepository;
        this.trackedFileRepository = theTrackedFileRepository;
    }

    /**
     * Returns the cursor, channel and lock state.
     *
     * @return the status
     */
    @Operation(summary = "Mirror status")
    @GetMapping("/sync/status")
    public ResponseEntity<StatusResponse> status() {
        final Subscription subscription =
                stateRepository.findSubscription().orElse(null);
        final SyncLock lock = lockRepository.current();

        return ResponseEntity.ok(new StatusResponse(
                stateRepository.findCursor().orElse(null),
                stateRepository.isResyncNeeded(),
                subscription != null ? subscription.channelId() : null,
                subscription != null ? subscription.expiresAt() : null,
                lock.held(),
                lock.owner(),
                lock.acquiredAt()));
    }

    /**
     * Lists the tracked files, optionally below a path prefix.
     *
     * @param prefix the relative path prefix, may be null
     * @return the tracked files ordered by path
     */
    @Operation(summary = "List tracked files")
    @GetMapping("/tracked-files")
    public ResponseEntity<List<TrackedFile>> trackedFiles(
            @RequestParam(value = "prefix", required = false)
            final String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return ResponseEntity.ok(trackedFileRepository.findAll());
        }
        return ResponseEntity.ok(trackedFileRepository.findByPathPrefix(prefix));
    }

    /**
     * Mirror status.
     *
     * @param cursor the stored change cursor, null before setup
     * @param resyncNeeded whether a notification is waiting for a cycle
     * @param channelId the active channel
     * @param channelExpiresAt when the active channel expires
     * @param lockHeld whether a cycle is running
     * @param lockOwner the lock holder
     * @param lockAcquiredAt when the lock was taken
     */
    public record StatusResponse(
            String cursor,
            boolean resyncNeeded,
            String channelId,
            Instant channelExpiresAt,
            boolean lockHeld,
            String lockOwner,
            Instant lockAcquiredAt
    ) {}

}
