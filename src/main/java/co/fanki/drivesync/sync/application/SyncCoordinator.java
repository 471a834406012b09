package co.fanki.drivesync.sync.application;

import co.fanki.drivesync.sync.domain.SyncLockRepository;
import co.fanki.drivesync.sync.domain.SyncResult;
import co.fanki.drivesync.sync.domain.SyncSettings;
import co.fanki.drivesync.sync.domain.SyncStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Serializes sync cycles across instances and folds bursts of
 * notifications into a bounded number of cycles.
 *
 * <p>A notification that finds the lock taken only raises the resync
 * flag; the holder sees the flag after its cycle and runs again, up to
 * the configured number of iterations. Changes left after the last
 * iteration wait for the next notification or the scheduled catch-up.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class SyncCoordinator {

    private static final Logger LOG =
            LoggerFactory.getLogger(SyncCoordinator.class);

    private final SyncLockRepository lockRepository;
    private final SyncStateRepository stateRepository;
    private final SyncCycleService cycleService;
    private final Clock clock;
    private final int maxIterations;
    private final Supplier<String> ownerIds;

    /**
     * Creates a new SyncCoordinator.
     *
     * @param theLockRepository the lock repository
     * @param theStateRepository the sync state repository
     * @param theCycleService the cycle runner
     * @param theSettings the mirror settings
     * @param theClock the clock used for lock timestamps
     */
    public SyncCoordinator(
            final SyncLockRepository theLockRepository,
            final SyncStateRepository theStateRepository,
            final SyncCycleService theCycleService,
            final SyncSettings theSettings,
            final Clock theClock) {
        this(theLockRepository, theStateRepository, theCycleService,
                theSettings, theClock, () -> UUID.randomUUID().toString());
    }

    /**
     * Creates a new SyncCoordinator with a custom owner id source.
     *
     * <p>Every acquisition takes a fresh id, so a holder whose stale lock
     * was taken over cannot release the new holder's lock, even inside
     * the same process.</p>
     */
    SyncCoordinator(
            final SyncLockRepository theLockRepository,
            final SyncStateRepository theStateRepository,
            final SyncCycleService theCycleService,
            final SyncSettings theSettings,
            final Clock theClock,
            final Supplier<String> theOwnerIds) {
        this.lockRepository = theLockRepository;
        this.stateRepository = theStateRepository;
        this.cycleService = theCycleService;
        this.clock = theClock;
        this.maxIterations = theSettings.maxResyncIterations();
        this.ownerIds = theOwnerIds;
    }

    /**
     * Handles a change notification.
     *
     * @return true when this call ran the cycles, false when another
     *         holder was flagged to run again instead
     */
    public boolean onNotification() {
        final String ownerId = ownerIds.get();
        if (!lockRepository.tryAcquire(ownerId, clock.instant())) {
            stateRepository.markResyncNeeded();
            LOG.info("Another sync is in progress, flagged for resync");
            return false;
        }
        try {
            runLoop();
            return true;
        } finally {
            lockRepository.release(ownerId);
        }
    }

    /**
     * Runs an action while holding the lock.
     *
     * @param purpose a short description for the logs
     * @param action the action to run
     * @param <T> the action result
     * @return the result, empty when the lock was taken by someone else
     */
    public <T> Optional<T> runExclusive(final String purpose,
            final Supplier<T> action) {
        final String ownerId = ownerIds.get();
        if (!lockRepository.tryAcquire(ownerId, clock.instant())) {
            LOG.info("Skipping {}: another sync is in progress", purpose);
            return Optional.empty();
        }
        try {
            LOG.info("Running {}", purpose);
            return Optional.ofNullable(action.get());
        } finally {
            lockRepository.release(ownerId);
        }
    }

    private int runLoop() {
        int total = 0;
        for (int i = 0; i < maxIterations; i++) {
            stateRepository.clearResyncNeeded();
            final SyncResult result = cycleService.runCycle();
            total += result.processed();
            LOG.info("Sync iteration {}: {} changes", i + 1,
                    result.processed());

            if (!stateRepository.isResyncNeeded()) {
                break;
            }
            LOG.info("Resync flag set, running again");
        }
        return total;
    }

}
