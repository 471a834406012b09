package co.fanki.drivesync.sync.application;

import co.fanki.drivesync.drive.domain.DriveAccessException;
import co.fanki.drivesync.drive.domain.DriveGateway;
import co.fanki.drivesync.drive.domain.Subscription;
import co.fanki.drivesync.shared.DomainException;
import co.fanki.drivesync.sync.domain.SyncResult;
import co.fanki.drivesync.sync.domain.SyncSettings;
import co.fanki.drivesync.sync.domain.SyncStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Opens and renews the Drive notification channel.
 *
 * <p>Channels expire after about a week, so they are renewed periodically.
 * Every renewal is followed by a catch-up cycle covering changes made
 * while no channel was delivering.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class SubscriptionService {

    private static final Logger LOG =
            LoggerFactory.getLogger(SubscriptionService.class);

    /** Error code when no webhook address is configured. */
    public static final String WEBHOOK_URL_MISSING = "WEBHOOK_URL_MISSING";

    private final DriveGateway drive;
    private final SyncStateRepository stateRepository;
    private final SyncCoordinator coordinator;
    private final SyncCycleService cycleService;
    private final SyncSettings settings;

    /**
     * Creates a new SubscriptionService.
     *
     * @param theDrive the Drive gateway
     * @param theStateRepository the sync state repository
     * @param theCoordinator the lock coordinator
     * @param theCycleService the cycle runner
     * @param theSettings the mirror settings
     */
    public SubscriptionService(
            final DriveGateway theDrive,
            final SyncStateRepository theStateRepository,
            final SyncCoordinator theCoordinator,
            final SyncCycleService theCycleService,
            final SyncSettings theSettings) {
        this.drive = theDrive;
        this.stateRepository = theStateRepository;
        this.coordinator = theCoordinator;
        this.cycleService = theCycleService;
        this.settings = theSettings;
    }

    /**
     * Initializes the mirror: records the current cursor and opens a
     * channel from it.
     *
     * @param initialSync whether to also mirror every existing file
     * @return the channel and, when run, the initial sync count
     */
    public SetupResult setup(final boolean initialSync) {
        final String address = requireWebhookUrl();

        final String cursor = drive.startCursor();
        stateRepository.saveCursor(cursor);
        LOG.info("Stored initial cursor: {}", cursor);

        final Subscription subscription = drive.watch(address, cursor);
        stateRepository.saveSubscription(subscription);
        LOG.info("Watch channel created: {}", subscription.channelId());

        Integer initialCount = null;
        if (initialSync) {
            initialCount = coordinator
                    .runExclusive("initial sync", cycleService::runInitialSync)
                    .map(SyncResult::processed)
                    .orElse(null);
        }

        return new SetupResult(subscription.channelId(),
                subscription.expiresAt(), initialCount);
    }

    /**
     * Replaces the channel and runs a catch-up cycle.
     *
     * @return the new channel and, when run, the catch-up count
     */
    public RenewResult renew() {
        final String address = requireWebhookUrl();

        final Optional<Subscription> previous =
                stateRepository.findSubscription();
        if (previous.isPresent()) {
            try {
                drive.stopWatch(previous.get());
            } catch (final DriveAccessException e) {
                LOG.warn("Failed to stop watch channel {}: {}",
                        previous.get().channelId(), e.getMessage());
            }
            stateRepository.clearSubscription();
        }

        final String cursor = stateRepository.findCursor().orElseGet(() -> {
            final String start = drive.startCursor();
            stateRepository.saveCursor(start);
            return start;
        });

        final Subscription subscription = drive.watch(address, cursor);
        stateRepository.saveSubscription(subscription);
        LOG.info("Created new watch channel {}, expires {}",
                subscription.channelId(), subscription.expiresAt());

        final Integer catchUp = coordinator
                .runExclusive("catch-up sync", cycleService::runCycle)
                .map(SyncResult::processed)
                .orElse(null);

        return new RenewResult(subscription.channelId(),
                subscription.expiresAt(), catchUp);
    }

    private String requireWebhookUrl() {
        final String url = settings.webhookUrl();
        if (url == null || url.isBlank()) {
            throw new DomainException("drive-sync.webhook-url is not configured",
                    WEBHOOK_URL_MISSING);
        }
        return url;
    }

    /**
     * Outcome of a setup.
     *
     * @param channelId the opened channel
     * @param expiresAt when the channel expires
     * @param initialSyncCount changes applied by the initial sync, null
     *                         when it did not run
     */
    public record SetupResult(String channelId, Instant expiresAt,
            Integer initialSyncCount) {
    }

    /**
     * Outcome of a renewal.
     *
     * @param channelId the opened channel
     * @param expiresAt when the channel expires
     * @param catchUpCount changes applied by the catch-up cycle, null when
     *                     the lock was taken
     */
    public record RenewResult(String channelId, Instant expiresAt,
            Integer catchUpCount) {
    }

}
