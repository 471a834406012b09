package co.fanki.drivesync.sync.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled channel renewal and catch-up sync.
 *
 * <p>Channels expire after about a week; renewing every six days keeps
 * one open. The catch-up sync covers notifications Drive never
 * delivered.</p>
 *
 * <p>Opt-in via {@code drive-sync.scheduler.enabled=true}. Disabled by
 * default.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConditionalOnProperty(
        name = "drive-sync.scheduler.enabled",
        havingValue = "true",
        matchIfMissing = false)
public class SyncScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(
            SyncScheduler.class);

    private final SubscriptionService subscriptionService;
    private final SyncCoordinator coordinator;

    /**
     * Creates a new SyncScheduler.
     *
     * @param theSubscriptionService the subscription service
     * @param theCoordinator the sync coordinator
     */
    public SyncScheduler(
            final SubscriptionService theSubscriptionService,
            final SyncCoordinator theCoordinator) {
        this.subscriptionService = theSubscriptionService;
        this.coordinator = theCoordinator;
    }

    /** Replaces the watch channel. */
    @Scheduled(cron = "${drive-sync.scheduler.renew-cron:0 0 3 */6 * *}")
    public void renewChannel() {
        LOG.info("Starting scheduled channel renewal");
        try {
            final SubscriptionService.RenewResult result =
                    subscriptionService.renew();
            LOG.info("Channel renewed: {}, expires {}", result.channelId(),
                    result.expiresAt());
        } catch (final Exception e) {
            LOG.error("Scheduled renewal failed: {}", e.getMessage(), e);
        }
    }

    /** Runs a sync as if a notification had arrived. */
    @Scheduled(cron = "${drive-sync.scheduler.catch-up-cron:0 0 */4 * * *}")
    public void catchUp() {
        LOG.info("Starting scheduled catch-up sync");
        try {
            coordinator.onNotification();
        } catch (final Exception e) {
            LOG.error("Scheduled catch-up failed: {}", e.getMessage(), e);
        }
    }

}
