package co.fanki.drivesync.sync.application;

import co.fanki.drivesync.drive.domain.Subscription;
import co.fanki.drivesync.sync.domain.SyncSettings;
import co.fanki.drivesync.sync.domain.SyncStateRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Receives Drive push notifications and manual triggers.
 *
 * <p>Always answers 200, even when the sync fails, so Drive does not
 * retry with backoff. Failures are logged and the next notification or
 * the scheduled catch-up picks up the pending changes.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/webhook/drive")
@Tag(name = "Drive Webhook", description = "Drive push notifications")
public class DriveNotificationController {

    private static final Logger LOG =
            LoggerFactory.getLogger(DriveNotificationController.class);

    /** Resource state Drive sends when a channel is opened. */
    static final String SYNC_STATE = "sync";

    private final SyncCoordinator coordinator;
    private final SyncStateRepository stateRepository;
    private final SyncSettings settings;

    /**
     * Creates a new DriveNotificationController.
     *
     * @param theCoordinator the sync coordinator
     * @param theStateRepository the sync state repository
     * @param theSettings the mirror settings
     */
    public DriveNotificationController(
            final SyncCoordinator theCoordinator,
            final SyncStateRepository theStateRepository,
            final SyncSettings theSettings) {
        this.coordinator = theCoordinator;
        this.stateRepository = theStateRepository;
        this.settings = theSettings;
    }

    /**
     * Handles a notification.
     *
     * <p>Requests without a channel id are manual triggers and must carry
     * the configured secret. The channel handshake and notifications from
     * channels other than the stored one are acknowledged without
     * syncing.</p>
     *
     * @param channelId the X-Goog-Channel-ID header
     * @param resourceState the X-Goog-Resource-State header
     * @param triggerSecret the X-Sync-Trigger-Secret header
     * @return always 200 "OK"
     */
    @Operation(summary = "Drive change notification",
            description = "Runs a sync cycle, or flags a resync when one is"
                    + " already running")
    @PostMapping
    public ResponseEntity<String> receive(
            @RequestHeader(value = "X-Goog-Channel-ID", required = false)
            final String channelId,
            @RequestHeader(value = "X-Goog-Resource-State", required = false)
            final String resourceState,
            @RequestHeader(value = "X-Sync-Trigger-Secret", required = false)
            final String triggerSecret) {

        if (channelId == null || channelId.isBlank()) {
            if (!acceptsTrigger(triggerSecret)) {
                LOG.warn("Ignoring manual trigger without a valid secret");
                return ResponseEntity.ok("OK");
            }
            LOG.info("Manual sync trigger received");
        } else {
            LOG.info("Webhook received: channel={}, state={}", channelId,
                    resourceState);
            if (SYNC_STATE.equals(resourceState)) {
                LOG.info("Channel {} handshake acknowledged", channelId);
                return ResponseEntity.ok("OK");
            }
            if (!isCurrentChannel(channelId)) {
                LOG.info("Ignoring notification from stale channel {}",
                        channelId);
                return ResponseEntity.ok("OK");
            }
        }

        try {
            coordinator.onNotification();
        } catch (final Exception e) {
            LOG.error("Sync failed", e);
        }
        return ResponseEntity.ok("OK");
    }

    /**
     * Serves the domain verification token.
     *
     * @return the verification body, "OK" when no token is configured
     */
    @Operation(summary = "Domain verification")
    @GetMapping(produces = MediaType.TEXT_HTML_VALUE)
    public ResponseEntity<String> verify() {
        if (!settings.hasVerificationToken()) {
            return ResponseEntity.ok("OK");
        }
        return ResponseEntity.ok("google-site-verification: "
                + settings.verificationToken());
    }

    private boolean isCurrentChannel(final String channelId) {
        final Optional<Subscription> current =
                stateRepository.findSubscription();
        return current.isEmpty() || current.get().channelId().equals(channelId);
    }

    private boolean acceptsTrigger(final String provided) {
        if (!settings.hasTriggerSecret() || provided == null) {
            return false;
        }
        return MessageDigest.isEqual(
                settings.triggerSecret().getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }

}
