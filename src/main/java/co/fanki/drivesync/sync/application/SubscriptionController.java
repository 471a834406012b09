package co.fanki.drivesync.sync.application;

import co.fanki.drivesync.sync.application.SubscriptionService.RenewResult;
import co.fanki.drivesync.sync.application.SubscriptionService.SetupResult;
import co.fanki.drivesync.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * REST controller for the Drive notification channel lifecycle.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/subscription")
@Tag(name = "Subscription", description = "Open and renew the Drive notification channel")
public class SubscriptionController {

    private static final Logger LOG = LoggerFactory.getLogger(
            SubscriptionController.class);

    private final SubscriptionService subscriptionService;

    /**
     * Creates a new SubscriptionController.
     *
     * @param theSubscriptionService the subscription service
     */
    public SubscriptionController(
            final SubscriptionService theSubscriptionService) {
        this.subscriptionService = theSubscriptionService;
    }

    /**
     * Initializes the mirror and opens the first channel.
     *
     * @param initialSync whether to mirror every existing file
     * @return the setup outcome
     */
    @Operation(
            summary = "Set up the mirror",
            description = "Records the current change cursor, opens a watch channel and "
                    + "optionally mirrors every file already in the folder."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Channel opened",
                    content = @Content(schema = @Schema(implementation = SubscriptionResponse.class))),
            @ApiResponse(responseCode = "500", description = "Setup failed")
    })
    @PostMapping("/setup")
    public ResponseEntity<SubscriptionResponse> setup(
            @RequestParam(value = "initialSync", defaultValue = "false")
            final boolean initialSync) {

        LOG.info("Received setup request (initialSync: {})", initialSync);

        try {
            final SetupResult result = subscriptionService.setup(initialSync);
            return ResponseEntity.ok(new SubscriptionResponse(true,
                    result.channelId(), result.expiresAt(),
                    result.initialSyncCount(), "Mirror initialized"));
        } catch (final DomainException e) {
            LOG.error("Setup failed: {}", e.getMessage());
            return ResponseEntity.internalServerError()
                    .body(SubscriptionResponse.failure(e.getMessage()));
        } catch (final Exception e) {
            LOG.error("Unexpected error during setup", e);
            return ResponseEntity.internalServerError()
                    .body(SubscriptionResponse.failure(
                            "Internal error: " + e.getMessage()));
        }
    }

    /**
     * Replaces the channel and runs a catch-up sync.
     *
     * @return the renewal outcome
     */
    @Operation(
            summary = "Renew the watch channel",
            description = "Stops the current channel, opens a new one from the stored cursor "
                    + "and runs a catch-up sync."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Channel renewed",
                    content = @Content(schema = @Schema(implementation = SubscriptionResponse.class))),
            @ApiResponse(responseCode = "500", description = "Renewal failed")
    })
    @PostMapping("/renew")
    public ResponseEntity<SubscriptionResponse> renew() {
        LOG.info("Received renew request");

        try {
            final RenewResult result = subscriptionService.renew();
            return ResponseEntity.ok(new SubscriptionResponse(true,
                    result.channelId(), result.expiresAt(),
                    result.catchUpCount(), "Channel renewed"));
        } catch (final DomainException e) {
            LOG.error("Renewal failed: {}", e.getMessage());
            return ResponseEntity.internalServerError()
                    .body(SubscriptionResponse.failure(e.getMessage()));
        } catch (final Exception e) {
            LOG.error("Unexpected error during renewal", e);
            return ResponseEntity.internalServerError()
                    .body(SubscriptionResponse.failure(
                            "Internal error: " + e.getMessage()));
        }
    }

    /**
     * Response of the subscription endpoints.
     *
     * @param success whether the operation succeeded
     * @param channelId the opened channel
     * @param expiresAt when the channel expires
     * @param changesSynced changes applied by the accompanying sync, null
     *                      when none ran
     * @param message a human readable outcome
     */
    public record SubscriptionResponse(
            boolean success,
            String channelId,
            Instant expiresAt,
            Integer changesSynced,
            String message
    ) {
        static SubscriptionResponse failure(final String message) {
            return new SubscriptionResponse(false, null, null, null, message);
        }
    }

}
