package co.fanki.drivesync.drive.domain;

import co.fanki.drivesync.shared.Preconditions;
import co.fanki.drivesync.shared.ValueObject;

import java.time.Instant;

/**
 * A Drive push notification channel.
 *
 * @param channelId the channel id chosen when the channel was opened,
 *                  echoed back in the {@code X-Goog-Channel-ID} header
 * @param resourceId the watched resource id assigned by Drive
 * @param expiresAt when Drive stops delivering, may be null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Subscription(String channelId, String resourceId,
        Instant expiresAt) implements ValueObject {

    /** Validates the identifiers. */
    public Subscription {
        Preconditions.requireNonBlank(channelId, "Channel id is required");
        Preconditions.requireNonBlank(resourceId, "Resource id is required");
    }

}
