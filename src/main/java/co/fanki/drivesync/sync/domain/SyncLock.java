package co.fanki.drivesync.sync.domain;

import co.fanki.drivesync.shared.ValueObject;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of the cross-instance sync lock.
 *
 * <p>A held lock older than the TTL is considered abandoned and may be
 * taken over by anyone.</p>
 *
 * @param held whether an instance holds the lock
 * @param owner the holder id, null when released
 * @param acquiredAt when the holder took it, null when released
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SyncLock(boolean held, String owner, Instant acquiredAt)
        implements ValueObject {

    /**
     * Creates a released lock.
     *
     * @return the lock
     */
    public static SyncLock free() {
        return new SyncLock(false, null, null);
    }

    /**
     * Creates a lock held by an owner from now on.
     *
     * @param owner the holder id
     * @param now the acquisition instant
     * @return the lock
     */
    public static SyncLock heldBy(final String owner, final Instant now) {
        return new SyncLock(true, owner, now);
    }

    /**
     * Returns how long the lock has been held.
     *
     * @param now the current instant
     * @return the age, zero when not held
     */
    public Duration age(final Instant now) {
        if (!held || acquiredAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(acquiredAt, now);
    }

    /**
     * Checks whether the lock is held but abandoned.
     *
     * @param now the current instant
     * @param ttl the maximum holding time
     * @return true when held for at least the TTL
     */
    public boolean isStale(final Instant now, final Duration ttl) {
        return held && (acquiredAt == null || age(now).compareTo(ttl) >= 0);
    }

    /**
     * Checks whether a new owner may take the lock.
     *
     * @param now the current instant
     * @param ttl the maximum holding time
     * @return true when released or stale
     */
    public boolean isAvailable(final Instant now, final Duration ttl) {
        return !held || isStale(now, ttl);
    }

    /**
     * Checks who holds the lock.
     *
     * @param candidate the owner id to compare
     * @return true when held by the candidate
     */
    public boolean isOwnedBy(final String candidate) {
        return held && Objects.equals(owner, candidate);
    }

}
