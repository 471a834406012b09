package co.fanki.drivesync.sync.domain;

import co.fanki.drivesync.drive.domain.Subscription;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * Repository for the singleton sync state: change cursor, resync flag and
 * notification channel.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class SyncStateRepository {

    /** Settings key of the change cursor. */
    static final String PAGE_TOKEN = "page_token";

    /** Settings key of the resync flag. */
    static final String RESYNC_NEEDED = "resync_needed";

    /** Find a setting by key. Uses: PK index. */
    public static final String FIND_SETTING =
            "SELECT value FROM sync_settings WHERE key = :key";

    /** Upsert a setting. Uses: PK index. */
    public static final String SAVE_SETTING = """
            INSERT INTO sync_settings (key, value, updated_at)
            VALUES (:key, :value, now())
            ON CONFLICT (key) DO UPDATE SET
                value = EXCLUDED.value,
                updated_at = EXCLUDED.updated_at
            """;

    /** Find the channel. Uses: PK index (single row). */
    public static final String FIND_SUBSCRIPTION =
            "SELECT * FROM sync_subscription WHERE id = 1";

    private final Jdbi jdbi;

    /**
     * Creates a new SyncStateRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public SyncStateRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    /**
     * Finds the cursor the next cycle resumes from.
     *
     * @return the cursor, empty when the mirror was never initialized
     */
    public Optional<String> findCursor() {
        return findSetting(PAGE_TOKEN);
    }

    /**
     * Stores the cursor the next cycle resumes from.
     *
     * @param cursor the Drive page token
     */
    public void saveCursor(final String cursor) {
        saveSetting(PAGE_TOKEN, cursor);
    }

    /**
     * Checks whether a notification arrived while a cycle held the lock.
     *
     * @return true when another cycle should run
     */
    public boolean isResyncNeeded() {
        return findSetting(RESYNC_NEEDED).map(Boolean::parseBoolean)
                .orElse(false);
    }

    /** Records that another cycle should run. */
    public void markResyncNeeded() {
        saveSetting(RESYNC_NEEDED, Boolean.TRUE.toString());
    }

    /** Clears the resync flag. */
    public void clearResyncNeeded() {
        saveSetting(RESYNC_NEEDED, Boolean.FALSE.toString());
    }

    /**
     * Finds the current notification channel.
     *
     * @return the channel, empty when none was opened
     */
    public Optional<Subscription> findSubscription() {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_SUBSCRIPTION)
                .map(new SubscriptionRowMapper())
                .findOne());
    }

    /**
     * Stores the current notification channel, replacing any previous one.
     *
     * @param subscription the channel
     */
    public void saveSubscription(final Subscription subscription) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO sync_subscription (
                    id, channel_id, resource_id, expires_at, created_at
                ) VALUES (
                    1, :channelId, :resourceId, :expiresAt, now()
                )
                ON CONFLICT (id) DO UPDATE SET
                    channel_id = EXCLUDED.channel_id,
                    resource_id = EXCLUDED.resource_id,
                    expires_at = EXCLUDED.expires_at,
                    created_at = EXCLUDED.created_at
                """)
                .bind("channelId", subscription.channelId())
                .bind("resourceId", subscription.resourceId())
                .bind("expiresAt", toTimestamp(subscription.expiresAt()))
                .execute());
    }

    /** Forgets the current notification channel. */
    public void clearSubscription() {
        jdbi.useHandle(handle -> handle
                .createUpdate("DELETE FROM sync_subscription WHERE id = 1")
                .execute());
    }

    private Optional<String> findSetting(final String key) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_SETTING)
                .bind("key", key)
                .mapTo(String.class)
                .findOne());
    }

    private void saveSetting(final String key, final String value) {
        jdbi.useHandle(handle -> handle
                .createUpdate(SAVE_SETTING)
                .bind("key", key)
                .bind("value", value)
                .execute());
    }

    private Timestamp toTimestamp(final Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static final class SubscriptionRowMapper
            implements RowMapper<Subscription> {

        @Override
        public Subscription map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            final Timestamp expiresTs = rs.getTimestamp("expires_at");
            return new Subscription(
                    rs.getString("channel_id"),
                    rs.getString("resource_id"),
                    expiresTs != null ? expiresTs.toInstant() : null);
        }
    }

}
