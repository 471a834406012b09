package co.fanki.drivesync.sync.domain;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;

/**
 * Repository for the single-row lock that serializes sync cycles across
 * instances.
 *
 * <p>Acquisition reads the row with {@code SELECT ... FOR UPDATE} and
 * writes the new owner in the same transaction, so two instances racing
 * for a free lock cannot both win.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class SyncLockRepository {

    private static final Logger LOG =
            LoggerFactory.getLogger(SyncLockRepository.class);

    /** Lock the row for the rest of the transaction. Uses: PK index. */
    public static final String FIND_FOR_UPDATE =
            "SELECT * FROM sync_lock WHERE id = 1 FOR UPDATE";

    /** Read the row without locking. Uses: PK index. */
    public static final String FIND =
            "SELECT * FROM sync_lock WHERE id = 1";

    private final Jdbi jdbi;
    private final Duration ttl;

    /**
     * Creates a new SyncLockRepository.
     *
     * @param theJdbi the JDBI instance
     * @param theTtlSeconds the age after which a held lock may be broken
     */
    public SyncLockRepository(
            final Jdbi theJdbi,
            @Value("${drive-sync.lock-ttl-seconds:600}")
            final long theTtlSeconds) {
        this.jdbi = theJdbi;
        this.ttl = Duration.ofSeconds(theTtlSeconds);
    }

    /**
     * Tries to take the lock for an owner.
     *
     * @param owner the owner id, unique per process
     * @param now the current instant
     * @return true when the owner now holds the lock
     */
    public boolean tryAcquire(final String owner, final Instant now) {
        return jdbi.inTransaction(handle -> {
            handle.createUpdate("""
                    INSERT INTO sync_lock (id, held)
                    VALUES (1, FALSE)
                    ON CONFLICT (id) DO NOTHING
                    """)
                    .execute();

            final SyncLock current = handle.createQuery(FIND_FOR_UPDATE)
                    .map(new SyncLockRowMapper())
                    .one();

            if (!current.isAvailable(now, ttl)) {
                LOG.debug("Lock held by {} for {}s", current.owner(),
                        current.age(now).toSeconds());
                return false;
            }

            if (current.held()) {
                LOG.warn("Breaking stale lock from {} (acquired {}s ago)",
                        current.owner(), current.age(now).toSeconds());
            }

            handle.createUpdate("""
                    UPDATE sync_lock SET
                        held = TRUE,
                        owner = :owner,
                        acquired_at = :acquiredAt
                    WHERE id = 1
                    """)
                    .bind("owner", owner)
                    .bind("acquiredAt", Timestamp.from(now))
                    .execute();
            return true;
        });
    }

    /**
     * Releases the lock if the owner still holds it.
     *
     * @param owner the owner id
     * @return true when the lock was released by this call
     */
    public boolean release(final String owner) {
        final int updated = jdbi.withHandle(handle -> handle.createUpdate("""
                UPDATE sync_lock SET
                    held = FALSE,
                    owner = NULL,
                    acquired_at = NULL
                WHERE id = 1 AND held = TRUE AND owner = :owner
                """)
                .bind("owner", owner)
                .execute());
        if (updated == 0) {
            LOG.warn("Lock was not held by {} at release", owner);
        }
        return updated > 0;
    }

    /**
     * Reads the lock without taking it.
     *
     * @return the current lock, free when never taken
     */
    public SyncLock current() {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND)
                .map(new SyncLockRowMapper())
                .findOne()
                .orElse(SyncLock.free()));
    }

    private static final class SyncLockRowMapper
            implements RowMapper<SyncLock> {

        @Override
        public SyncLock map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            final Timestamp acquiredTs = rs.getTimestamp("acquired_at");
            return new SyncLock(
                    rs.getBoolean("held"),
                    rs.getString("owner"),
                    acquiredTs != null ? acquiredTs.toInstant() : null);
        }
    }

}
