package co.fanki.drivesync.sync.domain;

import co.fanki.drivesync.support.PostgresDatabase;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Integration tests for SyncLockRepository using TestContainers.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Testcontainers(disabledWithoutDocker = true)
class SyncLockRepositoryIntegrationTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Container
    static PostgreSQLContainer<?> postgres = PostgresDatabase.container();

    private static Jdbi jdbi;

    private SyncLockRepository repository;

    @BeforeAll
    static void migrate() {
        jdbi = PostgresDatabase.migrate(postgres);
    }

    @BeforeEach
    void setUp() {
        repository = new SyncLockRepository(jdbi, 600);
        jdbi.useHandle(handle -> handle.execute("UPDATE sync_lock SET"
                + " held = FALSE, owner = NULL, acquired_at = NULL"));
    }

    @Test
    void whenAcquiring_givenFreeLock_shouldRecordOwner() {
        assertTrue(repository.tryAcquire("a", NOW));

        final SyncLock lock = repository.current();
        assertTrue(lock.held());
        assertEquals("a", lock.owner());
        assertEquals(NOW, lock.acquiredAt());
    }

    @Test
    void whenAcquiring_givenFreshLockOfAnotherOwner_shouldRefuse() {
        assertTrue(repository.tryAcquire("a", NOW));

        assertFalse(repository.tryAcquire("b", NOW.plusSeconds(60)));
        assertEquals("a", repository.current().owner());
    }

    @Test
    void whenAcquiring_givenStaleLock_shouldTakeOver() {
        assertTrue(repository.tryAcquire("a", NOW));

        assertTrue(repository.tryAcquire("b", NOW.plusSeconds(601)));
        assertEquals("b", repository.current().owner());

        assertFalse(repository.release("a"));
        assertTrue(repository.current().held());
        assertEquals("b", repository.current().owner());
    }

    @Test
    void whenReleasing_givenOwnerAndStranger_shouldOnlyHonorOwner() {
        assertTrue(repository.tryAcquire("a", NOW));

        assertFalse(repository.release("b"));
        assertTrue(repository.current().held());

        assertTrue(repository.release("a"));
        assertFalse(repository.current().held());
        assertTrue(repository.tryAcquire("b", NOW));
    }

    @Test
    void whenAcquiring_givenConcurrentOwners_shouldGrantExactlyOne()
            throws Exception {
        final int owners = 8;
        final ExecutorService executor = Executors.newFixedThreadPool(owners);
        final CountDownLatch start = new CountDownLatch(1);
        try {
            final List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < owners; i++) {
                final String owner = "owner-" + i;
                final Callable<Boolean> attempt = () -> {
                    start.await();
                    return repository.tryAcquire(owner, NOW);
                };
                results.add(executor.submit(attempt));
            }
            start.countDown();

            int granted = 0;
            for (final Future<Boolean> result : results) {
                if (result.get()) {
                    granted++;
                }
            }
            assertEquals(1, granted);
        } finally {
            executor.shutdownNow();
        }
    }

}
