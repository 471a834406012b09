package co.fanki.drivesync.sync.application;

import co.fanki.drivesync.git.domain.GitOperationException;
import co.fanki.drivesync.sync.domain.SyncLockRepository;
import co.fanki.drivesync.sync.domain.SyncResult;
import co.fanki.drivesync.sync.domain.SyncStateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link SyncCoordinator}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SyncCoordinatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private SyncLockRepository lockRepository;
    private SyncStateRepository stateRepository;
    private SyncCycleService cycleService;

    private SyncCoordinator coordinator;
    private final String owner = "owner-1";

    @BeforeEach
    void setUp() {
        lockRepository = createMock(SyncLockRepository.class);
        stateRepository = createMock(SyncStateRepository.class);
        cycleService = createMock(SyncCycleService.class);

        final Iterator<String> owners =
                List.of("owner-1", "owner-2", "owner-3").iterator();
        coordinator = new SyncCoordinator(lockRepository, stateRepository,
                cycleService, SyncCycleServiceTest.settings(),
                Clock.fixed(NOW, ZoneOffset.UTC), owners::next);
    }

    @Test
    void whenNotified_givenLockHeldElsewhere_shouldOnlyFlagResync() {
        expect(lockRepository.tryAcquire(owner, NOW)).andReturn(false);
        stateRepository.markResyncNeeded();
        replayAll();

        assertFalse(coordinator.onNotification());
        verifyAll();
    }

    @Test
    void whenNotified_givenNoResyncRequested_shouldRunOneCycle() {
        expect(lockRepository.tryAcquire(owner, NOW)).andReturn(true);
        stateRepository.clearResyncNeeded();
        expect(cycleService.runCycle()).andReturn(SyncResult.none());
        expect(stateRepository.isResyncNeeded()).andReturn(false);
        expect(lockRepository.release(owner)).andReturn(true);
        replayAll();

        assertTrue(coordinator.onNotification());
        verifyAll();
    }

    @Test
    void whenNotified_givenResyncAlwaysRequested_shouldStopAtIterationLimit() {
        expect(lockRepository.tryAcquire(owner, NOW)).andReturn(true);
        stateRepository.clearResyncNeeded();
        expectLastCall().times(3);
        expect(cycleService.runCycle()).andReturn(SyncResult.none()).times(3);
        expect(stateRepository.isResyncNeeded()).andReturn(true).times(3);
        expect(lockRepository.release(owner)).andReturn(true);
        replayAll();

        assertTrue(coordinator.onNotification());
        verifyAll();
    }

    @Test
    void whenNotified_givenCycleFailure_shouldReleaseLockAndPropagate() {
        expect(lockRepository.tryAcquire(owner, NOW)).andReturn(true);
        stateRepository.clearResyncNeeded();
        expect(cycleService.runCycle()).andThrow(new GitOperationException(
                "rejected", GitOperationException.PUSH_REJECTED));
        expect(lockRepository.release(owner)).andReturn(true);
        replayAll();

        assertThrows(GitOperationException.class,
                () -> coordinator.onNotification());
        verifyAll();
    }

    @Test
    void whenFirstHolderReleases_givenSameProcessTakeover_shouldUseItsOwnOwnerId() {
        expect(lockRepository.tryAcquire("owner-1", NOW)).andReturn(true);
        stateRepository.clearResyncNeeded();
        expect(cycleService.runCycle()).andAnswer(() -> {
            // A second request breaks the stale lock while this cycle runs.
            assertEquals(Optional.of("renewed"),
                    coordinator.runExclusive("catch-up sync", () -> "renewed"));
            return SyncResult.none();
        });
        expect(lockRepository.tryAcquire("owner-2", NOW)).andReturn(true);
        expect(lockRepository.release("owner-2")).andReturn(true);
        expect(stateRepository.isResyncNeeded()).andReturn(false);
        expect(lockRepository.release("owner-1")).andReturn(false);
        replayAll();

        assertTrue(coordinator.onNotification());
        verifyAll();
    }

    @Test
    void whenAcquiringTwice_givenSequentialRequests_shouldUseFreshOwnerEachTime() {
        expect(lockRepository.tryAcquire("owner-1", NOW)).andReturn(true);
        expect(lockRepository.release("owner-1")).andReturn(true);
        expect(lockRepository.tryAcquire("owner-2", NOW)).andReturn(true);
        expect(lockRepository.release("owner-2")).andReturn(true);
        replayAll();

        assertEquals(Optional.of(1), coordinator.runExclusive("a", () -> 1));
        assertEquals(Optional.of(2), coordinator.runExclusive("b", () -> 2));
        verifyAll();
    }

    @Test
    void whenRunningExclusive_givenLockAvailable_shouldReturnActionResult() {
        expect(lockRepository.tryAcquire(owner, NOW)).andReturn(true);
        expect(lockRepository.release(owner)).andReturn(true);
        replayAll();

        final Optional<String> result = coordinator.runExclusive("test",
                () -> "done");

        assertEquals(Optional.of("done"), result);
        verifyAll();
    }

    @Test
    void whenRunningExclusive_givenLockTaken_shouldSkipAction() {
        expect(lockRepository.tryAcquire(owner, NOW)).andReturn(false);
        replayAll();

        final Optional<String> result = coordinator.runExclusive("test",
                () -> {
                    throw new IllegalStateException("must not run");
                });

        assertTrue(result.isEmpty());
        verifyAll();
    }

    private void replayAll() {
        replay(lockRepository, stateRepository, cycleService);
    }

    private void verifyAll() {
        verify(lockRepository, stateRepository, cycleService);
    }

}
