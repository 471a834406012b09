package co.fanki.drivesync.sync.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Tracks the stage of one running sync cycle.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SyncCycle {

    private static final Logger LOG = LoggerFactory.getLogger(SyncCycle.class);

    private final String id;
    private SyncStage stage;

    private SyncCycle(final String theId) {
        this.id = theId;
        this.stage = SyncStage.IDLE;
    }

    /**
     * Starts a new cycle in {@link SyncStage#IDLE}.
     *
     * @return the cycle
     */
    public static SyncCycle start() {
        return new SyncCycle(UUID.randomUUID().toString().substring(0, 8));
    }

    /**
     * Moves the cycle to the next stage.
     *
     * @param next the target stage
     * @throws co.fanki.drivesync.shared.DomainException when the move is
     *         not a valid transition
     */
    public void advance(final SyncStage next) {
        stage = SyncStateMachine.transition(stage, next);
        LOG.debug("Cycle {} entered {}", id, stage);
    }

    public String id() {
        return id;
    }

    public SyncStage stage() {
        return stage;
    }

}
