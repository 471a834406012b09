package co.fanki.drivesync.sync.domain;

import co.fanki.drivesync.shared.DomainException;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Centralizes all valid sync cycle stage transitions.
 *
 * <p>Valid transitions:</p>
 * <pre>
 *   IDLE          → UNINITIALIZED, FETCHING
 *   UNINITIALIZED → DONE
 *   FETCHING      → CLASSIFYING, DONE
 *   CLASSIFYING   → MATERIALIZING, DONE
 *   MATERIALIZING → COMMITTING, PERSISTING
 *   COMMITTING    → PUSHING
 *   PUSHING       → PERSISTING
 *   PERSISTING    → DONE
 * </pre>
 *
 * <p>The only way to reach PERSISTING with something to record is through
 * PUSHING, so state is never written for commits that were not pushed.
 * MATERIALIZING goes straight to PERSISTING only when nothing could be
 * applied, and then only the cursor is written.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SyncStateMachine {

    private static final Map<SyncStage, Set<SyncStage>> TRANSITIONS;

    static {
        TRANSITIONS = new EnumMap<>(SyncStage.class);
        TRANSITIONS.put(SyncStage.IDLE,          EnumSet.of(SyncStage.UNINITIALIZED, SyncStage.FETCHING));
        TRANSITIONS.put(SyncStage.UNINITIALIZED, EnumSet.of(SyncStage.DONE));
        TRANSITIONS.put(SyncStage.FETCHING,      EnumSet.of(SyncStage.CLASSIFYING, SyncStage.DONE));
        TRANSITIONS.put(SyncStage.CLASSIFYING,   EnumSet.of(SyncStage.MATERIALIZING, SyncStage.DONE));
        TRANSITIONS.put(SyncStage.MATERIALIZING, EnumSet.of(SyncStage.COMMITTING, SyncStage.PERSISTING));
        TRANSITIONS.put(SyncStage.COMMITTING,    EnumSet.of(SyncStage.PUSHING));
        TRANSITIONS.put(SyncStage.PUSHING,       EnumSet.of(SyncStage.PERSISTING));
        TRANSITIONS.put(SyncStage.PERSISTING,    EnumSet.of(SyncStage.DONE));
    }

    private SyncStateMachine() {
    }

    /**
     * Validates a stage transition and returns the target stage if it is
     * permitted.
     *
     * @param from the current stage
     * @param to   the desired stage
     * @return {@code to} when the transition is valid
     * @throws DomainException      with code {@code SYNC_INVALID_TRANSITION}
     *                              when the transition is not permitted
     * @throws NullPointerException if {@code from} or {@code to} is null
     */
    public static SyncStage transition(final SyncStage from, final SyncStage to) {
        if (from == null || to == null) {
            throw new NullPointerException("from and to must not be null");
        }
        final Set<SyncStage> allowed = TRANSITIONS.getOrDefault(from, EnumSet.noneOf(SyncStage.class));
        if (!allowed.contains(to)) {
            throw new DomainException(
                    "Invalid transition: " + from + " → " + to,
                    "SYNC_INVALID_TRANSITION"
            );
        }
        return to;
    }

}
