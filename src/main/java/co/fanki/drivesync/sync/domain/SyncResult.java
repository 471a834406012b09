package co.fanki.drivesync.sync.domain;

import co.fanki.drivesync.change.domain.Change;

import java.util.List;

/**
 * Summary of one sync cycle.
 *
 * @param processed the number of changes committed and recorded
 * @param added the ADD changes among them
 * @param modified the MODIFY changes among them
 * @param renamed the RENAME changes among them
 * @param moved the MOVE changes among them
 * @param deleted the DELETE changes among them
 * @param failed the changes that could not be applied
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SyncResult(
        int processed,
        int added,
        int modified,
        int renamed,
        int moved,
        int deleted,
        int failed
) {

    /**
     * Creates the result of a cycle that applied nothing.
     *
     * @return an all-zero result
     */
    public static SyncResult none() {
        return new SyncResult(0, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Counts the applied changes by type.
     *
     * @param applied the changes that were pushed
     * @param failed how many changes failed to apply
     * @return the result
     */
    public static SyncResult of(final List<Change> applied, final int failed) {
        int added = 0;
        int modified = 0;
        int renamed = 0;
        int moved = 0;
        int deleted = 0;
        for (final Change change : applied) {
            switch (change.type()) {
                case ADD -> added++;
                case MODIFY -> modified++;
                case RENAME -> renamed++;
                case MOVE -> moved++;
                case DELETE -> deleted++;
                default -> {
                }
            }
        }
        return new SyncResult(applied.size(), added, modified, renamed, moved,
                deleted, failed);
    }

}
