package co.fanki.drivesync.sync.domain;

/**
 * Stages of one sync cycle.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum SyncStage {

    /** Cycle created, nothing done yet. */
    IDLE,

    /** No cursor stored; a start cursor is being recorded. */
    UNINITIALIZED,

    /** Reading the change feed, or listing the folder for an initial sync. */
    FETCHING,

    /** Deduplicating and classifying the fetched records. */
    CLASSIFYING,

    /** Applying changes to the working copy. */
    MATERIALIZING,

    /** Creating the per-author commits. */
    COMMITTING,

    /** Pushing the commits. */
    PUSHING,

    /** Writing tracked files and the cursor. */
    PERSISTING,

    /** Cycle finished. */
    DONE

}
