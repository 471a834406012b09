package co.fanki.drivesync.change.domain;

import java.util.Locale;

/**
 * Action decided for one Drive file during a sync cycle.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ChangeType {

    /** File not tracked yet. */
    ADD,

    /** Same path, new content. */
    MODIFY,

    /** Path changed and the bare name changed too. */
    RENAME,

    /** Path changed, same bare name (different folder). */
    MOVE,

    /** File removed, trashed or moved out of the monitored folder. */
    DELETE,

    /** Re-notification with nothing to apply. */
    SKIP;

    /**
     * Checks if the action relocates the file.
     *
     * @return true for RENAME and MOVE
     */
    public boolean isRelocation() {
        return this == RENAME || this == MOVE;
    }

    /**
     * Checks if the action writes fresh content.
     *
     * @return true for ADD and MODIFY
     */
    public boolean writesContent() {
        return this == ADD || this == MODIFY;
    }

    /**
     * Returns the lower-case label used in commit messages.
     *
     * @return the label
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

}
