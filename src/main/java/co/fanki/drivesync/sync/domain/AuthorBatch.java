package co.fanki.drivesync.sync.domain;

import co.fanki.drivesync.change.domain.Change;
import co.fanki.drivesync.change.domain.Editor;

import java.util.List;

/**
 * The changes committed together under one author.
 *
 * @param author the commit author
 * @param message the commit message
 * @param changes the changes in the order they were applied
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AuthorBatch(Editor author, String message, List<Change> changes) {

    /** Copies the changes. */
    public AuthorBatch {
        changes = List.copyOf(changes);
    }

}
