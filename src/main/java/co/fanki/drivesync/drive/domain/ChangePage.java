package co.fanki.drivesync.drive.domain;

import co.fanki.drivesync.change.domain.ChangeRecord;

import java.util.List;

/**
 * Every change reported after a cursor, with the cursor to resume from.
 *
 * @param records the raw records in feed order
 * @param nextCursor the cursor that follows the last record
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ChangePage(List<ChangeRecord> records, String nextCursor) {

    /** Copies the records. */
    public ChangePage {
        records = records != null ? List.copyOf(records) : List.of();
    }

    /**
     * Checks whether the feed had nothing new.
     *
     * @return true when there are no records
     */
    public boolean isEmpty() {
        return records.isEmpty();
    }

}
