package co.fanki.drivesync.change.domain;

/**
 * One raw entry of the Drive change feed.
 *
 * <p>Either a removal (the file is gone or no longer visible) or the
 * current metadata snapshot of the file. A removal may come without a
 * snapshot.</p>
 *
 * @param fileId the Drive file id, may be null for malformed entries
 * @param removed whether Drive reports the file as removed
 * @param file the metadata snapshot, may be null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ChangeRecord(String fileId, boolean removed, DriveFile file) {

    /**
     * Creates a record for a file that is present.
     *
     * @param file the snapshot
     * @return the record
     */
    public static ChangeRecord of(final DriveFile file) {
        return new ChangeRecord(file.id(), false, file);
    }

    /**
     * Creates a removal record.
     *
     * @param fileId the removed file id
     * @return the record
     */
    public static ChangeRecord removal(final String fileId) {
        return new ChangeRecord(fileId, true, null);
    }

    /**
     * Checks whether the record means the file should disappear.
     *
     * @return true when removed or trashed
     */
    public boolean isGone() {
        return removed || (file != null && file.trashed());
    }

}
