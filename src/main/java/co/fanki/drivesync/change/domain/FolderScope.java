package co.fanki.drivesync.change.domain;

/**
 * Answers where a Drive file sits relative to the monitored folder.
 *
 * <p>Both operations walk the parent chain up to the monitored root.
 * Lookups that fail are never propagated: containment degrades to
 * {@code false} and path resolution to a shorter path.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface FolderScope {

    /**
     * Checks whether the file lives somewhere below the monitored folder.
     *
     * @param file the snapshot, never null
     * @return true if one of its ancestors is the monitored folder
     */
    boolean contains(DriveFile file);

    /**
     * Builds the {@code /}-joined path of the file below the monitored
     * folder, e.g. {@code Contracts/2024/offer.docx}.
     *
     * @param file the snapshot, never null
     * @return the relative path, ending with the file name
     */
    String resolveRelativePath(DriveFile file);

}
