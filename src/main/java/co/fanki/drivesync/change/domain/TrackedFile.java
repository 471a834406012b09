package co.fanki.drivesync.change.domain;

import co.fanki.drivesync.shared.Preconditions;

import java.time.Instant;

/**
 * Persisted knowledge about a Drive file mirrored in the repository.
 *
 * <p>A record exists if and only if the file is believed to exist inside
 * the monitored folder and is not excluded. Records are written only
 * after the commit carrying the change has been pushed.</p>
 *
 * @param fileId the Drive file id, unique key
 * @param name the bare file name at the time of the last sync
 * @param relativePath the path relative to the monitored folder
 * @param contentHash the md5 checksum, null for Google-native documents
 * @param mimeType the MIME type
 * @param modifiedTime the last seen modification marker
 * @param derivedTextPath the relative path of the derived text, may be null
 * @param editorName the last modifying user name, may be null
 * @param editorEmail the last modifying user email, may be null
 * @param updatedAt when the record was written
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TrackedFile(
        String fileId,
        String name,
        String relativePath,
        String contentHash,
        String mimeType,
        String modifiedTime,
        String derivedTextPath,
        String editorName,
        String editorEmail,
        Instant updatedAt
) {

    /** Validates the identity and path. */
    public TrackedFile {
        Preconditions.requireNonBlank(fileId, "Tracked file id is required");
        Preconditions.requireNonBlank(relativePath,
                "Tracked file path is required");
    }

    /**
     * Builds the record describing a file after its change was pushed.
     *
     * @param file the snapshot the change was applied from
     * @param relativePath the path the file now lives at
     * @param derivedTextPath the derived text path, may be null
     * @param now the write instant
     * @return the new record
     */
    public static TrackedFile track(final DriveFile file,
            final String relativePath, final String derivedTextPath,
            final Instant now) {
        return new TrackedFile(
                file.id(),
                file.name(),
                relativePath,
                file.contentHash(),
                file.mimeType(),
                file.modifiedTime(),
                derivedTextPath,
                file.editorName(),
                file.editorEmail(),
                now);
    }

    /**
     * Checks whether a stable content hash was recorded.
     *
     * @return true when a hash is present
     */
    public boolean hasContentHash() {
        return contentHash != null && !contentHash.isEmpty();
    }

}
