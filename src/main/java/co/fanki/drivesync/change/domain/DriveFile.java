package co.fanki.drivesync.change.domain;

import co.fanki.drivesync.shared.Preconditions;

import java.util.List;

/**
 * Metadata snapshot of a Drive file as reported by the change feed.
 *
 * @param id the Drive file id
 * @param name the bare file name
 * @param parents the parent folder ids, never null
 * @param mimeType the MIME type, may be null
 * @param contentHash the md5 checksum, null for Google-native documents
 * @param trashed whether the file sits in the trash
 * @param modifiedTime the RFC-3339 modification time, may be null
 * @param size the size in bytes, null when Drive does not report one
 * @param editorName the display name of the last modifying user
 * @param editorEmail the email of the last modifying user
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DriveFile(
        String id,
        String name,
        List<String> parents,
        String mimeType,
        String contentHash,
        boolean trashed,
        String modifiedTime,
        Long size,
        String editorName,
        String editorEmail
) {

    /** MIME type Drive uses for folders. */
    public static final String FOLDER_MIME_TYPE =
            "application/vnd.google-apps.folder";

    private static final String GOOGLE_NATIVE_PREFIX =
            "application/vnd.google-apps.";

    /** Normalizes optional collections and the name. */
    public DriveFile {
        Preconditions.requireNonBlank(id, "Drive file id is required");
        name = name != null ? name : "unknown";
        parents = parents != null ? List.copyOf(parents) : List.of();
    }

    /**
     * Checks whether Drive reports a stable content hash for this file.
     *
     * @return true when an md5 checksum is present
     */
    public boolean hasContentHash() {
        return contentHash != null && !contentHash.isEmpty();
    }

    /**
     * Checks whether this entry is a folder.
     *
     * @return true for folders
     */
    public boolean isFolder() {
        return FOLDER_MIME_TYPE.equals(mimeType);
    }

    /**
     * Checks whether this is a Google-native (Docs, Sheets, ...) item.
     *
     * @return true when the MIME type lives under the google-apps tree
     */
    public boolean isGoogleNative() {
        return mimeType != null && mimeType.startsWith(GOOGLE_NATIVE_PREFIX);
    }

}
