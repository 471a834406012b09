package co.fanki.drivesync.change.domain;

import co.fanki.drivesync.shared.Preconditions;

import java.util.Objects;

/**
 * A classified Drive change, ready to be applied to the working copy.
 *
 * <p>Instances are only built through the factories, one per action, so
 * every change carries exactly the fields its action needs: a DELETE has
 * no snapshot and no new path, an ADD has no previous record, a SKIP
 * only names the file.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Change {

    private final String fileId;
    private final ChangeType type;
    private final DriveFile file;
    private final TrackedFile previous;
    private final String oldPath;
    private final String newPath;

    private Change(
            final String theFileId,
            final ChangeType theType,
            final DriveFile theFile,
            final TrackedFile thePrevious,
            final String theOldPath,
            final String theNewPath) {
        this.fileId = Preconditions.requireNonBlank(theFileId,
                "Change file id is required");
        this.type = Preconditions.requireNonNull(theType,
                "Change type is required");
        this.file = theFile;
        this.previous = thePrevious;
        this.oldPath = theOldPath;
        this.newPath = theNewPath;
    }

    /**
     * Creates an ADD for a file seen for the first time.
     *
     * @param file the current snapshot
     * @param path the resolved relative path
     * @return the change
     */
    public static Change add(final DriveFile file, final String path) {
        Preconditions.requireNonNull(file, "Snapshot is required");
        return new Change(file.id(), ChangeType.ADD, file, null, null,
                Preconditions.requireNonBlank(path, "Path is required"));
    }

    /**
     * Creates a MODIFY for a tracked file whose content changed in place.
     *
     * @param file the current snapshot
     * @param previous the tracked record
     * @return the change
     */
    public static Change modify(final DriveFile file,
            final TrackedFile previous) {
        Preconditions.requireNonNull(file, "Snapshot is required");
        Preconditions.requireNonNull(previous, "Previous record is required");
        return new Change(file.id(), ChangeType.MODIFY, file, previous,
                null, previous.relativePath());
    }

    /**
     * Creates a RENAME or MOVE for a tracked file whose path changed.
     *
     * <p>RENAME when the bare name differs from the recorded one, MOVE
     * when only the folder changed.</p>
     *
     * @param file the current snapshot
     * @param previous the tracked record
     * @param newPath the resolved relative path
     * @return the change
     */
    public static Change relocate(final DriveFile file,
            final TrackedFile previous, final String newPath) {
        Preconditions.requireNonNull(file, "Snapshot is required");
        Preconditions.requireNonNull(previous, "Previous record is required");
        final ChangeType type = Objects.equals(previous.name(), file.name())
                ? ChangeType.MOVE : ChangeType.RENAME;
        return new Change(file.id(), type, file, previous,
                previous.relativePath(),
                Preconditions.requireNonBlank(newPath, "Path is required"));
    }

    /**
     * Creates a DELETE for a tracked file that is gone or out of scope.
     *
     * @param previous the tracked record
     * @return the change
     */
    public static Change delete(final TrackedFile previous) {
        Preconditions.requireNonNull(previous, "Previous record is required");
        return new Change(previous.fileId(), ChangeType.DELETE, null,
                previous, previous.relativePath(), null);
    }

    /**
     * Creates a SKIP for a re-notification that changes nothing.
     *
     * @param fileId the file id
     * @return the change
     */
    public static Change skip(final String fileId) {
        return new Change(fileId, ChangeType.SKIP, null, null, null, null);
    }

    /**
     * Checks whether, for a relocation, the content has to be fetched
     * again.
     *
     * <p>With a content hash the answer is whether it differs from the
     * recorded one. Without a hash (Google-native documents) the
     * modification time cannot be trusted across a rename, so the content
     * is always refreshed. ADD and MODIFY always refresh.</p>
     *
     * @return true when content must be downloaded
     */
    public boolean requiresContentRefresh() {
        if (type.writesContent()) {
            return true;
        }
        if (!type.isRelocation()) {
            return false;
        }
        if (file.hasContentHash()) {
            return !file.contentHash().equals(previous.contentHash());
        }
        return true;
    }

    /**
     * Returns the path used to describe this change in commit messages.
     *
     * @return the new path, else the old path, else the file id
     */
    public String describedPath() {
        if (newPath != null) {
            return newPath;
        }
        if (oldPath != null) {
            return oldPath;
        }
        return fileId;
    }

    /**
     * Returns the editor name reported by Drive.
     *
     * @return the name, or null when unknown or for deletions
     */
    public String editorName() {
        return file != null ? file.editorName() : null;
    }

    /**
     * Returns the editor email reported by Drive.
     *
     * @return the email, or null when unknown or for deletions
     */
    public String editorEmail() {
        return file != null ? file.editorEmail() : null;
    }

    public String fileId() {
        return fileId;
    }

    public ChangeType type() {
        return type;
    }

    /** Current snapshot; null for DELETE and SKIP. */
    public DriveFile file() {
        return file;
    }

    /** Tracked record before this change; null for ADD and SKIP. */
    public TrackedFile previous() {
        return previous;
    }

    public String oldPath() {
        return oldPath;
    }

    public String newPath() {
        return newPath;
    }

    @Override
    public String toString() {
        return type.label() + " " + describedPath() + " (" + fileId + ")";
    }

}
