package co.fanki.drivesync.change.domain;

import co.fanki.drivesync.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Turns a raw change record into the action to apply to the mirror.
 *
 * <p>Rules are evaluated in order and the first match wins:</p>
 * <ol>
 *   <li>removed or trashed: DELETE when tracked, otherwise ignored</li>
 *   <li>outside the monitored folder: DELETE when tracked, otherwise
 *       ignored</li>
 *   <li>the relative path is resolved</li>
 *   <li>excluded path: ignored</li>
 *   <li>skipped by extension, size or type: ignored</li>
 *   <li>not tracked: ADD</li>
 *   <li>path changed: RENAME, or MOVE when only the folder changed</li>
 *   <li>hash available on both sides: MODIFY when it differs, else SKIP</li>
 *   <li>otherwise: MODIFY when the modification time differs, else
 *       SKIP</li>
 * </ol>
 *
 * <p>An ignored record yields an empty result; a SKIP is a classified
 * no-op. Neither ends up in a commit.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ChangeClassifier {

    private static final Logger LOG =
            LoggerFactory.getLogger(ChangeClassifier.class);

    private final PathFilter pathFilter;

    /**
     * Creates a new ChangeClassifier.
     *
     * @param thePathFilter the exclude and skip rules
     */
    public ChangeClassifier(final PathFilter thePathFilter) {
        this.pathFilter = Preconditions.requireNonNull(thePathFilter,
                "Path filter is required");
    }

    /**
     * Classifies one record.
     *
     * @param record the deduplicated change record
     * @param scope the folder membership and path resolution of this cycle
     * @param tracked lookup of the persisted record by file id
     * @return the change, or empty when the record is ignored
     */
    public Optional<Change> classify(
            final ChangeRecord record,
            final FolderScope scope,
            final Function<String, Optional<TrackedFile>> tracked) {

        final String fileId = record.fileId();
        final Optional<TrackedFile> previous = tracked.apply(fileId);

        if (record.isGone()) {
            return previous.map(Change::delete);
        }

        final DriveFile file = record.file();
        if (file == null || !scope.contains(file)) {
            if (previous.isPresent()) {
                LOG.debug("File {} left the monitored folder", fileId);
            }
            return previous.map(Change::delete);
        }

        final String path = scope.resolveRelativePath(file);

        if (pathFilter.isExcluded(path)) {
            LOG.debug("Excluded path: {}", path);
            return Optional.empty();
        }

        final Optional<String> skipReason = pathFilter.skipReason(file);
        if (skipReason.isPresent()) {
            LOG.info("Skipping {}: {}", path, skipReason.get());
            return Optional.empty();
        }

        if (previous.isEmpty()) {
            return Optional.of(Change.add(file, path));
        }
        final TrackedFile known = previous.get();

        if (!known.relativePath().equals(path)) {
            return Optional.of(Change.relocate(file, known, path));
        }

        if (file.hasContentHash() && known.hasContentHash()) {
            return Optional.of(file.contentHash().equals(known.contentHash())
                    ? Change.skip(fileId)
                    : Change.modify(file, known));
        }

        return Optional.of(
                Objects.equals(file.modifiedTime(), known.modifiedTime())
                        ? Change.skip(fileId)
                        : Change.modify(file, known));
    }

}
