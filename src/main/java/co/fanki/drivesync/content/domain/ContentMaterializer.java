package co.fanki.drivesync.content.domain;

import co.fanki.drivesync.change.domain.Change;
import co.fanki.drivesync.change.domain.DriveFile;
import co.fanki.drivesync.change.domain.TrackedFile;
import co.fanki.drivesync.drive.domain.DriveGateway;
import co.fanki.drivesync.git.domain.WorkingCopy;
import co.fanki.drivesync.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Applies classified changes to a working copy.
 *
 * <p>Each change is applied on its own: a failure is logged and returned
 * as a failed {@link MaterializationResult}, leaving the other changes of
 * the batch unaffected. A failed text extraction is not a failure of the
 * change; the original is still written and the derived file is
 * omitted.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ContentMaterializer {

    private static final Logger LOG =
            LoggerFactory.getLogger(ContentMaterializer.class);

    private final DriveGateway drive;
    private final TextExtractor extractor;
    private final ContentLayout layout;

    /**
     * Creates a new ContentMaterializer.
     *
     * @param theDrive the source of file content
     * @param theExtractor the text extractor
     * @param theLayout the working copy layout
     */
    public ContentMaterializer(
            final DriveGateway theDrive,
            final TextExtractor theExtractor,
            final ContentLayout theLayout) {
        this.drive = Preconditions.requireNonNull(theDrive,
                "Drive gateway is required");
        this.extractor = Preconditions.requireNonNull(theExtractor,
                "Text extractor is required");
        this.layout = Preconditions.requireNonNull(theLayout,
                "Content layout is required");
    }

    /**
     * Applies one change.
     *
     * @param change the classified change, not a SKIP
     * @param workingCopy the checkout of this cycle
     * @return the outcome, never null
     */
    public MaterializationResult materialize(final Change change,
            final WorkingCopy workingCopy) {
        try {
            return switch (change.type()) {
                case DELETE -> delete(change, workingCopy);
                case RENAME, MOVE -> relocate(change, workingCopy);
                case ADD, MODIFY -> write(change, workingCopy);
                case SKIP -> MaterializationResult.failed(change,
                        "Nothing to apply for a skipped change");
            };
        } catch (final RuntimeException e) {
            LOG.error("Failed to process {} for {}", change.type().label(),
                    change.fileId(), e);
            return MaterializationResult.failed(change, e.getMessage());
        }
    }

    private MaterializationResult delete(final Change change,
            final WorkingCopy workingCopy) {
        final TrackedFile previous = change.previous();
        if (change.oldPath() == null) {
            return MaterializationResult.success(change, null);
        }

        workingCopy.delete(layout.originalPath(previous.relativePath(),
                previous.mimeType()));
        if (previous.derivedTextPath() != null) {
            workingCopy.delete(layout.repoPath(previous.derivedTextPath()));
        }

        LOG.info("Deleted {}", change.oldPath());
        return MaterializationResult.success(change, null);
    }

    private MaterializationResult relocate(final Change change,
            final WorkingCopy workingCopy) {
        final TrackedFile previous = change.previous();
        final DriveFile file = change.file();

        workingCopy.rename(
                layout.originalPath(previous.relativePath(),
                        previous.mimeType()),
                layout.originalPath(change.newPath(), file.mimeType()));

        String derived = null;
        if (previous.derivedTextPath() != null) {
            final Optional<String> newDerived = ContentLayout.derivedTextPath(
                    change.newPath(), file.name(), file.mimeType());
            if (newDerived.isPresent()) {
                workingCopy.rename(layout.repoPath(previous.derivedTextPath()),
                        layout.repoPath(newDerived.get()));
                derived = newDerived.get();
            } else {
                workingCopy.delete(layout.repoPath(previous.derivedTextPath()));
            }
        }

        if (change.requiresContentRefresh()) {
            derived = writeContent(file, change.newPath(), workingCopy,
                    derived);
        }

        LOG.info("Renamed {} to {}", change.oldPath(), change.newPath());
        return MaterializationResult.success(change, derived);
    }

    private MaterializationResult write(final Change change,
            final WorkingCopy workingCopy) {
        final String existing = change.previous() != null
                ? change.previous().derivedTextPath() : null;
        final String derived = writeContent(change.file(), change.newPath(),
                workingCopy, existing);
        LOG.info("{} {}", change.type(), change.newPath());
        return MaterializationResult.success(change, derived);
    }

    /**
     * Downloads the file, writes the original and, when possible, the
     * derived text.
     *
     * @return the derived text path now present, or the existing one when
     *         no new text was written
     */
    private String writeContent(final DriveFile file, final String path,
            final WorkingCopy workingCopy, final String existingDerived) {
        final byte[] content = drive.fetchOriginal(file.id(), file.mimeType());
        workingCopy.write(layout.originalPath(path, file.mimeType()), content);

        final Optional<DocumentFormat> format =
                ContentLayout.extractableFormat(file.name(), file.mimeType());
        final Optional<String> derivedPath = ContentLayout.derivedTextPath(
                path, file.name(), file.mimeType());
        if (format.isEmpty() || derivedPath.isEmpty()) {
            return existingDerived;
        }

        try {
            final String text = extractor.extract(content, format.get());
            workingCopy.write(layout.repoPath(derivedPath.get()),
                    text.getBytes(StandardCharsets.UTF_8));
            return derivedPath.get();
        } catch (final TextExtractionException e) {
            LOG.warn("Text extraction failed for {}: {}", path,
                    e.getMessage());
            return existingDerived;
        }
    }

}
