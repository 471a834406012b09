package co.fanki.drivesync.content.domain;

import co.fanki.drivesync.change.domain.Change;
import co.fanki.drivesync.change.domain.DriveFile;
import co.fanki.drivesync.change.domain.TrackedFile;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps Drive paths to paths inside the working copy.
 *
 * <p>Paths handled by the rest of the system are relative to the monitored
 * folder (e.g. {@code Contracts/offer.pdf}). In the repository every such
 * path lives under the docs sub-directory, and natively-edited documents
 * are stored under their export name:</p>
 *
 * <pre>
 *   Contracts/offer.pdf  -&gt; docs/Contracts/offer.pdf
 *                           docs/Contracts/offer.pdf.txt   (derived)
 *   Plans/Roadmap        -&gt; docs/Plans/Roadmap.docx
 *                           docs/Plans/Roadmap.docx.md     (derived)
 * </pre>
 *
 * <p>Derived text paths are kept relative to the monitored folder, the way
 * they are stored in {@link TrackedFile#derivedTextPath()}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ContentLayout {

    private final String docsSubdir;

    /**
     * Creates a new ContentLayout.
     *
     * @param theDocsSubdir the directory holding the mirror, empty for the
     *                      repository root
     */
    public ContentLayout(final String theDocsSubdir) {
        this.docsSubdir = trimSlashes(
                theDocsSubdir != null ? theDocsSubdir : "");
    }

    /**
     * Prefixes a folder-relative path with the docs sub-directory.
     *
     * @param relativePath the path below the monitored folder
     * @return the path inside the working copy
     */
    public String repoPath(final String relativePath) {
        return docsSubdir.isEmpty() ? relativePath
                : docsSubdir + "/" + relativePath;
    }

    /**
     * Returns where the original bytes of a file are stored.
     *
     * @param relativePath the path below the monitored folder
     * @param mimeType the Drive MIME type
     * @return the path inside the working copy
     */
    public String originalPath(final String relativePath,
            final String mimeType) {
        final String stored = NativeDocumentType.fromMimeType(mimeType)
                .map(type -> type.exportName(relativePath))
                .orElse(relativePath);
        return repoPath(stored);
    }

    /**
     * Detects the format text can be derived from.
     *
     * @param fileName the Drive name
     * @param mimeType the Drive MIME type
     * @return the format, or empty when no text is derived
     */
    public static Optional<DocumentFormat> extractableFormat(
            final String fileName, final String mimeType) {
        final Optional<NativeDocumentType> nativeType =
                NativeDocumentType.fromMimeType(mimeType);
        if (nativeType.isPresent()) {
            return Optional.of(nativeType.get().exportFormat());
        }
        return DocumentFormat.fromFileName(fileName);
    }

    /**
     * Builds the bare name of the derived text file.
     *
     * @param fileName the Drive name
     * @param mimeType the Drive MIME type
     * @return e.g. {@code offer.pdf.txt} or {@code Roadmap.docx.md}
     */
    public static Optional<String> derivedName(final String fileName,
            final String mimeType) {
        final Optional<NativeDocumentType> nativeType =
                NativeDocumentType.fromMimeType(mimeType);
        if (nativeType.isPresent()) {
            final NativeDocumentType type = nativeType.get();
            return Optional.of(type.exportFormat()
                    .derivedName(type.exportName(fileName)));
        }
        return DocumentFormat.fromFileName(fileName)
                .map(format -> format.derivedName(fileName));
    }

    /**
     * Builds the folder-relative path of the derived text file: the
     * derived name placed in the directory of the given path.
     *
     * @param relativePath the path of the original below the folder
     * @param fileName the Drive name
     * @param mimeType the Drive MIME type
     * @return the path, or empty when no text is derived
     */
    public static Optional<String> derivedTextPath(final String relativePath,
            final String fileName, final String mimeType) {
        return derivedName(fileName, mimeType).map(name -> {
            final int slash = relativePath.lastIndexOf('/');
            return slash < 0 ? name
                    : relativePath.substring(0, slash + 1) + name;
        });
    }

    /**
     * Lists the working copy paths a change touches, for staging it on its
     * own.
     *
     * @param change the applied change
     * @return the paths inside the working copy, in staging order
     */
    public List<String> pathsOf(final Change change) {
        final List<String> paths = new ArrayList<>();
        final TrackedFile previous = change.previous();
        final DriveFile file = change.file();

        switch (change.type()) {
            case DELETE -> {
                paths.add(originalPath(previous.relativePath(),
                        previous.mimeType()));
                if (previous.derivedTextPath() != null) {
                    paths.add(repoPath(previous.derivedTextPath()));
                }
            }
            case RENAME, MOVE -> {
                paths.add(originalPath(previous.relativePath(),
                        previous.mimeType()));
                paths.add(originalPath(change.newPath(), file.mimeType()));
                if (previous.derivedTextPath() != null) {
                    paths.add(repoPath(previous.derivedTextPath()));
                }
                derivedTextPath(change.newPath(), file.name(),
                        file.mimeType())
                        .map(this::repoPath)
                        .ifPresent(paths::add);
            }
            case ADD, MODIFY -> {
                paths.add(originalPath(change.newPath(), file.mimeType()));
                derivedTextPath(change.newPath(), file.name(),
                        file.mimeType())
                        .map(this::repoPath)
                        .ifPresent(paths::add);
            }
            default -> {
            }
        }
        return paths;
    }

    private static String trimSlashes(final String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }

}
