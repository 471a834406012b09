package co.fanki.drivesync.change.domain;

import co.fanki.drivesync.content.domain.NativeDocumentType;
import co.fanki.drivesync.shared.GlobPattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides which Drive files are never mirrored.
 *
 * <p>Exclusions work on the relative path: a pattern matches the full
 * path, and also any leading folder prefix of it once trailing
 * {@code /} and {@code *} characters are removed from the pattern, so
 * {@code Archive/*} excludes everything under {@code Archive}.</p>
 *
 * <p>Skip rules work on the metadata: skipped extensions, files above the
 * size limit, folders, and Google-native types that cannot be
 * exported.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PathFilter {

    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final List<GlobPattern> excludes;
    private final List<GlobPattern> excludePrefixes;
    private final List<String> skipExtensions;
    private final int maxFileSizeMb;

    /**
     * Creates a new PathFilter.
     *
     * @param theExcludePatterns glob patterns on relative paths
     * @param theSkipExtensions extensions (with dot) never mirrored
     * @param theMaxFileSizeMb the largest mirrored size in megabytes
     */
    public PathFilter(
            final List<String> theExcludePatterns,
            final List<String> theSkipExtensions,
            final int theMaxFileSizeMb) {
        this.excludes = new ArrayList<>();
        this.excludePrefixes = new ArrayList<>();
        for (final String pattern : theExcludePatterns) {
            excludes.add(GlobPattern.of(pattern));
            excludePrefixes.add(GlobPattern.of(stripTrailing(pattern)));
        }
        this.skipExtensions = theSkipExtensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .toList();
        this.maxFileSizeMb = theMaxFileSizeMb;
    }

    /**
     * Checks a relative path against the exclude patterns.
     *
     * @param relativePath the path below the monitored folder
     * @return true if the path or one of its folders is excluded
     */
    public boolean isExcluded(final String relativePath) {
        final String[] parts = relativePath.split("/");
        for (int p = 0; p < excludes.size(); p++) {
            if (excludes.get(p).matches(relativePath)) {
                return true;
            }
            final GlobPattern prefixPattern = excludePrefixes.get(p);
            final StringBuilder partial = new StringBuilder();
            for (int i = 0; i < parts.length; i++) {
                if (i > 0) {
                    partial.append('/');
                }
                partial.append(parts[i]);
                if (prefixPattern.matches(partial.toString())) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Returns why a file is not mirrored, if it is not.
     *
     * @param file the snapshot
     * @return the reason, or empty when the file is mirrored
     */
    public Optional<String> skipReason(final DriveFile file) {
        if (file.isFolder()) {
            return Optional.of("folders are not mirrored");
        }
        if (file.isGoogleNative()
                && NativeDocumentType.fromMimeType(file.mimeType()).isEmpty()) {
            return Optional.of("no export format for " + file.mimeType());
        }

        final String lowerName = file.name().toLowerCase(Locale.ROOT);
        for (final String ext : skipExtensions) {
            if (lowerName.endsWith(ext)) {
                return Optional.of("skipped extension " + ext);
            }
        }

        final Long size = file.size();
        if (size != null && size > maxFileSizeMb * BYTES_PER_MB) {
            return Optional.of(String.format(Locale.ROOT,
                    "file too large (%dMB > %dMB)",
                    Math.round((double) size / BYTES_PER_MB), maxFileSizeMb));
        }
        return Optional.empty();
    }

    private static String stripTrailing(final String pattern) {
        int end = pattern.length();
        while (end > 0 && (pattern.charAt(end - 1) == '/'
                || pattern.charAt(end - 1) == '*')) {
            end--;
        }
        return pattern.substring(0, end);
    }

}
