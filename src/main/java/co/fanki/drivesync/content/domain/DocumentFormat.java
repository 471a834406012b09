package co.fanki.drivesync.content.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Binary formats a diffable text companion can be derived from.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum DocumentFormat {

    /** Word documents, converted to markdown. */
    DOCX(".docx", ".md"),

    /** PDF documents, converted to plain text per page. */
    PDF(".pdf", ".txt"),

    /** Comma separated values, converted to a markdown table. */
    CSV(".csv", ".txt");

    private final String extension;
    private final String derivedSuffix;

    DocumentFormat(final String theExtension, final String theDerivedSuffix) {
        this.extension = theExtension;
        this.derivedSuffix = theDerivedSuffix;
    }

    /**
     * Detects the format from a file name, ignoring case.
     *
     * @param fileName the bare file name
     * @return the format, or empty when nothing can be derived
     */
    public static Optional<DocumentFormat> fromFileName(final String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        final String lower = fileName.toLowerCase(Locale.ROOT);
        for (final DocumentFormat format : values()) {
            if (lower.endsWith(format.extension)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    /** The file extension, with the leading dot. */
    public String extension() {
        return extension;
    }

    /**
     * Builds the derived text name for a file of this format.
     *
     * @param fileName the name of the original, e.g. {@code offer.pdf}
     * @return the derived name, e.g. {@code offer.pdf.txt}
     */
    public String derivedName(final String fileName) {
        return fileName + derivedSuffix;
    }

}
