package co.fanki.drivesync.content.domain;

import java.util.Optional;

/**
 * Google-native document types and the format each one is exported to.
 *
 * <p>Native documents carry no binary content of their own. They are
 * exported through the Drive API and stored in the repository under the
 * export name, e.g. a document named {@code Plan} is stored as
 * {@code Plan.docx}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum NativeDocumentType {

    /** Google Docs. */
    DOCUMENT("application/vnd.google-apps.document", DocumentFormat.DOCX,
            "application/vnd.openxmlformats-officedocument"
                    + ".wordprocessingml.document"),

    /** Google Sheets, first sheet only. */
    SPREADSHEET("application/vnd.google-apps.spreadsheet", DocumentFormat.CSV,
            "text/csv"),

    /** Google Slides. */
    PRESENTATION("application/vnd.google-apps.presentation",
            DocumentFormat.PDF, "application/pdf");

    private final String mimeType;
    private final DocumentFormat exportFormat;
    private final String exportMimeType;

    NativeDocumentType(final String theMimeType,
            final DocumentFormat theExportFormat,
            final String theExportMimeType) {
        this.mimeType = theMimeType;
        this.exportFormat = theExportFormat;
        this.exportMimeType = theExportMimeType;
    }

    /**
     * Finds the native type for a Drive MIME type.
     *
     * @param mimeType the MIME type, may be null
     * @return the type, or empty for binary files and unsupported natives
     */
    public static Optional<NativeDocumentType> fromMimeType(
            final String mimeType) {
        for (final NativeDocumentType type : values()) {
            if (type.mimeType.equals(mimeType)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public String mimeType() {
        return mimeType;
    }

    public DocumentFormat exportFormat() {
        return exportFormat;
    }

    public String exportMimeType() {
        return exportMimeType;
    }

    /**
     * Returns the name the export is stored under.
     *
     * @param fileName the Drive name of the document
     * @return the name with the export extension appended
     */
    public String exportName(final String fileName) {
        return fileName + exportFormat.extension();
    }

}
