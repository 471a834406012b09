package co.fanki.drivesync.content.domain;

import co.fanki.drivesync.shared.Preconditions;

/**
 * Dispatches each format to its converter.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DocumentTextExtractor implements TextExtractor {

    private final PandocTextExtractor docx;
    private final PdfTextExtractor pdf;
    private final CsvTextExtractor csv;

    /**
     * Creates a new DocumentTextExtractor.
     *
     * @param theDocx the docx converter
     * @param thePdf the PDF converter
     * @param theCsv the CSV converter
     */
    public DocumentTextExtractor(
            final PandocTextExtractor theDocx,
            final PdfTextExtractor thePdf,
            final CsvTextExtractor theCsv) {
        this.docx = Preconditions.requireNonNull(theDocx,
                "Docx extractor is required");
        this.pdf = Preconditions.requireNonNull(thePdf,
                "PDF extractor is required");
        this.csv = Preconditions.requireNonNull(theCsv,
                "CSV extractor is required");
    }

    /** {@inheritDoc} */
    @Override
    public String extract(final byte[] content, final DocumentFormat format) {
        return switch (format) {
            case DOCX -> docx.extract(content);
            case PDF -> pdf.extract(content);
            case CSV -> csv.extract(content);
        };
    }

}
