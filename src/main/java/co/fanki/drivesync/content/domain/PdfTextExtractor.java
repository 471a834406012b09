package co.fanki.drivesync.content.domain;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the text of a PDF page by page.
 *
 * <p>Pages after the first are introduced by a {@code --- Page N ---}
 * separator. Pages without a text layer are replaced by a marker, and the
 * whole output is prefixed with a warning when at least one such page
 * exists.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PdfTextExtractor {

    static final String SCANNED_WARNING = "WARNING: Some pages contain no"
            + " extractable text (scanned/image-only).\n\n";

    /**
     * Extracts the text.
     *
     * @param content the PDF bytes
     * @return the text of every page
     */
    public String extract(final byte[] content) {
        try (PDDocument document = PDDocument.load(content)) {
            final PDFTextStripper stripper = new PDFTextStripper();
            final List<String> parts = new ArrayList<>();
            boolean emptyPages = false;

            final int pages = document.getNumberOfPages();
            for (int page = 1; page <= pages; page++) {
                if (page > 1) {
                    parts.add("\n--- Page " + page + " ---\n");
                }
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                final String text = stripper.getText(document).strip();
                if (text.isEmpty()) {
                    emptyPages = true;
                    parts.add("[Page " + page
                            + ": no extractable text (possibly scanned)]");
                } else {
                    parts.add(text);
                }
            }

            final String result = String.join("\n", parts);
            return emptyPages ? SCANNED_WARNING + result : result;

        } catch (final IOException e) {
            throw new TextExtractionException(
                    "Cannot read PDF: " + e.getMessage(), e);
        }
    }

}
