package co.fanki.drivesync.content.domain;

/**
 * Derives diffable text from a binary document.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface TextExtractor {

    /**
     * Extracts the text of a document.
     *
     * @param content the document bytes
     * @param format the document format
     * @return the derived text, never null
     * @throws TextExtractionException when the document cannot be read
     */
    String extract(byte[] content, DocumentFormat format);

}
