package co.fanki.drivesync.content.domain;

import co.fanki.drivesync.shared.DomainException;

/**
 * Thrown when no text can be derived from a document.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class TextExtractionException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code shared by every extraction failure. */
    public static final String EXTRACTION_FAILED = "EXTRACTION_FAILED";

    /**
     * Creates a new TextExtractionException.
     *
     * @param message the error message
     */
    public TextExtractionException(final String message) {
        super(message, EXTRACTION_FAILED);
    }

    /**
     * Creates a new TextExtractionException with a cause.
     *
     * @param message the error message
     * @param cause the underlying failure
     */
    public TextExtractionException(final String message,
            final Throwable cause) {
        super(message, EXTRACTION_FAILED, cause);
    }

}
