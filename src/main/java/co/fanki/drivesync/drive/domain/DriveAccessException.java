package co.fanki.drivesync.drive.domain;

import co.fanki.drivesync.shared.DomainException;

/**
 * Thrown when the Drive API cannot be reached or refuses a request.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DriveAccessException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Listing changes or reading the start cursor failed. */
    public static final String CHANGES_FAILED = "DRIVE_CHANGES_FAILED";

    /** Downloading or exporting a file failed. */
    public static final String DOWNLOAD_FAILED = "DRIVE_DOWNLOAD_FAILED";

    /** Listing the monitored folder failed. */
    public static final String LISTING_FAILED = "DRIVE_LISTING_FAILED";

    /** Opening or closing a notification channel failed. */
    public static final String WATCH_FAILED = "DRIVE_WATCH_FAILED";

    /**
     * Creates a new DriveAccessException.
     *
     * @param message the error message
     * @param errorCode one of the {@code DRIVE_*} codes
     * @param cause the underlying failure
     */
    public DriveAccessException(final String message, final String errorCode,
            final Throwable cause) {
        super(message, errorCode, cause);
    }

}
