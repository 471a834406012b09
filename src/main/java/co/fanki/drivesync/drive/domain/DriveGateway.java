package co.fanki.drivesync.drive.domain;

import co.fanki.drivesync.change.domain.DriveFile;
import co.fanki.drivesync.change.domain.FolderScope;

import java.util.List;

/**
 * Read access to Google Drive plus push notification channels.
 *
 * <p>Every operation throws {@link DriveAccessException} when the API call
 * fails.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface DriveGateway {

    /**
     * Reads every change after a cursor, following all pages.
     *
     * @param cursor the page token to resume from
     * @return the changes and the next cursor
     */
    ChangePage listChanges(String cursor);

    /**
     * Returns the cursor pointing at the current end of the feed.
     *
     * @return the start page token
     */
    String startCursor();

    /**
     * Downloads the bytes of a file. Google-native documents are exported
     * to their fixed export format.
     *
     * @param fileId the Drive file id
     * @param mimeType the Drive MIME type
     * @return the content
     */
    byte[] fetchOriginal(String fileId, String mimeType);

    /**
     * Creates the membership and path resolver used for one cycle. Folder
     * lookups are cached inside the returned scope only.
     *
     * @return a fresh scope
     */
    FolderScope newFolderScope();

    /**
     * Lists every non-trashed file below the monitored folder, recursively.
     * Folders themselves are not returned.
     *
     * @return the files
     */
    List<DriveFile> listFolderTree();

    /**
     * Opens a notification channel for the change feed.
     *
     * @param address the HTTPS URL Drive posts to
     * @param cursor the page token the channel watches from
     * @return the channel
     */
    Subscription watch(String address, String cursor);

    /**
     * Closes a notification channel.
     *
     * @param subscription the channel
     */
    void stopWatch(Subscription subscription);

}
