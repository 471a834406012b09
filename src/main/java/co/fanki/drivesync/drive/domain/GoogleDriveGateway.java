package co.fanki.drivesync.drive.domain;

import co.fanki.drivesync.change.domain.ChangeRecord;
import co.fanki.drivesync.change.domain.DriveFile;
import co.fanki.drivesync.change.domain.FolderScope;
import co.fanki.drivesync.content.domain.NativeDocumentType;
import co.fanki.drivesync.shared.Preconditions;
import com.google.api.client.util.DateTime;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.model.Change;
import com.google.api.services.drive.model.ChangeList;
import com.google.api.services.drive.model.Channel;
import com.google.api.services.drive.model.File;
import com.google.api.services.drive.model.FileList;
import com.google.api.services.drive.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * {@link DriveGateway} on the Google Drive v3 API client.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GoogleDriveGateway implements DriveGateway {

    private static final Logger LOG =
            LoggerFactory.getLogger(GoogleDriveGateway.class);

    private static final String FILE_FIELDS = "id,name,parents,mimeType,"
            + "md5Checksum,trashed,modifiedTime,size,"
            + "lastModifyingUser(displayName,emailAddress)";

    private static final String CHANGE_FIELDS =
            "nextPageToken,newStartPageToken,"
            + "changes(fileId,removed,file(" + FILE_FIELDS + "))";

    private static final String LIST_FIELDS =
            "nextPageToken,files(" + FILE_FIELDS + ")";

    private static final int PAGE_SIZE = 1000;

    private final Drive drive;
    private final String folderId;

    /**
     * Creates a new GoogleDriveGateway.
     *
     * @param theDrive the authenticated API client
     * @param theFolderId the monitored folder id
     */
    public GoogleDriveGateway(final Drive theDrive, final String theFolderId) {
        this.drive = Preconditions.requireNonNull(theDrive,
                "Drive client is required");
        this.folderId = Preconditions.requireNonBlank(theFolderId,
                "Drive folder id is required");
    }

    /** {@inheritDoc} */
    @Override
    public ChangePage listChanges(final String cursor) {
        final List<ChangeRecord> records = new ArrayList<>();
        String current = cursor;
        try {
            while (true) {
                final ChangeList response = drive.changes().list(current)
                        .setFields(CHANGE_FIELDS)
                        .setSpaces("drive")
                        .setIncludeRemoved(true)
                        .setPageSize(PAGE_SIZE)
                        .execute();

                if (response.getChanges() != null) {
                    for (final Change change : response.getChanges()) {
                        records.add(toRecord(change));
                    }
                }

                if (response.getNextPageToken() != null) {
                    current = response.getNextPageToken();
                } else {
                    final String next = response.getNewStartPageToken() != null
                            ? response.getNewStartPageToken() : current;
                    LOG.debug("Read {} changes after cursor {}",
                            records.size(), cursor);
                    return new ChangePage(records, next);
                }
            }
        } catch (final IOException e) {
            throw new DriveAccessException("Failed to list changes: "
                    + e.getMessage(), DriveAccessException.CHANGES_FAILED, e);
        }
    }

    /** {@inheritDoc} */
    @Override
    public String startCursor() {
        try {
            return drive.changes().getStartPageToken().execute()
                    .getStartPageToken();
        } catch (final IOException e) {
            throw new DriveAccessException("Failed to read start cursor: "
                    + e.getMessage(), DriveAccessException.CHANGES_FAILED, e);
        }
    }

    /** {@inheritDoc} */
    @Override
    public byte[] fetchOriginal(final String fileId, final String mimeType) {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        final Optional<NativeDocumentType> nativeType =
                NativeDocumentType.fromMimeType(mimeType);
        try {
            if (nativeType.isPresent()) {
                drive.files()
                        .export(fileId, nativeType.get().exportMimeType())
                        .executeMediaAndDownloadTo(out);
            } else {
                drive.files().get(fileId).executeMediaAndDownloadTo(out);
            }
            return out.toByteArray();
        } catch (final IOException e) {
            throw new DriveAccessException("Failed to download " + fileId
                    + ": " + e.getMessage(),
                    DriveAccessException.DOWNLOAD_FAILED, e);
        }
    }

    /** {@inheritDoc} */
    @Override
    public FolderScope newFolderScope() {
        return new DriveFolderScope(folderId, id -> {
            final File folder = drive.files().get(id)
                    .setFields("name,parents")
                    .execute();
            return new DriveFolderScope.Folder(folder.getName(),
                    folder.getParents());
        });
    }

    /** {@inheritDoc} */
    @Override
    public List<DriveFile> listFolderTree() {
        final List<DriveFile> files = new ArrayList<>();
        final Deque<String> folders = new ArrayDeque<>();
        final Set<String> visited = new HashSet<>();
        folders.add(folderId);

        try {
            while (!folders.isEmpty()) {
                final String parent = folders.poll();
                if (!visited.add(parent)) {
                    continue;
                }
                String pageToken = null;
                do {
                    final FileList response = drive.files().list()
                            .setQ("'" + parent + "' in parents"
                                    + " and trashed = false")
                            .setSpaces("drive")
                            .setFields(LIST_FIELDS)
                            .setPageSize(PAGE_SIZE)
                            .setPageToken(pageToken)
                            .execute();

                    if (response.getFiles() != null) {
                        for (final File file : response.getFiles()) {
                            final DriveFile snapshot = toDriveFile(file, null);
                            if (snapshot.isFolder()) {
                                folders.add(snapshot.id());
                            } else {
                                files.add(snapshot);
                            }
                        }
                    }
                    pageToken = response.getNextPageToken();
                } while (pageToken != null);
            }
        } catch (final IOException e) {
            throw new DriveAccessException("Failed to list folder tree: "
                    + e.getMessage(), DriveAccessException.LISTING_FAILED, e);
        }

        LOG.info("Listed {} files below folder {}", files.size(), folderId);
        return files;
    }

    /** {@inheritDoc} */
    @Override
    public Subscription watch(final String address, final String cursor) {
        final Channel request = new Channel()
                .setId(UUID.randomUUID().toString())
                .setType("web_hook")
                .setAddress(address);
        try {
            final Channel response = drive.changes().watch(cursor, request)
                    .setFields("resourceId,expiration")
                    .execute();
            final Instant expiresAt = response.getExpiration() != null
                    ? Instant.ofEpochMilli(response.getExpiration()) : null;
            LOG.info("Opened channel {} to {}, expires {}", request.getId(),
                    address, expiresAt);
            return new Subscription(request.getId(), response.getResourceId(),
                    expiresAt);
        } catch (final IOException e) {
            throw new DriveAccessException("Failed to open channel: "
                    + e.getMessage(), DriveAccessException.WATCH_FAILED, e);
        }
    }

    /** {@inheritDoc} */
    @Override
    public void stopWatch(final Subscription subscription) {
        try {
            drive.channels().stop(new Channel()
                    .setId(subscription.channelId())
                    .setResourceId(subscription.resourceId()))
                    .execute();
            LOG.info("Stopped channel {}", subscription.channelId());
        } catch (final IOException e) {
            throw new DriveAccessException("Failed to stop channel "
                    + subscription.channelId() + ": " + e.getMessage(),
                    DriveAccessException.WATCH_FAILED, e);
        }
    }

    private static ChangeRecord toRecord(final Change change) {
        final boolean removed = Boolean.TRUE.equals(change.getRemoved());
        final File source = change.getFile();
        final boolean identified = source != null
                && (source.getId() != null || change.getFileId() != null);
        final DriveFile file = identified
                ? toDriveFile(source, change.getFileId())
                : null;
        return new ChangeRecord(change.getFileId(), removed, file);
    }

    private static DriveFile toDriveFile(final File file,
            final String fallbackId) {
        final User user = file.getLastModifyingUser();
        final DateTime modified = file.getModifiedTime();
        return new DriveFile(
                file.getId() != null ? file.getId() : fallbackId,
                file.getName(),
                file.getParents(),
                file.getMimeType(),
                file.getMd5Checksum(),
                Boolean.TRUE.equals(file.getTrashed()),
                modified != null ? modified.toStringRfc3339() : null,
                file.getSize(),
                user != null ? user.getDisplayName() : null,
                user != null ? user.getEmailAddress() : null);
    }

}
