package co.fanki.drivesync.sync.domain;

import co.fanki.drivesync.change.domain.Editor;
import co.fanki.drivesync.shared.Preconditions;

import java.time.Duration;
import java.util.List;

/**
 * Immutable settings of the mirror, resolved once at startup.
 *
 * @param folderId the monitored Drive folder id
 * @param repositoryUrl the git remote URL
 * @param branch the mirrored branch
 * @param cloneBasePath the directory working copies are cloned into
 * @param gitTimeoutSeconds the clone and push timeout
 * @param docsSubdir the repository directory holding the mirror
 * @param excludePaths glob patterns of relative paths never mirrored
 * @param skipExtensions extensions never mirrored
 * @param maxFileSizeMb the largest mirrored file in megabytes
 * @param defaultAuthor the identity for changes without an editor
 * @param lockTtl the age after which a held lock may be broken
 * @param maxResyncIterations the maximum cycles run for one notification
 * @param webhookUrl the address Drive notification channels post to
 * @param triggerSecret the secret accepted from manual triggers
 * @param verificationToken the domain verification token
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SyncSettings(
        String folderId,
        String repositoryUrl,
        String branch,
        String cloneBasePath,
        int gitTimeoutSeconds,
        String docsSubdir,
        List<String> excludePaths,
        List<String> skipExtensions,
        int maxFileSizeMb,
        Editor defaultAuthor,
        Duration lockTtl,
        int maxResyncIterations,
        String webhookUrl,
        String triggerSecret,
        String verificationToken
) {

    /** Validates the required settings. */
    public SyncSettings {
        Preconditions.requireNonBlank(folderId,
                "drive-sync.drive.folder-id is required");
        Preconditions.requireNonBlank(repositoryUrl,
                "drive-sync.git.repository-url is required");
        Preconditions.requireNonBlank(branch,
                "drive-sync.git.branch is required");
        Preconditions.requireNonBlank(cloneBasePath,
                "drive-sync.git.clone-base-path is required");
        Preconditions.requirePositive(gitTimeoutSeconds,
                "drive-sync.git.timeout-seconds must be positive");
        Preconditions.requirePositive(maxFileSizeMb,
                "drive-sync.max-file-size-mb must be positive");
        Preconditions.requirePositive(maxResyncIterations,
                "drive-sync.max-resync-iterations must be positive");
        Preconditions.requireNonNull(defaultAuthor,
                "Default commit author is required");
        Preconditions.requireNonNull(lockTtl, "Lock TTL is required");
        docsSubdir = docsSubdir != null ? docsSubdir : "";
        excludePaths = excludePaths != null ? List.copyOf(excludePaths)
                : List.of();
        skipExtensions = skipExtensions != null ? List.copyOf(skipExtensions)
                : List.of();
    }

    /**
     * Checks whether a trigger secret is configured.
     *
     * @return true when manual triggers can be authenticated
     */
    public boolean hasTriggerSecret() {
        return triggerSecret != null && !triggerSecret.isBlank();
    }

    /**
     * Checks whether a domain verification token is configured.
     *
     * @return true when a token is set
     */
    public boolean hasVerificationToken() {
        return verificationToken != null && !verificationToken.isBlank();
    }

}
