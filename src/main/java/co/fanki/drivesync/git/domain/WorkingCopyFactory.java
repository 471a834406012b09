package co.fanki.drivesync.git.domain;

import co.fanki.drivesync.shared.Preconditions;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Clones a fresh working copy of the mirror repository for each cycle.
 *
 * <p>Every checkout lands in its own directory below the clone base path,
 * so concurrent cycles in the same process never share a tree.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class WorkingCopyFactory {

    /** User name paired with a token for HTTPS remotes. */
    private static final String TOKEN_USER = "oauth2";

    private final String repositoryUrl;
    private final String branch;
    private final Path cloneBasePath;
    private final int timeoutSeconds;
    private final GitTokenProvider tokenProvider;

    /**
     * Creates a new WorkingCopyFactory.
     *
     * @param theRepositoryUrl the remote URL
     * @param theBranch the mirrored branch
     * @param theCloneBasePath where checkouts are created
     * @param theTimeoutSeconds the clone and push timeout
     * @param theTokenProvider the remote token source
     */
    public WorkingCopyFactory(
            final String theRepositoryUrl,
            final String theBranch,
            final Path theCloneBasePath,
            final int theTimeoutSeconds,
            final GitTokenProvider theTokenProvider) {
        this.repositoryUrl = Preconditions.requireNonBlank(theRepositoryUrl,
                "Git repository URL is required");
        this.branch = Preconditions.requireNonBlank(theBranch,
                "Git branch is required");
        this.cloneBasePath = Preconditions.requireNonNull(theCloneBasePath,
                "Clone base path is required");
        this.timeoutSeconds = theTimeoutSeconds;
        this.tokenProvider = Preconditions.requireNonNull(theTokenProvider,
                "Git token provider is required");
    }

    /**
     * Clones the mirrored branch.
     *
     * @return a working copy the caller must clean up
     * @throws GitOperationException when no token is configured or the
     *                               clone fails
     */
    public WorkingCopy checkout() {
        final Path directory = cloneBasePath.resolve(
                "drive-sync-" + UUID.randomUUID());
        return JGitWorkingCopy.checkout(
                repositoryUrl,
                branch,
                directory,
                new UsernamePasswordCredentialsProvider(TOKEN_USER,
                        tokenProvider.token()),
                timeoutSeconds);
    }

}
