package co.fanki.drivesync.git.domain;

import co.fanki.drivesync.shared.DomainException;

/**
 * Thrown when an operation on the mirror repository fails.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GitOperationException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** No token was configured for the remote. */
    public static final String CREDENTIALS_MISSING = "GIT_CREDENTIALS_MISSING";

    /** The remote could not be cloned. */
    public static final String CLONE_FAILED = "GIT_CLONE_FAILED";

    /** A working tree or index operation failed. */
    public static final String WORKTREE_FAILED = "GIT_WORKTREE_FAILED";

    /** A path points outside the working copy. */
    public static final String INVALID_PATH = "GIT_INVALID_PATH";

    /** The commit could not be created. */
    public static final String COMMIT_FAILED = "GIT_COMMIT_FAILED";

    /** The remote did not accept the push. */
    public static final String PUSH_REJECTED = "GIT_PUSH_REJECTED";

    /**
     * Creates a new GitOperationException.
     *
     * @param message the error message
     * @param errorCode one of the {@code GIT_*} codes
     */
    public GitOperationException(final String message,
            final String errorCode) {
        super(message, errorCode);
    }

    /**
     * Creates a new GitOperationException with a cause.
     *
     * @param message the error message
     * @param errorCode one of the {@code GIT_*} codes
     * @param cause the underlying failure
     */
    public GitOperationException(final String message,
            final String errorCode, final Throwable cause) {
        super(message, errorCode, cause);
    }

}
