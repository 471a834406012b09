package co.fanki.drivesync.git.domain;

import co.fanki.drivesync.change.domain.Editor;

/**
 * A local checkout of the mirror repository, used for one sync cycle.
 *
 * <p>Paths are relative to the repository root and use {@code /}. Every
 * write operation updates the index as well as the working tree. Failures
 * are reported as {@link GitOperationException}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface WorkingCopy {

    /**
     * Writes a file, creating parent directories, and stages it.
     *
     * @param path the repository path
     * @param content the bytes to write
     */
    void write(String path, byte[] content);

    /**
     * Moves a file and stages both sides of the move.
     *
     * @param from the current repository path, must exist
     * @param to the new repository path
     */
    void rename(String from, String to);

    /**
     * Removes a file from the working tree and the index. Missing files
     * are ignored.
     *
     * @param path the repository path
     */
    void delete(String path);

    /**
     * Stages the current state of a path: its content when it exists, its
     * removal when it does not.
     *
     * @param path the repository path
     */
    void stage(String path);

    /** Resets the index to HEAD, keeping the working tree. */
    void unstageAll();

    /**
     * Checks whether the index differs from HEAD.
     *
     * @return true when a commit would not be empty
     */
    boolean hasStagedChanges();

    /**
     * Commits the index.
     *
     * @param message the commit message
     * @param author the author identity
     */
    void commit(String message, Editor author);

    /** Pushes the branch to the remote. */
    void push();

    /** Releases the repository and deletes the checkout directory. */
    void cleanup();

}
