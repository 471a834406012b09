package co.fanki.drivesync.git.domain;

import co.fanki.drivesync.change.domain.Editor;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.ResetCommand;
import org.eclipse.jgit.api.Status;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.PushResult;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.transport.RemoteRefUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Stream;

/**
 * {@link WorkingCopy} backed by a JGit clone in a private directory.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class JGitWorkingCopy implements WorkingCopy {

    private static final Logger LOG =
            LoggerFactory.getLogger(JGitWorkingCopy.class);

    private static final Set<RemoteRefUpdate.Status> ACCEPTED = EnumSet.of(
            RemoteRefUpdate.Status.OK, RemoteRefUpdate.Status.UP_TO_DATE);

    private final Git git;
    private final Path directory;
    private final String branch;
    private final CredentialsProvider credentials;
    private final int timeoutSeconds;

    private JGitWorkingCopy(
            final Git theGit,
            final Path theDirectory,
            final String theBranch,
            final CredentialsProvider theCredentials,
            final int theTimeoutSeconds) {
        this.git = theGit;
        this.directory = theDirectory;
        this.branch = theBranch;
        this.credentials = theCredentials;
        this.timeoutSeconds = theTimeoutSeconds;
    }

    /**
     * Clones a branch of a remote into a directory.
     *
     * @param url the remote URL
     * @param branch the branch to check out and push to
     * @param directory the target directory, must be empty or missing
     * @param credentials the remote credentials
     * @param timeoutSeconds the network timeout of clone and push
     * @return the working copy
     * @throws GitOperationException when the clone fails
     */
    public static JGitWorkingCopy checkout(
            final String url,
            final String branch,
            final Path directory,
            final CredentialsProvider credentials,
            final int timeoutSeconds) {

        final Path root = directory.toAbsolutePath().normalize();
        LOG.info("Cloning {} (branch: {}) to {}", url, branch, root);

        try {
            Files.createDirectories(root);
            final Git git = Git.cloneRepository()
                    .setURI(url)
                    .setDirectory(root.toFile())
                    .setBranch(branch)
                    .setCredentialsProvider(credentials)
                    .setTimeout(timeoutSeconds)
                    .call();
            return new JGitWorkingCopy(git, root, branch, credentials,
                    timeoutSeconds);

        } catch (final GitAPIException | IOException e) {
            deleteDirectory(root);
            throw new GitOperationException("Failed to clone repository: "
                    + e.getMessage(), GitOperationException.CLONE_FAILED, e);
        }
    }

    /** {@inheritDoc} */
    @Override
    public void write(final String path, final byte[] content) {
        final Path target = resolve(path);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
            git.add().addFilepattern(path).call();
        } catch (final GitAPIException | IOException e) {
            throw worktreeFailure("write " + path, e);
        }
    }

    /** {@inheritDoc} */
    @Override
    public void rename(final String from, final String to) {
        final Path source = resolve(from);
        final Path target = resolve(to);
        if (!Files.exists(source)) {
            throw new GitOperationException("Cannot rename missing path: "
                    + from, GitOperationException.WORKTREE_FAILED);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            git.rm().setCached(true).addFilepattern(from).call();
            git.add().addFilepattern(to).call();
        } catch (final GitAPIException | IOException e) {
            throw worktreeFailure("rename " + from + " to " + to, e);
        }
    }

    /** {@inheritDoc} */
    @Override
    public void delete(final String path) {
        if (!Files.exists(resolve(path))) {
            LOG.debug("Nothing to delete at {}", path);
            return;
        }
        try {
            git.rm().addFilepattern(path).call();
            Files.deleteIfExists(resolve(path));
        } catch (final GitAPIException | IOException e) {
            throw worktreeFailure("delete " + path, e);
        }
    }

    /** {@inheritDoc} */
    @Override
    public void stage(final String path) {
        try {
            if (Files.exists(resolve(path))) {
                git.add().addFilepattern(path).call();
            } else if (isIndexed(path)) {
                git.rm().setCached(true).addFilepattern(path).call();
            }
        } catch (final GitAPIException | IOException e) {
            throw worktreeFailure("stage " + path, e);
        }
    }

    /** {@inheritDoc} */
    @Override
    public void unstageAll() {
        try {
            git.reset()
                    .setMode(ResetCommand.ResetType.MIXED)
                    .setRef(Constants.HEAD)
                    .call();
        } catch (final GitAPIException e) {
            throw worktreeFailure("reset index", e);
        }
    }

    /** {@inheritDoc} */
    @Override
    public boolean hasStagedChanges() {
        try {
            final Status status = git.status().call();
            return !status.getAdded().isEmpty()
                    || !status.getChanged().isEmpty()
                    || !status.getRemoved().isEmpty();
        } catch (final GitAPIException e) {
            throw worktreeFailure("read status", e);
        }
    }

    /** {@inheritDoc} */
    @Override
    public void commit(final String message, final Editor author) {
        final PersonIdent ident = new PersonIdent(author.name(),
                author.email());
        try {
            git.commit()
                    .setMessage(message)
                    .setAuthor(ident)
                    .setCommitter(ident)
                    .call();
            LOG.info("Committed as {}: {}", author.asGitIdentity(),
                    firstLine(message));
        } catch (final GitAPIException e) {
            throw new GitOperationException("Failed to commit: "
                    + e.getMessage(), GitOperationException.COMMIT_FAILED, e);
        }
    }

    /** {@inheritDoc} */
    @Override
    public void push() {
        final String ref = Constants.R_HEADS + branch;
        try {
            final Iterable<PushResult> results = git.push()
                    .setRemote(Constants.DEFAULT_REMOTE_NAME)
                    .setRefSpecs(new RefSpec(ref + ":" + ref))
                    .setCredentialsProvider(credentials)
                    .setTimeout(timeoutSeconds)
                    .call();

            for (final PushResult result : results) {
                for (final RemoteRefUpdate update : result.getRemoteUpdates()) {
                    if (!ACCEPTED.contains(update.getStatus())) {
                        throw new GitOperationException("Push of " + ref
                                + " rejected: " + update.getStatus()
                                + messageOf(update),
                                GitOperationException.PUSH_REJECTED);
                    }
                }
            }
            LOG.info("Pushed {} to {}", ref, Constants.DEFAULT_REMOTE_NAME);

        } catch (final GitAPIException e) {
            throw new GitOperationException("Failed to push: "
                    + e.getMessage(), GitOperationException.PUSH_REJECTED, e);
        }
    }

    /** {@inheritDoc} */
    @Override
    public void cleanup() {
        try {
            git.close();
        } catch (final Exception e) {
            LOG.warn("Failed to close Git: {}", e.getMessage());
        }
        deleteDirectory(directory);
    }

    /** The checkout directory. */
    public Path directory() {
        return directory;
    }

    private Path resolve(final String path) {
        final Path resolved = directory.resolve(path).normalize();
        if (!resolved.startsWith(directory)) {
            throw new GitOperationException("Path escapes working copy: "
                    + path, GitOperationException.INVALID_PATH);
        }
        return resolved;
    }

    private boolean isIndexed(final String path) throws IOException {
        return git.getRepository().readDirCache().findEntry(path) >= 0;
    }

    private static GitOperationException worktreeFailure(
            final String operation, final Exception cause) {
        return new GitOperationException("Failed to " + operation + ": "
                + cause.getMessage(), GitOperationException.WORKTREE_FAILED,
                cause);
    }

    private static String messageOf(final RemoteRefUpdate update) {
        return update.getMessage() != null ? " (" + update.getMessage() + ")"
                : "";
    }

    private static String firstLine(final String message) {
        final int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    private static void deleteDirectory(final Path directory) {
        if (directory == null || !Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder())
                    .forEach(path -> {
                        try {
                            Files.delete(path);
                        } catch (final IOException e) {
                            LOG.warn("Failed to delete: {}", path);
                        }
                    });
            LOG.debug("Cleaned up working copy: {}", directory);
        } catch (final IOException e) {
            LOG.warn("Failed to cleanup working copy: {}", directory, e);
        }
    }

}
