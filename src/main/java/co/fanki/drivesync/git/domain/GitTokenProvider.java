package co.fanki.drivesync.git.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Supplies the access token used to authenticate against the git remote.
 *
 * <p>The token is taken from the configured value, or else read from the
 * configured file (e.g. a mounted secret). It is resolved on first use, so
 * a missing token only fails the first clone.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GitTokenProvider {

    private static final Logger LOG =
            LoggerFactory.getLogger(GitTokenProvider.class);

    private final String token;
    private final String tokenFile;
    private volatile String resolved;

    /**
     * Creates a new GitTokenProvider.
     *
     * @param theToken the token, may be blank
     * @param theTokenFile a file holding the token, may be blank
     */
    public GitTokenProvider(final String theToken, final String theTokenFile) {
        this.token = theToken;
        this.tokenFile = theTokenFile;
    }

    /**
     * Returns the token.
     *
     * @return the token, never blank
     * @throws GitOperationException when no token is configured
     */
    public String token() {
        String value = resolved;
        if (value == null) {
            value = resolve();
            resolved = value;
        }
        return value;
    }

    private String resolve() {
        if (token != null && !token.isBlank()) {
            return token.strip();
        }
        if (tokenFile != null && !tokenFile.isBlank()) {
            try {
                final String content = Files.readString(Path.of(tokenFile),
                        StandardCharsets.UTF_8).strip();
                if (!content.isEmpty()) {
                    LOG.debug("Git token read from {}", tokenFile);
                    return content;
                }
            } catch (final IOException e) {
                throw new GitOperationException("Cannot read git token file: "
                        + tokenFile, GitOperationException.CREDENTIALS_MISSING,
                        e);
            }
        }
        throw new GitOperationException("No git token configured",
                GitOperationException.CREDENTIALS_MISSING);
    }

}
