package co.fanki.drivesync.content.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Converts Word documents to markdown through the {@code pandoc} binary.
 *
 * <p>Tracked changes are kept ({@code --track-changes=all}) and lines are
 * not re-wrapped, so an edited paragraph shows up as one changed line.
 * The output goes through {@link PandocPostprocessor}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PandocTextExtractor {

    private static final Logger LOG =
            LoggerFactory.getLogger(PandocTextExtractor.class);

    private final String command;
    private final long timeoutSeconds;

    /**
     * Creates a new PandocTextExtractor.
     *
     * @param theCommand the pandoc executable, e.g. {@code pandoc}
     * @param theTimeoutSeconds how long a conversion may run
     */
    public PandocTextExtractor(final String theCommand,
            final long theTimeoutSeconds) {
        this.command = theCommand;
        this.timeoutSeconds = theTimeoutSeconds;
    }

    /**
     * Converts a document.
     *
     * @param content the docx bytes
     * @return the cleaned markdown
     */
    public String extract(final byte[] content) {
        Path input = null;
        Path output = null;
        try {
            input = Files.createTempFile("drive-sync-", ".docx");
            output = Files.createTempFile("drive-sync-", ".md");
            Files.write(input, content);

            final ProcessBuilder pb = new ProcessBuilder(
                    command,
                    "--from=docx",
                    "--to=markdown",
                    "--track-changes=all",
                    "--wrap=none",
                    "-o", output.toAbsolutePath().toString(),
                    input.toAbsolutePath().toString()
            );
            pb.redirectErrorStream(false);

            final Process process = pb.start();
            final boolean finished = process.waitFor(
                    timeoutSeconds, TimeUnit.SECONDS);

            if (!finished) {
                process.destroyForcibly();
                throw new TextExtractionException("pandoc timed out after "
                        + timeoutSeconds + " seconds");
            }

            if (process.exitValue() != 0) {
                final String stderr = new String(
                        process.getErrorStream().readAllBytes(),
                        StandardCharsets.UTF_8);
                throw new TextExtractionException("pandoc exited with code "
                        + process.exitValue() + ": " + stderr.strip());
            }

            final String markdown = Files.readString(output,
                    StandardCharsets.UTF_8);
            return PandocPostprocessor.postprocess(markdown);

        } catch (final IOException e) {
            throw new TextExtractionException(
                    "Cannot run pandoc: " + e.getMessage(), e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TextExtractionException("Interrupted running pandoc", e);
        } finally {
            deleteQuietly(input);
            deleteQuietly(output);
        }
    }

    private void deleteQuietly(final Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (final IOException e) {
            LOG.warn("Failed to delete temp file: {}", file, e);
        }
    }

}
