package co.fanki.drivesync.config;

import co.fanki.drivesync.change.domain.ChangeClassifier;
import co.fanki.drivesync.change.domain.Editor;
import co.fanki.drivesync.change.domain.PathFilter;
import co.fanki.drivesync.content.domain.ContentLayout;
import co.fanki.drivesync.content.domain.ContentMaterializer;
import co.fanki.drivesync.content.domain.CsvTextExtractor;
import co.fanki.drivesync.content.domain.DocumentTextExtractor;
import co.fanki.drivesync.content.domain.PandocTextExtractor;
import co.fanki.drivesync.content.domain.PdfTextExtractor;
import co.fanki.drivesync.content.domain.TextExtractor;
import co.fanki.drivesync.drive.domain.DriveGateway;
import co.fanki.drivesync.git.domain.GitTokenProvider;
import co.fanki.drivesync.git.domain.WorkingCopyFactory;
import co.fanki.drivesync.sync.domain.SyncSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Wires the mirror components from the {@code drive-sync.*} properties.
 *
 * <p>All settings are read once into {@link SyncSettings}; components get
 * what they need through their constructors.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class SyncConfiguration {

    /**
     * Resolves the mirror settings.
     *
     * @return the validated settings
     */
    @Bean
    public SyncSettings syncSettings(
            @Value("${drive-sync.drive.folder-id:}") final String folderId,
            @Value("${drive-sync.git.repository-url:}") final String repositoryUrl,
            @Value("${drive-sync.git.branch:main}") final String branch,
            @Value("${drive-sync.git.clone-base-path:${java.io.tmpdir}}")
            final String cloneBasePath,
            @Value("${drive-sync.git.timeout-seconds:120}")
            final int gitTimeoutSeconds,
            @Value("${drive-sync.docs-subdir:docs}") final String docsSubdir,
            @Value("${drive-sync.exclude-paths:}") final String excludePaths,
            @Value("${drive-sync.skip-extensions:.zip,.exe,.dmg,.iso}")
            final String skipExtensions,
            @Value("${drive-sync.max-file-size-mb:100}") final int maxFileSizeMb,
            @Value("${drive-sync.commit.author-name:Drive Sync Bot}")
            final String authorName,
            @Value("${drive-sync.commit.author-email:sync@example.com}")
            final String authorEmail,
            @Value("${drive-sync.lock-ttl-seconds:600}") final long lockTtlSeconds,
            @Value("${drive-sync.max-resync-iterations:3}")
            final int maxResyncIterations,
            @Value("${drive-sync.webhook-url:}") final String webhookUrl,
            @Value("${drive-sync.trigger-secret:}") final String triggerSecret,
            @Value("${drive-sync.verification-token:}")
            final String verificationToken) {

        return new SyncSettings(
                folderId,
                repositoryUrl,
                branch,
                cloneBasePath,
                gitTimeoutSeconds,
                docsSubdir,
                parseList(excludePaths),
                parseList(skipExtensions),
                maxFileSizeMb,
                new Editor(authorName, authorEmail),
                Duration.ofSeconds(lockTtlSeconds),
                maxResyncIterations,
                webhookUrl,
                triggerSecret,
                verificationToken);
    }

    /**
     * The clock stamping locks and tracked files.
     *
     * @return the UTC system clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ChangeClassifier changeClassifier(final SyncSettings settings) {
        return new ChangeClassifier(new PathFilter(settings.excludePaths(),
                settings.skipExtensions(), settings.maxFileSizeMb()));
    }

    @Bean
    public ContentLayout contentLayout(final SyncSettings settings) {
        return new ContentLayout(settings.docsSubdir());
    }

    /**
     * The text extractor for every supported format.
     *
     * @param pandocCommand the pandoc executable
     * @param pandocTimeoutSeconds how long one conversion may run
     * @return the extractor
     */
    @Bean
    public TextExtractor textExtractor(
            @Value("${drive-sync.pandoc.command:pandoc}")
            final String pandocCommand,
            @Value("${drive-sync.pandoc.timeout-seconds:120}")
            final long pandocTimeoutSeconds) {
        return new DocumentTextExtractor(
                new PandocTextExtractor(pandocCommand, pandocTimeoutSeconds),
                new PdfTextExtractor(),
                new CsvTextExtractor());
    }

    @Bean
    public ContentMaterializer contentMaterializer(
            final DriveGateway driveGateway,
            final TextExtractor textExtractor,
            final ContentLayout contentLayout) {
        return new ContentMaterializer(driveGateway, textExtractor,
                contentLayout);
    }

    /**
     * The git token source. The token is read on first use, so a missing
     * token fails the first clone and not the startup.
     *
     * @param token the token value
     * @param tokenFile a file holding the token
     * @return the provider
     */
    @Bean
    public GitTokenProvider gitTokenProvider(
            @Value("${drive-sync.git.token:}") final String token,
            @Value("${drive-sync.git.token-file:}") final String tokenFile) {
        return new GitTokenProvider(token, tokenFile);
    }

    @Bean
    public WorkingCopyFactory workingCopyFactory(
            final SyncSettings settings,
            final GitTokenProvider tokenProvider) {
        return new WorkingCopyFactory(
                settings.repositoryUrl(),
                settings.branch(),
                Path.of(settings.cloneBasePath()),
                settings.gitTimeoutSeconds(),
                tokenProvider);
    }

    /**
     * Splits a comma separated property, dropping blank entries.
     *
     * @param value the raw property, may be null
     * @return the trimmed entries
     */
    static List<String> parseList(final String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .toList();
    }

}
