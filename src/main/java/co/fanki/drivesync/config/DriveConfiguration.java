package co.fanki.drivesync.config;

import co.fanki.drivesync.drive.domain.DriveGateway;
import co.fanki.drivesync.drive.domain.GoogleDriveGateway;
import co.fanki.drivesync.sync.domain.SyncSettings;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.DriveScopes;
import com.google.auth.http.HttpCredentialsAdapter;
import com.google.auth.oauth2.GoogleCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Google Drive API client configuration.
 *
 * <p>Authenticates with the application default credentials: the
 * {@code GOOGLE_APPLICATION_CREDENTIALS} key file locally, the attached
 * service account when deployed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class DriveConfiguration {

    private static final Logger LOG =
            LoggerFactory.getLogger(DriveConfiguration.class);

    private static final String APPLICATION_NAME = "drive-git-sync";

    /**
     * Creates the Drive client.
     *
     * @param connectTimeoutMillis the HTTP connect timeout
     * @param readTimeoutMillis the HTTP read timeout
     * @return the authenticated client
     */
    @Bean
    public Drive drive(
            @Value("${drive-sync.drive.connect-timeout-millis:20000}")
            final int connectTimeoutMillis,
            @Value("${drive-sync.drive.read-timeout-millis:60000}")
            final int readTimeoutMillis) {

        final GoogleCredentials credentials;
        try {
            credentials = GoogleCredentials.getApplicationDefault()
                    .createScoped(List.of(DriveScopes.DRIVE_READONLY));
        } catch (final IOException e) {
            throw new UncheckedIOException(
                    "Google application default credentials not found", e);
        }

        final HttpCredentialsAdapter adapter =
                new HttpCredentialsAdapter(credentials);
        final HttpRequestInitializer initializer = request -> {
            adapter.initialize(request);
            request.setConnectTimeout(connectTimeoutMillis);
            request.setReadTimeout(readTimeoutMillis);
        };

        LOG.info("Drive client ready (connect timeout {}ms, read timeout {}ms)",
                connectTimeoutMillis, readTimeoutMillis);

        return new Drive.Builder(new NetHttpTransport(),
                GsonFactory.getDefaultInstance(), initializer)
                .setApplicationName(APPLICATION_NAME)
                .build();
    }

    /**
     * The gateway over the monitored folder.
     *
     * @param drive the Drive client
     * @param settings the mirror settings
     * @return the gateway
     */
    @Bean
    public DriveGateway driveGateway(final Drive drive,
            final SyncSettings settings) {
        return new GoogleDriveGateway(drive, settings.folderId());
    }

}
