package co.fanki.drivesync.config;

import co.fanki.drivesync.change.domain.Editor;
import co.fanki.drivesync.sync.domain.SyncSettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link SyncConfiguration}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SyncConfigurationTest {

    private final SyncConfiguration configuration = new SyncConfiguration();

    @Test
    void whenParsingList_givenSpacesAndBlanks_shouldTrimAndDrop() {
        assertEquals(List.of(".zip", ".exe"),
                SyncConfiguration.parseList(" .zip, ,.exe "));
        assertTrue(SyncConfiguration.parseList(null).isEmpty());
    }

    @Test
    void whenBuildingSettings_givenProperties_shouldResolveEveryValue() {
        final SyncSettings settings = settings("folder-1");

        assertEquals("folder-1", settings.folderId());
        assertEquals(List.of("Archive/*", "*.tmp"), settings.excludePaths());
        assertEquals(new Editor("Drive Sync Bot", "sync@example.com"),
                settings.defaultAuthor());
        assertEquals(Duration.ofSeconds(600), settings.lockTtl());
        assertTrue(settings.hasTriggerSecret());
    }

    @Test
    void whenBuildingSettings_givenNoFolderId_shouldFailStartup() {
        assertThrows(IllegalArgumentException.class, () -> settings(""));
    }

    private SyncSettings settings(final String folderId) {
        return configuration.syncSettings(folderId,
                "https://example.com/docs.git", "main", "/tmp", 120, "docs",
                "Archive/*, *.tmp", ".zip,.exe,.dmg,.iso", 100,
                "Drive Sync Bot", "sync@example.com", 600, 3,
                "https://sync.example.com/hook", "s3cret", "");
    }

}
