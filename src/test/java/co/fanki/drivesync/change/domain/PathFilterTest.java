package co.fanki.drivesync.change.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link PathFilter}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PathFilterTest {

    private final PathFilter filter = new PathFilter(
            List.of("Archive/*", "*.tmp", "Drafts/"),
            List.of(".zip", ".EXE"),
            10);

    @Test
    void whenCheckingExclusion_givenFileInsideExcludedFolder_shouldExclude() {
        assertTrue(filter.isExcluded("Archive/2019/budget.xlsx"));
    }

    @Test
    void whenCheckingExclusion_givenFolderPatternWithTrailingSlash_shouldExcludeContents() {
        assertTrue(filter.isExcluded("Drafts/idea.docx"));
    }

    @Test
    void whenCheckingExclusion_givenFullPathGlob_shouldExclude() {
        assertTrue(filter.isExcluded("Reports/cache.tmp"));
    }

    @Test
    void whenCheckingExclusion_givenSimilarlyNamedFolder_shouldNotExclude() {
        assertFalse(filter.isExcluded("Archived/plan.pdf"));
        assertFalse(filter.isExcluded("Reports/Archive.pdf"));
    }

    @Test
    void whenCheckingSkip_givenFolder_shouldSkip() {
        final DriveFile folder = file("Reports", DriveFile.FOLDER_MIME_TYPE, null);

        assertEquals(Optional.of("folders are not mirrored"),
                filter.skipReason(folder));
    }

    @Test
    void whenCheckingSkip_givenNativeTypeWithoutExport_shouldSkip() {
        final DriveFile form = file("Survey",
                "application/vnd.google-apps.form", null);

        assertEquals(Optional.of(
                "no export format for application/vnd.google-apps.form"),
                filter.skipReason(form));
    }

    @Test
    void whenCheckingSkip_givenNativeDocument_shouldMirror() {
        final DriveFile doc = file("Roadmap",
                "application/vnd.google-apps.document", null);

        assertTrue(filter.skipReason(doc).isEmpty());
    }

    @Test
    void whenCheckingSkip_givenSkippedExtensionInOtherCase_shouldSkip() {
        final DriveFile installer = file("Setup.exe", "application/octet-stream",
                1L);

        assertEquals(Optional.of("skipped extension .exe"),
                filter.skipReason(installer));
    }

    @Test
    void whenCheckingSkip_givenFileOverTheLimit_shouldSkipWithSize() {
        final DriveFile video = file("demo.mp4", "video/mp4",
                25L * 1024 * 1024);

        assertEquals(Optional.of("file too large (25MB > 10MB)"),
                filter.skipReason(video));
    }

    @Test
    void whenCheckingSkip_givenFileExactlyAtTheLimit_shouldMirror() {
        final DriveFile pdf = file("scan.pdf", "application/pdf",
                10L * 1024 * 1024);

        assertTrue(filter.skipReason(pdf).isEmpty());
    }

    private static DriveFile file(final String name, final String mimeType,
            final Long size) {
        return new DriveFile("id-1", name, List.of("root"), mimeType, null,
                false, null, size, null, null);
    }

}
