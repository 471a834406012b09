package co.fanki.drivesync.change.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link Change} and {@link Editor}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ChangeTest {

    private static final TrackedFile TRACKED = new TrackedFile("f1",
            "plan.pdf", "Projects/plan.pdf", "hash-1", "application/pdf",
            "2024-01-01T00:00:00Z", "Projects/plan.pdf.txt", null, null,
            Instant.EPOCH);

    @Test
    void whenRelocating_givenSameName_shouldBeMove() {
        final Change change = Change.relocate(pdf("plan.pdf", "hash-1"),
                TRACKED, "Archive/plan.pdf");

        assertEquals(ChangeType.MOVE, change.type());
        assertEquals("Projects/plan.pdf", change.oldPath());
        assertEquals("Archive/plan.pdf", change.newPath());
        assertFalse(change.requiresContentRefresh());
    }

    @Test
    void whenRelocating_givenNewNameAndNewHash_shouldBeRenameWithRefresh() {
        final Change change = Change.relocate(pdf("plan-v2.pdf", "hash-2"),
                TRACKED, "Projects/plan-v2.pdf");

        assertEquals(ChangeType.RENAME, change.type());
        assertTrue(change.requiresContentRefresh());
    }

    @Test
    void whenRelocating_givenNativeDocument_shouldAlwaysRefresh() {
        final DriveFile doc = new DriveFile("f1", "plan.pdf", List.of("root"),
                "application/vnd.google-apps.document", null, false,
                "2024-01-01T00:00:00Z", null, null, null);

        assertTrue(Change.relocate(doc, TRACKED, "Other/plan.pdf")
                .requiresContentRefresh());
    }

    @Test
    void whenDeleting_givenTrackedFile_shouldDescribeOldPath() {
        final Change change = Change.delete(TRACKED);

        assertEquals(ChangeType.DELETE, change.type());
        assertNull(change.file());
        assertEquals("Projects/plan.pdf", change.describedPath());
        assertNull(change.editorEmail());
    }

    @Test
    void whenSkipping_givenFileId_shouldDescribeTheId() {
        assertEquals("f9", Change.skip("f9").describedPath());
    }

    @Test
    void whenAdding_givenBlankPath_shouldReject() {
        assertThrows(IllegalArgumentException.class,
                () -> Change.add(pdf("plan.pdf", "h"), " "));
    }

    @Test
    void whenResolvingEditor_givenOnlyName_shouldTakeFallbackEmail() {
        final Editor fallback = new Editor("Drive Sync Bot",
                "sync@example.com");

        final Editor editor = Editor.resolve("Ana", null, fallback);

        assertEquals("Ana <sync@example.com>", editor.asGitIdentity());
    }

    private static DriveFile pdf(final String name, final String hash) {
        return new DriveFile("f1", name, List.of("root"), "application/pdf",
                hash, false, "2024-02-01T00:00:00Z", 100L, "Ana",
                "ana@example.com");
    }

}
