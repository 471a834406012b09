package co.fanki.drivesync.sync.domain;

import co.fanki.drivesync.change.domain.Change;
import co.fanki.drivesync.change.domain.ChangeType;
import co.fanki.drivesync.change.domain.DriveFile;
import co.fanki.drivesync.change.domain.Editor;
import co.fanki.drivesync.change.domain.TrackedFile;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link AuthorGrouper} and {@link SyncResult}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AuthorGrouperTest {

    private static final Editor BOT = new Editor("Drive Sync Bot",
            "sync@example.com");

    @Test
    void whenGrouping_givenTwoEditors_shouldKeepFirstSeenOrder() {
        final Change byBo = Change.add(file("f1", "a.pdf", "Bo", "bo@x.io"),
                "a.pdf");
        final Change byAna = Change.add(file("f2", "b.pdf", "Ana", "ana@x.io"),
                "b.pdf");
        final Change byBoAgain = Change.add(
                file("f3", "c.pdf", "Bo", "bo@x.io"), "c.pdf");

        final List<AuthorBatch> batches = AuthorGrouper.group(
                List.of(byBo, byAna, byBoAgain), BOT);

        assertEquals(2, batches.size());
        assertEquals(new Editor("Bo", "bo@x.io"), batches.get(0).author());
        assertEquals(List.of(byBo, byBoAgain), batches.get(0).changes());
        assertEquals(new Editor("Ana", "ana@x.io"), batches.get(1).author());
    }

    @Test
    void whenGrouping_givenDeletion_shouldAttributeToDefaultAuthor() {
        final TrackedFile tracked = new TrackedFile("f1", "old.pdf",
                "Docs/old.pdf", "h", "application/pdf", null, null, "Ana",
                "ana@x.io", Instant.EPOCH);

        final List<AuthorBatch> batches = AuthorGrouper.group(
                List.of(Change.delete(tracked)), BOT);

        assertEquals(BOT, batches.get(0).author());
    }

    @Test
    void whenBuildingMessage_givenChanges_shouldListThemUnderTitle() {
        final TrackedFile tracked = new TrackedFile("f2", "x.pdf", "x.pdf",
                "h", "application/pdf", null, null, null, null, Instant.EPOCH);
        final List<Change> changes = List.of(
                Change.add(file("f1", "a.pdf", null, null), "Docs/a.pdf"),
                Change.delete(tracked));

        assertEquals("Sync from Google Drive\n\n"
                + "  - add: Docs/a.pdf\n"
                + "  - delete: x.pdf", AuthorGrouper.message(changes));
    }

    @Test
    void whenSummarizing_givenAppliedChanges_shouldCountPerType() {
        final TrackedFile tracked = new TrackedFile("f2", "x.pdf", "x.pdf",
                "h", "application/pdf", null, null, null, null, Instant.EPOCH);
        final Change add = Change.add(file("f1", "a.pdf", null, null), "a.pdf");
        final Change move = Change.relocate(file("f2", "x.pdf", null, null),
                tracked, "Old/x.pdf");

        final SyncResult result = SyncResult.of(List.of(add, move), 1);

        assertEquals(ChangeType.MOVE, move.type());
        assertEquals(new SyncResult(2, 1, 0, 0, 1, 0, 1), result);
    }

    private static DriveFile file(final String id, final String name,
            final String editor, final String email) {
        return new DriveFile(id, name, List.of("root"), "application/pdf",
                "h", false, null, 1L, editor, email);
    }

}
