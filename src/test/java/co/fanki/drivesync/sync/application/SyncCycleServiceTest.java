package co.fanki.drivesync.sync.application;

import co.fanki.drivesync.change.domain.Change;
import co.fanki.drivesync.change.domain.ChangeClassifier;
import co.fanki.drivesync.change.domain.ChangeRecord;
import co.fanki.drivesync.change.domain.DriveFile;
import co.fanki.drivesync.change.domain.Editor;
import co.fanki.drivesync.change.domain.FolderScope;
import co.fanki.drivesync.change.domain.PathFilter;
import co.fanki.drivesync.change.domain.TrackedFile;
import co.fanki.drivesync.change.domain.TrackedFileRepository;
import co.fanki.drivesync.content.domain.ContentLayout;
import co.fanki.drivesync.content.domain.ContentMaterializer;
import co.fanki.drivesync.content.domain.MaterializationResult;
import co.fanki.drivesync.drive.domain.ChangePage;
import co.fanki.drivesync.drive.domain.DriveGateway;
import co.fanki.drivesync.git.domain.GitOperationException;
import co.fanki.drivesync.git.domain.WorkingCopy;
import co.fanki.drivesync.git.domain.WorkingCopyFactory;
import co.fanki.drivesync.sync.domain.SyncResult;
import co.fanki.drivesync.sync.domain.SyncSettings;
import co.fanki.drivesync.sync.domain.SyncStateRepository;
import org.easymock.Capture;
import org.easymock.IExpectationSetters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.anyString;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.getCurrentArgument;
import static org.easymock.EasyMock.newCapture;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.same;
import static org.easymock.EasyMock.startsWith;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link SyncCycleService}.
 *
 * <p>Drive, git and the repositories are mocked; classification and the
 * layout are real.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SyncCycleServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final Editor BOT = new Editor("Drive Sync Bot",
            "sync@example.com");
    private static final Editor ANA = new Editor("Ana", "ana@x.io");
    private static final Editor BO = new Editor("Bo", "bo@x.io");

    private DriveGateway drive;
    private ContentMaterializer materializer;
    private WorkingCopyFactory workingCopyFactory;
    private WorkingCopy workingCopy;
    private TrackedFileRepository trackedFileRepository;
    private SyncStateRepository stateRepository;

    private SyncCycleService service;

    @BeforeEach
    void setUp() {
        drive = createMock(DriveGateway.class);
        materializer = createMock(ContentMaterializer.class);
        workingCopyFactory = createMock(WorkingCopyFactory.class);
        workingCopy = createMock(WorkingCopy.class);
        trackedFileRepository = createMock(TrackedFileRepository.class);
        stateRepository = createMock(SyncStateRepository.class);

        service = new SyncCycleService(
                drive,
                new ChangeClassifier(new PathFilter(List.of(), List.of(".zip"),
                        100)),
                materializer,
                new ContentLayout("docs"),
                workingCopyFactory,
                trackedFileRepository,
                stateRepository,
                settings(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void whenRunningCycle_givenNoCursor_shouldOnlyRecordStartCursor() {
        expect(stateRepository.findCursor()).andReturn(Optional.empty());
        expect(drive.startCursor()).andReturn("100");
        stateRepository.saveCursor("100");
        replayAll();

        final SyncResult result = service.runCycle();

        assertEquals(SyncResult.none(), result);
        verifyAll();
    }

    @Test
    void whenRunningCycle_givenNoChanges_shouldAdvanceCursorWithoutClone() {
        expect(stateRepository.findCursor()).andReturn(Optional.of("100"));
        expect(drive.listChanges("100"))
                .andReturn(new ChangePage(List.of(), "101"));
        stateRepository.saveCursor("101");
        replayAll();

        assertEquals(SyncResult.none(), service.runCycle());
        verifyAll();
    }

    @Test
    void whenRunningCycle_givenOnlyUnchangedFiles_shouldAdvanceCursorWithoutClone() {
        final DriveFile file = pdf("f1", "a.pdf", "h1", ANA);
        expect(stateRepository.findCursor()).andReturn(Optional.of("100"));
        expect(drive.listChanges("100")).andReturn(new ChangePage(
                List.of(ChangeRecord.of(file)), "101"));
        expect(drive.newFolderScope()).andReturn(new FlatScope());
        expect(trackedFileRepository.findById("f1")).andReturn(Optional.of(
                TrackedFile.track(file, "a.pdf", "a.pdf.txt", NOW)));
        stateRepository.saveCursor("101");
        replayAll();

        assertEquals(SyncResult.none(), service.runCycle());
        verifyAll();
    }

    @Test
    void whenRunningCycle_givenNewFileFromOneEditor_shouldCommitPushAndTrack() {
        final DriveFile file = pdf("f1", "a.pdf", "h1", ANA);
        expectChanges(file);
        expect(trackedFileRepository.findById("f1")).andReturn(Optional.empty());
        expect(workingCopyFactory.checkout()).andReturn(workingCopy);
        expectMaterializationSucceeds("a.pdf.txt");
        expect(workingCopy.hasStagedChanges()).andReturn(true);
        workingCopy.commit(startsWith("Sync from Google Drive"), eq(ANA));
        workingCopy.push();
        final Capture<TrackedFile> saved = newCapture();
        trackedFileRepository.save(capture(saved));
        stateRepository.saveCursor("101");
        workingCopy.cleanup();
        replayAll();

        final SyncResult result = service.runCycle();

        assertEquals(1, result.processed());
        assertEquals(1, result.added());
        assertEquals("a.pdf", saved.getValue().relativePath());
        assertEquals("a.pdf.txt", saved.getValue().derivedTextPath());
        assertEquals(NOW, saved.getValue().updatedAt());
        verifyAll();
    }

    @Test
    void whenRunningCycle_givenTwoEditors_shouldCommitEachEditorSeparately() {
        expectChanges(pdf("f1", "a.pdf", "h1", ANA),
                pdf("f2", "b.pdf", "h2", BO));
        expect(trackedFileRepository.findById(anyString()))
                .andReturn(Optional.empty()).times(2);
        expect(workingCopyFactory.checkout()).andReturn(workingCopy);
        expectMaterializationSucceeds(null).times(2);
        workingCopy.unstageAll();
        workingCopy.stage("docs/a.pdf");
        workingCopy.stage("docs/a.pdf.txt");
        workingCopy.stage("docs/b.pdf");
        workingCopy.stage("docs/b.pdf.txt");
        expect(workingCopy.hasStagedChanges()).andReturn(true).times(2);
        workingCopy.commit("Sync from Google Drive\n\n  - add: a.pdf", ANA);
        workingCopy.commit("Sync from Google Drive\n\n  - add: b.pdf", BO);
        workingCopy.push();
        trackedFileRepository.save(anyObject(TrackedFile.class));
        expectLastCall().times(2);
        stateRepository.saveCursor("101");
        workingCopy.cleanup();
        replayAll();

        assertEquals(2, service.runCycle().added());
        verifyAll();
    }

    @Test
    void whenRunningCycle_givenRemovedTrackedFile_shouldForgetIt() {
        final TrackedFile tracked = TrackedFile.track(
                pdf("f1", "a.pdf", "h1", ANA), "a.pdf", null, NOW);
        expect(stateRepository.findCursor()).andReturn(Optional.of("100"));
        expect(drive.listChanges("100")).andReturn(new ChangePage(
                List.of(ChangeRecord.removal("f1")), "101"));
        expect(drive.newFolderScope()).andReturn(new FlatScope());
        expect(trackedFileRepository.findById("f1"))
                .andReturn(Optional.of(tracked));
        expect(workingCopyFactory.checkout()).andReturn(workingCopy);
        expectMaterializationSucceeds(null);
        expect(workingCopy.hasStagedChanges()).andReturn(true);
        workingCopy.commit("Sync from Google Drive\n\n  - delete: a.pdf", BOT);
        workingCopy.push();
        trackedFileRepository.delete("f1");
        stateRepository.saveCursor("101");
        workingCopy.cleanup();
        replayAll();

        assertEquals(1, service.runCycle().deleted());
        verifyAll();
    }

    @Test
    void whenRunningCycle_givenPushRejected_shouldKeepCursorAndCleanUp() {
        expectChanges(pdf("f1", "a.pdf", "h1", ANA));
        expect(trackedFileRepository.findById("f1")).andReturn(Optional.empty());
        expect(workingCopyFactory.checkout()).andReturn(workingCopy);
        expectMaterializationSucceeds(null);
        expect(workingCopy.hasStagedChanges()).andReturn(true);
        workingCopy.commit(anyString(), eq(ANA));
        workingCopy.push();
        expectLastCall().andThrow(new GitOperationException("rejected",
                GitOperationException.PUSH_REJECTED));
        workingCopy.cleanup();
        replayAll();

        assertThrows(GitOperationException.class, () -> service.runCycle());
        verifyAll();
    }

    @Test
    void whenRunningCycle_givenEveryChangeFailed_shouldAdvanceCursorWithoutCommit() {
        expectChanges(pdf("f1", "a.pdf", "h1", ANA));
        expect(trackedFileRepository.findById("f1")).andReturn(Optional.empty());
        expect(workingCopyFactory.checkout()).andReturn(workingCopy);
        expect(materializer.materialize(anyObject(Change.class),
                same(workingCopy))).andAnswer(() -> MaterializationResult
                        .failed(getCurrentArgument(0), "download failed"));
        stateRepository.saveCursor("101");
        workingCopy.cleanup();
        replayAll();

        final SyncResult result = service.runCycle();

        assertEquals(0, result.processed());
        assertEquals(1, result.failed());
        verifyAll();
    }

    @Test
    void whenRunningInitialSync_givenFolderTree_shouldNotTouchCursor() {
        expect(drive.listFolderTree()).andReturn(List.of(
                pdf("f1", "a.pdf", "h1", ANA)));
        expect(drive.newFolderScope()).andReturn(new FlatScope());
        expect(trackedFileRepository.findById("f1")).andReturn(Optional.empty());
        expect(workingCopyFactory.checkout()).andReturn(workingCopy);
        expectMaterializationSucceeds(null);
        expect(workingCopy.hasStagedChanges()).andReturn(true);
        workingCopy.commit(anyString(), eq(ANA));
        workingCopy.push();
        trackedFileRepository.save(anyObject(TrackedFile.class));
        workingCopy.cleanup();
        replayAll();

        assertEquals(1, service.runInitialSync().added());
        verifyAll();
    }

    private void expectChanges(final DriveFile... files) {
        expect(stateRepository.findCursor()).andReturn(Optional.of("100"));
        expect(drive.listChanges("100")).andReturn(new ChangePage(
                Arrays.stream(files).map(ChangeRecord::of).toList(),
                "101"));
        expect(drive.newFolderScope()).andReturn(new FlatScope());
    }

    private IExpectationSetters<MaterializationResult>
            expectMaterializationSucceeds(final String derivedPath) {
        return expect(materializer.materialize(anyObject(Change.class),
                same(workingCopy))).andAnswer(() -> MaterializationResult
                        .success(getCurrentArgument(0), derivedPath));
    }

    private void replayAll() {
        replay(drive, materializer, workingCopyFactory, workingCopy,
                trackedFileRepository, stateRepository);
    }

    private void verifyAll() {
        verify(drive, materializer, workingCopyFactory, workingCopy,
                trackedFileRepository, stateRepository);
    }

    private static DriveFile pdf(final String id, final String name,
            final String hash, final Editor editor) {
        return new DriveFile(id, name, List.of("root"), "application/pdf",
                hash, false, "2024-04-01T00:00:00.000Z", 10L, editor.name(),
                editor.email());
    }

    static SyncSettings settings() {
        return new SyncSettings("root", "https://example.com/docs.git",
                "main", "/tmp", 30, "docs", List.of(), List.of(".zip"), 100,
                BOT, Duration.ofSeconds(600), 3, "https://sync.example.com/hook",
                "s3cret", "verification-token");
    }

    /** Every file sits directly in the monitored folder. */
    private static final class FlatScope implements FolderScope {

        @Override
        public boolean contains(final DriveFile file) {
            return true;
        }

        @Override
        public String resolveRelativePath(final DriveFile file) {
            return file.name();
        }
    }

}
