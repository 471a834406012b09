package co.fanki.drivesync.sync.application;

import co.fanki.drivesync.change.domain.Change;
import co.fanki.drivesync.change.domain.ChangeClassifier;
import co.fanki.drivesync.change.domain.ChangeDeduplicator;
import co.fanki.drivesync.change.domain.ChangeRecord;
import co.fanki.drivesync.change.domain.ChangeType;
import co.fanki.drivesync.change.domain.FolderScope;
import co.fanki.drivesync.change.domain.TrackedFile;
import co.fanki.drivesync.change.domain.TrackedFileRepository;
import co.fanki.drivesync.content.domain.ContentLayout;
import co.fanki.drivesync.content.domain.ContentMaterializer;
import co.fanki.drivesync.content.domain.MaterializationResult;
import co.fanki.drivesync.drive.domain.ChangePage;
import co.fanki.drivesync.drive.domain.DriveGateway;
import co.fanki.drivesync.git.domain.WorkingCopy;
import co.fanki.drivesync.git.domain.WorkingCopyFactory;
import co.fanki.drivesync.sync.domain.AuthorBatch;
import co.fanki.drivesync.sync.domain.AuthorGrouper;
import co.fanki.drivesync.sync.domain.SyncCycle;
import co.fanki.drivesync.sync.domain.SyncResult;
import co.fanki.drivesync.sync.domain.SyncSettings;
import co.fanki.drivesync.sync.domain.SyncStage;
import co.fanki.drivesync.sync.domain.SyncStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs one sync cycle: from the stored cursor to pushed commits and
 * updated state.
 *
 * <p>The cycle:</p>
 * <ol>
 *   <li>Without a cursor, record the start cursor and stop</li>
 *   <li>Fetch every change after the cursor</li>
 *   <li>Deduplicate and classify; stop when nothing is actionable</li>
 *   <li>Clone the repository and apply each change</li>
 *   <li>Commit per author and push once</li>
 *   <li>Record the tracked files, then advance the cursor</li>
 * </ol>
 *
 * <p>State is written only after the push succeeded. A failed push
 * propagates and leaves the cursor untouched, so the same changes are
 * fetched again by the next cycle. A change that fails to apply while
 * others succeed is not retried: the cursor moves past it and only a new
 * notification for that file brings it back.</p>
 *
 * <p>Callers must hold the sync lock.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class SyncCycleService {

    private static final Logger LOG =
            LoggerFactory.getLogger(SyncCycleService.class);

    private final DriveGateway drive;
    private final ChangeClassifier classifier;
    private final ContentMaterializer materializer;
    private final ContentLayout layout;
    private final WorkingCopyFactory workingCopyFactory;
    private final TrackedFileRepository trackedFileRepository;
    private final SyncStateRepository stateRepository;
    private final SyncSettings settings;
    private final Clock clock;

    /**
     * Creates a new SyncCycleService.
     *
     * @param theDrive the Drive gateway
     * @param theClassifier the change classifier
     * @param theMaterializer the content materializer
     * @param theLayout the working copy layout
     * @param theWorkingCopyFactory the working copy factory
     * @param theTrackedFileRepository the tracked file repository
     * @param theStateRepository the sync state repository
     * @param theSettings the mirror settings
     * @param theClock the clock stamping tracked files
     */
    public SyncCycleService(
            final DriveGateway theDrive,
            final ChangeClassifier theClassifier,
            final ContentMaterializer theMaterializer,
            final ContentLayout theLayout,
            final WorkingCopyFactory theWorkingCopyFactory,
            final TrackedFileRepository theTrackedFileRepository,
            final SyncStateRepository theStateRepository,
            final SyncSettings theSettings,
            final Clock theClock) {
        this.drive = theDrive;
        this.classifier = theClassifier;
        this.materializer = theMaterializer;
        this.layout = theLayout;
        this.workingCopyFactory = theWorkingCopyFactory;
        this.trackedFileRepository = theTrackedFileRepository;
        this.stateRepository = theStateRepository;
        this.settings = theSettings;
        this.clock = theClock;
    }

    /**
     * Runs one incremental cycle from the stored cursor.
     *
     * @return the cycle summary
     * @throws co.fanki.drivesync.git.domain.GitOperationException when the
     *         clone or the push fails
     * @throws co.fanki.drivesync.drive.domain.DriveAccessException when the
     *         change feed cannot be read
     */
    public SyncResult runCycle() {
        final SyncCycle cycle = SyncCycle.start();
        final Optional<String> cursor = stateRepository.findCursor();

        if (cursor.isEmpty()) {
            cycle.advance(SyncStage.UNINITIALIZED);
            LOG.info("No cursor found, recording the start cursor");
            stateRepository.saveCursor(drive.startCursor());
            cycle.advance(SyncStage.DONE);
            return SyncResult.none();
        }

        cycle.advance(SyncStage.FETCHING);
        final ChangePage page = drive.listChanges(cursor.get());
        if (page.isEmpty()) {
            stateRepository.saveCursor(page.nextCursor());
            cycle.advance(SyncStage.DONE);
            LOG.info("No changes found");
            return SyncResult.none();
        }

        LOG.info("Found {} raw changes", page.records().size());
        return apply(cycle, page.records(),
                () -> stateRepository.saveCursor(page.nextCursor()));
    }

    /**
     * Mirrors every file currently below the monitored folder, whatever
     * the change feed says. Files already mirrored with the same content
     * are skipped. The cursor is not read nor written.
     *
     * @return the cycle summary
     */
    public SyncResult runInitialSync() {
        final SyncCycle cycle = SyncCycle.start();
        cycle.advance(SyncStage.FETCHING);

        final List<ChangeRecord> records = drive.listFolderTree().stream()
                .map(ChangeRecord::of)
                .toList();
        if (records.isEmpty()) {
            cycle.advance(SyncStage.DONE);
            LOG.info("Monitored folder is empty");
            return SyncResult.none();
        }

        LOG.info("Initial sync of {} files", records.size());
        return apply(cycle, records, () -> { });
    }

    private SyncResult apply(final SyncCycle cycle,
            final List<ChangeRecord> records, final Runnable advanceCursor) {

        cycle.advance(SyncStage.CLASSIFYING);
        final List<Change> changes = classify(records);
        if (changes.isEmpty()) {
            advanceCursor.run();
            cycle.advance(SyncStage.DONE);
            LOG.info("All changes were skipped");
            return SyncResult.none();
        }

        LOG.info("Processing {} changes", changes.size());
        cycle.advance(SyncStage.MATERIALIZING);

        WorkingCopy workingCopy = null;
        try {
            workingCopy = workingCopyFactory.checkout();

            final List<MaterializationResult> applied = new ArrayList<>();
            int failed = 0;
            for (final Change change : changes) {
                final MaterializationResult result =
                        materializer.materialize(change, workingCopy);
                if (result.succeeded()) {
                    applied.add(result);
                } else {
                    failed++;
                }
            }

            final List<Change> appliedChanges = applied.stream()
                    .map(MaterializationResult::change)
                    .toList();

            if (!applied.isEmpty()) {
                cycle.advance(SyncStage.COMMITTING);
                commit(workingCopy, appliedChanges);

                cycle.advance(SyncStage.PUSHING);
                workingCopy.push();

                cycle.advance(SyncStage.PERSISTING);
                applied.forEach(this::record);
            } else {
                cycle.advance(SyncStage.PERSISTING);
            }

            advanceCursor.run();
            cycle.advance(SyncStage.DONE);

            final SyncResult result = SyncResult.of(appliedChanges, failed);
            LOG.info("Sync complete: {} changes committed, {} failed",
                    result.processed(), result.failed());
            return result;

        } finally {
            if (workingCopy != null) {
                workingCopy.cleanup();
            }
        }
    }

    private List<Change> classify(final List<ChangeRecord> records) {
        final FolderScope scope = drive.newFolderScope();
        final List<Change> changes = new ArrayList<>();
        for (final ChangeRecord record
                : ChangeDeduplicator.latestPerFile(records)) {
            classifier.classify(record, scope, trackedFileRepository::findById)
                    .filter(change -> change.type() != ChangeType.SKIP)
                    .ifPresent(changes::add);
        }
        return changes;
    }

    /**
     * Commits the staged changes, one commit per author.
     *
     * <p>With a single author everything staged so far goes in one commit.
     * With several, the index is reset and each author's paths are staged
     * and committed in turn.</p>
     */
    private void commit(final WorkingCopy workingCopy,
            final List<Change> changes) {
        final List<AuthorBatch> batches = AuthorGrouper.group(changes,
                settings.defaultAuthor());

        if (batches.size() == 1) {
            final AuthorBatch batch = batches.get(0);
            if (workingCopy.hasStagedChanges()) {
                workingCopy.commit(batch.message(), batch.author());
            }
            return;
        }

        workingCopy.unstageAll();
        for (final AuthorBatch batch : batches) {
            for (final Change change : batch.changes()) {
                layout.pathsOf(change).forEach(workingCopy::stage);
            }
            if (workingCopy.hasStagedChanges()) {
                workingCopy.commit(batch.message(), batch.author());
            }
        }
    }

    private void record(final MaterializationResult result) {
        final Change change = result.change();
        if (change.type() == ChangeType.DELETE) {
            trackedFileRepository.delete(change.fileId());
            return;
        }
        trackedFileRepository.save(TrackedFile.track(change.file(),
                change.newPath(), result.derivedTextPath(), clock.instant()));
    }

}
