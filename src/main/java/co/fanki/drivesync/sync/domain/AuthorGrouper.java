package co.fanki.drivesync.sync.domain;

import co.fanki.drivesync.change.domain.Change;
import co.fanki.drivesync.change.domain.Editor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits applied changes into one commit per author.
 *
 * <p>Authors are keyed by their exact name and email. A change without an
 * editor (deletions, or Drive not reporting one) is attributed to the
 * default identity, part by part. Batches keep the order in which their
 * author first appears; changes keep their order inside a batch.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class AuthorGrouper {

    static final String MESSAGE_TITLE = "Sync from Google Drive";

    private AuthorGrouper() {
    }

    /**
     * Groups the changes.
     *
     * @param changes the applied changes
     * @param defaultAuthor the identity used for missing editor parts
     * @return the batches, empty when there are no changes
     */
    public static List<AuthorBatch> group(final List<Change> changes,
            final Editor defaultAuthor) {
        final Map<Editor, List<Change>> byAuthor = new LinkedHashMap<>();
        for (final Change change : changes) {
            final Editor author = Editor.resolve(change.editorName(),
                    change.editorEmail(), defaultAuthor);
            byAuthor.computeIfAbsent(author, key -> new ArrayList<>())
                    .add(change);
        }

        final List<AuthorBatch> batches = new ArrayList<>();
        byAuthor.forEach((author, batch) -> batches.add(
                new AuthorBatch(author, message(batch), batch)));
        return batches;
    }

    /**
     * Builds the commit message of a batch.
     *
     * @param changes the changes of the batch
     * @return the title, a blank line and one line per change
     */
    static String message(final List<Change> changes) {
        final StringBuilder message = new StringBuilder(MESSAGE_TITLE)
                .append("\n\n");
        for (int i = 0; i < changes.size(); i++) {
            if (i > 0) {
                message.append('\n');
            }
            final Change change = changes.get(i);
            message.append("  - ").append(change.type().label())
                    .append(": ").append(change.describedPath());
        }
        return message.toString();
    }

}
