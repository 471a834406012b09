package co.fanki.drivesync.change.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses a raw change batch to one record per file.
 *
 * <p>The last observed record of a file wins; its intermediate states in
 * the same batch are discarded. Files keep the position of their first
 * appearance. Records without a file id are dropped.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ChangeDeduplicator {

    private ChangeDeduplicator() {
    }

    /**
     * Deduplicates a batch.
     *
     * @param records the raw records in feed order
     * @return one record per file id
     */
    public static List<ChangeRecord> latestPerFile(
            final List<ChangeRecord> records) {
        final Map<String, ChangeRecord> latest = new LinkedHashMap<>();
        for (final ChangeRecord record : records) {
            if (record.fileId() == null || record.fileId().isEmpty()) {
                continue;
            }
            latest.put(record.fileId(), record);
        }
        return new ArrayList<>(latest.values());
    }

}
