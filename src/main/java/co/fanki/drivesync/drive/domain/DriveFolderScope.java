package co.fanki.drivesync.drive.domain;

import co.fanki.drivesync.change.domain.DriveFile;
import co.fanki.drivesync.change.domain.FolderScope;
import co.fanki.drivesync.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link FolderScope} that walks Drive parent chains up to the monitored
 * folder.
 *
 * <p>Folder lookups are cached for the lifetime of the scope, failed ones
 * included, so one cycle asks Drive at most once per folder. A scope is
 * not shared between cycles: renamed folders are picked up by the next
 * one.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DriveFolderScope implements FolderScope {

    private static final Logger LOG =
            LoggerFactory.getLogger(DriveFolderScope.class);

    /** Reads the name and parents of a folder. */
    @FunctionalInterface
    public interface FolderLookup {

        /**
         * Fetches a folder.
         *
         * @param folderId the folder id
         * @return the folder
         * @throws IOException when Drive cannot answer
         */
        Folder find(String folderId) throws IOException;
    }

    /**
     * The parts of a folder needed for the walk.
     *
     * @param name the folder name
     * @param parents its parent ids, never null
     */
    public record Folder(String name, List<String> parents) {

        /** Normalizes the parents. */
        public Folder {
            parents = parents != null ? List.copyOf(parents) : List.of();
        }
    }

    private final String rootFolderId;
    private final FolderLookup lookup;
    private final Map<String, Optional<Folder>> cache = new HashMap<>();

    /**
     * Creates a new DriveFolderScope.
     *
     * @param theRootFolderId the monitored folder id
     * @param theLookup the folder source
     */
    public DriveFolderScope(final String theRootFolderId,
            final FolderLookup theLookup) {
        this.rootFolderId = Preconditions.requireNonBlank(theRootFolderId,
                "Root folder id is required");
        this.lookup = Preconditions.requireNonNull(theLookup,
                "Folder lookup is required");
    }

    /** {@inheritDoc} */
    @Override
    public boolean contains(final DriveFile file) {
        final Deque<String> pending = new ArrayDeque<>(file.parents());
        final Set<String> visited = new HashSet<>();

        while (!pending.isEmpty()) {
            final String parentId = pending.pop();
            if (!visited.add(parentId)) {
                continue;
            }
            if (parentId.equals(rootFolderId)) {
                return true;
            }
            folder(parentId).ifPresent(
                    folder -> folder.parents().forEach(pending::push));
        }
        return false;
    }

    /** {@inheritDoc} */
    @Override
    public String resolveRelativePath(final DriveFile file) {
        if (file.parents().isEmpty()) {
            return file.name();
        }

        final List<String> parts = new ArrayList<>();
        final Set<String> visited = new HashSet<>();
        String current = file.parents().get(0);

        while (current != null && !current.equals(rootFolderId)) {
            if (!visited.add(current)) {
                LOG.warn("Folder cycle at {} while resolving path of {}",
                        current, file.id());
                break;
            }
            final Optional<Folder> folder = folder(current);
            if (folder.isEmpty()) {
                LOG.warn("Path of {} truncated: folder {} could not be read",
                        file.id(), current);
                break;
            }
            parts.add(folder.get().name());
            current = folder.get().parents().isEmpty()
                    ? null : folder.get().parents().get(0);
        }

        Collections.reverse(parts);
        parts.add(file.name());
        return String.join("/", parts);
    }

    private Optional<Folder> folder(final String folderId) {
        return cache.computeIfAbsent(folderId, id -> {
            try {
                return Optional.ofNullable(lookup.find(id));
            } catch (final IOException | RuntimeException e) {
                LOG.debug("Could not fetch folder {}: {}", id, e.getMessage());
                return Optional.empty();
            }
        });
    }

}
