package co.fanki.drivesync.change.domain;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for the files mirrored in the git repository.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class TrackedFileRepository {

    /** Find tracked file by Drive id. Uses: PK index. */
    public static final String FIND_BY_ID =
            "SELECT * FROM tracked_files WHERE file_id = :fileId";

    /** Find all tracked files. Uses: idx_tracked_files_path. */
    public static final String FIND_ALL =
            "SELECT * FROM tracked_files ORDER BY relative_path";

    /** Find tracked files below a folder. Uses: idx_tracked_files_path. */
    public static final String FIND_BY_PATH_PREFIX = """
            SELECT * FROM tracked_files
            WHERE relative_path LIKE :prefix ESCAPE '\\'
            ORDER BY relative_path
            """;

    private final Jdbi jdbi;

    /**
     * Creates a new TrackedFileRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public TrackedFileRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    /**
     * Finds the record of a Drive file.
     *
     * @param fileId the Drive file id
     * @return the record if the file is tracked
     */
    public Optional<TrackedFile> findById(final String fileId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ID)
                .bind("fileId", fileId)
                .map(new TrackedFileRowMapper())
                .findOne());
    }

    /**
     * Inserts or replaces the record of a Drive file.
     *
     * @param file the record to store
     */
    public void save(final TrackedFile file) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO tracked_files (
                    file_id, name, relative_path, content_hash, mime_type,
                    last_modified_marker, derived_text_path,
                    last_editor_name, last_editor_email, updated_at
                ) VALUES (
                    :fileId, :name, :relativePath, :contentHash, :mimeType,
                    :modifiedTime, :derivedTextPath,
                    :editorName, :editorEmail, :updatedAt
                )
                ON CONFLICT (file_id) DO UPDATE SET
                    name = EXCLUDED.name,
                    relative_path = EXCLUDED.relative_path,
                    content_hash = EXCLUDED.content_hash,
                    mime_type = EXCLUDED.mime_type,
                    last_modified_marker = EXCLUDED.last_modified_marker,
                    derived_text_path = EXCLUDED.derived_text_path,
                    last_editor_name = EXCLUDED.last_editor_name,
                    last_editor_email = EXCLUDED.last_editor_email,
                    updated_at = EXCLUDED.updated_at
                """)
                .bind("fileId", file.fileId())
                .bind("name", file.name())
                .bind("relativePath", file.relativePath())
                .bind("contentHash", file.contentHash())
                .bind("mimeType", file.mimeType())
                .bind("modifiedTime", file.modifiedTime())
                .bind("derivedTextPath", file.derivedTextPath())
                .bind("editorName", file.editorName())
                .bind("editorEmail", file.editorEmail())
                .bind("updatedAt", toTimestamp(file.updatedAt()))
                .execute());
    }

    /**
     * Removes the record of a Drive file. Missing records are ignored.
     *
     * @param fileId the Drive file id
     */
    public void delete(final String fileId) {
        jdbi.useHandle(handle -> handle
                .createUpdate("DELETE FROM tracked_files WHERE file_id = :fileId")
                .bind("fileId", fileId)
                .execute());
    }

    /**
     * Finds every tracked file.
     *
     * @return the records ordered by path
     */
    public List<TrackedFile> findAll() {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_ALL)
                .map(new TrackedFileRowMapper())
                .list());
    }

    /**
     * Finds the tracked files whose path starts with the given prefix.
     *
     * @param prefix the leading path, e.g. {@code Contracts/}
     * @return the records ordered by path
     */
    public List<TrackedFile> findByPathPrefix(final String prefix) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_PATH_PREFIX)
                .bind("prefix", escapeLike(prefix) + "%")
                .map(new TrackedFileRowMapper())
                .list());
    }

    private static String escapeLike(final String value) {
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }

    private Timestamp toTimestamp(final Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static final class TrackedFileRowMapper
            implements RowMapper<TrackedFile> {

        @Override
        public TrackedFile map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            final Timestamp updatedTs = rs.getTimestamp("updated_at");
            return new TrackedFile(
                    rs.getString("file_id"),
                    rs.getString("name"),
                    rs.getString("relative_path"),
                    rs.getString("content_hash"),
                    rs.getString("mime_type"),
                    rs.getString("last_modified_marker"),
                    rs.getString("derived_text_path"),
                    rs.getString("last_editor_name"),
                    rs.getString("last_editor_email"),
                    updatedTs != null ? updatedTs.toInstant() : null);
        }
    }

}
