package com.filetags.app.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jdbi.v3.sqlobject.transaction.Transaction;

import com.filetags.app.database.CatalogStore.FileRef;
import com.filetags.app.database.CatalogStore.FileRow;
import com.filetags.app.database.CatalogStore.Fingerprint;
import com.filetags.app.database.CatalogStore.RootRow;
import com.filetags.app.database.CatalogStore.TagCount;
import com.filetags.app.database.CatalogStore.TagRow;

public interface CatalogDao {

    // --- Files ---------------------------------------------------------------

    // hash nunca é tocado no update
    @SqlUpdate("""
        INSERT INTO files(path, size, mtime, hash)
        VALUES(:path, :size, :mtime, NULL)
        ON CONFLICT(path) DO UPDATE SET
            size  = excluded.size,
            mtime = excluded.mtime
        """)
    int upsertFile(@Bind("path") String path, @Bind("size") long size, @Bind("mtime") double mtime);

    @SqlQuery("""
        SELECT COUNT(*) AS file_count,
               COALESCE(MAX(mtime), 0) AS max_mtime
          FROM files
        """)
    @RegisterConstructorMapper(Fingerprint.class)
    Fingerprint fingerprintAll();

    @SqlQuery("""
        SELECT COUNT(*) AS file_count,
               COALESCE(MAX(mtime), 0) AS max_mtime
          FROM files
         WHERE path LIKE :pattern ESCAPE '!'
        """)
    @RegisterConstructorMapper(Fingerprint.class)
    Fingerprint fingerprintUnder(@Bind("pattern") String pattern);

    @SqlQuery("""
        SELECT id, path
          FROM files
         WHERE path LIKE :pattern ESCAPE '!'
         ORDER BY path
        """)
    @RegisterConstructorMapper(FileRef.class)
    List<FileRef> fetchFilesUnder(@Bind("pattern") String pattern);

    @SqlQuery("""
        SELECT f.id, f.path, f.size, f.mtime,
               (SELECT GROUP_CONCAT(t.name, ', ' ORDER BY t.ord, t.name)
                  FROM tags t
                  JOIN file_tags ft ON ft.tag_id = t.id
                 WHERE ft.file_id = f.id) AS tags
          FROM files f
         WHERE f.path = :path
        """)
    @RegisterRowMapper(FileRowMapper.class)
    Optional<FileRow> findFileByPath(@Bind("path") String path);

    @SqlQuery("SELECT COUNT(*) FROM files")
    long countFiles();

    @SqlUpdate("DELETE FROM files WHERE id IN (<ids>)")
    int deleteFilesById(@BindList("ids") Collection<Long> ids);

    @SqlUpdate("DELETE FROM files WHERE path = :path")
    int deleteFileByPath(@Bind("path") String path);

    @SqlUpdate("UPDATE files SET path = :newPath WHERE path = :oldPath")
    int moveFilePath(@Bind("oldPath") String oldPath, @Bind("newPath") String newPath);

    @SqlUpdate("DELETE FROM files WHERE path LIKE :pattern ESCAPE '!'")
    int deleteFilesUnder(@Bind("pattern") String pattern);

    // --- Tags ----------------------------------------------------------------

    @SqlQuery("SELECT COALESCE(MAX(ord), 0) + 1 FROM tags")
    long nextTagOrder();

    @SqlUpdate("INSERT OR IGNORE INTO tags(name, ord) VALUES(:name, :ord)")
    int insertTagIfAbsent(@Bind("name") String name, @Bind("ord") long ord);

    @SqlQuery("SELECT id FROM tags WHERE name = :name")
    Optional<Long> findTagId(@Bind("name") String name);

    @SqlQuery("SELECT id, name, ord FROM tags WHERE id = :id")
    @RegisterConstructorMapper(TagRow.class)
    Optional<TagRow> findTag(@Bind("id") long id);

    /**
     * Get-or-create. A ordem só é atribuída quando a tag nasce; INSERT OR IGNORE
     * descarta o valor calculado se o nome já existir.
     */
    @Transaction
    default long ensureTag(String name) {
        insertTagIfAbsent(name, nextTagOrder());
        return findTagId(name).orElseThrow(() -> new StorageException("Tag não encontrada após inserção: " + name));
    }

    @SqlQuery("""
        SELECT id, name, ord
          FROM tags
         ORDER BY ord ASC, name ASC
        """)
    @RegisterConstructorMapper(TagRow.class)
    List<TagRow> fetchTags();

    @SqlQuery("""
        SELECT t.id AS tag_id,
               COUNT(ft.file_id) AS file_count
          FROM tags t
          LEFT JOIN file_tags ft ON ft.tag_id = t.id
         GROUP BY t.id
         ORDER BY t.ord, t.name
        """)
    @RegisterConstructorMapper(TagCount.class)
    List<TagCount> countFilesByTag();

    @SqlQuery("""
        SELECT t.id, t.name, t.ord
          FROM tags t
          JOIN file_tags ft ON ft.tag_id = t.id
         WHERE ft.file_id = :fileId
         ORDER BY t.ord, t.name
        """)
    @RegisterConstructorMapper(TagRow.class)
    List<TagRow> fetchFileTags(@Bind("fileId") long fileId);

    @SqlUpdate("UPDATE tags SET name = :name WHERE id = :id")
    int renameTag(@Bind("id") long id, @Bind("name") String name);

    @SqlUpdate("""
        INSERT OR IGNORE INTO file_tags(file_id, tag_id)
        SELECT file_id, :toTag
          FROM file_tags
         WHERE tag_id = :fromTag
        """)
    int copyTagAssociations(@Bind("fromTag") long fromTag, @Bind("toTag") long toTag);

    @SqlUpdate("DELETE FROM file_tags WHERE tag_id = :tagId")
    int deleteTagAssociations(@Bind("tagId") long tagId);

    @SqlUpdate("DELETE FROM tags WHERE id IN (<ids>)")
    int deleteTagsById(@BindList("ids") Collection<Long> ids);

    @SqlBatch("INSERT OR IGNORE INTO file_tags(file_id, tag_id) VALUES(:fileId, :tagId)")
    int[] assignTag(@Bind("fileId") List<Long> fileIds, @Bind("tagId") long tagId);

    @SqlBatch("DELETE FROM file_tags WHERE file_id = :fileId AND tag_id = :tagId")
    int[] untag(@Bind("fileId") long fileId, @Bind("tagId") List<Long> tagIds);

    @SqlQuery("""
        SELECT id, name, ord
          FROM tags
         WHERE ord < :ord
         ORDER BY ord DESC
         LIMIT 1
        """)
    @RegisterConstructorMapper(TagRow.class)
    Optional<TagRow> findTagBefore(@Bind("ord") long ord);

    @SqlQuery("""
        SELECT id, name, ord
          FROM tags
         WHERE ord > :ord
         ORDER BY ord ASC
         LIMIT 1
        """)
    @RegisterConstructorMapper(TagRow.class)
    Optional<TagRow> findTagAfter(@Bind("ord") long ord);

    @SqlUpdate("UPDATE tags SET ord = :ord WHERE id = :id")
    int setTagOrder(@Bind("id") long id, @Bind("ord") long ord);

    /**
     * Troca a ordem com o vizinho imediato (delta &lt; 0: anterior, delta &gt; 0: seguinte).
     */
    @Transaction
    default boolean moveTag(long tagId, int delta) {
        if (delta == 0) return false;
        Optional<TagRow> current = findTag(tagId);
        if (current.isEmpty()) return false;
        long ord = current.get().ord();
        Optional<TagRow> neighbour = delta < 0 ? findTagBefore(ord) : findTagAfter(ord);
        if (neighbour.isEmpty()) return false;
        setTagOrder(tagId, neighbour.get().ord());
        setTagOrder(neighbour.get().id(), ord);
        return true;
    }

    // --- Roots ---------------------------------------------------------------

    @SqlUpdate("""
        INSERT INTO roots(path, last_scanned)
        VALUES(:path, :now)
        ON CONFLICT(path) DO UPDATE SET
            last_scanned = excluded.last_scanned
        """)
    void upsertRoot(@Bind("path") String path, @Bind("now") double nowSeconds);

    @SqlQuery("""
        SELECT path, last_scanned
          FROM roots
         ORDER BY path
        """)
    @RegisterConstructorMapper(RootRow.class)
    List<RootRow> fetchRoots();

    @SqlUpdate("DELETE FROM roots WHERE path = :path")
    int deleteRoot(@Bind("path") String path);

    @Transaction
    default int removeRoot(String path, String filesPattern) {
        deleteRoot(path);
        return deleteFilesUnder(filesPattern);
    }

    // --- Settings ------------------------------------------------------------

    @SqlUpdate("""
        INSERT INTO settings(key, value)
        VALUES(:key, :value)
        ON CONFLICT(key) DO UPDATE SET
            value = excluded.value
        """)
    void upsertSetting(@Bind("key") String key, @Bind("value") String value);

    @SqlQuery("SELECT value FROM settings WHERE key = :key")
    Optional<String> fetchSetting(@Bind("key") String key);

    // --- Mapper --------------------------------------------------------------

    final class FileRowMapper implements RowMapper<FileRow> {
        @Override
        public FileRow map(ResultSet rs, StatementContext ctx) throws SQLException {
            long id      = rs.getLong("id");
            String path  = rs.getString("path");
            long size    = rs.getLong("size");
            double mtime = rs.getDouble("mtime");
            String tags  = rs.getString("tags");
            return new FileRow(id, path, size, mtime, tags == null ? "" : tags);
        }
    }
}
