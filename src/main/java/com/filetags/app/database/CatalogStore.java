package com.filetags.app.database;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import org.apache.commons.lang3.StringUtils;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.statement.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

/**
 * Catálogo persistente: arquivos, tags, associações, raízes e preferências.
 * <p>
 * Cada método abre e fecha seu próprio handle Jdbi. Erros do banco saem como
 * {@link StorageException} e abortam apenas a operação chamada.
 */
public final class CatalogStore {

    private static final Logger logger = LoggerFactory.getLogger(CatalogStore.class);

    public static final String SETTING_LAST_ROOT = "last_root";
    public static final String SETTING_LAST_SEARCH = "last_search";
    public static final String SETTING_LAST_ONLY_TAGGED = "last_only_tagged";

    public record FileRow(long id, String path, long size, double mtime, String tags) {}
    public record FileRef(long id, String path) {}
    public record TagRow(long id, String name, long ord) {}
    public record TagCount(long tagId, long fileCount) {}
    public record RootRow(String path, Double lastScanned) {}

    /** Impressão digital barata do estado: quantidade de arquivos e maior mtime. */
    public record Fingerprint(long fileCount, double maxMtime) {
        public static final Fingerprint EMPTY = new Fingerprint(0, 0.0);
    }

    public enum RenameOutcome { RENAMED, MERGED, UNCHANGED }

    /**
     * Filtro conjuntivo de {@link #listFiles(FileFilter)}. Campos nulos ou vazios
     * não restringem.
     */
    public record FileFilter(String search, Set<Long> tagIds, boolean onlyTagged, String rootPrefix) {

        public FileFilter {
            tagIds = tagIds == null ? Set.of() : Set.copyOf(tagIds);
        }

        public static FileFilter all() {
            return new FileFilter(null, Set.of(), false, null);
        }

        public FileFilter withSearch(String text) {
            return new FileFilter(text, tagIds, onlyTagged, rootPrefix);
        }

        public FileFilter withTags(Collection<Long> ids) {
            return new FileFilter(search, new LinkedHashSet<>(ids), onlyTagged, rootPrefix);
        }

        public FileFilter withOnlyTagged(boolean value) {
            return new FileFilter(search, tagIds, value, rootPrefix);
        }

        public FileFilter withRoot(String root) {
            return new FileFilter(search, tagIds, onlyTagged, root);
        }
    }

    private final Jdbi jdbi;

    public CatalogStore(Database database) {
        this(database.jdbi());
    }

    public CatalogStore(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    // --- Files ---------------------------------------------------------------

    /**
     * Insere ou atualiza tamanho/mtime do arquivo. Se o caminho não for (mais) um
     * arquivo regular, não faz nada e retorna false: o disco pode mudar entre a
     * listagem e o stat.
     */
    public boolean upsertFile(Path file) {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (IOException e) {
            logger.debug("Stat falhou, ignorando {}: {}", file, e.toString());
            return false;
        }
        if (!attrs.isRegularFile()) return false;

        String path = CatalogPaths.normalize(file);
        double mtime = CatalogPaths.mtimeSeconds(attrs.lastModifiedTime());
        long size = attrs.size();
        withDao("upsertFile", dao -> dao.upsertFile(path, size, mtime));
        return true;
    }

    /**
     * Quantidade de arquivos e maior mtime, no catálogo inteiro (root nulo) ou
     * sob a raiz informada.
     */
    public Fingerprint countAndMaxModTime(String rootOrNull) {
        if (rootOrNull == null) {
            return withDao("countAndMaxModTime", CatalogDao::fingerprintAll);
        }
        String pattern = CatalogPaths.likeUnder(CatalogPaths.normalize(rootOrNull));
        return withDao("countAndMaxModTime", dao -> dao.fingerprintUnder(pattern));
    }

    /**
     * Remove as linhas sob a raiz cujo arquivo não existe mais no disco.
     *
     * @return quantidade de linhas removidas
     */
    public int removeMissingUnder(String root) {
        String pattern = CatalogPaths.likeUnder(CatalogPaths.normalize(root));
        int removed = inTransaction("removeMissingUnder", dao -> {
            List<Long> missing = new ArrayList<>();
            for (FileRef ref : dao.fetchFilesUnder(pattern)) {
                if (!Files.exists(Path.of(ref.path()), LinkOption.NOFOLLOW_LINKS)) {
                    missing.add(ref.id());
                }
            }
            return missing.isEmpty() ? 0 : dao.deleteFilesById(missing);
        });
        if (removed > 0) logger.info("Removidos {} arquivos que não existem mais sob {}", removed, root);
        return removed;
    }

    public List<FileRow> listFiles(FileFilter filter) {
        StringBuilder sql = new StringBuilder("""
            SELECT f.id, f.path, f.size, f.mtime,
                   (SELECT GROUP_CONCAT(t.name, ', ' ORDER BY t.ord, t.name)
                      FROM tags t
                      JOIN file_tags ft ON ft.tag_id = t.id
                     WHERE ft.file_id = f.id) AS tags
              FROM files f
            """);

        // Um JOIN por tag: o arquivo precisa ter TODAS as tags selecionadas
        List<Long> tagIds = List.copyOf(filter.tagIds());
        for (int i = 0; i < tagIds.size(); i++) {
            sql.append(" JOIN file_tags ft").append(i)
               .append(" ON ft").append(i).append(".file_id = f.id AND ft").append(i)
               .append(".tag_id = :tag").append(i).append('\n');
        }

        List<String> where = new ArrayList<>();
        String search = StringUtils.defaultString(filter.search());
        if (!search.isEmpty()) {
            where.add("f.path LIKE :search ESCAPE '" + CatalogPaths.LIKE_ESCAPE + "'");
        }
        if (filter.onlyTagged()) {
            where.add("EXISTS (SELECT 1 FROM file_tags x WHERE x.file_id = f.id)");
        }
        String rootPrefix = StringUtils.trimToNull(filter.rootPrefix());
        if (rootPrefix != null) {
            where.add("f.path LIKE :root ESCAPE '" + CatalogPaths.LIKE_ESCAPE + "'");
        }
        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", where)).append('\n');
        }
        sql.append(" ORDER BY f.path ASC");

        try {
            return jdbi.withHandle(h -> {
                Query q = h.createQuery(sql.toString());
                for (int i = 0; i < tagIds.size(); i++) {
                    q.bind("tag" + i, tagIds.get(i));
                }
                if (!search.isEmpty()) q.bind("search", CatalogPaths.likeContaining(search));
                if (rootPrefix != null) q.bind("root", CatalogPaths.likeUnder(CatalogPaths.normalize(rootPrefix)));
                return q.map(new CatalogDao.FileRowMapper()).list();
            });
        } catch (JdbiException e) {
            throw new StorageException("listFiles falhou", e);
        }
    }

    public Optional<FileRow> findFile(String path) {
        String normalized = CatalogPaths.normalize(path);
        return withDao("findFile", dao -> dao.findFileByPath(normalized));
    }

    public long countFiles() {
        return withDao("countFiles", CatalogDao::countFiles);
    }

    /**
     * Renomeia o arquivo no disco, dentro do mesmo diretório, e move a linha do
     * catálogo (as tags acompanham).
     *
     * @return novo caminho normalizado
     */
    public String renameFile(String path, String newName) {
        String name = StringUtils.trimToNull(newName);
        if (name == null || name.contains("/") || name.contains("\\")) {
            throw new IllegalArgumentException("Nome de arquivo inválido: " + newName);
        }
        String oldPath = CatalogPaths.normalize(path);
        Path source = Path.of(oldPath);
        Path target = source.resolveSibling(name);
        try {
            Files.move(source, target);
        } catch (IOException e) {
            throw new StorageException("Falha ao renomear " + source + " para " + name, e);
        }
        String newPath = CatalogPaths.normalize(target);
        int moved = withDao("renameFile", dao -> dao.moveFilePath(oldPath, newPath));
        if (moved == 0) {
            upsertFile(target);
        }
        logger.info("Arquivo renomeado: {} -> {}", oldPath, newPath);
        return newPath;
    }

    /**
     * Remove do catálogo os arquivos indicados. O arquivo no disco não é tocado.
     */
    public int forgetFiles(Collection<String> paths) {
        List<String> normalized = paths.stream().map(CatalogPaths::normalize).toList();
        return inTransaction("forgetFiles", dao -> {
            int n = 0;
            for (String p : normalized) n += dao.deleteFileByPath(p);
            return n;
        });
    }

    // --- Tags ----------------------------------------------------------------

    /**
     * Get-or-create pelo nome (com trim). Nome em branco não cria nada.
     */
    public Optional<Long> ensureTag(String name) {
        String trimmed = StringUtils.trimToNull(name);
        if (trimmed == null) return Optional.empty();
        return Optional.of(withDao("ensureTag", dao -> dao.ensureTag(trimmed)));
    }

    public Optional<Long> findTagId(String name) {
        String trimmed = StringUtils.trimToNull(name);
        if (trimmed == null) return Optional.empty();
        return withDao("findTagId", dao -> dao.findTagId(trimmed));
    }

    /**
     * Renomeia a tag. Se o novo nome já pertence a outra tag, une as associações
     * na tag existente e apaga a antiga.
     *
     * @throws DuplicateTagNameException se outra tag tomar o nome durante o rename
     */
    public RenameOutcome renameOrMergeTag(long tagId, String newName) {
        String name = StringUtils.trimToNull(newName);
        if (name == null) return RenameOutcome.UNCHANGED;

        RenameOutcome outcome;
        try {
            outcome = jdbi.inTransaction(h -> {
                CatalogDao dao = h.attach(CatalogDao.class);
                if (dao.findTag(tagId).isEmpty()) return RenameOutcome.UNCHANGED;

                Optional<Long> existing = dao.findTagId(name);
                if (existing.isPresent()) {
                    long target = existing.get();
                    if (target == tagId) return RenameOutcome.UNCHANGED;
                    dao.copyTagAssociations(tagId, target);
                    dao.deleteTagAssociations(tagId);
                    dao.deleteTagsById(List.of(tagId));
                    return RenameOutcome.MERGED;
                }
                return dao.renameTag(tagId, name) > 0 ? RenameOutcome.RENAMED : RenameOutcome.UNCHANGED;
            });
        } catch (JdbiException e) {
            if (isUniqueViolation(e)) {
                throw new DuplicateTagNameException(name, e);
            }
            throw new StorageException("renameOrMergeTag falhou", e);
        }
        if (outcome == RenameOutcome.MERGED) {
            logger.info("Tag {} unida à tag existente '{}'", tagId, name);
        }
        return outcome;
    }

    public List<TagRow> listTags() {
        return withDao("listTags", CatalogDao::fetchTags);
    }

    /** Quantidade de arquivos por tag, na ordem de exibição (tags sem uso contam 0). */
    public Map<Long, Long> countFilesByTag() {
        List<TagCount> counts = withDao("countFilesByTag", CatalogDao::countFilesByTag);
        Map<Long, Long> out = new LinkedHashMap<>();
        for (TagCount c : counts) out.put(c.tagId(), c.fileCount());
        return out;
    }

    public List<TagRow> listFileTags(long fileId) {
        return withDao("listFileTags", dao -> dao.fetchFileTags(fileId));
    }

    public int assignTag(Collection<Long> fileIds, long tagId) {
        if (fileIds.isEmpty()) return 0;
        List<Long> ids = List.copyOf(new LinkedHashSet<>(fileIds));
        return sum(withDao("assignTag", dao -> dao.assignTag(ids, tagId)));
    }

    public int untag(long fileId, Collection<Long> tagIds) {
        if (tagIds.isEmpty()) return 0;
        List<Long> ids = List.copyOf(new LinkedHashSet<>(tagIds));
        return sum(withDao("untag", dao -> dao.untag(fileId, ids)));
    }

    public int deleteTags(Collection<Long> tagIds) {
        if (tagIds.isEmpty()) return 0;
        return withDao("deleteTags", dao -> dao.deleteTagsById(tagIds));
    }

    /**
     * Move a tag uma posição na ordem de exibição.
     *
     * @return false se a tag não existe ou já está na ponta
     */
    public boolean moveTag(long tagId, int delta) {
        return withDao("moveTag", dao -> dao.moveTag(tagId, delta));
    }

    // --- Roots ---------------------------------------------------------------

    /** Registra a raiz (ou atualiza last_scanned). Retorna o caminho normalizado. */
    public String addRoot(String path) {
        String normalized = CatalogPaths.normalize(path);
        double now = Instant.now().toEpochMilli() / 1000.0;
        withDao("addRoot", dao -> {
            dao.upsertRoot(normalized, now);
            return null;
        });
        return normalized;
    }

    public List<RootRow> listRoots() {
        return withDao("listRoots", CatalogDao::fetchRoots);
    }

    /**
     * Remove a raiz e todos os arquivos sob o prefixo dela.
     *
     * @return quantidade de arquivos removidos
     */
    public int removeRoot(String path) {
        String normalized = CatalogPaths.normalize(path);
        String pattern = CatalogPaths.likeUnder(normalized);
        int removed = withDao("removeRoot", dao -> dao.removeRoot(normalized, pattern));
        logger.info("Raiz removida: {} ({} arquivos)", normalized, removed);
        return removed;
    }

    // --- Settings ------------------------------------------------------------

    public Optional<String> getSetting(String key) {
        return withDao("getSetting", dao -> dao.fetchSetting(key));
    }

    public String getSetting(String key, String defaultValue) {
        return getSetting(key).orElse(defaultValue);
    }

    public void setSetting(String key, String value) {
        withDao("setSetting", dao -> {
            dao.upsertSetting(key, value);
            return null;
        });
    }

    // --- Helpers -------------------------------------------------------------

    private <R> R withDao(String action, Function<CatalogDao, R> call) {
        try {
            return jdbi.withExtension(CatalogDao.class, call::apply);
        } catch (JdbiException e) {
            throw new StorageException(action + " falhou", e);
        }
    }

    private <R> R inTransaction(String action, Function<CatalogDao, R> call) {
        try {
            return jdbi.inTransaction(h -> call.apply(h.attach(CatalogDao.class)));
        } catch (JdbiException e) {
            throw new StorageException(action + " falhou", e);
        }
    }

    private static boolean isUniqueViolation(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLiteException sqlite
                    && sqlite.getResultCode() == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE) {
                return true;
            }
            // sem extended result codes o driver só reporta SQLITE_CONSTRAINT
            if (t instanceof SQLException sql && sql.getMessage() != null
                    && sql.getMessage().contains("UNIQUE constraint failed")) {
                return true;
            }
        }
        return false;
    }

    private static int sum(int[] counts) {
        int total = 0;
        for (int c : counts) total += c;
        return total;
    }
}
