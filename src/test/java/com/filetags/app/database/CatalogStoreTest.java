package com.filetags.app.database;

import com.filetags.app.database.CatalogStore.FileFilter;
import com.filetags.app.database.CatalogStore.FileRow;
import com.filetags.app.database.CatalogStore.Fingerprint;
import com.filetags.app.database.CatalogStore.RenameOutcome;
import com.filetags.app.database.CatalogStore.TagRow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class CatalogStoreTest {

    @TempDir
    Path tmp;

    private Database db;
    private CatalogStore store;
    private Path data;

    @BeforeEach
    void setUp() throws IOException {
        db = Database.open(tmp.resolve("catalog.db"));
        store = new CatalogStore(db);
        data = Files.createDirectories(tmp.resolve("data"));
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private Path file(String rel, String content) throws IOException {
        Path p = data.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.writeString(p, content, StandardCharsets.UTF_8);
        return p;
    }

    private long idOf(Path p) {
        return store.findFile(p.toString()).orElseThrow().id();
    }

    private List<String> paths(List<FileRow> rows) {
        return rows.stream().map(FileRow::path).toList();
    }

    @Test
    void upsertFile_isIdempotent_andUpdatesSize() throws IOException {
        Path a = file("a.txt", "hello");

        assertTrue(store.upsertFile(a));
        assertTrue(store.upsertFile(a));
        assertEquals(1, store.countFiles());

        long id = idOf(a);
        Files.writeString(a, "hello world", StandardCharsets.UTF_8);
        assertTrue(store.upsertFile(a));

        FileRow row = store.findFile(a.toString()).orElseThrow();
        assertEquals(id, row.id(), "row identity survives an update");
        assertEquals(11, row.size());
        assertEquals(1, store.countFiles());
    }

    @Test
    void upsertFile_ignoresMissingFilesAndDirectories() throws IOException {
        assertFalse(store.upsertFile(data.resolve("nope.txt")));
        assertFalse(store.upsertFile(Files.createDirectories(data.resolve("dir"))));
        assertEquals(0, store.countFiles());
    }

    @Test
    void countAndMaxModTime_isScopedToRoot() throws IOException {
        Path a = file("a/one.txt", "1");
        Path b = file("a/two.txt", "2");
        Path other = file("ab/three.txt", "3");
        Files.setLastModifiedTime(a, FileTime.from(Instant.ofEpochSecond(1_000)));
        Files.setLastModifiedTime(b, FileTime.from(Instant.ofEpochSecond(2_000)));
        Files.setLastModifiedTime(other, FileTime.from(Instant.ofEpochSecond(9_000)));
        store.upsertFile(a);
        store.upsertFile(b);
        store.upsertFile(other);

        Fingerprint underA = store.countAndMaxModTime(data.resolve("a").toString());
        assertEquals(2, underA.fileCount());
        assertEquals(2_000.0, underA.maxMtime(), 1e-6);

        Fingerprint all = store.countAndMaxModTime(null);
        assertEquals(3, all.fileCount());
        assertEquals(9_000.0, all.maxMtime(), 1e-6);

        assertEquals(Fingerprint.EMPTY, store.countAndMaxModTime(data.resolve("empty").toString()));
    }

    @Test
    void removeRoot_deletesOnlyFilesUnderThatDirectory() throws IOException {
        Path inA = file("a/x.txt", "x");
        Path inAb = file("ab/y.txt", "y");
        store.upsertFile(inA);
        store.upsertFile(inAb);
        store.addRoot(data.resolve("a").toString());
        store.addRoot(data.resolve("ab").toString());

        int removed = store.removeRoot(data.resolve("a").toString());

        assertEquals(1, removed);
        assertTrue(store.findFile(inA.toString()).isEmpty());
        assertTrue(store.findFile(inAb.toString()).isPresent());
        assertEquals(List.of(CatalogPaths.normalize(data.resolve("ab"))),
                store.listRoots().stream().map(CatalogStore.RootRow::path).toList());
    }

    @Test
    void removeMissingUnder_prunesOnlyVanishedFiles() throws IOException {
        Path keep = file("r/keep.txt", "k");
        Path gone = file("r/gone.txt", "g");
        store.upsertFile(keep);
        store.upsertFile(gone);
        Files.delete(gone);

        assertEquals(1, store.removeMissingUnder(data.resolve("r").toString()));
        assertEquals(0, store.removeMissingUnder(data.resolve("r").toString()));
        assertEquals(List.of(CatalogPaths.normalize(keep)), paths(store.listFiles(FileFilter.all())));
    }

    @Test
    void listFiles_tagFilterRequiresAllTags() throws IOException {
        Path f1 = file("f1.txt", "1");
        Path f2 = file("f2.txt", "2");
        Path f3 = file("f3.txt", "3");
        for (Path p : List.of(f1, f2, f3)) store.upsertFile(p);

        long x = store.ensureTag("x").orElseThrow();
        long y = store.ensureTag("y").orElseThrow();
        store.assignTag(List.of(idOf(f1), idOf(f2)), x);
        store.assignTag(List.of(idOf(f1)), y);

        assertEquals(List.of(CatalogPaths.normalize(f1)),
                paths(store.listFiles(FileFilter.all().withTags(List.of(x, y)))));
        assertEquals(List.of(CatalogPaths.normalize(f1), CatalogPaths.normalize(f2)),
                paths(store.listFiles(FileFilter.all().withTags(List.of(x)))));
        assertEquals(2, store.listFiles(FileFilter.all().withOnlyTagged(true)).size());
        assertEquals(3, store.listFiles(FileFilter.all()).size());

        FileRow first = store.findFile(f1.toString()).orElseThrow();
        assertTrue(first.tags().contains("x"));
        assertTrue(first.tags().contains("y"));
        assertEquals("", store.findFile(f3.toString()).orElseThrow().tags());
    }

    @Test
    void tagColumnFollowsTagDisplayOrder() throws IOException {
        Path f = file("ordered.txt", "o");
        store.upsertFile(f);
        long zeta = store.ensureTag("zeta").orElseThrow();
        long alpha = store.ensureTag("alpha").orElseThrow();
        store.assignTag(List.of(idOf(f)), zeta);
        store.assignTag(List.of(idOf(f)), alpha);

        assertEquals("zeta, alpha", store.findFile(f.toString()).orElseThrow().tags());

        assertTrue(store.moveTag(alpha, -1));
        assertEquals("alpha, zeta", store.findFile(f.toString()).orElseThrow().tags());
        assertEquals("alpha, zeta", store.listFiles(FileFilter.all()).get(0).tags());
    }

    @Test
    void listFiles_searchTreatsWildcardsLiterally() throws IOException {
        Path pct = file("100%.txt", "a");
        Path plain = file("1000.txt", "b");
        Path under = file("a_b.txt", "c");
        Path noUnder = file("axb.txt", "d");
        for (Path p : List.of(pct, plain, under, noUnder)) store.upsertFile(p);

        assertEquals(List.of(CatalogPaths.normalize(pct)),
                paths(store.listFiles(FileFilter.all().withSearch("100%"))));
        assertEquals(List.of(CatalogPaths.normalize(under)),
                paths(store.listFiles(FileFilter.all().withSearch("a_b"))));
    }

    @Test
    void listFiles_rootFilterIsPrefixExact() throws IOException {
        Path inA = file("a/x.txt", "x");
        Path inAb = file("ab/y.txt", "y");
        store.upsertFile(inA);
        store.upsertFile(inAb);

        assertEquals(List.of(CatalogPaths.normalize(inA)),
                paths(store.listFiles(FileFilter.all().withRoot(data.resolve("a").toString()))));
    }

    @Test
    void renameOrMergeTag_mergesIntoExistingTag() throws IOException {
        Path f1 = file("m1.txt", "1");
        Path f2 = file("m2.txt", "2");
        Path f3 = file("m3.txt", "3");
        for (Path p : List.of(f1, f2, f3)) store.upsertFile(p);

        long a = store.ensureTag("a").orElseThrow();
        long b = store.ensureTag("b").orElseThrow();
        store.assignTag(List.of(idOf(f1), idOf(f3)), a);
        store.assignTag(List.of(idOf(f2), idOf(f3)), b);

        assertEquals(RenameOutcome.MERGED, store.renameOrMergeTag(a, "b"));

        List<TagRow> tags = store.listTags();
        assertEquals(1, tags.size());
        assertEquals(b, tags.get(0).id());
        assertEquals(Map.of(b, 3L), store.countFilesByTag());
        assertTrue(store.findTagId("a").isEmpty());
    }

    @Test
    void renameOrMergeTag_renamesAndIgnoresNoOps() {
        long a = store.ensureTag("alpha").orElseThrow();

        assertEquals(RenameOutcome.UNCHANGED, store.renameOrMergeTag(a, "alpha"));
        assertEquals(RenameOutcome.UNCHANGED, store.renameOrMergeTag(a, "   "));
        assertEquals(RenameOutcome.UNCHANGED, store.renameOrMergeTag(9_999, "ghost"));

        assertEquals(RenameOutcome.RENAMED, store.renameOrMergeTag(a, "  beta "));
        assertEquals(a, store.findTagId("beta").orElseThrow());
        assertTrue(store.findTagId("alpha").isEmpty());
    }

    @Test
    void ensureTag_trimsSkipsBlankAndAssignsSequentialOrder() {
        assertTrue(store.ensureTag("  ").isEmpty());
        long one = store.ensureTag(" one ").orElseThrow();
        long two = store.ensureTag("two").orElseThrow();
        long three = store.ensureTag("three").orElseThrow();
        assertEquals(one, store.ensureTag("one").orElseThrow());

        List<TagRow> tags = store.listTags();
        assertEquals(List.of("one", "two", "three"), tags.stream().map(TagRow::name).toList());
        assertEquals(List.of(1L, 2L, 3L), tags.stream().map(TagRow::ord).toList());

        assertTrue(store.moveTag(three, -1));
        assertEquals(List.of("one", "three", "two"), store.listTags().stream().map(TagRow::name).toList());
        assertFalse(store.moveTag(one, -1), "first tag cannot move up");
        assertTrue(store.moveTag(one, 1));
        assertEquals(List.of(three, one, two), store.listTags().stream().map(TagRow::id).toList());
    }

    @Test
    void deleteTags_cascadesAssociations() throws IOException {
        Path f = file("d.txt", "d");
        store.upsertFile(f);
        long t = store.ensureTag("temp").orElseThrow();
        store.assignTag(List.of(idOf(f)), t);

        assertEquals(1, store.deleteTags(Set.of(t)));
        assertTrue(store.listFileTags(idOf(f)).isEmpty());
        assertEquals(0, store.listFiles(FileFilter.all().withOnlyTagged(true)).size());
    }

    @Test
    void assignAndUntag_areIdempotent() throws IOException {
        Path f = file("t.txt", "t");
        store.upsertFile(f);
        long id = idOf(f);
        long t = store.ensureTag("keep").orElseThrow();

        assertEquals(1, store.assignTag(List.of(id, id), t));
        assertEquals(0, store.assignTag(List.of(id), t));
        assertEquals(List.of("keep"), store.listFileTags(id).stream().map(TagRow::name).toList());

        assertEquals(1, store.untag(id, List.of(t)));
        assertEquals(0, store.untag(id, List.of(t)));
    }

    @Test
    void settings_roundTripAndOverwrite() {
        assertTrue(store.getSetting(CatalogStore.SETTING_LAST_ROOT).isEmpty());
        assertEquals("def", store.getSetting(CatalogStore.SETTING_LAST_SEARCH, "def"));

        store.setSetting(CatalogStore.SETTING_LAST_ROOT, "/one");
        store.setSetting(CatalogStore.SETTING_LAST_ROOT, "/two");
        assertEquals("/two", store.getSetting(CatalogStore.SETTING_LAST_ROOT).orElseThrow());
    }

    @Test
    void renameFile_movesDiskFileAndKeepsTags() throws IOException {
        Path f = file("old.txt", "content");
        store.upsertFile(f);
        long id = idOf(f);
        long t = store.ensureTag("doc").orElseThrow();
        store.assignTag(List.of(id), t);

        String newPath = store.renameFile(f.toString(), "new.txt");

        assertFalse(Files.exists(f));
        assertTrue(Files.exists(Path.of(newPath)));
        FileRow row = store.findFile(newPath).orElseThrow();
        assertEquals(id, row.id());
        assertEquals("doc", row.tags());
        assertTrue(store.findFile(f.toString()).isEmpty());
    }

    @Test
    void renameFile_rejectsExistingTargetAndBadNames() throws IOException {
        Path f = file("src.txt", "a");
        file("taken.txt", "b");
        store.upsertFile(f);

        assertThrows(StorageException.class, () -> store.renameFile(f.toString(), "taken.txt"));
        assertThrows(IllegalArgumentException.class, () -> store.renameFile(f.toString(), "sub/x.txt"));
        assertThrows(IllegalArgumentException.class, () -> store.renameFile(f.toString(), " "));
        assertTrue(Files.exists(f));
    }

    @Test
    void forgetFiles_removesRowsButNotDiskFiles() throws IOException {
        Path f = file("forget.txt", "f");
        store.upsertFile(f);

        assertEquals(1, store.forgetFiles(List.of(f.toString(), data.resolve("unknown").toString())));
        assertEquals(0, store.countFiles());
        assertTrue(Files.exists(f));
    }
}
