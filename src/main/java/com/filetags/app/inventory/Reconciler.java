package com.filetags.app.inventory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.filetags.app.database.CatalogPaths;
import com.filetags.app.database.CatalogStore;
import com.filetags.app.database.CatalogStore.Fingerprint;
import com.filetags.app.database.StorageException;

/**
 * Coloca as linhas de arquivo do catálogo sob uma raiz de acordo com o disco.
 * <p>
 * Não guarda estado entre chamadas; quem garante uma varredura por vez é o
 * {@link ScanCoordinator}.
 */
public final class Reconciler {

    private static final Logger logger = LoggerFactory.getLogger(Reconciler.class);

    /** {@link #reconcile} avisa progresso a cada ~1% do total. */
    static final int PROGRESS_SLICES = 100;
    /** {@link #reconcileAll} avisa progresso a cada N arquivos. */
    static final int PROGRESS_EVERY_ALL = 500;

    private final CatalogStore store;

    public Reconciler(CatalogStore store) {
        this.store = store;
    }

    /**
     * Conta os arquivos regulares sob a raiz e o maior mtime. Entradas com erro
     * de I/O simplesmente não contam.
     */
    public Fingerprint diskFingerprint(String root) {
        Path dir = Path.of(CatalogPaths.normalize(root));
        long[] count = {0};
        double[] max = {0.0};
        walk(dir, new FileSink() {
            @Override
            public void file(Path file, BasicFileAttributes attrs) {
                count[0]++;
                double mt = CatalogPaths.mtimeSeconds(attrs.lastModifiedTime());
                if (mt > max[0]) max[0] = mt;
            }
        });
        return new Fingerprint(count[0], max[0]);
    }

    /**
     * Reconcilia uma raiz. Se a quantidade de arquivos bate e o maior mtime do
     * catálogo não é mais antigo que o do disco, termina sem varrer.
     */
    public ReconcileResult reconcile(String root, ReconcileListener listener) {
        String normRoot = CatalogPaths.normalize(root);
        ScanProgress progress = null;
        ReconcileResult result;
        try {
            Fingerprint disk = diskFingerprint(normRoot);
            Fingerprint db = store.countAndMaxModTime(normRoot);

            if (disk.fileCount() == db.fileCount() && db.maxMtime() >= disk.maxMtime()) {
                logger.info("[SCAN] {} sem alterações ({} arquivos); varredura ignorada", normRoot, disk.fileCount());
                result = ReconcileResult.unchanged(normRoot, disk.fileCount());
                listener.finished(result);
                return result;
            }

            long total = disk.fileCount();
            long step = Math.max(1, total / PROGRESS_SLICES);
            progress = new ScanProgress(List.of(normRoot), total, step, listener);
            listener.started(progress.reportedTotal());
            logger.info("[SCAN] Indexando {}: disco={} catálogo={}", normRoot, total, db.fileCount());

            store.addRoot(normRoot);
            scanInto(normRoot, progress);
            progress.removed += store.removeMissingUnder(normRoot);

            result = progress.result(null);
        } catch (RuntimeException e) {
            ReconcileResult failed = progress != null
                    ? progress.result(e)
                    : new ReconcileResult(List.of(normRoot), false, 0, 0, BatchSummary.EMPTY, 0, e);
            logger.error("[SCAN] Falha ao indexar {}", normRoot, e);
            listener.finished(failed);
            throw e;
        }
        logFinished(result);
        listener.finished(result);
        return result;
    }

    /**
     * Varre todas as raízes de uma vez, sem atalho, com um total combinado.
     * Raízes repetidas (após normalização) são varridas uma vez só.
     */
    public ReconcileResult reconcileAll(Collection<String> roots, ReconcileListener listener) {
        Set<String> unique = new LinkedHashSet<>();
        for (String r : roots) unique.add(CatalogPaths.normalize(r));
        List<String> ordered = new ArrayList<>(unique);

        ScanProgress progress = null;
        ReconcileResult result;
        try {
            long total = 0;
            for (String r : ordered) total += diskFingerprint(r).fileCount();

            progress = new ScanProgress(ordered, total, PROGRESS_EVERY_ALL, listener);
            listener.started(progress.reportedTotal());
            logger.info("[SCAN] Reindexando {} raízes ({} arquivos)", ordered.size(), total);

            for (String r : ordered) {
                store.addRoot(r);
                scanInto(r, progress);
                progress.removed += store.removeMissingUnder(r);
            }

            result = progress.result(null);
        } catch (RuntimeException e) {
            ReconcileResult failed = progress != null
                    ? progress.result(e)
                    : new ReconcileResult(ordered, false, 0, 0, BatchSummary.EMPTY, 0, e);
            logger.error("[SCAN] Falha ao reindexar raízes {}", ordered, e);
            listener.finished(failed);
            throw e;
        }
        logFinished(result);
        listener.finished(result);
        return result;
    }

    private void scanInto(String root, ScanProgress progress) {
        walk(Path.of(root), new FileSink() {
            @Override
            public void file(Path file, BasicFileAttributes attrs) {
                progress.record(upsertOne(file));
            }

            @Override
            public void failed(Path file, IOException exc) {
                progress.files = progress.files.plus(FileOutcome.VANISHED);
            }
        });
    }

    private FileOutcome upsertOne(Path file) {
        try {
            return store.upsertFile(file) ? FileOutcome.UPSERTED : FileOutcome.VANISHED;
        } catch (StorageException e) {
            logger.debug("Falha ao gravar {}", file, e);
            return FileOutcome.FAILED;
        }
    }

    private static void logFinished(ReconcileResult r) {
        logger.info("[SCAN] Finalizado: {} arquivos, {} gravados, {} ignorados, {} removidos",
                r.processed(), r.files().upserted(), r.files().skipped(), r.removed());
    }

    // --- WALK ---

    private interface FileSink {
        void file(Path file, BasicFileAttributes attrs);

        default void failed(Path file, IOException exc) {}
    }

    private static void walk(Path root, FileSink sink) {
        try {
            Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        sink.file(file, attrs);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    if (!file.equals(root)) {
                        sink.failed(file, exc);
                    }
                    logger.debug("Ignorando {}: {}", file, exc.toString());
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                    if (exc != null) logger.debug("Listagem incompleta de {}: {}", dir, exc.toString());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    // --- PROGRESS ---

    private static final class ScanProgress {
        private final List<String> roots;
        private final long total;
        private final long step;
        private final ReconcileListener listener;
        private long processed;
        private BatchSummary files = BatchSummary.EMPTY;
        private int removed;

        ScanProgress(List<String> roots, long total, long step, ReconcileListener listener) {
            this.roots = roots;
            this.total = total;
            this.step = step;
            this.listener = listener;
        }

        /** Zero arquivos vira 1 para não dividir por zero no percentual. */
        long reportedTotal() {
            return total > 0 ? total : 1;
        }

        void record(FileOutcome outcome) {
            files = files.plus(outcome);
            processed++;
            if (processed % step == 0 || processed == total) {
                listener.progress(processed, reportedTotal());
            }
        }

        ReconcileResult result(Throwable failure) {
            return new ReconcileResult(roots, false, reportedTotal(), processed, files, removed, failure);
        }
    }
}
