package com.filetags.app.inventory;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dono do estado IDLE/SCANNING. Aceita no máximo uma reconciliação por vez e
 * recusa (sem enfileirar) pedidos feitos enquanto outra está rodando.
 * <p>
 * A varredura roda numa thread própria; o estado volta a IDLE antes do
 * {@code finished} chegar ao listener, então quem reage ao fim já pode pedir
 * outra varredura.
 */
public final class ScanCoordinator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ScanCoordinator.class);

    private final Reconciler reconciler;
    private final ExecutorService executor;
    private final AtomicReference<ScanState> state = new AtomicReference<>(ScanState.IDLE);
    private volatile String purpose;

    public ScanCoordinator(Reconciler reconciler) {
        this.reconciler = reconciler;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "filetags-scan");
            t.setDaemon(true);
            return t;
        });
    }

    public ScanState state() {
        return state.get();
    }

    public boolean isScanning() {
        return state.get() == ScanState.SCANNING;
    }

    /** Propósito da varredura em andamento, ou null quando ocioso. */
    public String currentPurpose() {
        return isScanning() ? purpose : null;
    }

    /**
     * Para ações que mexem no catálogo e não podem concorrer com uma varredura
     * (remover raiz, renomear arquivo...).
     *
     * @throws ScanBusyException se houver varredura em andamento
     */
    public void checkIdle(String requestedPurpose) {
        if (isScanning()) {
            throw new ScanBusyException(String.valueOf(purpose), requestedPurpose);
        }
    }

    public CompletableFuture<ReconcileResult> submitReconcile(String root, ReconcileListener listener) {
        String label = "Indexar " + root;
        return submit(label, listener, l -> () -> reconciler.reconcile(root, l));
    }

    public CompletableFuture<ReconcileResult> submitReconcileAll(Collection<String> roots, ReconcileListener listener) {
        List<String> copy = List.copyOf(roots);
        String label = "Reindexar todas as raízes";
        return submit(label, listener, l -> () -> reconciler.reconcileAll(copy, l));
    }

    private interface Job {
        Supplier<ReconcileResult> bind(ReconcileListener listener);
    }

    private CompletableFuture<ReconcileResult> submit(String label, ReconcileListener listener, Job job) {
        begin(label);
        ReconcileListener target = listener == null ? ReconcileListener.NONE : listener;
        AtomicBoolean ended = new AtomicBoolean(false);
        ReconcileListener wrapped = new ReconcileListener() {
            @Override
            public void started(long total) {
                target.started(total);
            }

            @Override
            public void progress(long processed, long total) {
                target.progress(processed, total);
            }

            @Override
            public void finished(ReconcileResult result) {
                end(ended);
                target.finished(result);
            }
        };

        Supplier<ReconcileResult> work = job.bind(wrapped);
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return work.get();
                } finally {
                    end(ended);
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            end(ended);
            throw new IllegalStateException("Coordenador de varredura encerrado", e);
        }
    }

    private void begin(String label) {
        if (!state.compareAndSet(ScanState.IDLE, ScanState.SCANNING)) {
            logger.warn("Pedido recusado ({}): varredura em andamento ({})", label, purpose);
            throw new ScanBusyException(String.valueOf(purpose), label);
        }
        purpose = label;
        logger.info("[SCAN] Iniciando: {}", label);
    }

    private void end(AtomicBoolean ended) {
        if (ended.compareAndSet(false, true)) {
            purpose = null;
            state.set(ScanState.IDLE);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Varredura não terminou a tempo; interrompendo");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
