package com.filetags.app.inventory;

/**
 * Eventos de uma reconciliação. {@code progress} chega com {@code processed}
 * crescente; {@code finished} chega exatamente uma vez por pedido aceito,
 * inclusive quando a operação falha.
 */
public interface ReconcileListener {

    ReconcileListener NONE = new ReconcileListener() {};

    default void started(long total) {}

    default void progress(long processed, long total) {}

    default void finished(ReconcileResult result) {}
}
