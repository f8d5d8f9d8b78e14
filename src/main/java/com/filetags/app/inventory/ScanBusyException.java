package com.filetags.app.inventory;

/**
 * Pedido recusado porque outra reconciliação está em andamento. Não há fila.
 */
public class ScanBusyException extends RuntimeException {

    private final String runningPurpose;
    private final String requestedPurpose;

    public ScanBusyException(String runningPurpose, String requestedPurpose) {
        super("Outra tarefa está em andamento (" + runningPurpose + "). "
                + "Tente \"" + requestedPurpose + "\" novamente quando ela terminar.");
        this.runningPurpose = runningPurpose;
        this.requestedPurpose = requestedPurpose;
    }

    public String runningPurpose() {
        return runningPurpose;
    }

    public String requestedPurpose() {
        return requestedPurpose;
    }
}
