package com.filetags.app.inventory;

/**
 * Contagem agregada dos {@link FileOutcome} de uma varredura.
 */
public record BatchSummary(long upserted, long vanished, long failed) {

    public static final BatchSummary EMPTY = new BatchSummary(0, 0, 0);

    public BatchSummary plus(FileOutcome outcome) {
        return switch (outcome) {
            case UPSERTED -> new BatchSummary(upserted + 1, vanished, failed);
            case VANISHED -> new BatchSummary(upserted, vanished + 1, failed);
            case FAILED -> new BatchSummary(upserted, vanished, failed + 1);
        };
    }

    public long skipped() {
        return vanished + failed;
    }

    public long attempted() {
        return upserted + vanished + failed;
    }
}
