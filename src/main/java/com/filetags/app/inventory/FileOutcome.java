package com.filetags.app.inventory;

/**
 * Resultado do upsert de um único arquivo durante a varredura.
 */
public enum FileOutcome {
    /** Linha inserida ou atualizada. */
    UPSERTED,
    /** Sumiu ou ficou ilegível entre a listagem e o stat; não entra no catálogo. */
    VANISHED,
    /** O banco recusou a escrita; o lote segue com os demais arquivos. */
    FAILED
}
