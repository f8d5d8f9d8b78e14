package com.filetags.app.inventory;

import java.util.List;

/**
 * Resumo de uma reconciliação.
 *
 * @param roots          raízes normalizadas, sem duplicatas
 * @param shortCircuited true quando a impressão digital bateu e nada foi varrido
 * @param total          total anunciado no início (nunca zero quando houve varredura)
 * @param processed      arquivos regulares visitados na varredura
 * @param files          resultado por arquivo, agregado
 * @param removed        linhas podadas por não existirem mais no disco
 * @param failure        erro que interrompeu a operação, ou null
 */
public record ReconcileResult(
        List<String> roots,
        boolean shortCircuited,
        long total,
        long processed,
        BatchSummary files,
        int removed,
        Throwable failure
) {

    public ReconcileResult {
        roots = List.copyOf(roots);
    }

    static ReconcileResult unchanged(String root, long fileCount) {
        return new ReconcileResult(List.of(root), true, fileCount, 0, BatchSummary.EMPTY, 0, null);
    }

    public boolean succeeded() {
        return failure == null;
    }
}
