package com.filetags.app.database;

import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.concurrent.TimeUnit;

/**
 * Normalização de caminhos e padrões LIKE usados como chave do catálogo.
 */
public final class CatalogPaths {

    /** Caractere de escape declarado nas cláusulas {@code LIKE ... ESCAPE '!'}. */
    public static final char LIKE_ESCAPE = '!';

    private CatalogPaths() {}

    /**
     * Caminho absoluto normalizado. A raiz de um sistema de arquivos mantém o
     * separador final ({@code /}, {@code C:\}).
     */
    public static String normalize(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Caminho vazio");
        }
        return normalize(Path.of(path.trim()));
    }

    public static String normalize(Path path) {
        Path abs = path.toAbsolutePath().normalize();
        return abs.toString();
    }

    /**
     * Prefixo de diretório: o próprio caminho terminado em separador, para que
     * {@code /data/a} não case com {@code /data/ab/x}.
     */
    public static String directoryPrefix(String normalizedRoot) {
        String sep = Path.of(normalizedRoot).getFileSystem().getSeparator();
        return normalizedRoot.endsWith(sep) ? normalizedRoot : normalizedRoot + sep;
    }

    /** Padrão LIKE para "todos os arquivos sob a raiz". */
    public static String likeUnder(String normalizedRoot) {
        return escapeLike(directoryPrefix(normalizedRoot)) + "%";
    }

    /** Padrão LIKE para "caminho contém o texto", com curingas tratados como literais. */
    public static String likeContaining(String text) {
        return "%" + escapeLike(text) + "%";
    }

    public static String escapeLike(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                sb.append(LIKE_ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /** Segundos desde a época, com fração, igual ao valor gravado em {@code files.mtime}. */
    public static double mtimeSeconds(FileTime time) {
        return time.to(TimeUnit.MICROSECONDS) / 1_000_000.0;
    }
}
