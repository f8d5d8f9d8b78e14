package com.filetags.app.cli;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Tamanhos no estilo do Explorer: bytes abaixo de 1KB, KB inteiro com
 * separador de milhar abaixo de 1MB, MB/GB com uma casa decimal (sem ".0").
 */
public final class SizeFormat {

    private static final long KB = 1024L;
    private static final long MB = KB * 1024;
    private static final long GB = MB * 1024;

    private SizeFormat() {}

    public static String explorer(long bytes) {
        if (bytes < KB) {
            return bytes + "B";
        }
        if (bytes < MB) {
            long kb = Math.round(bytes / (double) KB);
            return String.format(Locale.ROOT, "%,dKB", kb);
        }
        if (bytes < GB) {
            return oneDecimal(bytes / (double) MB) + "MB";
        }
        return oneDecimal(bytes / (double) GB) + "GB";
    }

    private static String oneDecimal(double value) {
        BigDecimal bd = BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).stripTrailingZeros();
        return bd.toPlainString();
    }
}
