package uk.gegc.formbatch.shared.util;

import java.util.Locale;

/**
 * Human readable byte sizes for limit messages: {@code 5.0MB}, {@code 250KB}, {@code 512 bytes}.
 */
public final class FileSizeFormatter {

    private static final long KB = 1024L;
    private static final long MB = KB * 1024L;

    private FileSizeFormatter() {
    }

    public static String format(long bytes) {
        if (bytes >= MB) {
            return String.format(Locale.ROOT, "%.1fMB", bytes / (double) MB);
        }
        if (bytes >= KB) {
            return String.format(Locale.ROOT, "%.0fKB", bytes / (double) KB);
        }
        return bytes + " bytes";
    }
}
