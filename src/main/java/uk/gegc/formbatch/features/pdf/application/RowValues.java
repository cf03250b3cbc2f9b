package uk.gegc.formbatch.features.pdf.application;

import org.apache.commons.io.FilenameUtils;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Value and output-name rules applied to every CSV row before filling.
 */
public final class RowValues {

    public static final String FILENAME_COLUMN = "Filename";

    private static final int MAX_FILENAME_LENGTH = 255;
    private static final String[] DANGEROUS_PATTERNS = {"..", "/", "\\", ":", "*", "?", "\"", "<", ">", "|"};
    private static final Set<String> RESERVED_NAMES = Set.of(
            "CON", "PRN", "AUX", "NUL",
            "COM1", "COM2", "COM3", "COM4", "COM5", "COM6", "COM7", "COM8", "COM9",
            "LPT1", "LPT2", "LPT3", "LPT4", "LPT5", "LPT6", "LPT7", "LPT8", "LPT9");

    private RowValues() {
    }

    /**
     * Trims the value and drops a trailing {@code .0}, so spreadsheet exports of whole
     * numbers fill as integers.
     */
    public static String clean(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.strip();
        if (trimmed.endsWith(".0")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        }
        return trimmed;
    }

    /**
     * Field values for the form: every column except {@code Filename}, cleaned.
     */
    public static Map<String, String> fieldValues(Map<String, String> row) {
        Map<String, String> values = new LinkedHashMap<>();
        row.forEach((column, value) -> {
            if (!FILENAME_COLUMN.equals(column)) {
                values.put(column, clean(value));
            }
        });
        return values;
    }

    /**
     * Output name for a row: the {@code Filename} column with {@code .pdf} appended when it
     * is usable, otherwise {@code row_<n>.pdf} with n 1-based.
     */
    public static String outputFileName(Map<String, String> row, int rowIndex) {
        String fallback = "row_" + (rowIndex + 1) + ".pdf";
        String requested = clean(row.get(FILENAME_COLUMN));
        if (requested.isEmpty()) {
            return fallback;
        }
        String name = requested.toLowerCase(Locale.ROOT).endsWith(".pdf") ? requested : requested + ".pdf";
        return isSafeFileName(name) ? name : fallback;
    }

    static boolean isSafeFileName(String fileName) {
        if (fileName == null || fileName.isBlank() || fileName.length() > MAX_FILENAME_LENGTH) {
            return false;
        }
        for (String pattern : DANGEROUS_PATTERNS) {
            if (fileName.contains(pattern)) {
                return false;
            }
        }
        for (char c : fileName.toCharArray()) {
            if (Character.isISOControl(c)) {
                return false;
            }
        }
        String stem = FilenameUtils.getBaseName(fileName).toUpperCase(Locale.ROOT);
        return !RESERVED_NAMES.contains(stem);
    }
}
