package utilities;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

// Minimal RFC 4180 style writer: comma separated, double-quoted only when needed, UTF-8.
public final class CsvUtil {

    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';

    private CsvUtil() {}

    public static void writeRows(Path file, List<? extends List<?>> rows) throws IOException {
        Objects.requireNonNull(file, "file");
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter bw = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeRows(bw, rows);
        }
    }

    // Caller closes the writer.
    public static void writeRows(Writer writer, List<? extends List<?>> rows) throws IOException {
        Objects.requireNonNull(writer, "writer");
        Objects.requireNonNull(rows, "rows");
        for (List<?> row : rows) {
            writer.write(toCsvLine(row));
            writer.write(System.lineSeparator());
        }
        writer.flush();
    }

    public static String toCsvLine(List<?> row) {
        Objects.requireNonNull(row, "row");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < row.size(); i++) {
            if (i > 0) sb.append(DELIMITER);
            sb.append(quoteIfNeeded(stringify(row.get(i))));
        }
        return sb.toString();
    }

    // null becomes an empty field; doubles use a locale-independent format.
    private static String stringify(Object value) {
        if (value == null) return "";
        if (value instanceof Double d) {
            return d.isInfinite() || d.isNaN() ? d.toString() : String.format(Locale.ROOT, "%.9f", d);
        }
        return String.valueOf(value);
    }

    private static String quoteIfNeeded(String field) {
        boolean needsQuote = field.indexOf(DELIMITER) >= 0
                || field.indexOf(QUOTE) >= 0
                || field.indexOf('\n') >= 0
                || field.indexOf('\r') >= 0;
        if (!needsQuote) {
            return field;
        }
        return QUOTE + field.replace(String.valueOf(QUOTE), "\"\"") + QUOTE;
    }
}
