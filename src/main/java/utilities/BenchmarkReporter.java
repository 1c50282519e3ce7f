package utilities;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Console table and CSV output for a selection benchmark sweep.
 */
public final class BenchmarkReporter {
    private BenchmarkReporter() {}

    public static void printHeader(PrintStream out) {
        out.printf(Locale.ROOT, "%-8s %-20s %-15s %-18s %-15s%n",
                "Size", "Distribution", "Randomized (s)", "Deterministic (s)", "Ratio (Det/Rand)");
        out.println("-".repeat(80));
    }

    public static void printRow(PrintStream out, ScenarioResult r) {
        out.printf(Locale.ROOT, "%-8d %-20s %-15.6f %-18.6f %-15.2f%n",
                r.size(), r.distribution().token(), r.randomizedSeconds(), r.deterministicSeconds(), r.ratio());
    }

    public static void printSummary(PrintStream out, BenchmarkOrchestrator.SweepResult sweep) {
        long mismatches = sweep.results().stream()
                .filter(r -> !r.randomizedCorrect() || !r.deterministicCorrect())
                .count();
        out.println();
        out.printf(Locale.ROOT, "Scenarios: %d completed, %d failed, %d with wrong results%n",
                sweep.results().size(), sweep.failures().size(), mismatches);
        for (String failure : sweep.failures()) {
            out.println("  failed: " + failure);
        }
    }

    public static List<List<Object>> toRows(List<ScenarioResult> results, BenchmarkOptions options) {
        List<List<Object>> rows = new ArrayList<>(results.size() + 1);
        rows.add(List.of(
                "size", "distribution", "rank", "expected",
                "randomized_s", "deterministic_s", "ratio",
                "randomized_ok", "deterministic_ok",
                "runs", "mom_strategy", "seed"));
        for (ScenarioResult r : results) {
            List<Object> row = new ArrayList<>();
            row.add(r.size());
            row.add(r.distribution().token());
            row.add(r.rank());
            row.add(r.expected());
            row.add(r.randomizedSeconds());
            row.add(r.deterministicSeconds());
            row.add(r.ratio());
            row.add(r.randomizedCorrect());
            row.add(r.deterministicCorrect());
            row.add(r.runs());
            row.add(options.momStrategy().token());
            row.add(options.seed());
            rows.add(row);
        }
        return rows;
    }

    public static Path writeCsv(Path csvPath, List<ScenarioResult> results, BenchmarkOptions options) throws IOException {
        CsvUtil.writeRows(csvPath, toRows(results, options));
        return csvPath;
    }
}
