package utilities;

import selection.MedianOfMediansStrategy;
import utilities.BenchmarkEnums.Distribution;

import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.stream.Collectors;

// Parsed options for SelectionBenchmark.
public record BenchmarkOptions(
        List<Integer> sizes,
        List<Distribution> distributions,
        int warmupRuns,
        int runs,
        long seed,
        MedianOfMediansStrategy momStrategy,
        Path csvPath,                // null disables CSV output
        int fewUniqueValues,
        double zipfExponent,
        Level logLevel) {            // null keeps SelectionLogger's defaults

    public static final List<Integer> DEFAULT_SIZES = List.of(100, 500, 1000, 5000);

    public static BenchmarkOptions defaults() {
        return parse(new String[0]);
    }

    public static BenchmarkOptions parse(String[] args) {
        List<Integer> sizes = DEFAULT_SIZES;
        List<Distribution> distributions = List.copyOf(Distribution.standard());
        int warmupRuns = 0;
        int runs = 1;
        long seed = 42L;
        MedianOfMediansStrategy momStrategy = MedianOfMediansStrategy.RECURSIVE;
        String csv = "selection_benchmark.csv";
        int fewUniqueValues = 5;
        double zipfExponent = 1.0;
        Level logLevel = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) continue;
            String key; String value;
            int eq = arg.indexOf('=');
            if (eq >= 0) { key = arg.substring(2, eq); value = arg.substring(eq + 1);} else {
                key = arg.substring(2);
                if (i + 1 >= args.length) throw new IllegalArgumentException("Missing value for option --" + key);
                value = args[++i];
            }

            switch (key) {
                case "sizes", "size" -> sizes = parseIntCsv(value);
                case "distributions", "distribution", "dist" -> distributions = parseDistributions(value);
                case "warmup" -> warmupRuns = Integer.parseInt(value);
                case "runs" -> runs = Integer.parseInt(value);
                case "seed" -> seed = Long.parseLong(value);
                case "mom-strategy", "strategy" -> momStrategy = MedianOfMediansStrategy.fromString(value.trim());
                case "csv", "out" -> csv = value;
                case "few-unique-values" -> fewUniqueValues = Integer.parseInt(value);
                case "zipf-exponent" -> zipfExponent = Double.parseDouble(value);
                case "log-level" -> logLevel = Level.parse(value.trim().toUpperCase(Locale.ROOT));
                default -> throw new IllegalArgumentException("Unknown option --" + key);
            }
        }

        if (sizes.isEmpty()) throw new IllegalArgumentException("Empty --sizes list");
        for (int size : sizes) {
            if (size <= 0) throw new IllegalArgumentException("--sizes must be positive, got " + size);
        }
        if (distributions.isEmpty()) throw new IllegalArgumentException("Empty --distributions list");
        if (warmupRuns < 0) throw new IllegalArgumentException("--warmup must be >= 0");
        if (runs <= 0) throw new IllegalArgumentException("--runs must be > 0");
        if (fewUniqueValues <= 0) throw new IllegalArgumentException("--few-unique-values must be > 0");
        if (!(zipfExponent > 0.0)) throw new IllegalArgumentException("--zipf-exponent must be > 0");

        sizes = sizes.stream().distinct().sorted().collect(Collectors.toUnmodifiableList());
        Path csvPath = csv.isBlank() ? null : Path.of(csv);

        return new BenchmarkOptions(
                sizes,
                distributions,
                warmupRuns,
                runs,
                seed,
                momStrategy,
                csvPath,
                fewUniqueValues,
                zipfExponent,
                logLevel
        );
    }

    // helpers
    private static List<Integer> parseIntCsv(String csv) {
        String[] parts = csv.split(",");
        List<Integer> out = new ArrayList<>(parts.length);
        for (String p : parts) if (!p.isBlank()) out.add(Integer.parseInt(p.trim()));
        return out;
    }

    private static List<Distribution> parseDistributions(String csv) {
        if ("all".equalsIgnoreCase(csv.trim())) {
            return List.copyOf(EnumSet.allOf(Distribution.class));
        }
        if ("standard".equalsIgnoreCase(csv.trim())) {
            return List.copyOf(Distribution.standard());
        }
        // keep the order given, drop repeats
        Set<Distribution> out = new LinkedHashSet<>();
        for (String p : csv.split(",")) if (!p.isBlank()) out.add(Distribution.fromString(p.trim()));
        return List.copyOf(out);
    }
}
