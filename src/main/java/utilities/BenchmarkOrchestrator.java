package utilities;

import datagenerators.Generator;
import org.apache.commons.math3.random.Well19937c;
import selection.DeterministicSelector;
import selection.OrderStatisticSelector;
import selection.OrderedSequence;
import selection.RandomizedSelector;
import utilities.BenchmarkEnums.Algorithm;
import utilities.BenchmarkEnums.Distribution;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.*;

// Runs the size x distribution sweep, timing both selectors against a full sort.
public final class BenchmarkOrchestrator {
    private BenchmarkOrchestrator() {}

    public record SweepResult(List<ScenarioResult> results, List<String> failures) {}

    public static SweepResult run(BenchmarkOptions options) throws IOException {
        if (options.logLevel() != null) {
            SelectionLogger.setLevel(options.logLevel());
        }
        OrderStatisticSelector randomized = new RandomizedSelector(options.seed());
        OrderStatisticSelector deterministic = new DeterministicSelector(options.momStrategy(), new Well19937c(options.seed() + 1));
        SweepResult sweep = run(options, randomized, deterministic, System.out);

        Path csvPath = options.csvPath();
        if (csvPath != null && !sweep.results().isEmpty()) {
            BenchmarkReporter.writeCsv(csvPath, sweep.results(), options);
            SelectionLogger.info("Wrote " + sweep.results().size() + " row(s) to " + csvPath.toAbsolutePath());
        }
        return sweep;
    }

    public static SweepResult run(BenchmarkOptions options,
                                  OrderStatisticSelector randomized,
                                  OrderStatisticSelector deterministic,
                                  PrintStream out) {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(randomized, "randomized");
        Objects.requireNonNull(deterministic, "deterministic");

        SelectionLogger.info(String.format(Locale.ROOT,
                "Sweep: sizes=%s distributions=%d runs=%d warmup=%d seed=%d strategy=%s",
                options.sizes(), options.distributions().size(), options.runs(), options.warmupRuns(),
                options.seed(), options.momStrategy().token()));

        List<ScenarioResult> results = new ArrayList<>();
        List<String> failures = new ArrayList<>();

        BenchmarkReporter.printHeader(out);
        for (int size : options.sizes()) {
            for (Distribution distribution : options.distributions()) {
                String label = "size=" + size + ", distribution=" + distribution.token();
                int[] data = Generator.generate(distribution, size, options.seed() + size,
                        options.fewUniqueValues(), options.zipfExponent());
                if (data.length == 0) {
                    continue;
                }

                int rank = size / 2; // median
                int[] sorted = data.clone();
                Arrays.sort(sorted);
                int expected = sorted[rank];

                Aggregation.TimingStats timings = new Aggregation.TimingStats();
                Integer randResult = measure(randomized, Algorithm.RANDOMIZED, data, rank, options, timings, label, failures);
                if (randResult == null) {
                    continue;
                }
                Integer detResult = measure(deterministic, Algorithm.DETERMINISTIC, data, rank, options, timings, label, failures);
                if (detResult == null) {
                    continue;
                }

                if (randResult != expected) {
                    SelectionLogger.warning("Randomized result error for " + label
                            + ": got " + randResult + ", expected " + expected);
                }
                if (detResult != expected) {
                    SelectionLogger.warning("Deterministic result error for " + label
                            + ": got " + detResult + ", expected " + expected);
                }

                ScenarioResult result = new ScenarioResult(
                        size,
                        distribution,
                        rank,
                        expected,
                        randResult,
                        detResult,
                        timings.snapshot(Algorithm.RANDOMIZED).meanSeconds(),
                        timings.snapshot(Algorithm.DETERMINISTIC).meanSeconds(),
                        options.runs());
                results.add(result);
                SelectionLogger.debug(String.format(Locale.ROOT, "%s: expected=%d randomized=%.9fs deterministic=%.9fs",
                        label, expected, result.randomizedSeconds(), result.deterministicSeconds()));
                BenchmarkReporter.printRow(out, result);
            }
        }

        SweepResult sweep = new SweepResult(List.copyOf(results), List.copyOf(failures));
        BenchmarkReporter.printSummary(out, sweep);
        return sweep;
    }

    // Returns the selected value, or null after logging when the selector threw.
    private static Integer measure(OrderStatisticSelector selector,
                                   Algorithm algorithm,
                                   int[] data,
                                   int rank,
                                   BenchmarkOptions options,
                                   Aggregation.TimingStats timings,
                                   String label,
                                   List<String> failures) {
        OrderedSequence<Integer> sequence = OrderedSequence.ofInts(data);
        Integer result = null;
        try {
            for (int w = 0; w < options.warmupRuns(); w++) {
                selector.select(sequence, rank);
            }
            for (int r = 0; r < options.runs(); r++) {
                long start = System.nanoTime();
                result = selector.select(sequence, rank);
                long elapsed = System.nanoTime() - start;
                timings.accumulate(algorithm, elapsed / 1e9);
            }
        } catch (RuntimeException e) {
            String msg = algorithm.displayName() + " select failed for " + label + ": " + e.getMessage();
            SelectionLogger.warning(msg, e);
            failures.add(msg);
            return null;
        }
        return result;
    }
}
