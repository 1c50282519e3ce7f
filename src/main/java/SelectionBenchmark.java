import utilities.BenchmarkOptions;
import utilities.BenchmarkOrchestrator;
import utilities.SelectionLogger;

import java.io.IOException;
import java.util.Locale;

/**
 * Compares randomized quickselect with median-of-medians selection across input
 * sizes and distributions, picking the median of every input. Each result is
 * checked against a full sort.
 * <p>
 * Example: {@code --sizes 100,1000,10000 --distributions all --runs 5 --warmup 2 --csv out/selection.csv --log-level fine}
 */
public final class SelectionBenchmark {

    private SelectionBenchmark() {
    }

    public static void main(String[] args) throws IOException {
        BenchmarkOptions options = BenchmarkOptions.parse(args);

        System.out.printf(Locale.ROOT,
                "Running selection algorithm comparison%nSizes: %s  Distributions: %d  Runs: %d  Warmup: %d  Seed: %d  MoM: %s%n%n",
                options.sizes(), options.distributions().size(), options.runs(), options.warmupRuns(),
                options.seed(), options.momStrategy().token());

        BenchmarkOrchestrator.SweepResult sweep = BenchmarkOrchestrator.run(options);
        if (sweep.results().isEmpty()) {
            SelectionLogger.warning("No results to display");
        }
        if (!sweep.failures().isEmpty()) {
            SelectionLogger.error(sweep.failures().size() + " scenario(s) failed; see the warnings above");
        }
    }
}
