package utilities;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import utilities.BenchmarkEnums.Algorithm;

import java.util.EnumMap;

/**
 * Timing accumulators for one benchmark scenario, one per algorithm.
 */
public final class Aggregation {
    private Aggregation() {}

    public static final class TimingStats {
        private final EnumMap<Algorithm, SummaryStatistics> sums = new EnumMap<>(Algorithm.class);

        public void accumulate(Algorithm algorithm, double seconds) {
            sums.computeIfAbsent(algorithm, ignored -> new SummaryStatistics()).addValue(seconds);
        }

        public StatsSnapshot snapshot(Algorithm algorithm) {
            SummaryStatistics sum = sums.get(algorithm);
            if (sum == null || sum.getN() == 0) {
                return null;
            }
            return new StatsSnapshot(
                    sum.getMean(),
                    sum.getN() > 1 ? sum.getStandardDeviation() : 0.0,
                    sum.getMin(),
                    sum.getMax(),
                    (int) sum.getN());
        }

        public int count(Algorithm algorithm) {
            SummaryStatistics sum = sums.get(algorithm);
            return sum == null ? 0 : (int) sum.getN();
        }

        public boolean hasData() {
            return sums.values().stream().anyMatch(sum -> sum.getN() > 0);
        }
    }

    public record StatsSnapshot(double meanSeconds,
                                double stdDevSeconds,
                                double minSeconds,
                                double maxSeconds,
                                int count) {}
}
