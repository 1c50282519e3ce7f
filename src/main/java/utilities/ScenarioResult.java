package utilities;

import utilities.BenchmarkEnums.Distribution;

public record ScenarioResult(
        int size,
        Distribution distribution,
        int rank,
        int expected,                   // value at rank in a fully sorted copy
        int randomizedResult,
        int deterministicResult,
        double randomizedSeconds,       // mean over timed runs
        double deterministicSeconds,    // mean over timed runs
        int runs) {

    public double ratio() {
        return randomizedSeconds > 0 ? deterministicSeconds / randomizedSeconds : Double.POSITIVE_INFINITY;
    }

    public boolean randomizedCorrect() {
        return randomizedResult == expected;
    }

    public boolean deterministicCorrect() {
        return deterministicResult == expected;
    }
}
