package com.centinel.core.rules;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DigitStatisticsTest {

    @Test
    void pValue_matchesClosedFormForTwoDegreesOfFreedom() {
        // with 2 degrees of freedom the upper tail is exp(-x / 2)
        assertThat(DigitStatistics.pValue(4.0, 2)).isCloseTo(Math.exp(-2.0), within(1e-9));
        assertThat(DigitStatistics.pValue(0.5, 2)).isCloseTo(Math.exp(-0.25), within(1e-9));
    }

    @Test
    void pValue_matchesTabulatedCriticalValues() {
        assertThat(DigitStatistics.pValue(3.841459, 1)).isCloseTo(0.05, within(1e-5));
        assertThat(DigitStatistics.pValue(20.090235, 8)).isCloseTo(0.01, within(1e-5));
        assertThat(DigitStatistics.pValue(27.877165, 9)).isCloseTo(0.001, within(1e-6));
    }

    @Test
    void pValue_edgeCases() {
        assertThat(DigitStatistics.pValue(0.0, 8)).isEqualTo(1.0);
        assertThat(DigitStatistics.pValue(10_000.0, 9)).isLessThan(1e-12);
        assertThat(DigitStatistics.pValue(Double.NaN, 9)).isNaN();
        assertThatThrownBy(() -> DigitStatistics.pValue(1.0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void logGamma_matchesFactorials() {
        assertThat(DigitStatistics.logGamma(5.0)).isCloseTo(Math.log(24), within(1e-9));
        assertThat(DigitStatistics.logGamma(0.5)).isCloseTo(Math.log(Math.sqrt(Math.PI)), within(1e-9));
    }

    @Test
    void digits_areTakenFromDecimalRepresentation() {
        assertThat(DigitStatistics.firstDigit(9071)).isEqualTo(9);
        assertThat(DigitStatistics.firstDigit(7)).isEqualTo(7);
        assertThat(DigitStatistics.lastDigit(9071)).isEqualTo(1);
        assertThat(DigitStatistics.lastDigit(0)).isZero();
    }

    @Test
    void benfordProbabilities_sumToOne() {
        double[] p = DigitStatistics.benfordProbabilities();

        assertThat(p[1]).isCloseTo(0.30103, within(1e-5));
        assertThat(java.util.Arrays.stream(p).sum()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void chiSquare_rejectsMismatchedBuckets() {
        assertThatThrownBy(() -> DigitStatistics.chiSquare(new long[3], new double[4]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Property(tries = 200)
    void pValueIsAProbabilityDecreasingWithStatistic(
            @ForAll @DoubleRange(min = 0.0, max = 200.0) double statistic,
            @ForAll @DoubleRange(min = 0.0, max = 50.0) double increase,
            @ForAll @IntRange(min = 1, max = 30) int degreesOfFreedom) {
        // Property: the upper tail stays within [0, 1] and never grows as the statistic grows
        double lower = DigitStatistics.pValue(statistic, degreesOfFreedom);
        double higher = DigitStatistics.pValue(statistic + increase, degreesOfFreedom);

        assertThat(lower).isBetween(0.0, 1.0);
        assertThat(higher).isLessThanOrEqualTo(lower + 1e-12);
    }
}
