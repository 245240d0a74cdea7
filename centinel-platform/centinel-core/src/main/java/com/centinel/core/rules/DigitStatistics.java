package com.centinel.core.rules;

/**
 * Digit distributions and the chi-square goodness-of-fit test used by the
 * Benford and last-digit rules.
 */
final class DigitStatistics {

    private static final int MAX_ITERATIONS = 1000;
    private static final double EPSILON = 1e-15;
    private static final double FLOOR = 1e-300;

    // Lanczos approximation, g = 5, n = 6
    private static final double[] LANCZOS = {
            76.18009172947146, -86.50532032941677, 24.01409824083091,
            -1.231739572450155, 0.1208650973866179e-2, -0.5395239384953e-5
    };

    private DigitStatistics() {
    }

    /**
     * Benford probability of each leading digit; index 0 is unused.
     */
    static double[] benfordProbabilities() {
        double[] p = new double[10];
        for (int d = 1; d <= 9; d++) {
            p[d] = Math.log10(1 + 1.0 / d);
        }
        return p;
    }

    static int firstDigit(long value) {
        long v = Math.abs(value);
        while (v >= 10) {
            v /= 10;
        }
        return (int) v;
    }

    static int lastDigit(long value) {
        return (int) Math.abs(value % 10);
    }

    /**
     * Sum of {@code (observed - expected)^2 / expected} over buckets with a
     * positive expectation.
     */
    static double chiSquare(long[] observed, double[] expected) {
        if (observed.length != expected.length) {
            throw new IllegalArgumentException("Observed and expected counts differ in length: "
                    + observed.length + " vs " + expected.length);
        }
        double statistic = 0;
        for (int i = 0; i < observed.length; i++) {
            if (expected[i] > 0) {
                double diff = observed[i] - expected[i];
                statistic += diff * diff / expected[i];
            }
        }
        return statistic;
    }

    /**
     * Upper-tail probability {@code P(X >= statistic)} of a chi-square
     * variable with {@code degreesOfFreedom}, the p-value of the test.
     */
    static double pValue(double statistic, int degreesOfFreedom) {
        if (degreesOfFreedom < 1) {
            throw new IllegalArgumentException("Degrees of freedom must be positive: " + degreesOfFreedom);
        }
        if (Double.isNaN(statistic)) {
            return Double.NaN;
        }
        if (statistic <= 0) {
            return 1.0;
        }
        return upperRegularizedGamma(degreesOfFreedom / 2.0, statistic / 2.0);
    }

    // ==================== Incomplete Gamma ====================

    private static double upperRegularizedGamma(double a, double x) {
        if (x < a + 1) {
            return Math.max(0.0, 1.0 - lowerSeries(a, x));
        }
        return continuedFraction(a, x);
    }

    // P(a, x) by its power series, converges quickly for x < a + 1
    private static double lowerSeries(double a, double x) {
        double denominator = a;
        double term = 1.0 / a;
        double sum = term;
        for (int n = 0; n < MAX_ITERATIONS; n++) {
            denominator += 1;
            term *= x / denominator;
            sum += term;
            if (Math.abs(term) < Math.abs(sum) * EPSILON) {
                break;
            }
        }
        return sum * Math.exp(-x + a * Math.log(x) - logGamma(a));
    }

    // Q(a, x) by Lentz's continued fraction, for x >= a + 1
    private static double continuedFraction(double a, double x) {
        double b = x + 1 - a;
        double c = 1 / FLOOR;
        double d = 1 / b;
        double h = d;
        for (int i = 1; i <= MAX_ITERATIONS; i++) {
            double an = -i * (i - a);
            b += 2;
            d = an * d + b;
            if (Math.abs(d) < FLOOR) {
                d = FLOOR;
            }
            c = b + an / c;
            if (Math.abs(c) < FLOOR) {
                c = FLOOR;
            }
            d = 1 / d;
            double delta = d * c;
            h *= delta;
            if (Math.abs(delta - 1) < EPSILON) {
                break;
            }
        }
        return Math.exp(-x + a * Math.log(x) - logGamma(a)) * h;
    }

    static double logGamma(double x) {
        double y = x;
        double tmp = x + 5.5;
        tmp -= (x + 0.5) * Math.log(tmp);
        double series = 1.000000000190015;
        for (double coefficient : LANCZOS) {
            y += 1;
            series += coefficient / y;
        }
        return -tmp + Math.log(2.5066282746310005 * series / x);
    }
}
