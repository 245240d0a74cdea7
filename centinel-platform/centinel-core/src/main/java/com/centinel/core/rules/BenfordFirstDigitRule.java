package com.centinel.core.rules;

import com.centinel.core.model.Alert;
import com.centinel.core.model.NormalizedSnapshot;
import com.centinel.core.model.Severity;

import java.util.List;

/**
 * Leading digits of the vote counts of one snapshot (candidates plus the
 * total) should follow Benford's law. Deviation is measured by the mean
 * absolute deviation of digit shares and by a chi-square test with 8 degrees
 * of freedom.
 */
public class BenfordFirstDigitRule extends AbstractIntegrityRule {

    public static final String ID = "benford_first_digit";
    public static final String TYPE = "BENFORD_FIRST_DIGIT_DEVIATION";

    private static final double[] EXPECTED = DigitStatistics.benfordProbabilities();

    public BenfordFirstDigitRule() {
        super(ID, "leading digits of vote counts must follow Benford's law", Severity.HIGH);
    }

    @Override
    protected boolean requiresPrevious() {
        return false;
    }

    @Override
    protected void check(RuleContext context, List<Alert> alerts) {
        DistributionThresholds thresholds = context.config().distribution();
        NormalizedSnapshot current = context.current();

        long[] observed = new long[10];
        int samples = 0;
        for (long votes : voteCounts(current)) {
            if (votes > 0) {
                observed[DigitStatistics.firstDigit(votes)]++;
                samples++;
            }
        }
        if (samples < thresholds.benfordMinSamples()) {
            return;
        }

        double[] expected = new double[10];
        double mad = 0;
        for (int d = 1; d <= 9; d++) {
            expected[d] = EXPECTED[d] * samples;
            mad += Math.abs((double) observed[d] / samples - EXPECTED[d]);
        }
        mad /= 9;
        double chiSquare = DigitStatistics.chiSquare(observed, expected);
        double pValue = DigitStatistics.pValue(chiSquare, 8);

        Severity graded;
        if (mad > thresholds.benfordMadCritical() || pValue < thresholds.benfordChiPvalueCritical()) {
            graded = Severity.HIGH;
        } else if (mad >= thresholds.benfordMadWarning()) {
            graded = Severity.MEDIUM;
        } else {
            return;
        }
        alerts.add(alert(current, TYPE, graded,
                "samples=" + samples
                        + " mad=" + decimal(mad)
                        + " chi_square=" + decimal(chiSquare)
                        + " p_value=" + decimal(pValue)
                        + " mad_warning=" + thresholds.benfordMadWarning()
                        + " mad_critical=" + thresholds.benfordMadCritical()
                        + " p_value_critical=" + thresholds.benfordChiPvalueCritical()));
    }
}
