package com.centinel.core.rules;

import com.centinel.core.model.Alert;
import com.centinel.core.model.NormalizedSnapshot;
import com.centinel.core.model.Severity;

import java.util.Arrays;
import java.util.List;

/**
 * Last digits of unmanipulated vote counts are close to uniform. Flags a
 * snapshot whose candidate and total counts fail a chi-square uniformity test
 * with 9 degrees of freedom.
 */
public class LastDigitUniformityRule extends AbstractIntegrityRule {

    public static final String ID = "last_digit_uniformity";
    public static final String TYPE = "LAST_DIGIT_NOT_UNIFORM";

    public LastDigitUniformityRule() {
        super(ID, "last digits of vote counts must be uniformly distributed", Severity.HIGH);
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
            if (votes >= 0) {
                observed[DigitStatistics.lastDigit(votes)]++;
                samples++;
            }
        }
        if (samples < thresholds.lastDigitMinSamples()) {
            return;
        }

        double[] expected = new double[10];
        Arrays.fill(expected, samples / 10.0);
        double chiSquare = DigitStatistics.chiSquare(observed, expected);
        double pValue = DigitStatistics.pValue(chiSquare, 9);
        if (pValue >= thresholds.lastDigitChiPvalueCritical()) {
            return;
        }
        alerts.add(alert(current, TYPE,
                "samples=" + samples
                        + " chi_square=" + decimal(chiSquare)
                        + " p_value=" + decimal(pValue)
                        + " p_value_critical=" + thresholds.lastDigitChiPvalueCritical()));
    }
}
