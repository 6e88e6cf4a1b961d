package com.example.verification.metrics;

import com.example.verification.model.AccumulatorConfig;
import com.example.verification.model.AccumulatorId;
import com.example.verification.model.AccumulatorState;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metrics derived from one accumulator's state.
 *
 * <p>Derivation is a pure function of the state: it never looks at raw pairs and
 * never raises for degenerate input. A state with zero samples yields undefined
 * for every ratio.
 *
 * @param completeness share of valid pairs, {@code sampleCount / (sampleCount + missingCount)}
 * @param probabilistic probability scores, {@code null} when the accumulator has no bins
 */
public record VerificationMetrics(
        AccumulatorId id,
        long sampleCount,
        long missingCount,
        MetricValue completeness,
        MetricValue mae,
        MetricValue bias,
        MetricValue rmse,
        MetricValue biasRatio,
        MetricValue meanForecast,
        MetricValue meanObservation,
        MetricValue forecastStdDev,
        MetricValue observationStdDev,
        List<CategoricalScores> categorical,
        ProbabilisticScores probabilistic
) {
    /** Observation means closer to zero than this make the bias ratio undefined. */
    static final double BIAS_RATIO_EPSILON = 1e-10;

    public static VerificationMetrics derive(AccumulatorId id, AccumulatorConfig config, AccumulatorState state) {
        long n = state.getSampleCount();

        MetricValue meanForecast = MetricValue.ratio(state.getSumForecast(), n);
        MetricValue meanObs = MetricValue.ratio(state.getSumObservation(), n);

        MetricValue biasRatio = MetricValue.undefined();
        if (meanForecast.isDefined() && Math.abs(meanObs.getAsDouble()) > BIAS_RATIO_EPSILON) {
            biasRatio = MetricValue.of(meanForecast.getAsDouble() / meanObs.getAsDouble());
        }

        List<Double> thresholds = config.thresholds();
        List<CategoricalScores> categorical = new ArrayList<>(thresholds.size());
        for (int k = 0; k < thresholds.size(); k++) {
            categorical.add(CategoricalScores.from(thresholds.get(k), state.contingency(k)));
        }

        ProbabilisticScores probabilistic = config.hasProbabilities()
                ? ProbabilisticScores.from(config.eventThreshold(), config.probabilityBins(), state)
                : null;

        return new VerificationMetrics(
                id,
                n,
                state.getMissingCount(),
                MetricValue.ratio(n, n + state.getMissingCount()),
                MetricValue.ratio(state.getSumAbsError(), n),
                MetricValue.ratio(state.getSumError(), n),
                MetricValue.ratio(state.getSumSquaredError(), n).map(Math::sqrt),
                biasRatio,
                meanForecast,
                meanObs,
                standardDeviation(state.getSumForecastSquared(), meanForecast, n),
                standardDeviation(state.getSumObservationSquared(), meanObs, n),
                List.copyOf(categorical),
                probabilistic
        );
    }

    /**
     * Population standard deviation from a sum of squares; small negative
     * variances from rounding clamp to zero.
     */
    private static MetricValue standardDeviation(double sumSquares, MetricValue mean, long n) {
        if (!mean.isDefined()) {
            return MetricValue.undefined();
        }
        double m = mean.getAsDouble();
        double variance = sumSquares / n - m * m;
        return MetricValue.of(Math.sqrt(Math.max(0.0, variance)));
    }

    /**
     * Flattens all metrics into {@code name -> value}, per-threshold names are
     * suffixed with {@code @threshold}. Undefined metrics are kept.
     */
    public Map<String, MetricValue> asMap() {
        Map<String, MetricValue> out = new LinkedHashMap<>();
        out.put("mae", mae);
        out.put("bias", bias);
        out.put("rmse", rmse);
        out.put("bias_ratio", biasRatio);
        out.put("mean_forecast", meanForecast);
        out.put("mean_obs", meanObservation);
        out.put("forecast_stddev", forecastStdDev);
        out.put("obs_stddev", observationStdDev);
        out.put("completeness", completeness);
        for (CategoricalScores scores : categorical) {
            String suffix = "@" + scores.threshold();
            out.put("hit_rate" + suffix, scores.hitRate());
            out.put("false_alarm_ratio" + suffix, scores.falseAlarmRatio());
            out.put("critical_success_index" + suffix, scores.criticalSuccessIndex());
            out.put("false_alarm_rate" + suffix, scores.falseAlarmRate());
            out.put("frequency_bias" + suffix, scores.frequencyBias());
        }
        if (probabilistic != null) {
            out.put("brier_score", probabilistic.brierScore());
            out.put("brier_skill_score", probabilistic.brierSkillScore());
            out.put("climatological_frequency", probabilistic.climatologicalFrequency());
            out.put("crps", probabilistic.crps());
            out.put("crpss", probabilistic.crpss());
        }
        return out;
    }
}
