package com.example.verification.metrics;

import com.example.verification.model.AccumulatorState;
import com.example.verification.model.ProbabilityBins;
import com.example.verification.model.ReliabilityBin;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores for probability-of-event forecasts.
 *
 * <p>The reference forecast for the skill score is the climatological event
 * frequency observed in the same state, whose Brier score is {@code p(1-p)}.
 * CRPS and CRPSS are reserved slots and always undefined; they need ensemble
 * members, which this engine does not accumulate.
 */
public record ProbabilisticScores(
        double eventThreshold,
        long sampleCount,
        MetricValue brierScore,
        MetricValue brierSkillScore,
        MetricValue climatologicalFrequency,
        List<ReliabilityPoint> reliability,
        List<RocPoint> roc,
        MetricValue crps,
        MetricValue crpss
) {
    public static ProbabilisticScores from(double eventThreshold, ProbabilityBins bins, AccumulatorState state) {
        long n = state.getProbabilitySampleCount();
        MetricValue brier = MetricValue.ratio(state.getSumSquaredProbabilityError(), n);
        MetricValue baseRate = MetricValue.ratio(state.getObservedEventCount(), n);
        MetricValue reference = baseRate.map(p -> p * (1.0 - p));

        MetricValue skill = MetricValue.undefined();
        if (brier.isDefined() && reference.isDefined()) {
            skill = MetricValue.ratio(brier.getAsDouble(), reference.getAsDouble()).map(r -> 1.0 - r);
        }

        List<ReliabilityBin> binTotals = state.getReliability();
        return new ProbabilisticScores(
                eventThreshold,
                n,
                brier,
                skill,
                baseRate,
                reliabilityPoints(bins, binTotals),
                rocPoints(bins, binTotals),
                MetricValue.undefined(),
                MetricValue.undefined()
        );
    }

    private static List<ReliabilityPoint> reliabilityPoints(ProbabilityBins bins, List<ReliabilityBin> totals) {
        List<ReliabilityPoint> points = new ArrayList<>(totals.size());
        for (int k = 0; k < totals.size(); k++) {
            ReliabilityBin bin = totals.get(k);
            points.add(new ReliabilityPoint(
                    bins.lowerEdge(k),
                    bins.upperEdge(k),
                    bin.sampleCount(),
                    MetricValue.ratio(bin.forecastProbabilitySum(), bin.sampleCount()),
                    MetricValue.ratio(bin.observedEventCount(), bin.sampleCount())
            ));
        }
        return List.copyOf(points);
    }

    private static List<RocPoint> rocPoints(ProbabilityBins bins, List<ReliabilityBin> totals) {
        long events = 0;
        long nonEvents = 0;
        for (ReliabilityBin bin : totals) {
            events += bin.observedEventCount();
            nonEvents += bin.sampleCount() - bin.observedEventCount();
        }

        // walk from the top bin down so "yes" counts are running suffix sums
        RocPoint[] points = new RocPoint[totals.size()];
        long truePositives = 0;
        long falsePositives = 0;
        for (int k = totals.size() - 1; k >= 0; k--) {
            ReliabilityBin bin = totals.get(k);
            truePositives += bin.observedEventCount();
            falsePositives += bin.sampleCount() - bin.observedEventCount();
            points[k] = new RocPoint(
                    bins.lowerEdge(k),
                    MetricValue.ratio(truePositives, events),
                    MetricValue.ratio(falsePositives, nonEvents)
            );
        }
        return List.of(points);
    }
}
