package com.herzen.obe.engine;

import com.herzen.obe.governance.GovernanceModels.LevelThreshold;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Maps a percentage to an attainment level. Total over all doubles: values below 0 or above 100
 * are clamped into range and NaN is read as 0, so a malformed percentage degrades to level 0
 * instead of failing the run.
 */
@Component
public class ThresholdClassifier {

    public int classify(double percentage, List<LevelThreshold> thresholds) {
        if (thresholds == null || thresholds.isEmpty()) return 0;
        double p = clamp(percentage);
        return thresholds.stream()
                .filter(t -> t.minPercentage() <= p + Scores.EPSILON)
                .map(LevelThreshold::level)
                .max(Comparator.naturalOrder())
                .orElse(0);
    }

    /** Level of a value on the 0-3 attainment scale. */
    public int classifyScaled(double value, List<LevelThreshold> thresholds) {
        return classify(Scores.toPercentage(value), thresholds);
    }

    static double clamp(double percentage) {
        if (Double.isNaN(percentage)) return 0.0;
        return Math.max(0.0, Math.min(100.0, percentage));
    }
}
