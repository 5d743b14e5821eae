package com.herzen.obe.governance;

import com.herzen.obe.domain.DomainModels.AssessmentCategory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

public class GovernanceModels {
    public record LevelThreshold(int level, double minPercentage) {}

    /**
     * Weights, cut points and target in effect for one computation run. Category weights are
     * percentages (expected to sum to 100), blend weights are fractions (expected to sum to 1.0),
     * the PO target is on the 0-3 attainment scale.
     */
    public record GovernanceSnapshot(long version,
                                     double ia1Weight,
                                     double ia2Weight,
                                     double endWeight,
                                     double directWeight,
                                     double indirectWeight,
                                     List<LevelThreshold> levelThresholds,
                                     double poTarget) {
        public GovernanceSnapshot {
            levelThresholds = levelThresholds == null ? List.of() : levelThresholds.stream()
                    .sorted(Comparator.comparingDouble(LevelThreshold::minPercentage).reversed()
                            .thenComparing(Comparator.comparingInt(LevelThreshold::level).reversed()))
                    .toList();
        }

        public double categoryWeight(AssessmentCategory category) {
            return switch (category) {
                case IA1 -> ia1Weight;
                case IA2 -> ia2Weight;
                case END -> endWeight;
            };
        }
    }

    public record GovernanceUpdateRequest(double ia1Weight,
                                          double ia2Weight,
                                          double endWeight,
                                          double directWeight,
                                          double indirectWeight,
                                          Map<Integer, Double> levelThresholds,
                                          double poTarget) {}
}
