package com.herzen.obe.engine;

import com.herzen.obe.domain.DomainModels.AssessmentCategory;
import com.herzen.obe.engine.EngineModels.AttainmentWarning;
import com.herzen.obe.engine.EngineModels.CoAssessmentAttainment;
import com.herzen.obe.engine.EngineModels.DirectCoAttainment;
import com.herzen.obe.engine.EngineModels.ExcludedOutcome;
import com.herzen.obe.governance.GovernanceModels.GovernanceSnapshot;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Weighted blend of per-category outcome percentages.
 * <p>
 * Only categories with at least one assessment take part; their weights are divided by their own
 * sum, which covers both a structurally absent category and weights not adding up to 100. An
 * outcome with no components in an existing category counts as 0 for it. Several assessments of
 * one category are averaged.
 * <p>
 * Assessments that excluded an outcome (zero max marks) leave the average for that outcome, and a
 * category in which every assessment excluded it drops out of the outcome's weight sum.
 */
@Component
public class DirectAttainmentAggregator {
    private final ThresholdClassifier classifier;

    public DirectAttainmentAggregator(ThresholdClassifier classifier) {
        this.classifier = classifier;
    }

    public List<DirectCoAttainment> aggregate(String scopeKey,
                                              Collection<String> coIds,
                                              Map<AssessmentCategory, Integer> assessmentsPerCategory,
                                              List<CoAssessmentAttainment> rows,
                                              List<ExcludedOutcome> excluded,
                                              GovernanceSnapshot governance,
                                              List<AttainmentWarning> warnings) {
        List<AssessmentCategory> present = Arrays.stream(AssessmentCategory.values())
                .filter(c -> assessmentsPerCategory.getOrDefault(c, 0) > 0)
                .toList();
        double totalWeight = present.stream().mapToDouble(governance::categoryWeight).sum();

        if (present.isEmpty()) {
            warnings.add(new AttainmentWarning(AttainmentWarnings.NO_ASSESSMENTS, scopeKey, scopeKey,
                    "Course has no assessments, direct attainment is 0"));
        } else if (totalWeight <= 0.0) {
            warnings.add(new AttainmentWarning(AttainmentWarnings.CONFIG_INCONSISTENCY, scopeKey, "category_weights",
                    "Weights of the existing assessment categories sum to 0, direct attainment is 0"));
        }

        Map<AssessmentCategory, Map<String, Double>> sums = new EnumMap<>(AssessmentCategory.class);
        for (CoAssessmentAttainment row : rows) {
            sums.computeIfAbsent(row.category(), k -> new TreeMap<>())
                    .merge(row.coId(), row.percentage(), Double::sum);
        }
        Map<AssessmentCategory, Map<String, Integer>> exclusions = new EnumMap<>(AssessmentCategory.class);
        for (ExcludedOutcome x : excluded) {
            exclusions.computeIfAbsent(x.category(), k -> new TreeMap<>()).merge(x.coId(), 1, Integer::sum);
        }

        List<DirectCoAttainment> out = new ArrayList<>();
        for (String coId : new TreeSet<>(coIds)) {
            double weighted = 0.0;
            double coWeight = 0.0;
            boolean excludedSomewhere = false;
            for (AssessmentCategory category : present) {
                int excludedIn = exclusions.getOrDefault(category, Map.of()).getOrDefault(coId, 0);
                int counted = assessmentsPerCategory.get(category) - excludedIn;
                excludedSomewhere |= excludedIn > 0;
                if (counted <= 0) continue;
                double categoryPercentage = sums.getOrDefault(category, Map.of()).getOrDefault(coId, 0.0) / counted;
                weighted += governance.categoryWeight(category) * categoryPercentage;
                coWeight += governance.categoryWeight(category);
            }

            double percentage = 0.0;
            if (coWeight > 0.0) {
                percentage = Scores.round(weighted / coWeight);
            } else if (excludedSomewhere && totalWeight > 0.0) {
                warnings.add(new AttainmentWarning(AttainmentWarnings.EMPTY_DENOMINATOR, scopeKey, coId,
                        "Outcome has no assessed marks in any category, direct attainment is 0"));
            }
            out.add(new DirectCoAttainment(coId, percentage, classifier.classify(percentage, governance.levelThresholds())));
        }
        return out;
    }
}
