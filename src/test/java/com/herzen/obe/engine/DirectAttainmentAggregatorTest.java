package com.herzen.obe.engine;

import com.herzen.obe.domain.DomainModels.AssessmentCategory;
import com.herzen.obe.engine.EngineModels.AttainmentWarning;
import com.herzen.obe.engine.EngineModels.CoAssessmentAttainment;
import com.herzen.obe.engine.EngineModels.DirectCoAttainment;
import com.herzen.obe.engine.EngineModels.ExcludedOutcome;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DirectAttainmentAggregatorTest {
    private static final String SCOPE = "course:CS101@2024-S1";
    private final DirectAttainmentAggregator aggregator = new DirectAttainmentAggregator(new ThresholdClassifier());

    @Test
    void blendsCategoriesWithGovernanceWeights() {
        List<CoAssessmentAttainment> rows = List.of(
                new CoAssessmentAttainment("IA1-A", AssessmentCategory.IA1, "CO1", 75, 2),
                new CoAssessmentAttainment("IA2-A", AssessmentCategory.IA2, "CO1", 50, 0),
                new CoAssessmentAttainment("END-A", AssessmentCategory.END, "CO1", 40, 0));
        Map<AssessmentCategory, Integer> perCategory = Map.of(
                AssessmentCategory.IA1, 1, AssessmentCategory.IA2, 1, AssessmentCategory.END, 1);

        List<DirectCoAttainment> direct = aggregator.aggregate(SCOPE, List.of("CO1"), perCategory, rows, List.of(),
                EngineFixtures.governance(), new ArrayList<>());

        assertEquals(49.0, direct.get(0).percentage(), 1e-9);
        assertEquals(0, direct.get(0).level());
    }

    @Test
    void renormalizesOverExistingCategories() {
        List<CoAssessmentAttainment> rows = List.of(
                new CoAssessmentAttainment("IA1-A", AssessmentCategory.IA1, "CO1", 80, 2),
                new CoAssessmentAttainment("IA2-A", AssessmentCategory.IA2, "CO1", 60, 1));
        Map<AssessmentCategory, Integer> perCategory = Map.of(AssessmentCategory.IA1, 1, AssessmentCategory.IA2, 1);

        List<DirectCoAttainment> direct = aggregator.aggregate(SCOPE, List.of("CO1"), perCategory, rows, List.of(),
                EngineFixtures.governance(), new ArrayList<>());

        assertEquals(70.0, direct.get(0).percentage(), 1e-9);
        assertEquals(2, direct.get(0).level());
    }

    @Test
    void outcomeMissingFromExistingCategoryCountsAsZero() {
        List<CoAssessmentAttainment> rows = List.of(
                new CoAssessmentAttainment("IA1-A", AssessmentCategory.IA1, "CO1", 100, 3),
                new CoAssessmentAttainment("END-A", AssessmentCategory.END, "CO1", 100, 3),
                new CoAssessmentAttainment("END-A", AssessmentCategory.END, "CO2", 50, 0));
        Map<AssessmentCategory, Integer> perCategory = Map.of(AssessmentCategory.IA1, 1, AssessmentCategory.END, 1);

        List<DirectCoAttainment> direct = aggregator.aggregate(SCOPE, List.of("CO2", "CO1"), perCategory, rows, List.of(),
                EngineFixtures.governance(), new ArrayList<>());

        assertEquals(List.of("CO1", "CO2"), direct.stream().map(DirectCoAttainment::coId).toList());
        assertEquals(100.0, direct.get(0).percentage(), 1e-9);
        assertEquals(37.5, direct.get(1).percentage(), 1e-9);
    }

    @Test
    void averagesSeveralAssessmentsOfOneCategory() {
        List<CoAssessmentAttainment> rows = List.of(
                new CoAssessmentAttainment("END-A", AssessmentCategory.END, "CO1", 40, 0),
                new CoAssessmentAttainment("END-B", AssessmentCategory.END, "CO1", 80, 2));

        List<DirectCoAttainment> direct = aggregator.aggregate(SCOPE, List.of("CO1"), Map.of(AssessmentCategory.END, 2),
                rows, List.of(), EngineFixtures.governance(), new ArrayList<>());

        assertEquals(60.0, direct.get(0).percentage(), 1e-9);
    }

    @Test
    void courseWithoutAssessmentsWarnsAndScoresZero() {
        List<AttainmentWarning> warnings = new ArrayList<>();

        List<DirectCoAttainment> direct = aggregator.aggregate(SCOPE, List.of("CO1"), Map.of(), List.of(), List.of(),
                EngineFixtures.governance(), warnings);

        assertEquals(0.0, direct.get(0).percentage());
        assertEquals(AttainmentWarnings.NO_ASSESSMENTS, warnings.get(0).code());
    }

    @Test
    void excludedOutcomeDropsCategoryWeightInsteadOfScoringZero() {
        List<CoAssessmentAttainment> rows = List.of(
                new CoAssessmentAttainment("END-A", AssessmentCategory.END, "CO1", 100, 3),
                new CoAssessmentAttainment("IA1-A", AssessmentCategory.IA1, "CO2", 50, 0),
                new CoAssessmentAttainment("END-A", AssessmentCategory.END, "CO2", 50, 0));
        List<ExcludedOutcome> excluded = List.of(new ExcludedOutcome("IA1-A", AssessmentCategory.IA1, "CO1"));
        Map<AssessmentCategory, Integer> perCategory = Map.of(AssessmentCategory.IA1, 1, AssessmentCategory.END, 1);

        List<DirectCoAttainment> direct = aggregator.aggregate(SCOPE, List.of("CO1", "CO2"), perCategory, rows, excluded,
                EngineFixtures.governance(), new ArrayList<>());

        assertEquals(100.0, direct.get(0).percentage(), 1e-9);
        assertEquals(3, direct.get(0).level());
        assertEquals(50.0, direct.get(1).percentage(), 1e-9);
    }

    @Test
    void excludedAssessmentLeavesCategoryAverage() {
        List<CoAssessmentAttainment> rows = List.of(
                new CoAssessmentAttainment("END-B", AssessmentCategory.END, "CO1", 80, 2));
        List<ExcludedOutcome> excluded = List.of(new ExcludedOutcome("END-A", AssessmentCategory.END, "CO1"));

        List<DirectCoAttainment> direct = aggregator.aggregate(SCOPE, List.of("CO1"), Map.of(AssessmentCategory.END, 2),
                rows, excluded, EngineFixtures.governance(), new ArrayList<>());

        assertEquals(80.0, direct.get(0).percentage(), 1e-9);
    }

    @Test
    void outcomeExcludedEverywhereScoresZeroWithWarning() {
        List<AttainmentWarning> warnings = new ArrayList<>();

        List<DirectCoAttainment> direct = aggregator.aggregate(SCOPE, List.of("CO1"), Map.of(AssessmentCategory.IA1, 1),
                List.of(), List.of(new ExcludedOutcome("IA1-A", AssessmentCategory.IA1, "CO1")),
                EngineFixtures.governance(), warnings);

        assertEquals(0.0, direct.get(0).percentage());
        assertEquals(AttainmentWarnings.EMPTY_DENOMINATOR, warnings.get(0).code());
    }
}
