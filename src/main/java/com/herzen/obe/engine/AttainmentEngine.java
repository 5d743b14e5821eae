package com.herzen.obe.engine;

import com.herzen.obe.domain.DomainModels.*;
import com.herzen.obe.engine.EngineModels.*;
import com.herzen.obe.exception.LockedScopeException;
import com.herzen.obe.governance.GovernanceModels.GovernanceSnapshot;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Runs the attainment pipeline for one scope: per-assessment CO scores, direct and indirect CO
 * scores, final CO values, course PO values, CQI decisions. Pure over its arguments; the same
 * input and snapshot always give an equal result.
 */
@Component
public class AttainmentEngine {
    private static final double WEIGHT_TOLERANCE = 1e-6;

    private final CoAssessmentScorer assessmentScorer;
    private final DirectAttainmentAggregator directAggregator;
    private final IndirectAttainmentAggregator indirectAggregator;
    private final FinalCoCombiner finalCombiner;
    private final CoursePoProjector coursePoProjector;
    private final ProgramPoAggregator programPoAggregator;
    private final CqiTrigger cqiTrigger;

    public AttainmentEngine(CoAssessmentScorer assessmentScorer,
                            DirectAttainmentAggregator directAggregator,
                            IndirectAttainmentAggregator indirectAggregator,
                            FinalCoCombiner finalCombiner,
                            CoursePoProjector coursePoProjector,
                            ProgramPoAggregator programPoAggregator,
                            CqiTrigger cqiTrigger) {
        this.assessmentScorer = assessmentScorer;
        this.directAggregator = directAggregator;
        this.indirectAggregator = indirectAggregator;
        this.finalCombiner = finalCombiner;
        this.coursePoProjector = coursePoProjector;
        this.programPoAggregator = programPoAggregator;
        this.cqiTrigger = cqiTrigger;
    }

    public CourseAttainmentResult computeCourse(CourseScopeInput input, GovernanceSnapshot governance) {
        CourseScope scope = input.scope();
        String scopeKey = scope.key();
        if (scope.locked()) {
            throw new LockedScopeException(scopeKey, scope.semesterId());
        }

        List<AttainmentWarning> warnings = new ArrayList<>(checkGovernance(scopeKey, governance));
        Map<String, CourseOutcome> outcomes = input.outcomes().stream()
                .collect(Collectors.toMap(CourseOutcome::coId, o -> o, (a, b) -> a, TreeMap::new));

        Map<String, List<AssessmentComponent>> componentsByAssessment = input.components().stream()
                .collect(Collectors.groupingBy(AssessmentComponent::assessmentId));
        Map<String, List<StudentMark>> marksByAssessment = input.marks().stream()
                .collect(Collectors.groupingBy(StudentMark::assessmentId));
        List<Assessment> assessments = input.assessments().stream()
                .sorted(Comparator.comparing(Assessment::category).thenComparing(Assessment::assessmentId))
                .toList();

        List<CoAssessmentAttainment> assessmentRows = new ArrayList<>();
        List<ExcludedOutcome> excluded = new ArrayList<>();
        Map<AssessmentCategory, Integer> perCategory = new EnumMap<>(AssessmentCategory.class);
        for (Assessment assessment : assessments) {
            perCategory.merge(assessment.category(), 1, Integer::sum);
            AssessmentScoringInput scoringInput = new AssessmentScoringInput(assessment,
                    componentsByAssessment.getOrDefault(assessment.assessmentId(), List.of()),
                    marksByAssessment.getOrDefault(assessment.assessmentId(), List.of()),
                    input.enrolledStudents());
            assessmentRows.addAll(assessmentScorer.score(scopeKey, scoringInput, outcomes,
                    governance.levelThresholds(), excluded, warnings));
        }

        List<DirectCoAttainment> direct = directAggregator.aggregate(scopeKey, outcomes.keySet(), perCategory,
                assessmentRows, excluded, governance, warnings);
        Map<String, Double> indirect = indirectAggregator.scoreAll(scopeKey, input.surveys(), warnings);

        List<CoFinalAttainment> finals = direct.stream()
                .map(d -> finalCombiner.combine(scopeKey, d, indirect.get(d.coId()), governance, warnings))
                .toList();
        Map<String, Double> finalByCo = finals.stream()
                .collect(Collectors.toMap(CoFinalAttainment::coId, CoFinalAttainment::finalValue, (a, b) -> a, TreeMap::new));

        List<CoursePoAttainment> coursePos = coursePoProjector.project(scopeKey, scope.courseId(), finalByCo,
                input.mappings(), governance.levelThresholds());
        List<CqiActionRequest> cqi = cqiTrigger.evaluate(scope, finals, governance.poTarget());

        return new CourseAttainmentResult(scope, governance.version(), List.copyOf(assessmentRows), direct, finals,
                coursePos, cqi, List.copyOf(warnings));
    }

    public ProgramAttainmentResult computeProgram(ProgramScopeInput input, GovernanceSnapshot governance) {
        ProgramScope scope = input.scope();
        if (scope.locked()) {
            throw new LockedScopeException(scope.key(), scope.semesterId());
        }
        List<AttainmentWarning> warnings = new ArrayList<>(checkGovernance(scope.key(), governance));
        List<ProgramPoAttainment> rows = programPoAggregator.aggregate(scope, input.coursePos(), governance.levelThresholds());
        return new ProgramAttainmentResult(scope, governance.version(), rows, List.copyOf(warnings));
    }

    public static List<AttainmentWarning> checkGovernance(String scopeKey, GovernanceSnapshot governance) {
        List<AttainmentWarning> warnings = new ArrayList<>();
        double categorySum = governance.ia1Weight() + governance.ia2Weight() + governance.endWeight();
        if (Math.abs(categorySum - 100.0) > WEIGHT_TOLERANCE) {
            warnings.add(new AttainmentWarning(AttainmentWarnings.CONFIG_INCONSISTENCY, scopeKey, "category_weights",
                    "IA1/IA2/END weights sum to " + categorySum + " instead of 100, scaled proportionally"));
        }
        double blendSum = governance.directWeight() + governance.indirectWeight();
        if (Math.abs(blendSum - 1.0) > WEIGHT_TOLERANCE) {
            warnings.add(new AttainmentWarning(AttainmentWarnings.CONFIG_INCONSISTENCY, scopeKey, "blend_weights",
                    "Direct/indirect weights sum to " + blendSum + " instead of 1.0"));
        }
        return warnings;
    }
}
