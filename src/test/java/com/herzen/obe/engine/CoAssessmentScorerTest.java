package com.herzen.obe.engine;

import com.herzen.obe.domain.DomainModels.*;
import com.herzen.obe.engine.EngineModels.AssessmentScoringInput;
import com.herzen.obe.engine.EngineModels.AttainmentWarning;
import com.herzen.obe.engine.EngineModels.CoAssessmentAttainment;
import com.herzen.obe.engine.EngineModels.ExcludedOutcome;
import com.herzen.obe.exception.IncompleteMappingException;
import com.herzen.obe.exception.InvalidMarkException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.herzen.obe.engine.EngineFixtures.mark;
import static com.herzen.obe.engine.EngineFixtures.outcome;
import static org.junit.jupiter.api.Assertions.*;

class CoAssessmentScorerTest {
    private static final String SCOPE = "course:CS101@2024-S1";
    private static final Assessment IA1 = new Assessment("IA1-A", "CS101", AssessmentCategory.IA1, 20);

    private final CoAssessmentScorer scorer = new CoAssessmentScorer(new ThresholdClassifier());
    private final Map<String, CourseOutcome> outcomes = Map.of("CO1", outcome("CO1"), "CO2", outcome("CO2"));

    @Test
    void countsStudentsReachingExpectedProficiency() {
        List<AssessmentComponent> components = List.of(
                new AssessmentComponent("IA1-A", "1", "CO1", 10),
                new AssessmentComponent("IA1-A", "2", "CO1", 10));
        List<StudentMark> marks = List.of(
                mark("s1", "IA1-A", "1", 10), mark("s1", "IA1-A", "2", 5),
                mark("s2", "IA1-A", "1", 5), mark("s2", "IA1-A", "2", 5),
                mark("s3", "IA1-A", "1", 5));
        List<AttainmentWarning> warnings = new ArrayList<>();

        List<CoAssessmentAttainment> rows = scorer.score(SCOPE,
                new AssessmentScoringInput(IA1, components, marks, Set.of("s1", "s2", "s3")),
                outcomes, EngineFixtures.THRESHOLDS, new ArrayList<>(), warnings);

        assertEquals(1, rows.size());
        assertEquals("CO1", rows.get(0).coId());
        assertEquals(33.3333, rows.get(0).percentage(), 1e-9);
        assertEquals(0, rows.get(0).level());
        assertTrue(warnings.isEmpty());
    }

    @Test
    void enrolledStudentWithoutMarksCountsAsZero() {
        List<AssessmentComponent> components = List.of(new AssessmentComponent("IA1-A", "1", "CO1", 10));
        List<StudentMark> marks = List.of(mark("s1", "IA1-A", "1", 8));

        List<CoAssessmentAttainment> rows = scorer.score(SCOPE,
                new AssessmentScoringInput(IA1, components, marks, Set.of("s1", "s2")),
                outcomes, EngineFixtures.THRESHOLDS, new ArrayList<>(), new ArrayList<>());

        assertEquals(50.0, rows.get(0).percentage(), 1e-9);
    }

    @Test
    void rejectsComponentWithoutOutcome() {
        List<AssessmentComponent> components = List.of(
                new AssessmentComponent("IA1-A", "1", "CO1", 10),
                new AssessmentComponent("IA1-A", "2", null, 10),
                new AssessmentComponent("IA1-A", "3", "CO9", 10));

        IncompleteMappingException e = assertThrows(IncompleteMappingException.class, () -> scorer.score(SCOPE,
                new AssessmentScoringInput(IA1, components, List.of(), Set.of("s1")),
                outcomes, EngineFixtures.THRESHOLDS, new ArrayList<>(), new ArrayList<>()));
        assertEquals(List.of("2", "3"), e.getComponentNumbers());
        assertEquals("IA1-A", e.getEntityId());
    }

    @Test
    void rejectsWholeAssessmentOnInvalidMarks() {
        List<AssessmentComponent> components = List.of(new AssessmentComponent("IA1-A", "1", "CO1", 10));
        List<StudentMark> marks = List.of(
                mark("s1", "IA1-A", "1", 11),
                mark("s2", "IA1-A", "1", -1),
                mark("s3", "IA1-A", "7", 3),
                mark("s4", "IA1-A", "1", 6));

        InvalidMarkException e = assertThrows(InvalidMarkException.class, () -> scorer.score(SCOPE,
                new AssessmentScoringInput(IA1, components, marks, Set.of()),
                outcomes, EngineFixtures.THRESHOLDS, new ArrayList<>(), new ArrayList<>()));
        assertEquals(3, e.getRows().size());
        assertEquals(List.of("s1", "s2", "s3"), e.getRows().stream().map(InvalidMarkException.InvalidMarkRow::studentId).toList());
    }

    @Test
    void excludesOutcomeWithZeroMaxMarksAndWarns() {
        List<AssessmentComponent> components = List.of(
                new AssessmentComponent("IA1-A", "1", "CO1", 10),
                new AssessmentComponent("IA1-A", "2", "CO2", 0));
        List<AttainmentWarning> warnings = new ArrayList<>();
        List<ExcludedOutcome> excluded = new ArrayList<>();

        List<CoAssessmentAttainment> rows = scorer.score(SCOPE,
                new AssessmentScoringInput(IA1, components, List.of(mark("s1", "IA1-A", "1", 7)), Set.of("s1")),
                outcomes, EngineFixtures.THRESHOLDS, excluded, warnings);

        assertEquals(List.of("CO1"), rows.stream().map(CoAssessmentAttainment::coId).toList());
        assertEquals(100.0, rows.get(0).percentage(), 1e-9);
        assertEquals(AttainmentWarnings.EMPTY_DENOMINATOR, warnings.get(0).code());
        assertEquals(List.of(new ExcludedOutcome("IA1-A", AssessmentCategory.IA1, "CO2")), excluded);
    }

    @Test
    void noStudentsScoresZeroWithWarning() {
        List<AssessmentComponent> components = List.of(new AssessmentComponent("IA1-A", "1", "CO1", 10));
        List<AttainmentWarning> warnings = new ArrayList<>();

        List<CoAssessmentAttainment> rows = scorer.score(SCOPE,
                new AssessmentScoringInput(IA1, components, List.of(), Set.of()),
                outcomes, EngineFixtures.THRESHOLDS, new ArrayList<>(), warnings);

        assertEquals(0.0, rows.get(0).percentage());
        assertFalse(Double.isNaN(rows.get(0).percentage()));
        assertEquals(AttainmentWarnings.NO_STUDENTS, warnings.get(0).code());
    }
}
