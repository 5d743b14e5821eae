package com.herzen.obe;

import com.herzen.obe.domain.DomainModels.Assessment;
import com.herzen.obe.domain.DomainModels.AssessmentCategory;
import com.herzen.obe.domain.DomainModels.AssessmentComponent;
import com.herzen.obe.domain.DomainModels.SurveySummary;
import com.herzen.obe.repository.CourseSetupJdbcRepository;
import com.herzen.obe.service.CourseSetupService;
import com.herzen.obe.service.SemesterService;
import com.herzen.obe.validation.IntakeModels.*;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class CourseSetupServiceTest {
    @Autowired
    private CourseSetupService setupService;

    @Autowired
    private SemesterService semesterService;

    @Autowired
    private CourseSetupJdbcRepository repository;

    @Test
    void rejectsComponentsWithoutKnownOutcome() {
        String course = CourseFixture.uniqueId("CS");
        CourseFixture.seedCourse(setupService, course, "BTECH", CourseFixture.uniqueId("S"));

        IntakeResult result = setupService.registerAssessment(new AssessmentRequest(course + "-IA1B", course, AssessmentCategory.IA1, 10,
                List.of(new ComponentIn("1", "CO9", 5), new ComponentIn("2", "", 5))));

        assertFalse(result.accepted());
        List<String> codes = result.issues().stream().map(IntakeIssue::code).toList();
        assertTrue(codes.contains("CO_NOT_FOUND"));
        assertTrue(codes.contains("MISSING_CO_MAPPING"));
        assertTrue(repository.findAssessment(course + "-IA1B").isEmpty());
    }

    @Test
    void rejectsMarksAboveComponentMaximum() {
        String course = CourseFixture.uniqueId("CS");
        CourseFixture.seedCourse(setupService, course, "BTECH", CourseFixture.uniqueId("S"));

        IntakeResult result = setupService.uploadMarks(new MarksRequest(course + "-IA2", List.of(
                new MarkIn("s1", "1", 25.0), new MarkIn("s2", "9", 3.0))));

        assertFalse(result.accepted());
        assertEquals(List.of("INVALID_MARK", "COMPONENT_NOT_FOUND"), result.issues().stream().map(IntakeIssue::code).toList());
        assertEquals(3, repository.loadMarks(course).stream().filter(m -> m.assessmentId().equals(course + "-IA2")).count());
    }

    @Test
    void surveySummaryIsWriteOnce() {
        String course = CourseFixture.uniqueId("CS");
        CourseFixture.seedCourse(setupService, course, "BTECH", CourseFixture.uniqueId("S"));

        IntakeResult again = setupService.uploadSurvey(new SurveyRequest(course, "CO1", 10, 0, 0, 0, 10));

        assertFalse(again.accepted());
        assertEquals("SURVEY_IMMUTABLE", again.issues().get(0).code());
        assertEquals(2, repository.loadSurveys(course).get(0).stronglyAgree());
    }

    @Test
    void talliesLikertResponses() {
        String course = CourseFixture.uniqueId("CS");
        CourseFixture.seedCourse(setupService, course, "BTECH", CourseFixture.uniqueId("S"));

        IntakeResult invalid = setupService.tallySurvey(new SurveyResponsesRequest(course, "CO2", List.of("Agree", "Maybe")));
        assertFalse(invalid.accepted());
        assertEquals("INVALID_RESPONSE", invalid.issues().get(0).code());

        IntakeResult result = setupService.tallySurvey(new SurveyResponsesRequest(course, "CO2",
                List.of("Strongly Agree", "agree", " Neutral ", "DISAGREE", "", "Agree")));
        assertTrue(result.accepted());

        SurveySummary summary = repository.loadSurveys(course).stream()
                .filter(s -> s.coId().equals("CO2"))
                .findFirst().orElseThrow();
        assertEquals(1, summary.stronglyAgree());
        assertEquals(2, summary.agree());
        assertEquals(1, summary.neutral());
        assertEquals(1, summary.disagree());
        assertEquals(5, summary.totalRespondents());
    }

    @Test
    void refusesIntakeIntoLockedSemester() {
        String course = CourseFixture.uniqueId("CS");
        String semester = CourseFixture.uniqueId("S");
        CourseFixture.seedCourse(setupService, course, "BTECH", semester);
        semesterService.lock(semester);

        IntakeResult result = setupService.uploadMarks(new MarksRequest(course + "-IA2", List.of(new MarkIn("s1", "1", 20.0))));

        assertFalse(result.accepted());
        assertEquals("SEMESTER_LOCKED", result.issues().get(0).code());
        assertTrue(semesterService.status(semester).locked());

        IntakeResult survey = setupService.uploadSurvey(new SurveyRequest(course, "CO2", 1, 1, 0, 0, 2));
        IntakeResult tally = setupService.tallySurvey(new SurveyResponsesRequest(course, "CO2", List.of("Agree", "Neutral")));
        IntakeResult enrollment = setupService.enroll(new EnrollmentRequest(course, List.of("s9")));
        for (IntakeResult refused : List.of(survey, tally, enrollment)) {
            assertFalse(refused.accepted());
            assertTrue(refused.issues().stream().anyMatch(i -> i.code().equals("SEMESTER_LOCKED")));
        }
        assertEquals(1, repository.loadSurveys(course).size());
        assertFalse(repository.loadEnrollment(course).contains("s9"));
    }

    @Test
    void failedComponentReplacementKeepsPreviousComponents() {
        String course = CourseFixture.uniqueId("CS");
        CourseFixture.seedCourse(setupService, course, "BTECH", CourseFixture.uniqueId("S"));
        String assessmentId = course + "-END";

        assertThrows(DataAccessException.class, () -> repository.replaceAssessment(
                new Assessment(assessmentId, course, AssessmentCategory.END, 40),
                List.of(new AssessmentComponent(assessmentId, "1", "CO1", 30),
                        new AssessmentComponent(assessmentId, "1", "CO2", 10))));

        List<AssessmentComponent> components = repository.loadAssessmentComponents(assessmentId);
        assertEquals(2, components.size());
        assertEquals(20.0, components.get(0).maxMarks());
    }

    @Test
    void keepsReferencedOutcomesImmutable() {
        String course = CourseFixture.uniqueId("CS");
        String semester = CourseFixture.uniqueId("S");
        CourseFixture.seedCourse(setupService, course, "BTECH", semester);

        IntakeResult changed = setupService.registerCourse(new CourseRequest(course, "BTECH", semester, "Data Structures",
                List.of(new OutcomeIn("CO1", 2, 75.0))));
        IntakeResult unchanged = setupService.registerCourse(new CourseRequest(course, "BTECH", semester, "Data Structures",
                List.of(new OutcomeIn("CO1", 2, 60.0), new OutcomeIn("CO3", 1, 50.0))));

        assertFalse(changed.accepted());
        assertEquals("CO_IMMUTABLE", changed.issues().get(0).code());
        assertTrue(unchanged.accepted());
        assertEquals(3, repository.loadOutcomes(course).size());
    }

    @Test
    void rejectsMappingLevelOutsideRange() {
        String course = CourseFixture.uniqueId("CS");
        CourseFixture.seedCourse(setupService, course, "BTECH", CourseFixture.uniqueId("S"));

        IntakeResult result = setupService.mapOutcomes(new MappingRequest(course, List.of(
                new MappingIn("CO1", "PO1", 4), new MappingIn("CO1", "PO77", 2))));

        assertFalse(result.accepted());
        List<String> codes = result.issues().stream().map(IntakeIssue::code).toList();
        assertTrue(codes.contains("INVALID_LEVEL"));
        assertTrue(codes.contains("PO_NOT_FOUND"));
        assertEquals(3, repository.loadMappings(course).size());
    }
}
