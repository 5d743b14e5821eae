package com.herzen.obe.service;

import com.herzen.obe.domain.DomainModels.*;
import com.herzen.obe.repository.CourseSetupJdbcRepository;
import com.herzen.obe.repository.SemesterJdbcRepository;
import com.herzen.obe.validation.IntakeModels.*;
import com.herzen.obe.validation.IntakeValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

@Slf4j
@Service
public class CourseSetupService {
    private final CourseSetupJdbcRepository repository;
    private final SemesterJdbcRepository semesterRepository;
    private final IntakeValidator validator;

    public CourseSetupService(CourseSetupJdbcRepository repository,
                              SemesterJdbcRepository semesterRepository,
                              IntakeValidator validator) {
        this.repository = repository;
        this.semesterRepository = semesterRepository;
        this.validator = validator;
    }

    public IntakeResult registerCourse(CourseRequest request) {
        List<IntakeIssue> issues = new ArrayList<>(validator.validateCourse(request));
        List<OutcomeIn> outcomes = request.outcomes() == null ? List.of() : request.outcomes();
        if (issues.isEmpty()) {
            lockedSemester(request.semesterId(), request.courseId()).ifPresent(issues::add);
        }
        if (issues.isEmpty()) {
            Map<String, CourseOutcome> existing = new HashMap<>();
            repository.loadOutcomes(request.courseId()).forEach(o -> existing.put(o.coId(), o));
            for (OutcomeIn o : outcomes) {
                CourseOutcome current = existing.get(o.coId());
                if (current != null && !current.equals(toOutcome(request.courseId(), o))
                        && repository.isOutcomeReferenced(request.courseId(), o.coId())) {
                    issues.add(new IntakeIssue("CO_IMMUTABLE", "Outcome is referenced by assessments and cannot be redefined", "outcome", o.coId()));
                }
            }
        }
        if (!issues.isEmpty()) return rejected("course", request.courseId(), issues);

        repository.upsertCourse(new Course(request.courseId(), request.programId(), request.semesterId(), request.title()));
        outcomes.forEach(o -> repository.upsertOutcome(toOutcome(request.courseId(), o)));
        log.info("Registered course {} with {} outcomes", request.courseId(), outcomes.size());
        return new IntakeResult(true, outcomes.size(), List.of());
    }

    public IntakeResult registerProgramOutcomes(List<ProgramOutcomeIn> outcomes) {
        List<IntakeIssue> issues = new ArrayList<>();
        outcomes.forEach(po -> {
            if (po.poId() == null || po.poId().isBlank()) {
                issues.add(new IntakeIssue("MISSING_FIELD", "poId is required", "program_outcome", null));
            }
        });
        if (!issues.isEmpty()) return rejected("program_outcome", null, issues);
        outcomes.forEach(po -> repository.upsertProgramOutcome(new ProgramOutcome(po.poId(), po.description())));
        return new IntakeResult(true, outcomes.size(), List.of());
    }

    public IntakeResult registerAssessment(AssessmentRequest request) {
        Optional<Course> course = repository.findCourse(request.courseId());
        if (course.isEmpty()) {
            return rejected("assessment", request.assessmentId(),
                    List.of(new IntakeIssue("COURSE_NOT_FOUND", "Unknown course " + request.courseId(), "assessment", request.assessmentId())));
        }
        List<IntakeIssue> issues = new ArrayList<>(validator.validateAssessment(request, repository.loadOutcomes(request.courseId())));
        repository.findAssessment(request.assessmentId())
                .filter(a -> !a.courseId().equals(request.courseId()))
                .ifPresent(a -> issues.add(new IntakeIssue("ASSESSMENT_CONFLICT",
                        "Assessment already belongs to course " + a.courseId(), "assessment", request.assessmentId())));
        lockedSemester(course.get().semesterId(), request.courseId()).ifPresent(issues::add);
        if (!issues.isEmpty()) return rejected("assessment", request.assessmentId(), issues);

        List<AssessmentComponent> components = request.components().stream()
                .map(c -> new AssessmentComponent(request.assessmentId(), c.componentNumber(), c.coId(), c.maxMarks()))
                .toList();
        repository.replaceAssessment(new Assessment(request.assessmentId(), request.courseId(), request.category(), request.maxMarks()), components);
        log.info("Registered assessment {} ({}) with {} components", request.assessmentId(), request.category(), components.size());
        return new IntakeResult(true, components.size(), List.of());
    }

    /**
     * Replaces all marks of an assessment. Blank marks are not stored and count as 0.
     */
    public IntakeResult uploadMarks(MarksRequest request) {
        Optional<Assessment> assessment = repository.findAssessment(request.assessmentId());
        if (assessment.isEmpty()) {
            return rejected("marks", request.assessmentId(),
                    List.of(new IntakeIssue("ASSESSMENT_NOT_FOUND", "Unknown assessment " + request.assessmentId(), "marks", request.assessmentId())));
        }
        List<IntakeIssue> issues = new ArrayList<>(validator.validateMarks(request,
                repository.loadAssessmentComponents(request.assessmentId())));
        repository.findCourse(assessment.get().courseId())
                .flatMap(c -> lockedSemester(c.semesterId(), c.courseId()))
                .ifPresent(issues::add);
        if (!issues.isEmpty()) return rejected("marks", request.assessmentId(), issues);

        List<StudentMark> marks = request.marks().stream()
                .filter(m -> m.mark() != null)
                .map(m -> new StudentMark(m.studentId(), request.assessmentId(), m.componentNumber(), m.mark()))
                .toList();
        repository.replaceMarks(request.assessmentId(), marks);
        log.info("Stored {} marks for assessment {}", marks.size(), request.assessmentId());
        return new IntakeResult(true, marks.size(), List.of());
    }

    public IntakeResult enroll(EnrollmentRequest request) {
        Optional<Course> course = repository.findCourse(request.courseId());
        if (course.isEmpty()) {
            return rejected("enrollment", request.courseId(),
                    List.of(new IntakeIssue("COURSE_NOT_FOUND", "Unknown course " + request.courseId(), "enrollment", request.courseId())));
        }
        Optional<IntakeIssue> locked = lockedSemester(course.get().semesterId(), request.courseId());
        if (locked.isPresent()) return rejected("enrollment", request.courseId(), List.of(locked.get()));
        Set<String> students = new TreeSet<>();
        if (request.studentIds() != null) {
            request.studentIds().stream().filter(s -> s != null && !s.isBlank()).map(String::trim).forEach(students::add);
        }
        repository.replaceEnrollment(request.courseId(), students);
        return new IntakeResult(true, students.size(), List.of());
    }

    public IntakeResult mapOutcomes(MappingRequest request) {
        Optional<Course> course = repository.findCourse(request.courseId());
        if (course.isEmpty()) {
            return rejected("mapping", request.courseId(),
                    List.of(new IntakeIssue("COURSE_NOT_FOUND", "Unknown course " + request.courseId(), "mapping", request.courseId())));
        }
        List<IntakeIssue> issues = new ArrayList<>(validator.validateMappings(request,
                repository.loadOutcomes(request.courseId()), repository.loadProgramOutcomeIds()));
        lockedSemester(course.get().semesterId(), request.courseId()).ifPresent(issues::add);
        if (!issues.isEmpty()) return rejected("mapping", request.courseId(), issues);

        List<CoPoMapping> mappings = request.mappings().stream()
                .map(m -> new CoPoMapping(request.courseId(), m.coId(), m.poId(), m.level()))
                .toList();
        repository.replaceMappings(request.courseId(), mappings);
        return new IntakeResult(true, mappings.size(), List.of());
    }

    /**
     * Stores a survey summary. Summaries are read-only once stored.
     */
    public IntakeResult uploadSurvey(SurveyRequest request) {
        Optional<Course> course = repository.findCourse(request.courseId());
        if (course.isEmpty()) {
            return rejected("survey", request.coId(),
                    List.of(new IntakeIssue("COURSE_NOT_FOUND", "Unknown course " + request.courseId(), "survey", request.coId())));
        }
        List<IntakeIssue> issues = new ArrayList<>(validator.validateSurvey(request, repository.loadOutcomes(request.courseId())));
        if (repository.surveyExists(request.courseId(), request.coId())) {
            issues.add(new IntakeIssue("SURVEY_IMMUTABLE", "Survey summary already uploaded for this outcome", "survey", request.coId()));
        }
        lockedSemester(course.get().semesterId(), request.courseId()).ifPresent(issues::add);
        if (!issues.isEmpty()) return rejected("survey", request.coId(), issues);

        repository.insertSurvey(new SurveySummary(request.courseId(), request.coId(), request.stronglyAgree(), request.agree(),
                request.neutral(), request.disagree(), request.totalRespondents()));
        return new IntakeResult(true, 1, List.of());
    }

    /**
     * Tallies individual Likert answers into a survey summary and stores it. Blank answers are skipped.
     */
    public IntakeResult tallySurvey(SurveyResponsesRequest request) {
        EnumMap<LikertResponse, Integer> counts = new EnumMap<>(LikertResponse.class);
        List<IntakeIssue> issues = new ArrayList<>();
        List<String> responses = request.responses() == null ? List.of() : request.responses();
        for (int i = 0; i < responses.size(); i++) {
            String raw = responses.get(i);
            if (raw == null || raw.isBlank()) continue;
            int row = i + 1;
            LikertResponse.fromLabel(raw).ifPresentOrElse(
                    r -> counts.merge(r, 1, Integer::sum),
                    () -> issues.add(new IntakeIssue("INVALID_RESPONSE", "Response " + row + " is not a Likert answer: \"" + raw + "\"",
                            "survey", request.coId())));
        }
        if (!issues.isEmpty()) return rejected("survey", request.coId(), issues);

        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        return uploadSurvey(new SurveyRequest(request.courseId(), request.coId(),
                counts.getOrDefault(LikertResponse.STRONGLY_AGREE, 0),
                counts.getOrDefault(LikertResponse.AGREE, 0),
                counts.getOrDefault(LikertResponse.NEUTRAL, 0),
                counts.getOrDefault(LikertResponse.DISAGREE, 0),
                total));
    }

    private Optional<IntakeIssue> lockedSemester(String semesterId, String courseId) {
        if (semesterId != null && semesterRepository.isLocked(semesterId)) {
            return Optional.of(new IntakeIssue("SEMESTER_LOCKED", "Semester " + semesterId + " is locked", "course", courseId));
        }
        return Optional.empty();
    }

    private CourseOutcome toOutcome(String courseId, OutcomeIn o) {
        return new CourseOutcome(courseId, o.coId(), o.bloomLevel(),
                o.expectedProficiency() == null ? CourseOutcome.DEFAULT_EXPECTED_PROFICIENCY : o.expectedProficiency());
    }

    private IntakeResult rejected(String entity, String id, List<IntakeIssue> issues) {
        log.warn("Rejected {} {}: {} issue(s)", entity, id, issues.size());
        return new IntakeResult(false, 0, issues);
    }
}
