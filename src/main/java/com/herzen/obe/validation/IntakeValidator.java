package com.herzen.obe.validation;

import com.herzen.obe.domain.DomainModels.AssessmentComponent;
import com.herzen.obe.domain.DomainModels.CourseOutcome;
import com.herzen.obe.validation.IntakeModels.*;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Checks structured intake records before they are stored. Issues carry the entity and id so the
 * offending row can be located.
 */
@Component
public class IntakeValidator {

    public List<IntakeIssue> validateCourse(CourseRequest request) {
        List<IntakeIssue> issues = new ArrayList<>();
        require(request.courseId(), "course", "courseId", issues);
        require(request.programId(), "course", "programId", issues);
        require(request.semesterId(), "course", "semesterId", issues);
        List<OutcomeIn> outcomes = request.outcomes() == null ? List.of() : request.outcomes();

        duplicate(outcomes.stream().map(o -> new Row(o.coId(), "outcome")).toList(), "DUPLICATE_OUTCOME", issues);
        outcomes.forEach(o -> {
            if (o.coId() == null || o.coId().isBlank()) {
                issues.add(new IntakeIssue("MISSING_FIELD", "Outcome id is required", "outcome", request.courseId()));
            }
            if (o.expectedProficiency() != null && (o.expectedProficiency() < 0 || o.expectedProficiency() > 100)) {
                issues.add(new IntakeIssue("INVALID_PROFICIENCY", "Expected proficiency must be within 0..100: " + o.expectedProficiency(),
                        "outcome", o.coId()));
            }
        });
        return issues;
    }

    public List<IntakeIssue> validateAssessment(AssessmentRequest request, Collection<CourseOutcome> outcomes) {
        List<IntakeIssue> issues = new ArrayList<>();
        require(request.assessmentId(), "assessment", "assessmentId", issues);
        if (request.category() == null) {
            issues.add(new IntakeIssue("MISSING_FIELD", "Assessment category is required (IA1, IA2, END)", "assessment", request.assessmentId()));
        }
        if (request.maxMarks() < 0) {
            issues.add(new IntakeIssue("INVALID_MAX_MARKS", "Assessment max marks must not be negative", "assessment", request.assessmentId()));
        }

        List<ComponentIn> components = request.components() == null ? List.of() : request.components();
        if (components.isEmpty()) {
            issues.add(new IntakeIssue("NO_COMPONENTS", "Assessment has no components defined", "assessment", request.assessmentId()));
        }
        duplicate(components.stream().map(c -> new Row(c.componentNumber(), "component")).toList(), "DUPLICATE_COMPONENT", issues);

        Set<String> coIds = outcomes.stream().map(CourseOutcome::coId).collect(Collectors.toSet());
        components.forEach(c -> {
            if (c.coId() == null || c.coId().isBlank()) {
                issues.add(new IntakeIssue("MISSING_CO_MAPPING", "Component is not mapped to a course outcome", "component", c.componentNumber()));
            } else if (!coIds.contains(c.coId())) {
                issues.add(new IntakeIssue("CO_NOT_FOUND", "Component references unknown course outcome: " + c.coId(), "component", c.componentNumber()));
            }
            if (c.maxMarks() < 0) {
                issues.add(new IntakeIssue("INVALID_MAX_MARKS", "Component max marks must not be negative", "component", c.componentNumber()));
            }
        });
        return issues;
    }

    public List<IntakeIssue> validateMarks(MarksRequest request, List<AssessmentComponent> components) {
        List<IntakeIssue> issues = new ArrayList<>();
        Map<String, AssessmentComponent> byNumber = components.stream()
                .collect(Collectors.toMap(AssessmentComponent::componentNumber, c -> c, (a, b) -> a));
        List<MarkIn> marks = request.marks() == null ? List.of() : request.marks();

        duplicate(marks.stream().map(m -> new Row(m.studentId() + "/" + m.componentNumber(), "mark")).toList(), "DUPLICATE_MARK", issues);
        marks.forEach(m -> {
            String rowId = m.studentId() + "/" + m.componentNumber();
            AssessmentComponent component = byNumber.get(m.componentNumber());
            if (m.studentId() == null || m.studentId().isBlank()) {
                issues.add(new IntakeIssue("MISSING_FIELD", "Student id is required", "mark", rowId));
            }
            if (component == null) {
                issues.add(new IntakeIssue("COMPONENT_NOT_FOUND", "Unknown component " + m.componentNumber(), "mark", rowId));
            } else if (m.mark() != null && (m.mark() < 0 || m.mark() > component.maxMarks())) {
                issues.add(new IntakeIssue("INVALID_MARK", "Mark " + m.mark() + " outside 0.." + component.maxMarks(), "mark", rowId));
            }
        });
        return issues;
    }

    public List<IntakeIssue> validateMappings(MappingRequest request, Collection<CourseOutcome> outcomes, Set<String> programOutcomes) {
        List<IntakeIssue> issues = new ArrayList<>();
        Set<String> coIds = outcomes.stream().map(CourseOutcome::coId).collect(Collectors.toSet());
        List<MappingIn> mappings = request.mappings() == null ? List.of() : request.mappings();

        duplicate(mappings.stream().map(m -> new Row(m.coId() + "->" + m.poId(), "mapping")).toList(), "DUPLICATE_MAPPING", issues);
        mappings.forEach(m -> {
            String rowId = m.coId() + "->" + m.poId();
            if (!coIds.contains(m.coId())) {
                issues.add(new IntakeIssue("CO_NOT_FOUND", "Mapping references unknown course outcome: " + m.coId(), "mapping", rowId));
            }
            if (!programOutcomes.contains(m.poId())) {
                issues.add(new IntakeIssue("PO_NOT_FOUND", "Mapping references unknown program outcome: " + m.poId(), "mapping", rowId));
            }
            if (m.level() < 1 || m.level() > 3) {
                issues.add(new IntakeIssue("INVALID_LEVEL", "Mapping level must be 1, 2 or 3: " + m.level(), "mapping", rowId));
            }
        });
        return issues;
    }

    public List<IntakeIssue> validateSurvey(SurveyRequest request, Collection<CourseOutcome> outcomes) {
        List<IntakeIssue> issues = new ArrayList<>();
        if (outcomes.stream().noneMatch(o -> o.coId().equals(request.coId()))) {
            issues.add(new IntakeIssue("CO_NOT_FOUND", "Survey references unknown course outcome: " + request.coId(), "survey", request.coId()));
        }
        if (request.stronglyAgree() < 0 || request.agree() < 0 || request.neutral() < 0 || request.disagree() < 0
                || request.totalRespondents() < 0) {
            issues.add(new IntakeIssue("NEGATIVE_COUNT", "Survey counts must not be negative", "survey", request.coId()));
        }
        return issues;
    }

    private void require(String value, String entity, String field, List<IntakeIssue> issues) {
        if (value == null || value.isBlank()) {
            issues.add(new IntakeIssue("MISSING_FIELD", field + " is required", entity, null));
        }
    }

    private void duplicate(List<Row> rows, String code, List<IntakeIssue> issues) {
        Map<String, Long> counts = rows.stream()
                .filter(r -> r.id() != null)
                .collect(Collectors.groupingBy(Row::id, Collectors.counting()));
        counts.forEach((id, count) -> {
            if (count > 1) {
                String entity = rows.get(0).entity();
                issues.add(new IntakeIssue(code, "Duplicate " + entity + " id: " + id, entity, id));
            }
        });
    }

    private record Row(String id, String entity) {}
}
