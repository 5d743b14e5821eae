package com.herzen.obe.validation;

import com.herzen.obe.domain.DomainModels.AssessmentCategory;

import java.util.List;

public class IntakeModels {
    public record CourseRequest(String courseId, String programId, String semesterId, String title, List<OutcomeIn> outcomes) {}

    public record OutcomeIn(String coId, Integer bloomLevel, Double expectedProficiency) {}

    public record ProgramOutcomeIn(String poId, String description) {}

    public record AssessmentRequest(String assessmentId,
                                    String courseId,
                                    AssessmentCategory category,
                                    double maxMarks,
                                    List<ComponentIn> components) {}

    public record ComponentIn(String componentNumber, String coId, double maxMarks) {}

    public record MarksRequest(String assessmentId, List<MarkIn> marks) {}

    public record MarkIn(String studentId, String componentNumber, Double mark) {}

    public record EnrollmentRequest(String courseId, List<String> studentIds) {}

    public record MappingRequest(String courseId, List<MappingIn> mappings) {}

    public record MappingIn(String coId, String poId, int level) {}

    public record SurveyRequest(String courseId,
                                String coId,
                                int stronglyAgree,
                                int agree,
                                int neutral,
                                int disagree,
                                int totalRespondents) {}

    public record SurveyResponsesRequest(String courseId, String coId, List<String> responses) {}

    public record IntakeIssue(String code, String message, String entity, String entityId) {}

    public record IntakeResult(boolean accepted, int records, List<IntakeIssue> issues) {}
}
