package com.herzen.obe.domain;

import java.util.Arrays;
import java.util.Optional;

public class DomainModels {
    public record Course(String courseId, String programId, String semesterId, String title) {}

    public record Semester(String semesterId, boolean locked) {}

    public record CourseOutcome(String courseId, String coId, Integer bloomLevel, double expectedProficiency) {
        public static final double DEFAULT_EXPECTED_PROFICIENCY = 60.0;
    }

    public record ProgramOutcome(String poId, String description) {}

    public record Assessment(String assessmentId, String courseId, AssessmentCategory category, double maxMarks) {}

    public record AssessmentComponent(String assessmentId, String componentNumber, String coId, double maxMarks) {}

    public record StudentMark(String studentId, String assessmentId, String componentNumber, double mark) {}

    public record SurveySummary(String courseId,
                                String coId,
                                int stronglyAgree,
                                int agree,
                                int neutral,
                                int disagree,
                                int totalRespondents) {
        public int countedResponses() {
            return stronglyAgree + agree + neutral + disagree;
        }
    }

    public record CoPoMapping(String courseId, String coId, String poId, int level) {}

    public enum AssessmentCategory { IA1, IA2, END }

    public enum LikertResponse {
        STRONGLY_AGREE("Strongly Agree", 3),
        AGREE("Agree", 2),
        NEUTRAL("Neutral", 1),
        DISAGREE("Disagree", 0);

        private final String label;
        private final int score;

        LikertResponse(String label, int score) {
            this.label = label;
            this.score = score;
        }

        public String label() {
            return label;
        }

        public int score() {
            return score;
        }

        public static Optional<LikertResponse> fromLabel(String value) {
            if (value == null) return Optional.empty();
            String normalized = value.trim().replaceAll("\\s+", " ");
            return Arrays.stream(values())
                    .filter(r -> r.label.equalsIgnoreCase(normalized) || r.name().equalsIgnoreCase(normalized))
                    .findFirst();
        }
    }
}
