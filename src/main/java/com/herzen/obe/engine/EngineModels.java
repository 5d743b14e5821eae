package com.herzen.obe.engine;

import com.herzen.obe.domain.DomainModels.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

public class EngineModels {
    public record CourseScope(String courseId, String semesterId, boolean locked) {
        public String key() {
            return "course:" + courseId + "@" + semesterId;
        }
    }

    public record ProgramScope(String programId, String semesterId, boolean locked) {
        public String key() {
            return "program:" + programId + "@" + semesterId;
        }
    }

    public record CourseScopeInput(CourseScope scope,
                                   List<CourseOutcome> outcomes,
                                   List<Assessment> assessments,
                                   List<AssessmentComponent> components,
                                   List<StudentMark> marks,
                                   Set<String> enrolledStudents,
                                   List<SurveySummary> surveys,
                                   List<CoPoMapping> mappings) {}

    /** Course-PO rows per contributing course, keyed by course id. */
    public record ProgramScopeInput(ProgramScope scope, Map<String, List<CoursePoAttainment>> coursePos) {}

    public record AssessmentScoringInput(Assessment assessment,
                                         List<AssessmentComponent> components,
                                         List<StudentMark> marks,
                                         Set<String> enrolledStudents) {}

    public record AttainmentWarning(String code, String scopeKey, String entityId, String message) {}

    public record CoAssessmentAttainment(String assessmentId, AssessmentCategory category, String coId,
                                         double percentage, int level) {}

    /** Outcome left out of an assessment because its components there carry no marks. */
    public record ExcludedOutcome(String assessmentId, AssessmentCategory category, String coId) {}

    public record DirectCoAttainment(String coId, double percentage, int level) {}

    /**
     * Direct score, indirect score and final value are on the 0-3 scale; the direct percentage is 0-100.
     * {@code indirectScore} is null when no survey exists for the outcome.
     */
    public record CoFinalAttainment(String coId,
                                    double directPercentage,
                                    int directLevel,
                                    double directScore,
                                    Double indirectScore,
                                    double finalValue,
                                    int level,
                                    boolean indirectDegraded) {}

    public record CoursePoAttainment(String courseId, String poId, double value, int level) {}

    public record ProgramPoAttainment(String programId, String semesterId, String poId,
                                      double value, int level, int contributingCourses) {}

    public record CqiActionRequest(String courseId, String semesterId, String coId, double finalValue, double target) {}

    public record CourseAttainmentResult(CourseScope scope,
                                         long governanceVersion,
                                         List<CoAssessmentAttainment> assessmentAttainments,
                                         List<DirectCoAttainment> direct,
                                         List<CoFinalAttainment> finals,
                                         List<CoursePoAttainment> coursePos,
                                         List<CqiActionRequest> cqiRequests,
                                         List<AttainmentWarning> warnings) {}

    public record ProgramAttainmentResult(ProgramScope scope,
                                          long governanceVersion,
                                          List<ProgramPoAttainment> programPos,
                                          List<AttainmentWarning> warnings) {}
}
