package com.herzen.obe.repository;

import com.herzen.obe.domain.DomainModels.*;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

@Repository
public class CourseSetupJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public CourseSetupJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void upsertCourse(Course course) {
        jdbcTemplate.update(
                "MERGE INTO courses(course_id, program_id, semester_id, title) KEY(course_id) VALUES (?,?,?,?)",
                course.courseId(), course.programId(), course.semesterId(), course.title());
    }

    public Optional<Course> findCourse(String courseId) {
        return jdbcTemplate.query(
                "SELECT course_id, program_id, semester_id, title FROM courses WHERE course_id=?",
                (rs, n) -> new Course(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4)),
                courseId).stream().findFirst();
    }

    public List<Course> findCoursesInProgram(String programId, String semesterId) {
        return jdbcTemplate.query(
                "SELECT course_id, program_id, semester_id, title FROM courses WHERE program_id=? AND semester_id=? ORDER BY course_id",
                (rs, n) -> new Course(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4)),
                programId, semesterId);
    }

    public void upsertOutcome(CourseOutcome outcome) {
        jdbcTemplate.update(
                "MERGE INTO course_outcomes(course_id, co_id, bloom_level, expected_proficiency) KEY(course_id, co_id) VALUES (?,?,?,?)",
                outcome.courseId(), outcome.coId(), outcome.bloomLevel(), outcome.expectedProficiency());
    }

    public List<CourseOutcome> loadOutcomes(String courseId) {
        return jdbcTemplate.query(
                "SELECT course_id, co_id, bloom_level, expected_proficiency FROM course_outcomes WHERE course_id=? ORDER BY co_id",
                (rs, n) -> new CourseOutcome(rs.getString(1), rs.getString(2), (Integer) rs.getObject(3), rs.getDouble(4)),
                courseId);
    }

    public boolean isOutcomeReferenced(String courseId, String coId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM assessment_components c JOIN assessments a ON a.assessment_id = c.assessment_id WHERE a.course_id=? AND c.co_id=?",
                Long.class, courseId, coId);
        return count != null && count > 0;
    }

    public void upsertProgramOutcome(ProgramOutcome outcome) {
        jdbcTemplate.update(
                "MERGE INTO program_outcomes(po_id, description) KEY(po_id) VALUES (?,?)",
                outcome.poId(), outcome.description());
    }

    public Set<String> loadProgramOutcomeIds() {
        return new TreeSet<>(jdbcTemplate.queryForList("SELECT po_id FROM program_outcomes", String.class));
    }

    public Optional<Assessment> findAssessment(String assessmentId) {
        return jdbcTemplate.query(
                "SELECT assessment_id, course_id, category, max_marks FROM assessments WHERE assessment_id=?",
                (rs, n) -> new Assessment(rs.getString(1), rs.getString(2), AssessmentCategory.valueOf(rs.getString(3)), rs.getDouble(4)),
                assessmentId).stream().findFirst();
    }

    @Transactional
    public void replaceAssessment(Assessment assessment, List<AssessmentComponent> components) {
        jdbcTemplate.update(
                "MERGE INTO assessments(assessment_id, course_id, category, max_marks) KEY(assessment_id) VALUES (?,?,?,?)",
                assessment.assessmentId(), assessment.courseId(), assessment.category().name(), assessment.maxMarks());
        jdbcTemplate.update("DELETE FROM assessment_components WHERE assessment_id=?", assessment.assessmentId());
        components.forEach(c -> jdbcTemplate.update(
                "INSERT INTO assessment_components(assessment_id, component_number, co_id, max_marks) VALUES (?,?,?,?)",
                c.assessmentId(), c.componentNumber(), c.coId(), c.maxMarks()));
    }

    public List<Assessment> loadAssessments(String courseId) {
        return jdbcTemplate.query(
                "SELECT assessment_id, course_id, category, max_marks FROM assessments WHERE course_id=? ORDER BY assessment_id",
                (rs, n) -> new Assessment(rs.getString(1), rs.getString(2), AssessmentCategory.valueOf(rs.getString(3)), rs.getDouble(4)),
                courseId);
    }

    public List<AssessmentComponent> loadComponents(String courseId) {
        return jdbcTemplate.query(
                "SELECT c.assessment_id, c.component_number, c.co_id, c.max_marks FROM assessment_components c " +
                        "JOIN assessments a ON a.assessment_id = c.assessment_id WHERE a.course_id=? ORDER BY c.assessment_id, c.component_number",
                (rs, n) -> new AssessmentComponent(rs.getString(1), rs.getString(2), rs.getString(3), rs.getDouble(4)),
                courseId);
    }

    public List<AssessmentComponent> loadAssessmentComponents(String assessmentId) {
        return jdbcTemplate.query(
                "SELECT assessment_id, component_number, co_id, max_marks FROM assessment_components WHERE assessment_id=? ORDER BY component_number",
                (rs, n) -> new AssessmentComponent(rs.getString(1), rs.getString(2), rs.getString(3), rs.getDouble(4)),
                assessmentId);
    }

    @Transactional
    public void replaceMarks(String assessmentId, List<StudentMark> marks) {
        jdbcTemplate.update("DELETE FROM student_marks WHERE assessment_id=?", assessmentId);
        marks.forEach(m -> jdbcTemplate.update(
                "INSERT INTO student_marks(student_id, assessment_id, component_number, mark) VALUES (?,?,?,?)",
                m.studentId(), m.assessmentId(), m.componentNumber(), m.mark()));
    }

    public List<StudentMark> loadMarks(String courseId) {
        return jdbcTemplate.query(
                "SELECT m.student_id, m.assessment_id, m.component_number, m.mark FROM student_marks m " +
                        "JOIN assessments a ON a.assessment_id = m.assessment_id WHERE a.course_id=? ORDER BY m.assessment_id, m.student_id, m.component_number",
                (rs, n) -> new StudentMark(rs.getString(1), rs.getString(2), rs.getString(3), rs.getDouble(4)),
                courseId);
    }

    @Transactional
    public void replaceEnrollment(String courseId, Set<String> studentIds) {
        jdbcTemplate.update("DELETE FROM course_enrollment WHERE course_id=?", courseId);
        studentIds.forEach(s -> jdbcTemplate.update(
                "INSERT INTO course_enrollment(course_id, student_id) VALUES (?,?)", courseId, s));
    }

    public Set<String> loadEnrollment(String courseId) {
        return new TreeSet<>(jdbcTemplate.queryForList(
                "SELECT student_id FROM course_enrollment WHERE course_id=?", String.class, courseId));
    }

    @Transactional
    public void replaceMappings(String courseId, List<CoPoMapping> mappings) {
        jdbcTemplate.update("DELETE FROM co_po_mappings WHERE course_id=?", courseId);
        mappings.forEach(m -> jdbcTemplate.update(
                "INSERT INTO co_po_mappings(course_id, co_id, po_id, mapping_level) VALUES (?,?,?,?)",
                m.courseId(), m.coId(), m.poId(), m.level()));
    }

    public List<CoPoMapping> loadMappings(String courseId) {
        return jdbcTemplate.query(
                "SELECT course_id, co_id, po_id, mapping_level FROM co_po_mappings WHERE course_id=? ORDER BY co_id, po_id",
                (rs, n) -> new CoPoMapping(rs.getString(1), rs.getString(2), rs.getString(3), rs.getInt(4)),
                courseId);
    }

    public boolean surveyExists(String courseId, String coId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM survey_summaries WHERE course_id=? AND co_id=?", Long.class, courseId, coId);
        return count != null && count > 0;
    }

    public void insertSurvey(SurveySummary s) {
        jdbcTemplate.update(
                "INSERT INTO survey_summaries(course_id, co_id, strongly_agree, agree, neutral, disagree, total_respondents, uploaded_at) VALUES (?,?,?,?,?,?,?,?)",
                s.courseId(), s.coId(), s.stronglyAgree(), s.agree(), s.neutral(), s.disagree(), s.totalRespondents(), Instant.now().toString());
    }

    public List<SurveySummary> loadSurveys(String courseId) {
        return jdbcTemplate.query(
                "SELECT course_id, co_id, strongly_agree, agree, neutral, disagree, total_respondents FROM survey_summaries WHERE course_id=? ORDER BY co_id",
                (rs, n) -> new SurveySummary(rs.getString(1), rs.getString(2), rs.getInt(3), rs.getInt(4), rs.getInt(5), rs.getInt(6), rs.getInt(7)),
                courseId);
    }
}
