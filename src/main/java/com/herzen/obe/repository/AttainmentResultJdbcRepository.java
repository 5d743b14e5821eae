package com.herzen.obe.repository;

import com.herzen.obe.domain.DomainModels.AssessmentCategory;
import com.herzen.obe.engine.EngineModels.*;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Versioned, append-only result store. Every run inserts a new version for its scope; readers pick
 * the highest version.
 */
@Repository
public class AttainmentResultJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public AttainmentResultJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public long saveCourseResult(String runId, String inputChecksum, Instant computedAt, CourseAttainmentResult result) {
        String scopeKey = result.scope().key();
        long version = insertRun(runId, "course", scopeKey, result.governanceVersion(), inputChecksum, computedAt);

        result.assessmentAttainments().forEach(a -> jdbcTemplate.update(
                "INSERT INTO co_assessment_attainment(run_id, scope_key, version, assessment_id, category, co_id, percentage, attainment_level) VALUES (?,?,?,?,?,?,?,?)",
                runId, scopeKey, version, a.assessmentId(), a.category().name(), a.coId(), a.percentage(), a.level()));

        result.finals().forEach(f -> jdbcTemplate.update(
                "INSERT INTO co_final_attainment(run_id, scope_key, version, co_id, direct_percentage, direct_level, direct_score, indirect_score, final_value, attainment_level, indirect_degraded) VALUES (?,?,?,?,?,?,?,?,?,?,?)",
                runId, scopeKey, version, f.coId(), f.directPercentage(), f.directLevel(), f.directScore(), f.indirectScore(),
                f.finalValue(), f.level(), f.indirectDegraded()));

        result.coursePos().forEach(p -> jdbcTemplate.update(
                "INSERT INTO course_po_attainment(run_id, scope_key, version, course_id, po_id, po_value, attainment_level) VALUES (?,?,?,?,?,?,?)",
                runId, scopeKey, version, p.courseId(), p.poId(), p.value(), p.level()));
        return version;
    }

    @Transactional
    public long saveProgramResult(String runId, String inputChecksum, Instant computedAt, ProgramAttainmentResult result) {
        String scopeKey = result.scope().key();
        long version = insertRun(runId, "program", scopeKey, result.governanceVersion(), inputChecksum, computedAt);
        result.programPos().forEach(p -> jdbcTemplate.update(
                "INSERT INTO program_po_attainment(run_id, scope_key, version, program_id, semester_id, po_id, po_value, attainment_level, contributing_courses) VALUES (?,?,?,?,?,?,?,?,?)",
                runId, scopeKey, version, p.programId(), p.semesterId(), p.poId(), p.value(), p.level(), p.contributingCourses()));
        return version;
    }

    public Optional<RunRow> latestRun(String scopeKey) {
        return jdbcTemplate.query(
                "SELECT run_id, scope_type, scope_key, version, governance_version, input_checksum, computed_at FROM attainment_runs WHERE scope_key=? ORDER BY version DESC LIMIT 1",
                (rs, n) -> new RunRow(rs.getString(1), rs.getString(2), rs.getString(3), rs.getLong(4), rs.getLong(5),
                        rs.getString(6), Instant.parse(rs.getString(7))),
                scopeKey).stream().findFirst();
    }

    public int countRuns(String scopeKey) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM attainment_runs WHERE scope_key=?", Integer.class, scopeKey);
        return count == null ? 0 : count;
    }

    public List<CoAssessmentAttainment> loadAssessmentAttainments(String runId) {
        return jdbcTemplate.query(
                "SELECT assessment_id, category, co_id, percentage, attainment_level FROM co_assessment_attainment WHERE run_id=? ORDER BY category, assessment_id, co_id",
                (rs, n) -> new CoAssessmentAttainment(rs.getString(1), AssessmentCategory.valueOf(rs.getString(2)), rs.getString(3),
                        rs.getDouble(4), rs.getInt(5)),
                runId);
    }

    public List<CoFinalAttainment> loadFinals(String runId) {
        return jdbcTemplate.query(
                "SELECT co_id, direct_percentage, direct_level, direct_score, indirect_score, final_value, attainment_level, indirect_degraded FROM co_final_attainment WHERE run_id=? ORDER BY co_id",
                (rs, n) -> new CoFinalAttainment(rs.getString(1), rs.getDouble(2), rs.getInt(3), rs.getDouble(4),
                        (Double) rs.getObject(5), rs.getDouble(6), rs.getInt(7), rs.getBoolean(8)),
                runId);
    }

    public List<CoursePoAttainment> loadCoursePos(String runId) {
        return jdbcTemplate.query(
                "SELECT course_id, po_id, po_value, attainment_level FROM course_po_attainment WHERE run_id=? ORDER BY po_id",
                (rs, n) -> new CoursePoAttainment(rs.getString(1), rs.getString(2), rs.getDouble(3), rs.getInt(4)),
                runId);
    }

    public List<ProgramPoAttainment> loadProgramPos(String runId) {
        return jdbcTemplate.query(
                "SELECT program_id, semester_id, po_id, po_value, attainment_level, contributing_courses FROM program_po_attainment WHERE run_id=? ORDER BY po_id",
                (rs, n) -> new ProgramPoAttainment(rs.getString(1), rs.getString(2), rs.getString(3), rs.getDouble(4),
                        rs.getInt(5), rs.getInt(6)),
                runId);
    }

    public int countOutputRows(String scopeKey) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT (SELECT COUNT(*) FROM co_assessment_attainment WHERE scope_key=?) + (SELECT COUNT(*) FROM co_final_attainment WHERE scope_key=?) " +
                        "+ (SELECT COUNT(*) FROM course_po_attainment WHERE scope_key=?) + (SELECT COUNT(*) FROM program_po_attainment WHERE scope_key=?)",
                Integer.class, scopeKey, scopeKey, scopeKey, scopeKey);
        return count == null ? 0 : count;
    }

    private long insertRun(String runId, String scopeType, String scopeKey, long governanceVersion, String inputChecksum, Instant computedAt) {
        Long max = jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(version), 0) FROM attainment_runs WHERE scope_key=?", Long.class, scopeKey);
        long version = (max == null ? 0 : max) + 1;
        jdbcTemplate.update(
                "INSERT INTO attainment_runs(run_id, scope_type, scope_key, version, governance_version, input_checksum, computed_at) VALUES (?,?,?,?,?,?,?)",
                runId, scopeType, scopeKey, version, governanceVersion, inputChecksum, computedAt.toString());
        return version;
    }

    public record RunRow(String runId, String scopeType, String scopeKey, long version, long governanceVersion,
                         String inputChecksum, Instant computedAt) {}
}
