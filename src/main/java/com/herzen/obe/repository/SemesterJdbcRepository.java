package com.herzen.obe.repository;

import com.herzen.obe.domain.DomainModels.Semester;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public class SemesterJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public SemesterJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void setLocked(String semesterId, boolean locked) {
        jdbcTemplate.update(
                "MERGE INTO semesters(semester_id, locked, updated_at) KEY(semester_id) VALUES (?,?,?)",
                semesterId, locked, Instant.now().toString());
    }

    public Optional<Semester> find(String semesterId) {
        return jdbcTemplate.query(
                "SELECT semester_id, locked FROM semesters WHERE semester_id=?",
                (rs, n) -> new Semester(rs.getString(1), rs.getBoolean(2)),
                semesterId).stream().findFirst();
    }

    /** Semesters never registered are open. */
    public boolean isLocked(String semesterId) {
        return find(semesterId).map(Semester::locked).orElse(false);
    }
}
