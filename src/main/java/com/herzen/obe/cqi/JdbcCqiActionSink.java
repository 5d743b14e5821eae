package com.herzen.obe.cqi;

import com.herzen.obe.engine.EngineModels.CqiActionRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

@Slf4j
@Component
public class JdbcCqiActionSink implements CqiActionSink {
    private final JdbcTemplate jdbcTemplate;

    public JdbcCqiActionSink(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void submit(String runId, List<CqiActionRequest> requests) {
        String now = Instant.now().toString();
        requests.forEach(r -> {
            jdbcTemplate.update(
                    "INSERT INTO cqi_action_requests(run_id, course_id, semester_id, co_id, final_value, target, requested_at) VALUES (?,?,?,?,?,?,?)",
                    runId, r.courseId(), r.semesterId(), r.coId(), r.finalValue(), r.target(), now);
            log.info("CQI action requested course={} co={} final={} target={}", r.courseId(), r.coId(), r.finalValue(), r.target());
        });
    }

    public List<CqiActionRequest> loadForCourse(String courseId) {
        return jdbcTemplate.query(
                "SELECT course_id, semester_id, co_id, final_value, target FROM cqi_action_requests WHERE course_id=? ORDER BY requested_at, co_id",
                (rs, n) -> new CqiActionRequest(rs.getString(1), rs.getString(2), rs.getString(3), rs.getDouble(4), rs.getDouble(5)),
                courseId);
    }
}
