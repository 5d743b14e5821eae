package com.herzen.obe.repository;

import com.herzen.obe.governance.GovernanceModels.GovernanceSnapshot;
import com.herzen.obe.governance.GovernanceModels.LevelThreshold;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public class GovernanceJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public GovernanceJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public long nextVersion() {
        Long max = jdbcTemplate.queryForObject("SELECT COALESCE(MAX(version), 0) FROM governance_config", Long.class);
        return (max == null ? 0 : max) + 1;
    }

    public void insert(GovernanceSnapshot s) {
        jdbcTemplate.update(
                "INSERT INTO governance_config(version, ia1_weight, ia2_weight, end_weight, direct_weight, indirect_weight, level_thresholds, po_target, created_at) VALUES (?,?,?,?,?,?,?,?,?)",
                s.version(), s.ia1Weight(), s.ia2Weight(), s.endWeight(), s.directWeight(), s.indirectWeight(),
                toThresholdString(s.levelThresholds()), s.poTarget(), Instant.now().toString());
    }

    public Optional<GovernanceSnapshot> loadLatest() {
        return jdbcTemplate.query(
                "SELECT version, ia1_weight, ia2_weight, end_weight, direct_weight, indirect_weight, level_thresholds, po_target FROM governance_config ORDER BY version DESC LIMIT 1",
                (rs, n) -> new GovernanceSnapshot(rs.getLong(1), rs.getDouble(2), rs.getDouble(3), rs.getDouble(4),
                        rs.getDouble(5), rs.getDouble(6), parseThresholds(rs.getString(7)), rs.getDouble(8))
        ).stream().findFirst();
    }

    private String toThresholdString(List<LevelThreshold> thresholds) {
        return thresholds.stream()
                .map(t -> t.level() + "=" + String.format(Locale.US, "%.4f", t.minPercentage()))
                .collect(Collectors.joining(";"));
    }

    private List<LevelThreshold> parseThresholds(String value) {
        if (value == null || value.isBlank()) return List.of();
        return Arrays.stream(value.split(";"))
                .map(String::trim)
                .filter(s -> !s.isEmpty() && s.contains("="))
                .map(s -> s.split("=", 2))
                .map(p -> new LevelThreshold(Integer.parseInt(p[0]), Double.parseDouble(p[1])))
                .toList();
    }
}
