package com.herzen.obe.audit;

import com.herzen.obe.audit.AuditModels.AuditEvent;
import com.herzen.obe.audit.AuditModels.AuditRecord;
import com.herzen.obe.engine.EngineModels.AttainmentWarning;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Component
public class JdbcAuditEmitter implements AuditEmitter {
    private final JdbcTemplate jdbcTemplate;

    public JdbcAuditEmitter(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void emit(AuditEvent e) {
        jdbcTemplate.update(
                "INSERT INTO attainment_audit(run_id, scope_type, scope_key, status, governance_version, input_checksum, warnings, error_code, message, recorded_at) VALUES (?,?,?,?,?,?,?,?,?,?)",
                e.runId(), e.scopeType(), e.scopeKey(), e.status().name(), e.governanceVersion(), e.inputChecksum(),
                serializeWarnings(e.warnings()), e.errorCode(), e.message(), e.recordedAt().toString());
        log.info("audit run={} scope={} status={} governance={} checksum={} warnings={}",
                e.runId(), e.scopeKey(), e.status(), e.governanceVersion(), e.inputChecksum(), e.warnings().size());
    }

    public List<AuditRecord> loadForScope(String scopeKey) {
        return jdbcTemplate.query(
                "SELECT run_id, scope_type, scope_key, status, governance_version, input_checksum, warnings, error_code, message, recorded_at FROM attainment_audit WHERE scope_key=? ORDER BY recorded_at",
                (rs, n) -> new AuditRecord(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getLong(5),
                        rs.getString(6), rs.getString(7), rs.getString(8), rs.getString(9), Instant.parse(rs.getString(10))),
                scopeKey);
    }

    private String serializeWarnings(List<AttainmentWarning> warnings) {
        return warnings.stream()
                .map(w -> w.code() + "=" + w.entityId())
                .collect(Collectors.joining(";"));
    }
}
