package com.herzen.obe.audit;

import com.herzen.obe.engine.EngineModels.AttainmentWarning;

import java.time.Instant;
import java.util.List;

public class AuditModels {
    public enum RunStatus { SUCCEEDED, REJECTED, LOCKED }

    public record AuditEvent(String runId,
                             String scopeType,
                             String scopeKey,
                             RunStatus status,
                             long governanceVersion,
                             String inputChecksum,
                             List<AttainmentWarning> warnings,
                             String errorCode,
                             String message,
                             Instant recordedAt) {}

    public record AuditRecord(String runId,
                              String scopeType,
                              String scopeKey,
                              String status,
                              long governanceVersion,
                              String inputChecksum,
                              String warnings,
                              String errorCode,
                              String message,
                              Instant recordedAt) {}
}
