package com.herzen.obe.audit;

import com.herzen.obe.audit.AuditModels.AuditEvent;

/**
 * Receives exactly one event per computation invocation, successful or not.
 */
public interface AuditEmitter {
    void emit(AuditEvent event);
}
