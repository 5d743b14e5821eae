package com.herzen.obe.cqi;

import com.herzen.obe.engine.EngineModels.CqiActionRequest;

import java.util.List;

/**
 * Workflow collaborator that owns the CQI action lifecycle.
 */
public interface CqiActionSink {
    void submit(String runId, List<CqiActionRequest> requests);
}
