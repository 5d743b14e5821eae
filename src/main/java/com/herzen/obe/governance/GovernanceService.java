package com.herzen.obe.governance;

import com.herzen.obe.engine.AttainmentEngine;
import com.herzen.obe.engine.EngineModels.AttainmentWarning;
import com.herzen.obe.exception.AttainmentException;
import com.herzen.obe.exception.ErrorCode;
import com.herzen.obe.governance.GovernanceModels.GovernanceSnapshot;
import com.herzen.obe.governance.GovernanceModels.GovernanceUpdateRequest;
import com.herzen.obe.governance.GovernanceModels.LevelThreshold;
import com.herzen.obe.repository.GovernanceJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
public class GovernanceService {
    private static final String SCOPE = "governance";

    private final GovernanceProperties properties;
    private final GovernanceJdbcRepository repository;

    public GovernanceService(GovernanceProperties properties, GovernanceJdbcRepository repository) {
        this.properties = properties;
        this.repository = repository;
    }

    /**
     * Snapshot to use for a run that starts now: the latest published version, or the configured
     * defaults (version 0) when nothing was published yet.
     */
    public GovernanceSnapshot capture() {
        return repository.loadLatest().orElseGet(properties::toSnapshot);
    }

    public synchronized PublishResult publish(GovernanceUpdateRequest request) {
        List<String> problems = validate(request);
        if (!problems.isEmpty()) {
            throw new AttainmentException(ErrorCode.INVALID_GOVERNANCE, SCOPE, "governance_config", String.join("; ", problems));
        }

        GovernanceSnapshot snapshot = new GovernanceSnapshot(repository.nextVersion(),
                request.ia1Weight(), request.ia2Weight(), request.endWeight(),
                request.directWeight(), request.indirectWeight(),
                request.levelThresholds().entrySet().stream()
                        .map(e -> new LevelThreshold(e.getKey(), e.getValue()))
                        .toList(),
                request.poTarget());
        repository.insert(snapshot);

        List<AttainmentWarning> warnings = AttainmentEngine.checkGovernance(SCOPE, snapshot);
        warnings.forEach(w -> log.warn("governance v{}: {}", snapshot.version(), w.message()));
        log.info("Published governance version {}", snapshot.version());
        return new PublishResult(snapshot, warnings);
    }

    private List<String> validate(GovernanceUpdateRequest request) {
        List<String> problems = new ArrayList<>();
        if (request.ia1Weight() < 0 || request.ia2Weight() < 0 || request.endWeight() < 0) {
            problems.add("category weights must not be negative");
        }
        if (request.directWeight() < 0 || request.indirectWeight() < 0) {
            problems.add("blend weights must not be negative");
        }
        if (request.poTarget() < 0 || request.poTarget() > 3) {
            problems.add("PO target must be within 0..3");
        }
        if (request.levelThresholds() == null || request.levelThresholds().isEmpty()) {
            problems.add("at least one level threshold is required");
            return problems;
        }
        Set<Double> seen = new HashSet<>();
        request.levelThresholds().forEach((level, min) -> {
            if (level == null || level <= 0) problems.add("level must be positive: " + level);
            if (min == null || min < 0 || min > 100) problems.add("threshold for level " + level + " must be within 0..100");
            else if (!seen.add(min)) problems.add("duplicate threshold " + min);
        });
        List<LevelThreshold> ordered = new GovernanceSnapshot(0, 0, 0, 0, 0, 0,
                request.levelThresholds().entrySet().stream()
                        .filter(e -> e.getKey() != null && e.getValue() != null)
                        .map(e -> new LevelThreshold(e.getKey(), e.getValue()))
                        .toList(), 0).levelThresholds();
        for (int i = 1; i < ordered.size(); i++) {
            if (ordered.get(i).level() >= ordered.get(i - 1).level()) {
                problems.add("higher levels must have higher thresholds");
                break;
            }
        }
        return problems;
    }

    public record PublishResult(GovernanceSnapshot snapshot, List<AttainmentWarning> warnings) {}
}
