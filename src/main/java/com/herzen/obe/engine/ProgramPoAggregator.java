package com.herzen.obe.engine;

import com.herzen.obe.engine.EngineModels.CoursePoAttainment;
import com.herzen.obe.engine.EngineModels.ProgramPoAttainment;
import com.herzen.obe.engine.EngineModels.ProgramScope;
import com.herzen.obe.governance.GovernanceModels.LevelThreshold;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class ProgramPoAggregator {
    private final ThresholdClassifier classifier;

    public ProgramPoAggregator(ThresholdClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Mean of course PO values per PO, over the courses that report the PO.
     */
    public List<ProgramPoAttainment> aggregate(ProgramScope scope,
                                               Map<String, List<CoursePoAttainment>> coursePos,
                                               List<LevelThreshold> thresholds) {
        Map<String, List<Double>> byPo = new TreeMap<>();
        new TreeMap<>(coursePos).forEach((courseId, rows) -> rows.stream()
                .sorted(Comparator.comparing(CoursePoAttainment::poId))
                .forEach(row -> byPo.computeIfAbsent(row.poId(), k -> new ArrayList<>()).add(row.value())));

        List<ProgramPoAttainment> out = new ArrayList<>();
        byPo.forEach((poId, values) -> {
            double value = Scores.round(values.stream().mapToDouble(Double::doubleValue).sum() / values.size());
            out.add(new ProgramPoAttainment(scope.programId(), scope.semesterId(), poId, value,
                    classifier.classifyScaled(value, thresholds), values.size()));
        });
        return out;
    }
}
