package com.herzen.obe.engine;

import com.herzen.obe.domain.DomainModels.CoPoMapping;
import com.herzen.obe.engine.EngineModels.CoursePoAttainment;
import com.herzen.obe.exception.InvalidMappingException;
import com.herzen.obe.governance.GovernanceModels.LevelThreshold;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Course-level PO value: final CO values averaged with the CO to PO mapping levels as weights.
 * A PO whose mapping levels sum to 0 is left out of the result.
 */
@Component
public class CoursePoProjector {
    static final int MAX_MAPPING_LEVEL = 3;

    private final ThresholdClassifier classifier;

    public CoursePoProjector(ThresholdClassifier classifier) {
        this.classifier = classifier;
    }

    public List<CoursePoAttainment> project(String scopeKey,
                                            String courseId,
                                            Map<String, Double> finalByCo,
                                            List<CoPoMapping> mappings,
                                            List<LevelThreshold> thresholds) {
        Map<String, double[]> byPo = new TreeMap<>();
        for (CoPoMapping mapping : mappings) {
            String entity = mapping.coId() + "->" + mapping.poId();
            if (mapping.level() < 0 || mapping.level() > MAX_MAPPING_LEVEL) {
                throw new InvalidMappingException(scopeKey, entity, "level " + mapping.level() + " outside 0.." + MAX_MAPPING_LEVEL);
            }
            Double finalValue = finalByCo.get(mapping.coId());
            if (finalValue == null) {
                throw new InvalidMappingException(scopeKey, entity, "course outcome not defined for course " + courseId);
            }
            double[] acc = byPo.computeIfAbsent(mapping.poId(), k -> new double[2]);
            acc[0] += finalValue * mapping.level();
            acc[1] += mapping.level();
        }

        List<CoursePoAttainment> out = new ArrayList<>();
        byPo.forEach((poId, acc) -> {
            if (acc[1] <= 0.0) return;
            double value = Scores.round(acc[0] / acc[1]);
            out.add(new CoursePoAttainment(courseId, poId, value, classifier.classifyScaled(value, thresholds)));
        });
        return out;
    }
}
