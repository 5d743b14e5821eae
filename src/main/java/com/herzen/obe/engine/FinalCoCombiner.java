package com.herzen.obe.engine;

import com.herzen.obe.engine.EngineModels.AttainmentWarning;
import com.herzen.obe.engine.EngineModels.CoFinalAttainment;
import com.herzen.obe.engine.EngineModels.DirectCoAttainment;
import com.herzen.obe.governance.GovernanceModels.GovernanceSnapshot;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class FinalCoCombiner {
    private final ThresholdClassifier classifier;

    public FinalCoCombiner(ThresholdClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Blends the direct score (converted to 0-3) with the survey score using the snapshot's blend
     * weights. Without a survey the final value is the direct score alone.
     */
    public CoFinalAttainment combine(String scopeKey,
                                     DirectCoAttainment direct,
                                     Double indirectScore,
                                     GovernanceSnapshot governance,
                                     List<AttainmentWarning> warnings) {
        double directScore = Scores.round(Scores.toScale(direct.percentage()));
        boolean degraded = indirectScore == null;
        double finalValue;
        if (degraded) {
            warnings.add(new AttainmentWarning(AttainmentWarnings.MISSING_INDIRECT_DATA, scopeKey, direct.coId(),
                    "No survey summary, final value uses the direct score only"));
            finalValue = directScore;
        } else {
            finalValue = Scores.round(directScore * governance.directWeight() + indirectScore * governance.indirectWeight());
        }
        return new CoFinalAttainment(direct.coId(), direct.percentage(), direct.level(), directScore, indirectScore,
                finalValue, classifier.classifyScaled(finalValue, governance.levelThresholds()), degraded);
    }
}
