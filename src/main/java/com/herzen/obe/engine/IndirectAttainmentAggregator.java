package com.herzen.obe.engine;

import com.herzen.obe.domain.DomainModels.LikertResponse;
import com.herzen.obe.domain.DomainModels.SurveySummary;
import com.herzen.obe.engine.EngineModels.AttainmentWarning;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Survey score on the 0-3 scale: Strongly Agree 3, Agree 2, Neutral 1, Disagree 0, averaged over
 * the respondent count. An empty survey scores 0.
 */
@Component
public class IndirectAttainmentAggregator {

    public double score(SurveySummary summary) {
        if (summary.totalRespondents() <= 0) return 0.0;
        double total = summary.stronglyAgree() * LikertResponse.STRONGLY_AGREE.score()
                + summary.agree() * LikertResponse.AGREE.score()
                + summary.neutral() * LikertResponse.NEUTRAL.score()
                + summary.disagree() * LikertResponse.DISAGREE.score();
        return Scores.round(total / summary.totalRespondents());
    }

    public Map<String, Double> scoreAll(String scopeKey, List<SurveySummary> summaries, List<AttainmentWarning> warnings) {
        Map<String, Double> byCo = new TreeMap<>();
        for (SurveySummary summary : summaries) {
            if (summary.countedResponses() != summary.totalRespondents()) {
                warnings.add(new AttainmentWarning(AttainmentWarnings.SURVEY_COUNT_MISMATCH, scopeKey, summary.coId(),
                        "Likert counts sum to " + summary.countedResponses() + " but " + summary.totalRespondents() + " respondents reported"));
            }
            byCo.put(summary.coId(), score(summary));
        }
        return byCo;
    }
}
