package com.herzen.obe.governance;

import com.herzen.obe.governance.GovernanceModels.GovernanceSnapshot;
import com.herzen.obe.governance.GovernanceModels.LevelThreshold;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Baseline governance values used until a versioned configuration has been published.
 */
@ConfigurationProperties(prefix = "attainment.governance")
public class GovernanceProperties {

    /** IA1 share of the direct score, in percent. */
    private double ia1Weight = 20.0;

    /** IA2 share of the direct score, in percent. */
    private double ia2Weight = 20.0;

    /** End-semester share of the direct score, in percent. */
    private double endWeight = 60.0;

    /** Direct share of the final CO value. */
    private double directWeight = 0.8;

    /** Indirect (survey) share of the final CO value. */
    private double indirectWeight = 0.2;

    /** Final CO values below this (0-3 scale) raise a CQI action request. */
    private double poTarget = 2.0;

    /** Attainment level to minimum percentage. */
    private Map<Integer, Double> levelThresholds = defaultThresholds();

    public GovernanceSnapshot toSnapshot() {
        return new GovernanceSnapshot(0L, ia1Weight, ia2Weight, endWeight, directWeight, indirectWeight,
                levelThresholds.entrySet().stream()
                        .map(e -> new LevelThreshold(e.getKey(), e.getValue()))
                        .toList(),
                poTarget);
    }

    private static Map<Integer, Double> defaultThresholds() {
        Map<Integer, Double> map = new LinkedHashMap<>();
        map.put(3, 85.0);
        map.put(2, 70.0);
        map.put(1, 60.0);
        return map;
    }

    public double getIa1Weight() {
        return ia1Weight;
    }

    public void setIa1Weight(double ia1Weight) {
        this.ia1Weight = ia1Weight;
    }

    public double getIa2Weight() {
        return ia2Weight;
    }

    public void setIa2Weight(double ia2Weight) {
        this.ia2Weight = ia2Weight;
    }

    public double getEndWeight() {
        return endWeight;
    }

    public void setEndWeight(double endWeight) {
        this.endWeight = endWeight;
    }

    public double getDirectWeight() {
        return directWeight;
    }

    public void setDirectWeight(double directWeight) {
        this.directWeight = directWeight;
    }

    public double getIndirectWeight() {
        return indirectWeight;
    }

    public void setIndirectWeight(double indirectWeight) {
        this.indirectWeight = indirectWeight;
    }

    public double getPoTarget() {
        return poTarget;
    }

    public void setPoTarget(double poTarget) {
        this.poTarget = poTarget;
    }

    public Map<Integer, Double> getLevelThresholds() {
        return levelThresholds;
    }

    public void setLevelThresholds(Map<Integer, Double> levelThresholds) {
        this.levelThresholds = levelThresholds;
    }
}
