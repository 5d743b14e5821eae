package com.herzen.obe.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ThresholdClassifierTest {
    private final ThresholdClassifier classifier = new ThresholdClassifier();

    @Test
    void mapsPercentagesToHighestReachedLevel() {
        assertEquals(0, classifier.classify(59.99, EngineFixtures.THRESHOLDS));
        assertEquals(1, classifier.classify(60, EngineFixtures.THRESHOLDS));
        assertEquals(2, classifier.classify(70, EngineFixtures.THRESHOLDS));
        assertEquals(2, classifier.classify(84.9, EngineFixtures.THRESHOLDS));
        assertEquals(3, classifier.classify(85, EngineFixtures.THRESHOLDS));
    }

    @Test
    void isMonotonicAndTotalOverOutOfRangeInput() {
        int previous = -1;
        for (double p = -20; p <= 120; p += 0.5) {
            int level = classifier.classify(p, EngineFixtures.THRESHOLDS);
            assertTrue(level >= previous, "level dropped at " + p);
            previous = level;
        }
        assertEquals(0, classifier.classify(-5, EngineFixtures.THRESHOLDS));
        assertEquals(3, classifier.classify(140, EngineFixtures.THRESHOLDS));
        assertEquals(0, classifier.classify(Double.NaN, EngineFixtures.THRESHOLDS));
    }

    @Test
    void classifiesScaledValuesThroughPercentage() {
        assertEquals(3, classifier.classifyScaled(2.7, EngineFixtures.THRESHOLDS));
        assertEquals(1, classifier.classifyScaled(1.8, EngineFixtures.THRESHOLDS));
        assertEquals(0, classifier.classifyScaled(1.436, EngineFixtures.THRESHOLDS));
    }
}
