package com.herzen.obe.engine;

import com.herzen.obe.domain.DomainModels.CoPoMapping;
import com.herzen.obe.engine.EngineModels.*;
import com.herzen.obe.exception.InvalidMappingException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PoProjectionTest {
    private static final String SCOPE = "course:CS101@2024-S1";
    private final ThresholdClassifier classifier = new ThresholdClassifier();
    private final CoursePoProjector projector = new CoursePoProjector(classifier);
    private final ProgramPoAggregator programAggregator = new ProgramPoAggregator(classifier);

    @Test
    void weightsFinalValuesByMappingLevel() {
        List<CoursePoAttainment> pos = projector.project(SCOPE, "CS101", Map.of("CO1", 2.4, "CO2", 1.2),
                List.of(new CoPoMapping("CS101", "CO1", "PO1", 3),
                        new CoPoMapping("CS101", "CO2", "PO1", 1),
                        new CoPoMapping("CS101", "CO2", "PO2", 2)),
                EngineFixtures.THRESHOLDS);

        assertEquals(2, pos.size());
        assertEquals("PO1", pos.get(0).poId());
        assertEquals(2.1, pos.get(0).value(), 1e-9);
        assertEquals(2, pos.get(0).level());
        assertEquals(1.2, pos.get(1).value(), 1e-9);
    }

    @Test
    void leavesOutPoWithZeroTotalLevel() {
        List<CoursePoAttainment> pos = projector.project(SCOPE, "CS101", Map.of("CO1", 2.0),
                List.of(new CoPoMapping("CS101", "CO1", "PO1", 2), new CoPoMapping("CS101", "CO1", "PO3", 0)),
                EngineFixtures.THRESHOLDS);

        assertEquals(List.of("PO1"), pos.stream().map(CoursePoAttainment::poId).toList());
    }

    @Test
    void rejectsMappingOutsideCourseOrLevelRange() {
        assertThrows(InvalidMappingException.class, () -> projector.project(SCOPE, "CS101", Map.of("CO1", 2.0),
                List.of(new CoPoMapping("CS101", "CO7", "PO1", 2)), EngineFixtures.THRESHOLDS));
        assertThrows(InvalidMappingException.class, () -> projector.project(SCOPE, "CS101", Map.of("CO1", 2.0),
                List.of(new CoPoMapping("CS101", "CO1", "PO1", 4)), EngineFixtures.THRESHOLDS));
    }

    @Test
    void averagesCoursePosPerProgramOutcome() {
        ProgramScope scope = new ProgramScope("BTECH", "2024-S1", false);
        List<ProgramPoAttainment> rows = programAggregator.aggregate(scope, Map.of(
                "CS101", List.of(new CoursePoAttainment("CS101", "PO1", 2.0, 1), new CoursePoAttainment("CS101", "PO2", 1.5, 0)),
                "CS102", List.of(new CoursePoAttainment("CS102", "PO1", 2.6, 3))),
                EngineFixtures.THRESHOLDS);

        assertEquals(2, rows.size());
        assertEquals(2.3, rows.get(0).value(), 1e-9);
        assertEquals(2, rows.get(0).contributingCourses());
        assertEquals(1.5, rows.get(1).value(), 1e-9);
        assertEquals(1, rows.get(1).contributingCourses());
    }
}
