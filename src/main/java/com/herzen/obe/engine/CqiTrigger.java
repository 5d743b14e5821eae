package com.herzen.obe.engine;

import com.herzen.obe.engine.EngineModels.CoFinalAttainment;
import com.herzen.obe.engine.EngineModels.CourseScope;
import com.herzen.obe.engine.EngineModels.CqiActionRequest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides which outcomes need a continuous quality improvement action. Lifecycle of the action
 * belongs to the workflow that receives the request.
 */
@Component
public class CqiTrigger {

    public List<CqiActionRequest> evaluate(CourseScope scope, List<CoFinalAttainment> finals, double target) {
        return finals.stream()
                .filter(f -> f.finalValue() < target)
                .map(f -> new CqiActionRequest(scope.courseId(), scope.semesterId(), f.coId(), f.finalValue(), target))
                .toList();
    }
}
