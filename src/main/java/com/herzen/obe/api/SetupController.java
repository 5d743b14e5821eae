package com.herzen.obe.api;

import com.herzen.obe.service.CourseSetupService;
import com.herzen.obe.validation.IntakeModels.*;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/setup")
public class SetupController {
    private final CourseSetupService setupService;

    public SetupController(CourseSetupService setupService) {
        this.setupService = setupService;
    }

    @PostMapping("/courses")
    public ResponseEntity<IntakeResult> course(@RequestBody CourseRequest request) {
        return respond(setupService.registerCourse(request));
    }

    @PostMapping("/program-outcomes")
    public ResponseEntity<IntakeResult> programOutcomes(@RequestBody List<ProgramOutcomeIn> outcomes) {
        return respond(setupService.registerProgramOutcomes(outcomes));
    }

    @PostMapping("/assessments")
    public ResponseEntity<IntakeResult> assessment(@RequestBody AssessmentRequest request) {
        return respond(setupService.registerAssessment(request));
    }

    @PostMapping("/marks")
    public ResponseEntity<IntakeResult> marks(@RequestBody MarksRequest request) {
        return respond(setupService.uploadMarks(request));
    }

    @PostMapping("/enrollment")
    public ResponseEntity<IntakeResult> enrollment(@RequestBody EnrollmentRequest request) {
        return respond(setupService.enroll(request));
    }

    @PostMapping("/mappings")
    public ResponseEntity<IntakeResult> mappings(@RequestBody MappingRequest request) {
        return respond(setupService.mapOutcomes(request));
    }

    @PostMapping("/surveys")
    public ResponseEntity<IntakeResult> survey(@RequestBody SurveyRequest request) {
        return respond(setupService.uploadSurvey(request));
    }

    @PostMapping("/surveys/responses")
    public ResponseEntity<IntakeResult> surveyResponses(@RequestBody SurveyResponsesRequest request) {
        return respond(setupService.tallySurvey(request));
    }

    private ResponseEntity<IntakeResult> respond(IntakeResult result) {
        return result.accepted()
                ? ResponseEntity.ok(result)
                : ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);
    }
}
