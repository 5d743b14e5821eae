package com.herzen.obe.api;

import com.herzen.obe.audit.AuditModels.AuditRecord;
import com.herzen.obe.audit.JdbcAuditEmitter;
import com.herzen.obe.cqi.JdbcCqiActionSink;
import com.herzen.obe.engine.EngineModels.CqiActionRequest;
import com.herzen.obe.service.AttainmentService;
import com.herzen.obe.service.AttainmentService.*;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/attainment")
public class AttainmentController {
    private final AttainmentService attainmentService;
    private final JdbcAuditEmitter auditLog;
    private final JdbcCqiActionSink cqiActions;

    public AttainmentController(AttainmentService attainmentService, JdbcAuditEmitter auditLog, JdbcCqiActionSink cqiActions) {
        this.attainmentService = attainmentService;
        this.auditLog = auditLog;
        this.cqiActions = cqiActions;
    }

    @PostMapping("/courses/{courseId}/compute")
    public ResponseEntity<CourseRun> computeCourse(@PathVariable String courseId) {
        return ResponseEntity.ok(attainmentService.computeCourse(courseId));
    }

    @PostMapping("/courses/compute")
    public ResponseEntity<List<BatchOutcome>> computeCourses(@RequestBody BatchRequest request) {
        return ResponseEntity.ok(attainmentService.computeCourses(request.courseIds()));
    }

    @PostMapping("/programs/{programId}/semesters/{semesterId}/compute")
    public ResponseEntity<ProgramRun> computeProgram(@PathVariable String programId, @PathVariable String semesterId) {
        return ResponseEntity.ok(attainmentService.computeProgram(programId, semesterId));
    }

    @GetMapping("/courses/{courseId}")
    public ResponseEntity<CourseAttainmentView> latestCourse(@PathVariable String courseId) {
        return attainmentService.latestCourse(courseId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/programs/{programId}/semesters/{semesterId}")
    public ResponseEntity<ProgramAttainmentView> latestProgram(@PathVariable String programId, @PathVariable String semesterId) {
        return attainmentService.latestProgram(programId, semesterId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/audit")
    public ResponseEntity<List<AuditRecord>> audit(@RequestParam String scopeKey) {
        return ResponseEntity.ok(auditLog.loadForScope(scopeKey));
    }

    @GetMapping("/courses/{courseId}/cqi")
    public ResponseEntity<List<CqiActionRequest>> cqi(@PathVariable String courseId) {
        return ResponseEntity.ok(cqiActions.loadForCourse(courseId));
    }

    public record BatchRequest(List<String> courseIds) {}
}
