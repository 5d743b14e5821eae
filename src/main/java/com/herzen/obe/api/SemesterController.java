package com.herzen.obe.api;

import com.herzen.obe.domain.DomainModels.Semester;
import com.herzen.obe.service.SemesterService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/semesters")
public class SemesterController {
    private final SemesterService semesterService;

    public SemesterController(SemesterService semesterService) {
        this.semesterService = semesterService;
    }

    @GetMapping("/{semesterId}")
    public ResponseEntity<Semester> status(@PathVariable String semesterId) {
        return ResponseEntity.ok(semesterService.status(semesterId));
    }

    @PostMapping("/{semesterId}/lock")
    public ResponseEntity<Semester> lock(@PathVariable String semesterId) {
        return ResponseEntity.ok(semesterService.lock(semesterId));
    }

    @PostMapping("/{semesterId}/unlock")
    public ResponseEntity<Semester> unlock(@PathVariable String semesterId) {
        return ResponseEntity.ok(semesterService.unlock(semesterId));
    }
}
