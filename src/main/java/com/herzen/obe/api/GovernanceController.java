package com.herzen.obe.api;

import com.herzen.obe.governance.GovernanceModels.GovernanceSnapshot;
import com.herzen.obe.governance.GovernanceModels.GovernanceUpdateRequest;
import com.herzen.obe.governance.GovernanceService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/governance")
public class GovernanceController {
    private final GovernanceService governanceService;

    public GovernanceController(GovernanceService governanceService) {
        this.governanceService = governanceService;
    }

    @GetMapping
    public ResponseEntity<GovernanceSnapshot> current() {
        return ResponseEntity.ok(governanceService.capture());
    }

    @PostMapping
    public ResponseEntity<GovernanceService.PublishResult> publish(@RequestBody GovernanceUpdateRequest request) {
        return ResponseEntity.ok(governanceService.publish(request));
    }
}
