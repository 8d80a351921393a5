package com.fintech.savings.api;

import com.fintech.savings.domain.model.PerformanceSnapshot;
import com.fintech.savings.domain.service.PerformanceMetricsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(ApiPaths.BASE)
@RequiredArgsConstructor
public class PerformanceController {

    private final PerformanceMetricsService performanceMetricsService;

    @GetMapping("/performance")
    public ResponseEntity<PerformanceSnapshot> performance() {
        return ResponseEntity.ok(performanceMetricsService.snapshot());
    }
}
