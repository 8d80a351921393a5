package com.fintech.savings.api;

import com.fintech.savings.api.dto.ReturnsRequest;
import com.fintech.savings.domain.model.ReturnsPreset;
import com.fintech.savings.domain.model.ReturnsResult;
import com.fintech.savings.domain.service.SavingsPipeline;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for returns projections under the NPS and index presets.
 */
@Slf4j
@RestController
@RequestMapping(ApiPaths.BASE)
@RequiredArgsConstructor
public class ReturnsController {

    private final SavingsPipeline savingsPipeline;

    @PostMapping("/returns:nps")
    public ResponseEntity<ReturnsResult> nps(@Valid @RequestBody ReturnsRequest request) {
        return ResponseEntity.ok(project(request, ReturnsPreset.NPS));
    }

    @PostMapping("/returns:index")
    public ResponseEntity<ReturnsResult> index(@Valid @RequestBody ReturnsRequest request) {
        return ResponseEntity.ok(project(request, ReturnsPreset.INDEX));
    }

    private ReturnsResult project(ReturnsRequest request, ReturnsPreset preset) {
        log.info("Received {} returns request: {} transactions", preset, request.getTransactions().size());
        return savingsPipeline.projectReturns(
                request.getTransactions(),
                request.getQ(),
                request.getP(),
                request.getK(),
                request.getAge(),
                request.getWage(),
                request.getInflation(),
                preset);
    }
}
