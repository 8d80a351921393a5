package com.fintech.savings.api;

import com.fintech.savings.api.dto.FilterRequest;
import com.fintech.savings.api.dto.ValidatorRequest;
import com.fintech.savings.domain.model.EnrichedTransaction;
import com.fintech.savings.domain.model.FilterResult;
import com.fintech.savings.domain.model.Transaction;
import com.fintech.savings.domain.model.ValidationResult;
import com.fintech.savings.domain.service.SavingsPipeline;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for transaction parsing, validation and period filtering.
 */
@Slf4j
@Validated
@RestController
@RequestMapping(ApiPaths.BASE)
@RequiredArgsConstructor
public class TransactionController {

    private final SavingsPipeline savingsPipeline;

    /**
     * POST /transactions:parse
     *
     * Request body: [{date, amount}]
     * Response: [{date, amount, ceiling, remnant}]
     */
    @PostMapping("/transactions:parse")
    public ResponseEntity<List<EnrichedTransaction>> parse(@RequestBody List<@Valid @NotNull Transaction> transactions) {
        log.info("Received parse request: {} transactions", transactions.size());
        return ResponseEntity.ok(savingsPipeline.enrich(transactions));
    }

    /**
     * POST /transactions:validator
     */
    @PostMapping("/transactions:validator")
    public ResponseEntity<ValidationResult> validate(@Valid @RequestBody ValidatorRequest request) {
        log.info("Received validation request: {} transactions", request.getTransactions().size());
        return ResponseEntity.ok(savingsPipeline.validate(request.getTransactions()));
    }

    @PostMapping("/transactions:filter")
    public ResponseEntity<FilterResult> filter(@Valid @RequestBody FilterRequest request) {
        log.info("Received filter request: {} transactions", request.getTransactions().size());
        return ResponseEntity.ok(savingsPipeline.filterByPeriods(
                request.getTransactions(), request.getQ(), request.getP(), request.getK()));
    }
}
