package com.prismTax.simulator.gateway.controller;

import com.prismTax.simulator.classifier.dto.NluClassifyRequest;
import com.prismTax.simulator.classifier.model.ClassificationResult;
import com.prismTax.simulator.classifier.service.IntentClassifierService;
import com.prismTax.simulator.gateway.service.CorrelationIdService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Admin surface for trying the intent classifier without a session.
 * An unrecognized message returns an empty result rather than an error.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/nlu")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class NluTestingController {

    private final IntentClassifierService intentClassifierService;
    private final CorrelationIdService correlationIdService;

    @RequestMapping(method = RequestMethod.OPTIONS)
    public ResponseEntity<Void> options() {
        return ResponseEntity.ok().build();
    }

    @PostMapping("/classify")
    public ResponseEntity<ClassificationResult> classify(@Valid @RequestBody NluClassifyRequest request) {
        String correlationId = correlationIdService.generateCorrelationId();
        log.info("NLU test request - correlationId: {}, contextSize: {}", correlationId,
                request.getContext() == null ? 0 : request.getContext().size());
        ClassificationResult result = intentClassifierService
                .classify(request.getMessage(), request.getContext(), correlationId)
                .orElseGet(ClassificationResult::new);
        return ResponseEntity.ok(result);
    }
}
