package com.prismTax.simulator.gateway.controller;

import com.prismTax.simulator.gateway.dto.ButtonRequest;
import com.prismTax.simulator.gateway.dto.ResetRequest;
import com.prismTax.simulator.gateway.dto.SimulatorMessageRequest;
import com.prismTax.simulator.gateway.dto.SimulatorTurnResponse;
import com.prismTax.simulator.gateway.dto.TranscriptResponse;
import com.prismTax.simulator.gateway.dto.UploadRequest;
import com.prismTax.simulator.gateway.service.SimulatorGatewayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Simulator REST controller - thin HTTP layer over the simulated WhatsApp channel.
 *
 * Responsibilities:
 * - Handle HTTP requests/responses
 * - Extract the simulated phone number header
 * - Delegate turns to SimulatorGatewayService
 */
@RestController
@RequestMapping("/api/v1/simulator")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class SimulatorController {

    static final String PHONE_HEADER = "X-Simulator-Phone";

    private final SimulatorGatewayService simulatorGatewayService;

    /**
     * Handle preflight OPTIONS requests for CORS.
     */
    @RequestMapping(method = RequestMethod.OPTIONS)
    public ResponseEntity<Void> options() {
        return ResponseEntity.ok().build();
    }

    @PostMapping("/messages")
    public ResponseEntity<SimulatorTurnResponse> message(
            @Valid @RequestBody SimulatorMessageRequest request,
            @RequestHeader(value = PHONE_HEADER, required = false) String phoneHeader) {
        return ResponseEntity.ok(simulatorGatewayService.processMessage(request, phoneHeader));
    }

    @PostMapping("/buttons")
    public ResponseEntity<SimulatorTurnResponse> button(
            @Valid @RequestBody ButtonRequest request,
            @RequestHeader(value = PHONE_HEADER, required = false) String phoneHeader) {
        return ResponseEntity.ok(simulatorGatewayService.processButton(request, phoneHeader));
    }

    @PostMapping("/uploads")
    public ResponseEntity<SimulatorTurnResponse> upload(
            @Valid @RequestBody UploadRequest request,
            @RequestHeader(value = PHONE_HEADER, required = false) String phoneHeader) {
        return ResponseEntity.ok(simulatorGatewayService.processUpload(request, phoneHeader));
    }

    /**
     * Starts over: the current session is replaced by a fresh one in state NEW.
     */
    @PostMapping("/reset")
    public ResponseEntity<SimulatorTurnResponse> reset(
            @RequestBody(required = false) ResetRequest request,
            @RequestHeader(value = PHONE_HEADER, required = false) String phoneHeader) {
        return ResponseEntity.ok(simulatorGatewayService.reset(request, phoneHeader));
    }

    @GetMapping("/transcript")
    public ResponseEntity<TranscriptResponse> transcript(
            @RequestHeader(value = PHONE_HEADER, required = false) String phoneHeader) {
        return ResponseEntity.ok(simulatorGatewayService.getTranscript(phoneHeader));
    }
}
