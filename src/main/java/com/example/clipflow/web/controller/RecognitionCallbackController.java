package com.example.clipflow.web.controller;

import com.example.clipflow.service.RecognitionCallbackService;
import com.example.clipflow.service.RecognitionCallbackService.DeliveryOutcome;
import com.example.clipflow.web.dto.RecognitionCallbackRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Map;

/**
 * Receiver for completions pushed by the recognition service. Only registered in the process that
 * runs with {@code clipflow.callback-receiver.enabled=true}.
 */
@RestController
@RequestMapping("/api/recognition")
@ConditionalOnProperty(name = "clipflow.callback-receiver.enabled", havingValue = "true")
public class RecognitionCallbackController {

    private static final Logger log = LoggerFactory.getLogger(RecognitionCallbackController.class);

    private final RecognitionCallbackService callbackService;

    public RecognitionCallbackController(RecognitionCallbackService callbackService) {
        this.callbackService = callbackService;
    }

    @PostMapping(value = "/callback", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, String>> receive(@RequestBody @Valid RecognitionCallbackRequest request) {
        log.info("[Callback] Received {} for correlation {}", request.status(), request.correlationId());
        DeliveryOutcome outcome = callbackService.deliver(
                request.correlationId(), request.status(), request.resultRef(), request.error());
        return ResponseEntity.ok(Map.of("status", outcome.name().toLowerCase(Locale.ROOT)));
    }
}
