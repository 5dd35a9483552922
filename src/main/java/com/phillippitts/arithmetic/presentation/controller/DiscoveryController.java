package com.phillippitts.arithmetic.presentation.controller;

import com.phillippitts.arithmetic.config.properties.CalculatorProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Greeting and liveness endpoints. Neither touches the evaluator.
 */
@RestController
class DiscoveryController {

    private static final Logger log = LogManager.getLogger(DiscoveryController.class);

    private final CalculatorProperties properties;

    DiscoveryController(CalculatorProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/")
    ResponseEntity<Map<String, Object>> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", properties.greeting());
        body.put("try", properties.examples());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    ResponseEntity<Map<String, String>> health() {
        log.debug("Liveness check");
        return ResponseEntity.ok(Map.of("status", "ok"));
    }
}
