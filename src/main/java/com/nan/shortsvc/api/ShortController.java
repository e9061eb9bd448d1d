package com.nan.shortsvc.api;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import com.nan.shortsvc.metrics.ShortMetrics;
import com.nan.shortsvc.model.CreateRequest;
import com.nan.shortsvc.model.CreateResponse;
import com.nan.shortsvc.model.LookupResponse;
import com.nan.shortsvc.service.ShortService;

@RestController
public class ShortController {

    private final ShortService service;
    private final ShortMetrics metrics;

    public ShortController(ShortService service, ShortMetrics metrics) {
        this.service = service;
        this.metrics = metrics;
    }

    // POST /api {"v":"..."} -> {"k":"..."}
    @PostMapping("/api")
    public ResponseEntity<CreateResponse> create(@RequestBody CreateRequest request) {
        if (request.getV() == null) {
            throw new MissingValueException();
        }
        return ResponseEntity.ok(new CreateResponse(service.create(request.getV())));
    }

    // GET /api/{key} -> {"v":"..."}
    @GetMapping("/api/{key}")
    public ResponseEntity<LookupResponse> lookup(@PathVariable String key) {
        return ResponseEntity.ok(new LookupResponse(service.lookup(key)));
    }

    // Liveness probe -> {"status":"UP"}
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Long>> metrics() {
        return ResponseEntity.ok(metrics.snapshot());
    }

    static class MissingValueException extends RuntimeException {
        MissingValueException() {
            super("request body must carry a \"v\" field");
        }
    }
}
