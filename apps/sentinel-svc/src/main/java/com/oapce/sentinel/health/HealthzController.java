package com.oapce.sentinel.health;

import com.oapce.sentinel.detection.DetectionEnsemble;
import com.oapce.sentinel.model.DetectionMethod;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoint that also reports which detectors the ensemble resolved at startup.
 * {@code DEGRADED} means the service is up but no detector can run.
 */
@RestController
public class HealthzController {

    private final DetectionEnsemble ensemble;

    public HealthzController(DetectionEnsemble ensemble) {
        this.ensemble = ensemble;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> healthz() {
        List<String> detectors = wireNames(ensemble.methods());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", detectors.isEmpty() ? "DEGRADED" : "UP");
        body.put("detectors", detectors);
        body.put("unavailableDetectors", wireNames(ensemble.unavailableMethods()));
        return body;
    }

    private static List<String> wireNames(List<DetectionMethod> methods) {
        return methods.stream().map(DetectionMethod::wireName).toList();
    }
}
