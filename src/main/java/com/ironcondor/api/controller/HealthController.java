package com.ironcondor.api.controller;

import com.ironcondor.api.dto.response.HealthInfoResponse;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/health -- shallow liveness check, always 200 while the app runs</li>
 *   <li>GET /api/health/info -- service name, version and the analytics it offers</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    static final List<String> FEATURES = List.of(
            "black_scholes_pricing",
            "probability_of_profit",
            "payoff_profile",
            "strike_optimization",
            "strategy_scoring",
            "portfolio_greeks",
            "position_monitoring");

    private final String serviceName;
    private final String version;

    public HealthController(
            @Value("${spring.application.name:iron-condor-analytics}") String serviceName,
            @Value("${info.app.version:1.0.0}") String version) {
        this.serviceName = serviceName;
        this.version = version;
    }

    @GetMapping
    public ResponseEntity<Map<String, String>> shallowHealth() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    @GetMapping("/info")
    public ResponseEntity<HealthInfoResponse> info() {
        return ResponseEntity.ok(HealthInfoResponse.builder()
                .status("UP")
                .service(serviceName)
                .version(version)
                .features(FEATURES)
                .build());
    }
}
