package com.plateaccess.presentation.controller;

import com.plateaccess.application.service.VerificationService;
import com.plateaccess.presentation.websocket.VerificationWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Controlador REST para consultar el estado del sistema en un solo JSON.
 */
@RestController
@RequestMapping("/api/system")
@RequiredArgsConstructor
public class SystemStatusController {

    private final VerificationService verificationService;
    private final VerificationWebSocketHandler webSocketHandler;

    /**
     * GET /api/system/status
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getSystemStatus() {
        Map<String, Object> status = new LinkedHashMap<>();

        var stats = verificationService.getStats();
        status.put("registeredOwners", stats.registeredOwners());

        Map<String, Object> attempts = new LinkedHashMap<>();
        attempts.put("total", stats.totalAttempts());
        attempts.put("matched", stats.matchedAttempts());
        attempts.put("unmatched", stats.unmatchedAttempts());
        attempts.put("lastScanTime", stats.lastScanTime());
        status.put("verificationLog", attempts);

        status.put("connectedWebSocketClients", webSocketHandler.getConnectedClients());
        status.put("serverTime", LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));

        return ResponseEntity.ok(status);
    }
}
