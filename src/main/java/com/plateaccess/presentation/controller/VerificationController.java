package com.plateaccess.presentation.controller;

import com.plateaccess.application.dto.VerificationAttemptDto;
import com.plateaccess.application.dto.VerificationResultDto;
import com.plateaccess.application.service.VerificationService;
import com.plateaccess.domain.model.VerificationResult;
import com.plateaccess.infrastructure.file.CsvExportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controlador REST para verificar matrículas y consultar la bitácora.
 * Los fallos de persistencia no se capturan aquí: RestExceptionHandler los
 * convierte en 503 para que nunca parezcan un "sin coincidencia".
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class VerificationController {

    private final VerificationService verificationService;
    private final CsvExportService csvExportService;

    /**
     * API: Verifica un texto escaneado por el OCR.
     */
    @PostMapping("/verify")
    public ResponseEntity<VerificationResultDto> verify(@RequestBody VerifyRequest request) {
        double confidence = request.confidence() != null ? request.confidence() : 0.0;
        VerificationResult result = verificationService.verify(request.scannedText(), confidence);
        return ResponseEntity.ok(VerificationResultDto.fromDomain(result));
    }

    /**
     * API: Obtiene los últimos intentos, más recientes primero.
     */
    @GetMapping("/attempts")
    public ResponseEntity<List<VerificationAttemptDto>> getRecentAttempts(
            @RequestParam(defaultValue = "${verification.default-recent-limit:100}") int limit) {
        return ResponseEntity.ok(verificationService.recentAttempts(limit));
    }

    /**
     * API: Descarga la bitácora reciente como CSV.
     */
    @GetMapping("/attempts/export")
    public ResponseEntity<String> exportAttempts(@RequestParam(defaultValue = "${verification.default-recent-limit:100}") int limit) {
        String csv = csvExportService.exportAttempts(verificationService.recentAttempts(limit));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"verification_log.csv\"")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(csv);
    }

    /**
     * API: Obtiene estadísticas de verificación.
     */
    @GetMapping("/stats")
    public ResponseEntity<VerificationService.VerificationStatsDto> getStats() {
        return ResponseEntity.ok(verificationService.getStats());
    }

    /**
     * Request DTO para verificar un texto escaneado.
     */
    record VerifyRequest(String scannedText, Double confidence) {
    }
}
