package com.plateaccess.application.service;

import com.plateaccess.application.dto.VerificationAttemptDto;
import com.plateaccess.domain.exception.PersistenceFailureException;
import com.plateaccess.domain.model.OwnerRecord;
import com.plateaccess.domain.model.VerificationAttempt;
import com.plateaccess.domain.model.VerificationResult;
import com.plateaccess.domain.port.OwnerRegistryPort;
import com.plateaccess.domain.port.VerificationLogPort;
import com.plateaccess.domain.service.PlateNormalizer;
import com.plateaccess.presentation.websocket.VerificationWebSocketHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Implementación del motor de verificación.
 * No guarda estado propio: delega en el registro y en la bitácora.
 */
@Service
@Slf4j
public class VerificationServiceImpl implements VerificationService {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final OwnerRegistryPort ownerRegistryPort;
    private final VerificationLogPort verificationLogPort;
    private final VerificationWebSocketHandler webSocketHandler;

    @Value("${verification.recent-max-limit:500}")
    private int recentMaxLimit;

    public VerificationServiceImpl(
            OwnerRegistryPort ownerRegistryPort,
            VerificationLogPort verificationLogPort,
            VerificationWebSocketHandler webSocketHandler) {
        this.ownerRegistryPort = ownerRegistryPort;
        this.verificationLogPort = verificationLogPort;
        this.webSocketHandler = webSocketHandler;
    }

    @Override
    public VerificationResult verify(String scannedText, double confidence) {
        String canonical = PlateNormalizer.normalize(scannedText);
        double clamped = clampConfidence(confidence);
        log.info("Verificando matrícula: '{}' -> '{}' (confianza {})", scannedText, canonical, clamped);

        // Una clave vacía nunca está en el registro
        Optional<OwnerRecord> owner;
        try {
            owner = PlateNormalizer.isBlankKey(canonical)
                    ? Optional.empty()
                    : ownerRegistryPort.findByPlate(canonical);
        } catch (PersistenceFailureException e) {
            log.error("Registro no disponible al verificar '{}': {}", canonical, e.getMessage());
            throw e;
        }

        VerificationAttempt pending = VerificationAttempt.pending(
                canonical,
                owner.map(OwnerRecord::getOwnerId).orElse(null),
                clamped);

        VerificationAttempt stored;
        try {
            stored = verificationLogPort.append(pending);
        } catch (PersistenceFailureException e) {
            log.error("No se pudo registrar el intento para '{}' en la bitácora: {}", canonical, e.getMessage());
            throw e;
        }

        VerificationResult result = owner
                .map(o -> VerificationResult.matched(o, stored))
                .orElseGet(() -> VerificationResult.notMatched(stored));

        try {
            webSocketHandler.broadcastAttempt(VerificationAttemptDto.fromDomain(stored));
        } catch (Exception e) {
            log.error("Error notificando WebSocket: {}", e.getMessage());
        }

        log.info("Intento #{} procesado: {}", stored.getAttemptId(), result.message());
        return result;
    }

    @Override
    public List<VerificationAttemptDto> recentAttempts(int limit) {
        int effectiveLimit = Math.min(limit, recentMaxLimit);
        return verificationLogPort.recent(effectiveLimit).stream()
                .map(VerificationAttemptDto::fromDomain)
                .collect(Collectors.toList());
    }

    @Override
    public VerificationStatsDto getStats() {
        long total = verificationLogPort.count();
        long matched = verificationLogPort.countMatched();

        String lastScan = verificationLogPort.recent(1).stream()
                .findFirst()
                .map(a -> a.getScanTimestamp().format(TIME_FORMAT))
                .orElse("--");

        return new VerificationStatsDto(total, matched, total - matched, ownerRegistryPort.count(), lastScan);
    }

    /**
     * Acota la confianza a [0, 1]. NaN se guarda como 0.
     */
    static double clampConfidence(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
