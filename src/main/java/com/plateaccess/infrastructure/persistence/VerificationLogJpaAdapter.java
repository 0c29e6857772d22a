package com.plateaccess.infrastructure.persistence;

import com.plateaccess.domain.exception.PersistenceFailureException;
import com.plateaccess.domain.model.VerificationAttempt;
import com.plateaccess.domain.port.VerificationLogPort;
import com.plateaccess.infrastructure.persistence.entity.VerificationLogEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Implementación del puerto VerificationLogPort usando JPA.
 * <p>
 * append no es @Transactional: saveAndFlush confirma dentro del lock, así el
 * orden de attemptId, el de scanTimestamp y el de commit coinciden.
 * La espera por el lock está acotada; si se agota, el append falla con
 * PersistenceFailureException en lugar de bloquear al llamador.
 */
@Component
@Slf4j
public class VerificationLogJpaAdapter implements VerificationLogPort {

    private final JpaVerificationLogRepository logRepository;
    private final Clock clock;
    private final long lockTimeoutMillis;

    private final ReentrantLock appendLock = new ReentrantLock();

    // Protegido por appendLock
    private LocalDateTime lastIssued;

    public VerificationLogJpaAdapter(JpaVerificationLogRepository logRepository, Clock clock,
            @Value("${verification.append-lock-timeout-ms:15000}") long lockTimeoutMillis) {
        this.logRepository = logRepository;
        this.clock = clock;
        this.lockTimeoutMillis = lockTimeoutMillis;
    }

    @Override
    public VerificationAttempt append(VerificationAttempt attempt) {
        acquireAppendLock();
        try {
            LocalDateTime timestamp = nextTimestamp();
            VerificationLogEntity saved = logRepository.saveAndFlush(toEntity(attempt, timestamp));
            lastIssued = timestamp;

            log.debug("Intento #{} registrado en bitácora: {} -> {}",
                    saved.getId(), saved.getScannedPlate(), saved.getMatchedOwnerId());
            return toDomain(saved);

        } catch (DataAccessException e) {
            throw PersistenceFailureException.auditLog("append", e);
        } finally {
            appendLock.unlock();
        }
    }

    @Override
    public List<VerificationAttempt> recent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        try {
            return logRepository.findLatest(PageRequest.of(0, limit))
                    .stream()
                    .map(this::toDomain)
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            throw PersistenceFailureException.auditLog("recent", e);
        }
    }

    @Override
    public long count() {
        try {
            return logRepository.count();
        } catch (DataAccessException e) {
            throw PersistenceFailureException.auditLog("count", e);
        }
    }

    @Override
    public long countMatched() {
        try {
            return logRepository.countByMatchFound(Boolean.TRUE);
        } catch (DataAccessException e) {
            throw PersistenceFailureException.auditLog("countMatched", e);
        }
    }

    private void acquireAppendLock() {
        boolean acquired;
        try {
            acquired = appendLock.tryLock(lockTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw PersistenceFailureException.auditLog("append", e);
        }
        if (!acquired) {
            log.error("Bitácora ocupada: append esperó más de {} ms", lockTimeoutMillis);
            throw PersistenceFailureException.auditLogTimeout("append", lockTimeoutMillis);
        }
    }

    /**
     * Timestamp no decreciente respecto al último emitido, aunque el reloj retroceda.
     * Debe llamarse con appendLock tomado.
     */
    private LocalDateTime nextTimestamp() {
        if (lastIssued == null) {
            lastIssued = logRepository.findLastScanTimestamp().orElse(null);
        }
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
        if (lastIssued != null && now.isBefore(lastIssued)) {
            return lastIssued;
        }
        return now;
    }

    /**
     * Convierte un VerificationAttempt de dominio a una entidad JPA.
     */
    private VerificationLogEntity toEntity(VerificationAttempt attempt, LocalDateTime timestamp) {
        return VerificationLogEntity.builder()
                .scannedPlate(attempt.getScannedPlate())
                .matchedOwnerId(attempt.getMatchedOwnerId())
                .matchFound(attempt.isMatchFound())
                .confidence(attempt.getConfidence())
                .scanTimestamp(timestamp)
                .build();
    }

    /**
     * Convierte una entidad JPA a un VerificationAttempt de dominio.
     */
    private VerificationAttempt toDomain(VerificationLogEntity entity) {
        return VerificationAttempt.builder()
                .attemptId(entity.getId())
                .scannedPlate(entity.getScannedPlate())
                .matchedOwnerId(entity.getMatchedOwnerId())
                .matchFound(Boolean.TRUE.equals(entity.getMatchFound()))
                .confidence(entity.getConfidence())
                .scanTimestamp(entity.getScanTimestamp())
                .build();
    }
}
