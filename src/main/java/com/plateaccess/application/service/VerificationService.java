package com.plateaccess.application.service;

import com.plateaccess.application.dto.VerificationAttemptDto;
import com.plateaccess.domain.model.VerificationResult;

import java.util.List;

/**
 * Motor de verificación: compara el texto escaneado con el registro y deja
 * constancia de cada intento en la bitácora.
 */
public interface VerificationService {

    /**
     * Verifica un texto escaneado por el OCR.
     * <p>
     * El intento queda guardado en la bitácora antes de retornar. Si el registro
     * o la bitácora no están disponibles se lanza PersistenceFailureException
     * y no se devuelve ningún resultado.
     *
     * @param scannedText Texto entregado por el OCR
     * @param confidence  Confianza del OCR, se acota a [0, 1]
     * @return Resultado de la verificación
     */
    VerificationResult verify(String scannedText, double confidence);

    /**
     * Obtiene los últimos N intentos, más recientes primero.
     *
     * @param limit Número máximo de intentos
     * @return Lista de DTOs de intentos
     */
    List<VerificationAttemptDto> recentAttempts(int limit);

    /**
     * Obtiene estadísticas de la bitácora y del registro.
     *
     * @return DTO con estadísticas
     */
    VerificationStatsDto getStats();

    /**
     * DTO interno para estadísticas.
     */
    record VerificationStatsDto(
            long totalAttempts,
            long matchedAttempts,
            long unmatchedAttempts,
            long registeredOwners,
            String lastScanTime) {
    }
}
