package com.plateaccess.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Modelo de dominio que representa una entrada de la bitácora de verificación.
 * Una entrada por cada llamada a verify, con o sin coincidencia.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationAttempt {

    /** Identificador asignado por la bitácora, creciente */
    private Long attemptId;

    /** Matrícula canónica verificada (tras normalizar) */
    private String scannedPlate;

    /**
     * ownerId capturado en el momento del escaneo. Referencia débil:
     * no se modifica si el propietario se elimina después.
     */
    private String matchedOwnerId;

    private boolean matchFound;

    /** Confianza del OCR, ya acotada a [0, 1] */
    private double confidence;

    /** Asignado por la bitácora al insertar */
    private LocalDateTime scanTimestamp;

    /**
     * Crea un intento pendiente de guardar (sin id ni timestamp).
     *
     * @param scannedPlate   Matrícula canónica
     * @param matchedOwnerId ownerId encontrado o null
     * @param confidence     Confianza acotada
     * @return Nuevo VerificationAttempt
     */
    public static VerificationAttempt pending(String scannedPlate, String matchedOwnerId, double confidence) {
        return VerificationAttempt.builder()
                .scannedPlate(scannedPlate)
                .matchedOwnerId(matchedOwnerId)
                .matchFound(matchedOwnerId != null)
                .confidence(confidence)
                .build();
    }
}
