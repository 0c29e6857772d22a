package com.plateaccess.application.dto;

import com.plateaccess.domain.model.VerificationAttempt;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.format.DateTimeFormatter;

/**
 * DTO para transferir un intento de verificación a la capa de presentación.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationAttemptDto {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private Long attemptId;
    private String scannedPlate;
    private String matchedOwnerId;
    private boolean matchFound;
    private double confidence;
    private String scanTimestamp;
    private String date;
    private String time;
    private String status;
    private String statusClass;

    /**
     * Crea un DTO desde un modelo de dominio.
     */
    public static VerificationAttemptDto fromDomain(VerificationAttempt attempt) {
        return VerificationAttemptDto.builder()
                .attemptId(attempt.getAttemptId())
                .scannedPlate(attempt.getScannedPlate())
                .matchedOwnerId(attempt.getMatchedOwnerId())
                .matchFound(attempt.isMatchFound())
                .confidence(attempt.getConfidence())
                .scanTimestamp(attempt.getScanTimestamp().toString())
                .date(attempt.getScanTimestamp().format(DATE_FORMAT))
                .time(attempt.getScanTimestamp().format(TIME_FORMAT))
                .status(attempt.isMatchFound() ? "Match" : "No match")
                .statusClass(attempt.isMatchFound() ? "success" : "danger")
                .build();
    }
}
