package com.plateaccess.application.dto;

import com.plateaccess.domain.model.VerificationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO con el resultado de una verificación. ownerInfo es null sin coincidencia.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationResultDto {

    private boolean matchFound;
    private OwnerRecordDto ownerInfo;
    private String scannedPlate;
    private double confidence;
    private String message;
    private Long attemptId;

    public static VerificationResultDto fromDomain(VerificationResult result) {
        return VerificationResultDto.builder()
                .matchFound(result.matchFound())
                .ownerInfo(result.ownerInfo() != null ? OwnerRecordDto.fromDomain(result.ownerInfo()) : null)
                .scannedPlate(result.scannedPlate())
                .confidence(result.confidence())
                .message(result.message())
                .attemptId(result.attemptId())
                .build();
    }
}
