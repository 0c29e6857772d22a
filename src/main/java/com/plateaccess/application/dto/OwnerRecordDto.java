package com.plateaccess.application.dto;

import com.plateaccess.domain.model.OwnerRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.format.DateTimeFormatter;

/**
 * DTO para transferencia de datos de un propietario registrado.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OwnerRecordDto {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private String ownerId;
    private String displayName;
    private String vehicleDescriptor;
    private String plateKey;
    private String createdAt;
    private String updatedAt;

    /**
     * Convierte un modelo de dominio a DTO.
     */
    public static OwnerRecordDto fromDomain(OwnerRecord owner) {
        return OwnerRecordDto.builder()
                .ownerId(owner.getOwnerId())
                .displayName(owner.getDisplayName())
                .vehicleDescriptor(owner.getVehicleDescriptor())
                .plateKey(owner.getPlateKey())
                .createdAt(owner.getCreatedAt() != null ? owner.getCreatedAt().format(DATE_FORMAT) : "N/A")
                .updatedAt(owner.getUpdatedAt() != null ? owner.getUpdatedAt().format(DATE_FORMAT) : "N/A")
                .build();
    }
}
