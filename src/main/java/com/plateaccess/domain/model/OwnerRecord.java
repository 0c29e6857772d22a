package com.plateaccess.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Modelo de dominio que representa un propietario registrado con su vehículo.
 * La matrícula siempre se guarda en forma canónica (ver PlateNormalizer).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OwnerRecord {

    /** Longitudes máximas admitidas por el almacén */
    public static final int MAX_OWNER_ID_LENGTH = 64;
    public static final int MAX_DISPLAY_NAME_LENGTH = 150;
    public static final int MAX_VEHICLE_DESCRIPTOR_LENGTH = 100;
    public static final int MAX_PLATE_KEY_LENGTH = 32;

    /** Identificador externo del propietario (ej: matrícula institucional) */
    private String ownerId;

    /** Nombre visible del propietario */
    private String displayName;

    /** Descripción libre del vehículo (ej: color) */
    private String vehicleDescriptor;

    /** Matrícula canónica, única en todo el registro */
    private String plateKey;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
