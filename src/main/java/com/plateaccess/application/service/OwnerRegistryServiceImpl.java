package com.plateaccess.application.service;

import com.plateaccess.application.dto.OwnerRecordDto;
import com.plateaccess.domain.exception.DuplicateKeyException;
import com.plateaccess.domain.model.OwnerRecord;
import com.plateaccess.domain.port.OwnerRegistryPort;
import com.plateaccess.domain.service.PlateNormalizer;
import com.plateaccess.presentation.websocket.VerificationWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Implementación del servicio de registro de propietarios.
 * Un PersistenceFailureException del puerto se propaga tal cual.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OwnerRegistryServiceImpl implements OwnerRegistryService {

    private final OwnerRegistryPort ownerRegistryPort;
    private final VerificationWebSocketHandler webSocketHandler;

    @Override
    public RegistrationResult registerOwner(String ownerId, String displayName, String vehicleDescriptor,
            String plate) {
        log.info("Registrando propietario: {} - {} - matrícula '{}'", ownerId, displayName, plate);

        if (ownerId == null || ownerId.isBlank()) {
            return reject("Owner id is required");
        }
        if (displayName == null || displayName.isBlank()) {
            return reject("Display name is required");
        }

        String plateKey = PlateNormalizer.normalize(plate);
        if (PlateNormalizer.isBlankKey(plateKey)) {
            return reject("License plate is required");
        }

        OwnerRecord owner = OwnerRecord.builder()
                .ownerId(ownerId.trim())
                .displayName(displayName.trim())
                .vehicleDescriptor(vehicleDescriptor != null ? vehicleDescriptor.trim() : null)
                .plateKey(plateKey)
                .build();

        String tooLong = checkLengths(owner);
        if (tooLong != null) {
            return reject(tooLong);
        }

        OwnerRecord saved;
        try {
            saved = ownerRegistryPort.register(owner);
        } catch (DuplicateKeyException e) {
            log.warn("Registro rechazado por duplicado ({}): {}", e.getField(), e.getMessage());
            return RegistrationResult.duplicate(e.getMessage());
        }

        OwnerRecordDto dto = OwnerRecordDto.fromDomain(saved);
        try {
            webSocketHandler.broadcastOwnerRegistered(dto);
        } catch (Exception e) {
            log.error("Error notificando WebSocket: {}", e.getMessage());
        }

        log.info("Propietario registrado exitosamente: {} - {}", saved.getOwnerId(), saved.getPlateKey());
        return RegistrationResult.registered(dto);
    }

    @Override
    public List<OwnerRecordDto> listOwners() {
        return ownerRegistryPort.findAll().stream()
                .map(OwnerRecordDto::fromDomain)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<OwnerRecordDto> findOwner(String ownerId) {
        if (ownerId == null) {
            return Optional.empty();
        }
        return ownerRegistryPort.findByOwnerId(ownerId.trim())
                .map(OwnerRecordDto::fromDomain);
    }

    @Override
    public boolean removeOwner(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            return false;
        }
        String normalizedId = ownerId.trim();
        log.info("Eliminando propietario: {}", normalizedId);

        boolean removed = ownerRegistryPort.remove(normalizedId);
        if (removed) {
            try {
                webSocketHandler.broadcastOwnerRemoved(normalizedId);
            } catch (Exception e) {
                log.error("Error notificando WebSocket: {}", e.getMessage());
            }
        } else {
            log.warn("Propietario no encontrado para eliminar: {}", normalizedId);
        }
        return removed;
    }

    @Override
    public long countOwners() {
        return ownerRegistryPort.count();
    }

    /**
     * @return motivo del rechazo, o null si todos los campos caben en el almacén
     */
    private String checkLengths(OwnerRecord owner) {
        if (owner.getOwnerId().length() > OwnerRecord.MAX_OWNER_ID_LENGTH) {
            return "Owner id exceeds " + OwnerRecord.MAX_OWNER_ID_LENGTH + " characters";
        }
        if (owner.getDisplayName().length() > OwnerRecord.MAX_DISPLAY_NAME_LENGTH) {
            return "Display name exceeds " + OwnerRecord.MAX_DISPLAY_NAME_LENGTH + " characters";
        }
        if (owner.getVehicleDescriptor() != null
                && owner.getVehicleDescriptor().length() > OwnerRecord.MAX_VEHICLE_DESCRIPTOR_LENGTH) {
            return "Vehicle descriptor exceeds " + OwnerRecord.MAX_VEHICLE_DESCRIPTOR_LENGTH + " characters";
        }
        if (owner.getPlateKey().length() > OwnerRecord.MAX_PLATE_KEY_LENGTH) {
            return "License plate exceeds " + OwnerRecord.MAX_PLATE_KEY_LENGTH + " characters";
        }
        return null;
    }

    private RegistrationResult reject(String reason) {
        log.warn("Registro rechazado: {}", reason);
        return RegistrationResult.invalid(reason);
    }
}
