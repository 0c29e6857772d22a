package com.plateaccess.application.service;

import com.plateaccess.application.dto.OwnerRecordDto;

import java.util.List;
import java.util.Optional;

/**
 * Servicio para la gestión del registro de propietarios.
 * Es la frontera que consume la capa de presentación.
 */
public interface OwnerRegistryService {

    /**
     * Registra un nuevo propietario. La matrícula se normaliza antes de guardarse.
     *
     * @param ownerId           Identificador externo del propietario
     * @param displayName       Nombre del propietario
     * @param vehicleDescriptor Descripción del vehículo (puede ser null)
     * @param plate             Matrícula tal como se escribió
     * @return Resultado con el propietario guardado o el motivo del rechazo
     */
    RegistrationResult registerOwner(String ownerId, String displayName, String vehicleDescriptor, String plate);

    /**
     * Obtiene todos los propietarios en orden de inserción.
     *
     * @return Lista de DTOs de propietarios
     */
    List<OwnerRecordDto> listOwners();

    /**
     * Busca un propietario por su ownerId.
     *
     * @param ownerId Identificador del propietario
     * @return Optional con el DTO si existe
     */
    Optional<OwnerRecordDto> findOwner(String ownerId);

    /**
     * Elimina un propietario. Las entradas de la bitácora no se tocan.
     *
     * @param ownerId Identificador del propietario
     * @return true si se eliminó, false si no existía
     */
    boolean removeOwner(String ownerId);

    long countOwners();

    /**
     * Resultado de un registro. conflict indica un ownerId o matrícula duplicados.
     */
    record RegistrationResult(
            boolean success,
            boolean conflict,
            String reason,
            OwnerRecordDto owner) {

        public static RegistrationResult registered(OwnerRecordDto owner) {
            return new RegistrationResult(true, false, null, owner);
        }

        public static RegistrationResult duplicate(String reason) {
            return new RegistrationResult(false, true, reason, null);
        }

        public static RegistrationResult invalid(String reason) {
            return new RegistrationResult(false, false, reason, null);
        }
    }
}
