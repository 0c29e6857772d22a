package com.plateaccess.domain.port;

import com.plateaccess.domain.model.OwnerRecord;

import java.util.List;
import java.util.Optional;

/**
 * Puerto (interfaz) para el registro de propietarios.
 * Las matrículas llegan ya normalizadas; el registro no las vuelve a normalizar.
 * Toda mutación es durable antes de retornar.
 */
public interface OwnerRegistryPort {

    /**
     * Registra un nuevo propietario. La comprobación de unicidad y el insert
     * son una sola unidad atómica.
     *
     * @param owner Propietario a registrar (plateKey canónica)
     * @return Registro guardado con createdAt/updatedAt asignados
     * @throws com.plateaccess.domain.exception.DuplicateKeyException si ownerId o plateKey ya existen
     */
    OwnerRecord register(OwnerRecord owner);

    /**
     * Busca un propietario por matrícula canónica (coincidencia exacta).
     *
     * @param plateKey Matrícula canónica
     * @return Optional con el propietario si existe
     */
    Optional<OwnerRecord> findByPlate(String plateKey);

    /**
     * Busca un propietario por su ownerId.
     *
     * @param ownerId Identificador del propietario
     * @return Optional con el propietario si existe
     */
    Optional<OwnerRecord> findByOwnerId(String ownerId);

    /**
     * Obtiene todos los propietarios en orden de inserción.
     *
     * @return Lista de propietarios
     */
    List<OwnerRecord> findAll();

    /**
     * Elimina un propietario. No toca la bitácora.
     *
     * @param ownerId Identificador del propietario
     * @return true si se eliminó, false si no existía
     */
    boolean remove(String ownerId);

    long count();
}
