package com.plateaccess.infrastructure.persistence;

import com.plateaccess.infrastructure.persistence.entity.OwnerEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repositorio JPA para operaciones con owners.
 */
@Repository
public interface JpaOwnerRepository extends JpaRepository<OwnerEntity, Long> {

    Optional<OwnerEntity> findByPlateKey(String plateKey);

    Optional<OwnerEntity> findByOwnerId(String ownerId);

    boolean existsByPlateKey(String plateKey);

    boolean existsByOwnerId(String ownerId);

    /**
     * Todos los propietarios en orden de inserción.
     */
    List<OwnerEntity> findAllByOrderByIdAsc();
}
