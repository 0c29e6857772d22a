package com.plateaccess.infrastructure.persistence;

import com.plateaccess.domain.exception.DuplicateKeyException;
import com.plateaccess.domain.exception.PersistenceFailureException;
import com.plateaccess.domain.model.OwnerRecord;
import com.plateaccess.domain.port.OwnerRegistryPort;
import com.plateaccess.infrastructure.persistence.entity.OwnerEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Implementación del puerto OwnerRegistryPort usando JPA.
 * Las restricciones únicas de la tabla owners son el árbitro final cuando dos
 * registros concurrentes pasan la comprobación previa a la vez.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OwnerRegistryJpaAdapter implements OwnerRegistryPort {

    private final JpaOwnerRepository ownerRepository;
    private final Clock clock;

    @Override
    @Transactional
    public OwnerRecord register(OwnerRecord owner) {
        try {
            if (ownerRepository.existsByOwnerId(owner.getOwnerId())) {
                throw DuplicateKeyException.ownerId(owner.getOwnerId());
            }
            if (ownerRepository.existsByPlateKey(owner.getPlateKey())) {
                throw DuplicateKeyException.plateKey(owner.getPlateKey());
            }

            LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
            OwnerEntity saved = ownerRepository.saveAndFlush(toEntity(owner, now));
            log.info("Propietario insertado: {} ({}) - matrícula {}",
                    saved.getOwnerId(), saved.getDisplayName(), saved.getPlateKey());

            return toDomain(saved);

        } catch (DataIntegrityViolationException e) {
            Optional<DuplicateKeyException.Field> field = resolveConstraint(e);
            if (field.isEmpty()) {
                // Longitud o NOT NULL: no es un duplicado
                throw PersistenceFailureException.registry("register", e);
            }
            log.warn("Restricción única violada al registrar {}: {}", owner.getOwnerId(), field.get());
            throw DuplicateKeyException.fromConstraint(field.get(), e);
        } catch (DataAccessException e) {
            throw PersistenceFailureException.registry("register", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OwnerRecord> findByPlate(String plateKey) {
        try {
            return ownerRepository.findByPlateKey(plateKey).map(this::toDomain);
        } catch (DataAccessException e) {
            throw PersistenceFailureException.registry("findByPlate", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OwnerRecord> findByOwnerId(String ownerId) {
        try {
            return ownerRepository.findByOwnerId(ownerId).map(this::toDomain);
        } catch (DataAccessException e) {
            throw PersistenceFailureException.registry("findByOwnerId", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<OwnerRecord> findAll() {
        try {
            return ownerRepository.findAllByOrderByIdAsc()
                    .stream()
                    .map(this::toDomain)
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            throw PersistenceFailureException.registry("findAll", e);
        }
    }

    @Override
    @Transactional
    public boolean remove(String ownerId) {
        try {
            Optional<OwnerEntity> entity = ownerRepository.findByOwnerId(ownerId);
            if (entity.isEmpty()) {
                return false;
            }
            ownerRepository.delete(entity.get());
            ownerRepository.flush();
            log.info("Propietario eliminado: {}", ownerId);
            return true;
        } catch (DataAccessException e) {
            throw PersistenceFailureException.registry("remove", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long count() {
        try {
            return ownerRepository.count();
        } catch (DataAccessException e) {
            throw PersistenceFailureException.registry("count", e);
        }
    }

    /**
     * Determina qué restricción única saltó a partir del mensaje del driver.
     * Vacío si la violación no corresponde a uk_owners_owner_id ni a uk_owners_plate_key.
     */
    private Optional<DuplicateKeyException.Field> resolveConstraint(DataIntegrityViolationException e) {
        String detail = String.valueOf(e.getMostSpecificCause().getMessage()).toLowerCase(Locale.ROOT);
        if (detail.contains(OwnerEntity.UK_PLATE_KEY)) {
            return Optional.of(DuplicateKeyException.Field.PLATE_KEY);
        }
        if (detail.contains(OwnerEntity.UK_OWNER_ID)) {
            return Optional.of(DuplicateKeyException.Field.OWNER_ID);
        }
        return Optional.empty();
    }

    /**
     * Convierte un OwnerRecord de dominio a una entidad JPA.
     */
    private OwnerEntity toEntity(OwnerRecord owner, LocalDateTime now) {
        return OwnerEntity.builder()
                .ownerId(owner.getOwnerId())
                .displayName(owner.getDisplayName())
                .vehicleDescriptor(owner.getVehicleDescriptor())
                .plateKey(owner.getPlateKey())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Convierte una entidad JPA a un OwnerRecord de dominio.
     */
    private OwnerRecord toDomain(OwnerEntity entity) {
        return OwnerRecord.builder()
                .ownerId(entity.getOwnerId())
                .displayName(entity.getDisplayName())
                .vehicleDescriptor(entity.getVehicleDescriptor())
                .plateKey(entity.getPlateKey())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
