package com.plateaccess.infrastructure.persistence;

import com.plateaccess.infrastructure.persistence.entity.VerificationLogEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repositorio JPA para operaciones con verification_log.
 */
@Repository
public interface JpaVerificationLogRepository extends JpaRepository<VerificationLogEntity, Long> {

    /**
     * Busca los intentos más recientes primero.
     */
    @Query("SELECT v FROM VerificationLogEntity v ORDER BY v.id DESC")
    List<VerificationLogEntity> findLatest(Pageable pageable);

    /**
     * Último timestamp emitido, para continuar la secuencia tras un reinicio.
     */
    @Query("SELECT MAX(v.scanTimestamp) FROM VerificationLogEntity v")
    Optional<LocalDateTime> findLastScanTimestamp();

    long countByMatchFound(Boolean matchFound);
}
