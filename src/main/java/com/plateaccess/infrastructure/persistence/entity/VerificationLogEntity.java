package com.plateaccess.infrastructure.persistence.entity;

import com.plateaccess.domain.model.OwnerRecord;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entidad JPA que mapea a la tabla verification_log.
 * matched_owner_id es un valor copiado, sin clave foránea.
 * scanned_plate no tiene límite: cualquier texto escaneado debe quedar registrado.
 */
@Entity
@Table(name = "verification_log", indexes = {
        @Index(name = "idx_verification_log_scan_timestamp", columnList = "scan_timestamp")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "scanned_plate", nullable = false, columnDefinition = "TEXT")
    private String scannedPlate;

    @Column(name = "matched_owner_id", length = OwnerRecord.MAX_OWNER_ID_LENGTH)
    private String matchedOwnerId;

    @Column(name = "match_found", nullable = false)
    private Boolean matchFound;

    @Column(name = "confidence", nullable = false)
    private Double confidence;

    @Column(name = "scan_timestamp", nullable = false, updatable = false)
    private LocalDateTime scanTimestamp;
}
