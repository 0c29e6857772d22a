package com.plateaccess.infrastructure.persistence.entity;

import com.plateaccess.domain.model.OwnerRecord;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entidad JPA que mapea a la tabla owners.
 * El id sustituto solo se usa para conservar el orden de inserción.
 * En MySQL las columnas owner_id y plate_key usan utf8mb4_bin (ver schema-mysql.sql).
 */
@Entity
@Table(name = "owners", uniqueConstraints = {
        @UniqueConstraint(name = OwnerEntity.UK_OWNER_ID, columnNames = "owner_id"),
        @UniqueConstraint(name = OwnerEntity.UK_PLATE_KEY, columnNames = "plate_key")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OwnerEntity {

    public static final String UK_OWNER_ID = "uk_owners_owner_id";
    public static final String UK_PLATE_KEY = "uk_owners_plate_key";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false, length = OwnerRecord.MAX_OWNER_ID_LENGTH)
    private String ownerId;

    @Column(name = "display_name", nullable = false, length = OwnerRecord.MAX_DISPLAY_NAME_LENGTH)
    private String displayName;

    @Column(name = "vehicle_descriptor", length = OwnerRecord.MAX_VEHICLE_DESCRIPTOR_LENGTH)
    private String vehicleDescriptor;

    @Column(name = "plate_key", nullable = false, length = OwnerRecord.MAX_PLATE_KEY_LENGTH)
    private String plateKey;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
