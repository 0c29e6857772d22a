package com.plateaccess.infrastructure.persistence;

import com.plateaccess.domain.exception.DuplicateKeyException;
import com.plateaccess.domain.model.OwnerRecord;
import com.plateaccess.infrastructure.config.TimeConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({OwnerRegistryJpaAdapter.class, TimeConfig.class})
class OwnerRegistryJpaAdapterTest {

    @Autowired
    private OwnerRegistryJpaAdapter adapter;

    @Test
    void registerSetsTimestampsAndFindByPlateReturnsRecord() {
        OwnerRecord saved = adapter.register(owner("STU001", "John Doe", "ABC1234"));

        assertThat(saved.getCreatedAt()).isNotNull();
        assertThat(saved.getUpdatedAt()).isEqualTo(saved.getCreatedAt());

        assertThat(adapter.findByPlate("ABC1234"))
                .hasValueSatisfying(found -> {
                    assertThat(found.getOwnerId()).isEqualTo("STU001");
                    assertThat(found.getDisplayName()).isEqualTo("John Doe");
                    assertThat(found.getVehicleDescriptor()).isEqualTo("Silver");
                });
    }

    @Test
    void findByPlateIsExactAndDoesNotNormalize() {
        adapter.register(owner("STU001", "John Doe", "ABC1234"));

        assertThat(adapter.findByPlate("abc1234")).isEmpty();
        assertThat(adapter.findByPlate("ABC 1234")).isEmpty();
        assertThat(adapter.findByPlate(" ABC1234")).isEmpty();
    }

    @Test
    void duplicatePlateIsRejectedAndRegistryUnchanged() {
        adapter.register(owner("STU001", "John Doe", "ABC1234"));

        assertThatThrownBy(() -> adapter.register(owner("STU002", "Jane Smith", "ABC1234")))
                .isInstanceOf(DuplicateKeyException.class)
                .extracting("field")
                .isEqualTo(DuplicateKeyException.Field.PLATE_KEY);
        assertThat(adapter.count()).isEqualTo(1);
    }

    @Test
    void duplicateOwnerIdIsRejectedAndRegistryUnchanged() {
        adapter.register(owner("STU001", "John Doe", "ABC1234"));

        assertThatThrownBy(() -> adapter.register(owner("STU001", "John Again", "XYZ9876")))
                .isInstanceOf(DuplicateKeyException.class)
                .extracting("field")
                .isEqualTo(DuplicateKeyException.Field.OWNER_ID);
        assertThat(adapter.count()).isEqualTo(1);
    }

    @Test
    void findAllKeepsInsertionOrder() {
        adapter.register(owner("STU003", "Zed", "ZZZ0001"));
        adapter.register(owner("STU001", "Amy", "AAA0001"));
        adapter.register(owner("STU002", "Bob", "MMM0001"));

        List<OwnerRecord> all = adapter.findAll();

        assertThat(all).extracting(OwnerRecord::getOwnerId).containsExactly("STU003", "STU001", "STU002");
    }

    @Test
    void removeReportsWhetherOwnerExisted() {
        adapter.register(owner("STU001", "John Doe", "ABC1234"));

        assertThat(adapter.remove("STU999")).isFalse();
        assertThat(adapter.remove("STU001")).isTrue();
        assertThat(adapter.findByOwnerId("STU001")).isEmpty();
        assertThat(adapter.findByPlate("ABC1234")).isEmpty();
        assertThat(adapter.remove("STU001")).isFalse();
    }

    private static OwnerRecord owner(String ownerId, String name, String plateKey) {
        return OwnerRecord.builder()
                .ownerId(ownerId)
                .displayName(name)
                .vehicleDescriptor("Silver")
                .plateKey(plateKey)
                .build();
    }
}
