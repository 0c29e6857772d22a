package com.plateaccess.infrastructure.file;

import com.opencsv.CSVReader;
import com.plateaccess.application.dto.OwnerRecordDto;
import com.plateaccess.application.dto.VerificationAttemptDto;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvExportServiceTest {

    private final CsvExportService exportService = new CsvExportService();

    @Test
    void ownersExportKeepsOrderAndQuotesCommas() throws Exception {
        List<OwnerRecordDto> owners = List.of(
                OwnerRecordDto.builder().ownerId("STU002").displayName("Smith, Jane").plateKey("XYZ9876")
                        .createdAt("2026-03-01 10:00:00").build(),
                OwnerRecordDto.builder().ownerId("STU001").displayName("John Doe").vehicleDescriptor("Silver")
                        .plateKey("ABC 1234").createdAt("2026-03-01 10:05:00").build());

        List<String[]> rows = new CSVReader(new StringReader(exportService.exportOwners(owners))).readAll();

        assertThat(rows).hasSize(3);
        assertThat(rows.get(0)).containsExactly(CsvExportService.OWNER_HEADER);
        assertThat(rows.get(1)).containsExactly("STU002", "Smith, Jane", "", "XYZ9876", "2026-03-01 10:00:00");
        assertThat(rows.get(2)[3]).isEqualTo("ABC 1234");
    }

    @Test
    void attemptsExportLeavesMissingOwnerBlank() throws Exception {
        VerificationAttemptDto miss = VerificationAttemptDto.builder()
                .attemptId(9L).scannedPlate("").matchFound(false).confidence(0.0)
                .scanTimestamp("2026-03-01T10:15:30").build();

        List<String[]> rows = new CSVReader(new StringReader(exportService.exportAttempts(List.of(miss)))).readAll();

        assertThat(rows.get(0)).containsExactly(CsvExportService.ATTEMPT_HEADER);
        assertThat(rows.get(1)).containsExactly("9", "", "", "false", "0.0", "2026-03-01T10:15:30");
    }
}
