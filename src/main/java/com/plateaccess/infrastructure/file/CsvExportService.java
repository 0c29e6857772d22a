package com.plateaccess.infrastructure.file;

import com.opencsv.CSVWriter;
import com.plateaccess.application.dto.OwnerRecordDto;
import com.plateaccess.application.dto.VerificationAttemptDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Exporta el registro de propietarios y la bitácora de verificación a CSV.
 */
@Service
@Slf4j
public class CsvExportService {

    static final String[] OWNER_HEADER = {
            "owner_id", "display_name", "vehicle_descriptor", "plate_key", "created_at" };
    static final String[] ATTEMPT_HEADER = {
            "attempt_id", "scanned_plate", "matched_owner_id", "match_found", "confidence", "scan_timestamp" };

    /**
     * Genera el CSV del registro de propietarios, en orden de inserción.
     *
     * @param owners Propietarios a exportar
     * @return Contenido CSV con header
     */
    public String exportOwners(List<OwnerRecordDto> owners) {
        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(OWNER_HEADER);
            for (OwnerRecordDto owner : owners) {
                writer.writeNext(new String[] {
                        owner.getOwnerId(),
                        owner.getDisplayName(),
                        owner.getVehicleDescriptor() != null ? owner.getVehicleDescriptor() : "",
                        owner.getPlateKey(),
                        owner.getCreatedAt()
                });
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error generando CSV de propietarios", e);
        }
        log.info("Exportados {} propietarios a CSV", owners.size());
        return out.toString();
    }

    /**
     * Genera el CSV de la bitácora, más recientes primero.
     *
     * @param attempts Intentos a exportar
     * @return Contenido CSV con header
     */
    public String exportAttempts(List<VerificationAttemptDto> attempts) {
        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(ATTEMPT_HEADER);
            for (VerificationAttemptDto attempt : attempts) {
                writer.writeNext(new String[] {
                        String.valueOf(attempt.getAttemptId()),
                        attempt.getScannedPlate(),
                        attempt.getMatchedOwnerId() != null ? attempt.getMatchedOwnerId() : "",
                        String.valueOf(attempt.isMatchFound()),
                        String.valueOf(attempt.getConfidence()),
                        attempt.getScanTimestamp()
                });
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error generando CSV de la bitácora", e);
        }
        log.info("Exportados {} intentos a CSV", attempts.size());
        return out.toString();
    }
}
