package com.plateaccess.application.bootstrap;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import com.plateaccess.application.service.OwnerRegistryService;
import com.plateaccess.application.service.OwnerRegistryService.RegistrationResult;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Carga propietarios iniciales desde un CSV al arrancar.
 * Formato: owner_id,display_name,vehicle_descriptor,plate (con header).
 * Los duplicados se omiten, así el arranque es repetible.
 */
@Component
@Slf4j
public class CsvOwnerSeedLoader {

    private final OwnerRegistryService ownerRegistryService;

    @Value("${registry.seed-file:}")
    private String seedFile;

    public CsvOwnerSeedLoader(OwnerRegistryService ownerRegistryService) {
        this.ownerRegistryService = ownerRegistryService;
    }

    @PostConstruct
    public void init() {
        if (seedFile == null || seedFile.isBlank()) {
            log.debug("Sin archivo semilla configurado (registry.seed-file)");
            return;
        }
        loadFrom(Paths.get(seedFile));
    }

    /**
     * Registra cada fila del archivo.
     *
     * @param path Ruta del CSV
     * @return Número de propietarios registrados
     */
    public int loadFrom(Path path) {
        if (!Files.exists(path)) {
            log.error("Archivo semilla no encontrado: {}", path.toAbsolutePath());
            return 0;
        }

        int registered = 0;
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
                CSVReader reader = new CSVReader(in)) {
            List<String[]> lines = reader.readAll();

            // Saltar header
            for (int i = 1; i < lines.size(); i++) {
                String[] fields = lines.get(i);
                if (fields.length < 4) {
                    log.warn("Línea {} del archivo semilla ignorada: se esperaban 4 columnas", i + 1);
                    continue;
                }

                RegistrationResult result = ownerRegistryService.registerOwner(
                        fields[0], fields[1], fields[2], fields[3]);
                if (result.success()) {
                    registered++;
                } else {
                    log.warn("Línea {} del archivo semilla no registrada: {}", i + 1, result.reason());
                }
            }
        } catch (IOException | CsvException e) {
            log.error("Error leyendo archivo semilla {}: {}", path, e.getMessage());
            return registered;
        }

        log.info("Cargados {} propietarios desde {}", registered, path);
        return registered;
    }
}
