package com.plateaccess.presentation.controller;

import com.plateaccess.application.dto.OwnerRecordDto;
import com.plateaccess.application.service.OwnerRegistryService;
import com.plateaccess.application.service.OwnerRegistryService.RegistrationResult;
import com.plateaccess.infrastructure.file.CsvExportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Controlador REST para la gestión del registro de propietarios.
 */
@RestController
@RequestMapping("/api/owners")
@RequiredArgsConstructor
@Slf4j
public class OwnerController {

    private final OwnerRegistryService ownerRegistryService;
    private final CsvExportService csvExportService;

    /**
     * Obtiene todos los propietarios en orden de registro.
     */
    @GetMapping
    public ResponseEntity<List<OwnerRecordDto>> getAllOwners() {
        log.info("Obteniendo lista de propietarios registrados");
        return ResponseEntity.ok(ownerRegistryService.listOwners());
    }

    /**
     * Obtiene el conteo de propietarios registrados.
     */
    @GetMapping("/count")
    public ResponseEntity<Map<String, Long>> getOwnerCount() {
        Map<String, Long> response = new HashMap<>();
        response.put("count", ownerRegistryService.countOwners());
        return ResponseEntity.ok(response);
    }

    /**
     * Descarga el registro como CSV.
     */
    @GetMapping("/export")
    public ResponseEntity<String> exportOwners() {
        String csv = csvExportService.exportOwners(ownerRegistryService.listOwners());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"owners.csv\"")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(csv);
    }

    @GetMapping("/{ownerId}")
    public ResponseEntity<OwnerRecordDto> getOwner(@PathVariable String ownerId) {
        return ownerRegistryService.findOwner(ownerId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Registra un nuevo propietario.
     *
     * @param request ownerId, displayName, vehicleDescriptor y plate
     * @return 200 si se registró, 409 si el ownerId o la matrícula ya existen,
     *         400 si faltan datos
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> registerOwner(@RequestBody RegisterOwnerRequest request) {
        Map<String, Object> response = new HashMap<>();

        RegistrationResult result = ownerRegistryService.registerOwner(
                request.ownerId(), request.displayName(), request.vehicleDescriptor(), request.plate());

        response.put("success", result.success());
        if (result.success()) {
            response.put("message", "Owner registered");
            response.put("owner", result.owner());
            return ResponseEntity.ok(response);
        }

        response.put("message", result.reason());
        HttpStatus status = result.conflict() ? HttpStatus.CONFLICT : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(response);
    }

    /**
     * Elimina un propietario. La bitácora conserva sus intentos.
     */
    @DeleteMapping("/{ownerId}")
    public ResponseEntity<Map<String, Object>> deleteOwner(@PathVariable String ownerId) {
        Map<String, Object> response = new HashMap<>();

        boolean deleted = ownerRegistryService.removeOwner(ownerId);
        response.put("success", deleted);
        response.put("ownerId", ownerId);

        if (deleted) {
            response.put("message", "Owner removed");
            return ResponseEntity.ok(response);
        }
        response.put("message", "Owner not found");
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    /**
     * Request DTO para registrar un propietario.
     */
    record RegisterOwnerRequest(String ownerId, String displayName, String vehicleDescriptor, String plate) {
    }
}
