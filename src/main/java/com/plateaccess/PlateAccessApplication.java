package com.plateaccess;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Plate Access - Aplicación Principal
 * 
 * Sistema de verificación de matrículas con:
 * - Registro de propietarios con matrícula única
 * - Verificación de texto OCR contra el registro
 * - Bitácora de auditoría de cada intento (append-only)
 * - API REST y notificaciones WebSocket en tiempo real
 */
@SpringBootApplication
@Slf4j
public class PlateAccessApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlateAccessApplication.class, args);
        log.info("Plate Access iniciado. API: http://localhost:8080/api - WebSocket: /ws/verifications");
    }
}
