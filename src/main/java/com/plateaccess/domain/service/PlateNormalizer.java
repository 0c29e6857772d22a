package com.plateaccess.domain.service;

import java.util.Locale;

/**
 * Normaliza el texto escaneado a la forma canónica de matrícula.
 * <p>
 * Convierte a mayúsculas y elimina espacios al inicio y al final. Los espacios
 * internos se conservan: "ABC 1234" y "ABC1234" son matrículas distintas.
 */
public final class PlateNormalizer {

    private PlateNormalizer() {
    }

    /**
     * @param raw Texto tal como lo entrega el OCR (puede ser null)
     * @return Matrícula canónica, "" si no queda texto
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.strip().toUpperCase(Locale.ROOT);
    }

    public static boolean isBlankKey(String canonical) {
        return canonical == null || canonical.isEmpty();
    }
}
