package com.plateaccess.domain.exception;

/**
 * Excepción lanzada cuando el almacenamiento no está disponible o una escritura
 * no se completó. Nunca debe confundirse con un "sin coincidencia".
 */
public class PersistenceFailureException extends RuntimeException {

    public PersistenceFailureException(String message) {
        super(message);
    }

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Excepción cuando falla una lectura o escritura del registro de propietarios.
     */
    public static PersistenceFailureException registry(String operation, Throwable cause) {
        return new PersistenceFailureException("Owner registry unavailable during " + operation, cause);
    }

    /**
     * Excepción cuando falla una operación sobre la bitácora de verificación.
     */
    public static PersistenceFailureException auditLog(String operation, Throwable cause) {
        return new PersistenceFailureException("Verification log unavailable during " + operation, cause);
    }

    /**
     * Excepción cuando la bitácora no quedó libre dentro del tiempo de espera.
     */
    public static PersistenceFailureException auditLogTimeout(String operation, long timeoutMillis) {
        return new PersistenceFailureException(
                "Verification log busy: " + operation + " timed out after " + timeoutMillis + " ms");
    }
}
