package com.plateaccess.domain.exception;

import lombok.Getter;

/**
 * Excepción lanzada cuando un registro choca con un ownerId o una matrícula ya existentes.
 */
@Getter
public class DuplicateKeyException extends RuntimeException {

    /**
     * Campo único que provocó el conflicto.
     */
    public enum Field {
        OWNER_ID,
        PLATE_KEY
    }

    private final Field field;

    public DuplicateKeyException(Field field, String message) {
        super(message);
        this.field = field;
    }

    public DuplicateKeyException(Field field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * Excepción cuando el ownerId ya está registrado.
     */
    public static DuplicateKeyException ownerId(String ownerId) {
        return new DuplicateKeyException(Field.OWNER_ID, "Owner id already registered: " + ownerId);
    }

    /**
     * Excepción cuando la matrícula ya está registrada.
     */
    public static DuplicateKeyException plateKey(String plateKey) {
        return new DuplicateKeyException(Field.PLATE_KEY, "License plate already registered: " + plateKey);
    }

    /**
     * Excepción cuando la base de datos rechazó el insert por una restricción única.
     */
    public static DuplicateKeyException fromConstraint(Field field, Throwable cause) {
        return new DuplicateKeyException(field, "Unique constraint violated on " + field, cause);
    }
}
