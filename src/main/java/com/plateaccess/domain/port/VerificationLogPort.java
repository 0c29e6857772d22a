package com.plateaccess.domain.port;

import com.plateaccess.domain.model.VerificationAttempt;

import java.util.List;

/**
 * Puerto (interfaz) para la bitácora de intentos de verificación.
 * Solo permite agregar y leer: ninguna entrada se modifica ni se elimina.
 */
public interface VerificationLogPort {

    /**
     * Agrega un intento a la bitácora. Las llamadas concurrentes se serializan:
     * attemptId y scanTimestamp siguen el orden real de inserción.
     *
     * @param attempt Intento pendiente (sin id ni timestamp)
     * @return Intento guardado con attemptId y scanTimestamp asignados
     * @throws com.plateaccess.domain.exception.PersistenceFailureException si no se pudo guardar
     */
    VerificationAttempt append(VerificationAttempt attempt);

    /**
     * Obtiene los intentos más recientes primero.
     *
     * @param limit Número máximo de intentos
     * @return Lista de intentos, vacía si limit no es positivo
     */
    List<VerificationAttempt> recent(int limit);

    long count();

    long countMatched();
}
