package com.plateaccess.domain.model;

/**
 * Resultado de una verificación devuelto al llamador.
 * ownerInfo es null cuando no hay coincidencia; se guarda y se entrega como copia.
 */
public record VerificationResult(
        boolean matchFound,
        OwnerRecord ownerInfo,
        String scannedPlate,
        double confidence,
        String message,
        Long attemptId) {

    public VerificationResult {
        ownerInfo = copyOf(ownerInfo);
    }

    /**
     * Devuelve una copia: el resultado no cambia aunque el llamador modifique el propietario.
     */
    @Override
    public OwnerRecord ownerInfo() {
        return copyOf(ownerInfo);
    }

    public static VerificationResult matched(OwnerRecord owner, VerificationAttempt attempt) {
        return new VerificationResult(
                true,
                owner,
                attempt.getScannedPlate(),
                attempt.getConfidence(),
                String.format("Match found: %s (%s)", owner.getDisplayName(), owner.getOwnerId()),
                attempt.getAttemptId());
    }

    public static VerificationResult notMatched(VerificationAttempt attempt) {
        String message = attempt.getScannedPlate().isEmpty()
                ? "No plate text to verify"
                : "No record found for plate: " + attempt.getScannedPlate();
        return new VerificationResult(
                false,
                null,
                attempt.getScannedPlate(),
                attempt.getConfidence(),
                message,
                attempt.getAttemptId());
    }

    private static OwnerRecord copyOf(OwnerRecord owner) {
        return owner != null ? owner.toBuilder().build() : null;
    }
}
