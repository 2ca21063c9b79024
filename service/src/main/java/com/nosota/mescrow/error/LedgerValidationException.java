package com.nosota.mescrow.error;

public class LedgerValidationException extends DomainException {

    public LedgerValidationException(String code, String message) {
        super(ErrorKind.VALIDATION_ERROR, code, message);
    }

    public static LedgerValidationException nonPositiveAmount(long amount) {
        return new LedgerValidationException("INVALID_AMOUNT", "Amount must be positive: " + amount);
    }
}
