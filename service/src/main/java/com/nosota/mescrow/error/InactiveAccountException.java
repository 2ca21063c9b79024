package com.nosota.mescrow.error;

/**
 * A user, contract or escrow account exists but is not in a state that allows the operation.
 */
public class InactiveAccountException extends DomainException {

    public InactiveAccountException(String code, String message) {
        super(ErrorKind.INACTIVE, code, message);
    }
}
