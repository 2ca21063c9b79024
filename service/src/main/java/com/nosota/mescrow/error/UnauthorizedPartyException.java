package com.nosota.mescrow.error;

/**
 * The caller is not the contract party (or role) the operation requires.
 */
public class UnauthorizedPartyException extends DomainException {

    public UnauthorizedPartyException(String message) {
        super(ErrorKind.UNAUTHORIZED, "USER_NOT_AUTHORIZED", message);
    }

    public UnauthorizedPartyException(String code, String message) {
        super(ErrorKind.UNAUTHORIZED, code, message);
    }
}
