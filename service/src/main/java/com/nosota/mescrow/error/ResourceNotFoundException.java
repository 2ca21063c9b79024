package com.nosota.mescrow.error;

public class ResourceNotFoundException extends DomainException {

    public ResourceNotFoundException(String code, String message) {
        super(ErrorKind.NOT_FOUND, code, message);
    }

    public static ResourceNotFoundException wallet(Object userId) {
        return new ResourceNotFoundException("WALLET_NOT_FOUND", "Wallet not found for user " + userId);
    }

    public static ResourceNotFoundException contract(Object contractId) {
        return new ResourceNotFoundException("CONTRACT_NOT_FOUND", "Contract not found: " + contractId);
    }

    public static ResourceNotFoundException milestone(Object milestoneId) {
        return new ResourceNotFoundException("MILESTONE_NOT_FOUND", "Milestone not found: " + milestoneId);
    }

    public static ResourceNotFoundException escrow(Object contractId) {
        return new ResourceNotFoundException("ESCROW_NOT_FOUND", "Escrow account not found for contract " + contractId);
    }

    public static ResourceNotFoundException user(Object userId) {
        return new ResourceNotFoundException("USER_NOT_FOUND", "User not found: " + userId);
    }
}
