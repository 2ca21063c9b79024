package com.nosota.mescrow.service;

import com.nosota.mescrow.error.UnauthorizedPartyException;
import com.nosota.mescrow.model.Contract;

import java.util.UUID;

/**
 * Decides whether a user may act on a contract in a given role.
 */
public interface AccessPolicy {

    /**
     * @throws UnauthorizedPartyException if {@code userId} does not hold {@code role} on the contract
     */
    void require(Contract contract, UUID userId, PartyRole role) throws UnauthorizedPartyException;

    boolean isParty(Contract contract, UUID userId);
}
