package com.nosota.mescrow.service;

import com.nosota.mescrow.error.UnauthorizedPartyException;
import com.nosota.mescrow.model.Contract;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Access policy based on the contract's client and freelancer IDs.
 */
@Component
@Slf4j
public class ContractPartyAccessPolicy implements AccessPolicy {

    @Override
    public void require(Contract contract, UUID userId, PartyRole role) throws UnauthorizedPartyException {
        boolean allowed = switch (role) {
            case CLIENT -> contract.getClientId().equals(userId);
            case FREELANCER -> contract.getFreelancerId().equals(userId);
            case EITHER -> isParty(contract, userId);
        };

        if (!allowed) {
            log.debug("User {} is not {} of contract {}", userId, role, contract.getId());
            throw new UnauthorizedPartyException(switch (role) {
                case CLIENT -> "Only the client of the contract can perform this action";
                case FREELANCER -> "Only the freelancer of the contract can perform this action";
                case EITHER -> "User is not a party of the contract";
            });
        }
    }

    @Override
    public boolean isParty(Contract contract, UUID userId) {
        return contract.getClientId().equals(userId) || contract.getFreelancerId().equals(userId);
    }
}
