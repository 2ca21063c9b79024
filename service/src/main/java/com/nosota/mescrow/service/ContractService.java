package com.nosota.mescrow.service;

import com.nosota.mescrow.api.model.ContractStatus;
import com.nosota.mescrow.config.LedgerProperties;
import com.nosota.mescrow.error.InactiveAccountException;
import com.nosota.mescrow.error.InvalidStateTransitionException;
import com.nosota.mescrow.error.LedgerValidationException;
import com.nosota.mescrow.error.ResourceNotFoundException;
import com.nosota.mescrow.error.UnauthorizedPartyException;
import com.nosota.mescrow.model.Contract;
import com.nosota.mescrow.repository.ContractRepository;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Contract lifecycle.
 *
 * <p>Each transition locks the contract row, checks the caller's role, validates the
 * transition against {@link ContractStatusStateMachine} and sets the status with its timestamp:
 * <ul>
 *   <li>start (client): PENDING → ACTIVE, startDate</li>
 *   <li>submitWork (freelancer): ACTIVE → REVIEW_PENDING, submittedAt</li>
 *   <li>complete (client): REVIEW_PENDING → COMPLETED, endDate</li>
 *   <li>dispute (client): REVIEW_PENDING → DISPUTED</li>
 *   <li>terminate (either party): any non-final status → TERMINATED, endDate</li>
 * </ul>
 *
 * <p>This service is the only writer of contract rows; escrow releases update
 * {@code totalPaid} through {@link #recordPayment}.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class ContractService {

    private final ContractRepository contractRepository;
    private final ContractStatusStateMachine contractStatusStateMachine;
    private final AccessPolicy accessPolicy;
    private final LedgerProperties ledgerProperties;

    /**
     * Creates a PENDING contract with the caller as client.
     *
     * @param amount   Agreed amount in minor units
     * @param currency ISO 4217 code, null for the service currency
     */
    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public Contract createContract(@NotNull UUID clientId, @NotNull UUID freelancerId, @NotNull UUID jobId,
                                   long amount, String currency, @NotNull LocalDateTime startDate,
                                   LocalDateTime endDate) throws LedgerValidationException {
        if (clientId.equals(freelancerId)) {
            throw new LedgerValidationException("SELF_CONTRACT", "Client and freelancer must be different users");
        }
        if (amount <= 0) {
            throw LedgerValidationException.nonPositiveAmount(amount);
        }
        if (endDate != null && endDate.isBefore(startDate)) {
            throw new LedgerValidationException("INVALID_DATES", "End date must not be before start date");
        }

        Contract contract = new Contract();
        contract.setClientId(clientId);
        contract.setFreelancerId(freelancerId);
        contract.setJobId(jobId);
        contract.setStatus(ContractStatus.PENDING);
        contract.setAmount(amount);
        contract.setCurrency(currency != null ? currency : ledgerProperties.getCurrency());
        contract.setTotalPaid(0L);
        contract.setStartDate(startDate);
        contract.setEndDate(endDate);
        contract = contractRepository.save(contract);

        log.info("Contract created: id={}, clientId={}, freelancerId={}, amount={}",
                contract.getId(), clientId, freelancerId, amount);
        return contract;
    }

    @Transactional(readOnly = true)
    public Contract getContract(@NotNull UUID contractId, @NotNull UUID userId)
            throws ResourceNotFoundException, UnauthorizedPartyException {
        Contract contract = contractRepository.findById(contractId)
                .orElseThrow(() -> ResourceNotFoundException.contract(contractId));
        accessPolicy.require(contract, userId, PartyRole.EITHER);
        return contract;
    }

    /**
     * Unchecked lookup for other services; callers apply their own access rules.
     */
    @Transactional(readOnly = true)
    public Optional<Contract> findContract(@NotNull UUID contractId) {
        return contractRepository.findById(contractId);
    }

    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public Contract start(@NotNull UUID contractId, @NotNull UUID userId)
            throws ResourceNotFoundException, UnauthorizedPartyException, InvalidStateTransitionException {
        return transition(contractId, userId, PartyRole.CLIENT, ContractStatus.ACTIVE);
    }

    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public Contract submitWork(@NotNull UUID contractId, @NotNull UUID userId)
            throws ResourceNotFoundException, UnauthorizedPartyException, InvalidStateTransitionException {
        return transition(contractId, userId, PartyRole.FREELANCER, ContractStatus.REVIEW_PENDING);
    }

    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public Contract complete(@NotNull UUID contractId, @NotNull UUID userId)
            throws ResourceNotFoundException, UnauthorizedPartyException, InvalidStateTransitionException {
        return transition(contractId, userId, PartyRole.CLIENT, ContractStatus.COMPLETED);
    }

    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public Contract dispute(@NotNull UUID contractId, @NotNull UUID userId)
            throws ResourceNotFoundException, UnauthorizedPartyException, InvalidStateTransitionException {
        return transition(contractId, userId, PartyRole.CLIENT, ContractStatus.DISPUTED);
    }

    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public Contract terminate(@NotNull UUID contractId, @NotNull UUID userId)
            throws ResourceNotFoundException, UnauthorizedPartyException, InvalidStateTransitionException {
        return transition(contractId, userId, PartyRole.EITHER, ContractStatus.TERMINATED);
    }

    /**
     * Adds a released escrow amount to the contract's total paid. Called inside the release transaction.
     *
     * <p>The contract row is locked last in the release, so its status is checked here again: a
     * contract that ended after the caller read it rolls the whole release back.
     *
     * @throws InactiveAccountException if the contract is COMPLETED or TERMINATED
     */
    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public void recordPayment(@NotNull UUID contractId, long amount)
            throws ResourceNotFoundException, InactiveAccountException {
        Contract contract = contractRepository.findByIdForUpdate(contractId)
                .orElseThrow(() -> ResourceNotFoundException.contract(contractId));
        if (contract.getStatus() == ContractStatus.COMPLETED || contract.getStatus() == ContractStatus.TERMINATED) {
            throw new InactiveAccountException("CONTRACT_INACTIVE",
                    "Cannot pay out on a " + contract.getStatus() + " contract " + contractId);
        }
        contract.setTotalPaid(Math.addExact(contract.getTotalPaid(), amount));
        contractRepository.save(contract);
        log.debug("Contract {} total paid is now {}", contractId, contract.getTotalPaid());
    }

    private Contract transition(UUID contractId, UUID userId, PartyRole role, ContractStatus target)
            throws ResourceNotFoundException, UnauthorizedPartyException, InvalidStateTransitionException {
        Contract contract = contractRepository.findByIdForUpdate(contractId)
                .orElseThrow(() -> ResourceNotFoundException.contract(contractId));
        accessPolicy.require(contract, userId, role);

        ContractStatus previous = contract.getStatus();
        contractStatusStateMachine.validateTransition(previous, target);

        LocalDateTime now = LocalDateTime.now();
        contract.setStatus(target);
        switch (target) {
            case ACTIVE -> contract.setStartDate(now);
            case REVIEW_PENDING -> contract.setSubmittedAt(now);
            case COMPLETED, TERMINATED -> contract.setEndDate(now);
            default -> {
                // DISPUTED carries no timestamp
            }
        }
        contract = contractRepository.save(contract);

        log.info("Contract {} moved {} → {} by user {}", contractId, previous, target, userId);
        return contract;
    }
}
