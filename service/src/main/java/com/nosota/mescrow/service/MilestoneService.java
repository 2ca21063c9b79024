package com.nosota.mescrow.service;

import com.nosota.mescrow.api.model.ContractStatus;
import com.nosota.mescrow.api.model.MilestoneStatus;
import com.nosota.mescrow.error.DomainException;
import com.nosota.mescrow.error.InactiveAccountException;
import com.nosota.mescrow.error.InvalidStateTransitionException;
import com.nosota.mescrow.error.LedgerValidationException;
import com.nosota.mescrow.error.NoDeletionRequestException;
import com.nosota.mescrow.error.ResourceNotFoundException;
import com.nosota.mescrow.model.Contract;
import com.nosota.mescrow.model.Milestone;
import com.nosota.mescrow.repository.ContractRepository;
import com.nosota.mescrow.repository.MilestoneRepository;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Milestone lifecycle within a contract.
 *
 * <p>Every modification resolves its context first: the milestone is locked, its contract must be
 * ACTIVE or PENDING and the caller must be a party of it. Then the operation's own role is checked
 * and the transition is validated against {@link MilestoneStatusStateMachine}.
 *
 * <p>Transitions take an {@code allowUnchecked} flag. When set, the transition table is skipped;
 * context and role checks still apply. Callers set it only for administrators.
 *
 * <p>Deletion is a handshake: the client requests it ({@link #requestDeletion}), the freelancer
 * accepts it ({@link #acceptRequestDeletion}).
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class MilestoneService {

    private final MilestoneRepository milestoneRepository;
    private final ContractRepository contractRepository;
    private final ContractService contractService;
    private final EscrowService escrowService;
    private final MilestoneStatusStateMachine milestoneStatusStateMachine;
    private final AccessPolicy accessPolicy;

    /**
     * Side effect applied to a milestone after its transition was validated.
     */
    @FunctionalInterface
    private interface TransitionEffect {
        void apply(MilestoneContext context, LocalDateTime now) throws DomainException;
    }

    /**
     * Adds a PENDING milestone at the end of the contract. Client only.
     *
     * <p>The contract row is locked while the next sequence number is taken, so concurrent
     * creations on one contract get distinct numbers.
     *
     * @param amount Minor units
     */
    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public Milestone createMilestone(@NotNull UUID userId, @NotNull UUID contractId, @NotNull String title,
                                     String description, long amount, LocalDateTime dueDate)
            throws DomainException {
        Contract contract = contractRepository.findByIdForUpdate(contractId)
                .orElseThrow(() -> ResourceNotFoundException.contract(contractId));
        requireActionable(contract);
        accessPolicy.require(contract, userId, PartyRole.EITHER);
        accessPolicy.require(contract, userId, PartyRole.CLIENT);

        validateTitle(title);
        validateAmount(amount);
        validateDueDate(dueDate);

        Milestone milestone = new Milestone();
        milestone.setContractId(contractId);
        milestone.setSequence(milestoneRepository.findMaxSequence(contractId) + 1);
        milestone.setTitle(title);
        milestone.setDescription(description);
        milestone.setAmount(amount);
        milestone.setCurrency(contract.getCurrency());
        milestone.setStatus(MilestoneStatus.PENDING);
        milestone.setDueDate(dueDate);
        milestone = milestoneRepository.save(milestone);

        log.info("Milestone created: id={}, contractId={}, sequence={}, amount={}",
                milestone.getId(), contractId, milestone.getSequence(), amount);
        return milestone;
    }

    /**
     * Milestones of a contract ordered by sequence. Either party.
     */
    @Transactional(readOnly = true)
    public List<Milestone> getMilestones(@NotNull UUID contractId, @NotNull UUID userId) throws DomainException {
        Contract contract = contractService.findContract(contractId)
                .orElseThrow(() -> ResourceNotFoundException.contract(contractId));
        accessPolicy.require(contract, userId, PartyRole.EITHER);
        return milestoneRepository.findByContractIdOrderBySequenceAsc(contractId);
    }

    @Transactional(readOnly = true)
    public Milestone getMilestone(@NotNull UUID milestoneId, @NotNull UUID userId) throws DomainException {
        Milestone milestone = milestoneRepository.findById(milestoneId)
                .orElseThrow(() -> ResourceNotFoundException.milestone(milestoneId));
        Contract contract = contractService.findContract(milestone.getContractId())
                .orElseThrow(() -> ResourceNotFoundException.contract(milestone.getContractId()));
        accessPolicy.require(contract, userId, PartyRole.EITHER);
        return milestone;
    }

    /**
     * Partial update of a PENDING milestone. Client only. Null arguments leave the field unchanged.
     *
     * @param amount Minor units, or null
     */
    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public Milestone updateMilestone(@NotNull UUID milestoneId, @NotNull UUID userId, String title,
                                     String description, Long amount, LocalDateTime dueDate)
            throws DomainException {
        MilestoneContext context = resolveContext(milestoneId, userId);
        accessPolicy.require(context.contract(), userId, PartyRole.CLIENT);

        Milestone milestone = context.milestone();
        if (milestone.getStatus() != MilestoneStatus.PENDING) {
            throw new InvalidStateTransitionException("INVALID_MILESTONE_UPDATE", milestone.getStatus(),
                    "Only milestones with PENDING status can be updated");
        }

        if (title != null) {
            validateTitle(title);
            milestone.setTitle(title);
        }
        if (description != null) {
            milestone.setDescription(description);
        }
        if (amount != null) {
            validateAmount(amount);
            milestone.setAmount(amount);
        }
        if (dueDate != null) {
            validateDueDate(dueDate);
            milestone.setDueDate(dueDate);
        }

        log.info("Milestone {} updated by {}", milestoneId, userId);
        return milestoneRepository.save(milestone);
    }

    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public Milestone startMilestone(@NotNull UUID milestoneId, @NotNull UUID userId, boolean allowUnchecked)
            throws DomainException {
        return transition(milestoneId, userId, PartyRole.FREELANCER, MilestoneStatus.IN_PROGRESS, allowUnchecked,
                (context, now) -> { });
    }

    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public Milestone submitMilestone(@NotNull UUID milestoneId, @NotNull UUID userId, boolean allowUnchecked)
            throws DomainException {
        return transition(milestoneId, userId, PartyRole.FREELANCER, MilestoneStatus.SUBMITTED, allowUnchecked,
                (context, now) -> context.milestone().setSubmittedAt(now));
    }

    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public Milestone approveByFreelancer(@NotNull UUID milestoneId, @NotNull UUID userId, boolean allowUnchecked)
            throws DomainException {
        return transition(milestoneId, userId, PartyRole.FREELANCER, MilestoneStatus.APPROVED, allowUnchecked,
                (context, now) -> context.milestone().setApprovedAt(now));
    }

    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public Milestone rejectMilestone(@NotNull UUID milestoneId, @NotNull UUID userId, boolean allowUnchecked)
            throws DomainException {
        return transition(milestoneId, userId, PartyRole.FREELANCER, MilestoneStatus.REJECTED, allowUnchecked,
                (context, now) -> { });
    }

    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public Milestone disputeMilestone(@NotNull UUID milestoneId, @NotNull UUID userId, boolean allowUnchecked)
            throws DomainException {
        return transition(milestoneId, userId, PartyRole.CLIENT, MilestoneStatus.DISPUTED, allowUnchecked,
                (context, now) -> context.milestone().setDisputedAt(now));
    }

    /**
     * Marks the milestone PAID and releases its amount from the contract escrow to the freelancer,
     * in one transaction. Client only.
     */
    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public Milestone payMilestone(@NotNull UUID milestoneId, @NotNull UUID userId, boolean allowUnchecked)
            throws DomainException {
        return transition(milestoneId, userId, PartyRole.CLIENT, MilestoneStatus.PAID, allowUnchecked,
                (context, now) -> {
                    Milestone milestone = context.milestone();
                    escrowService.release(userId, milestone.getContractId(), milestone.getAmount(), null);
                    milestone.setPaidAt(now);
                });
    }

    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public Milestone approveWorkByClient(@NotNull UUID milestoneId, @NotNull UUID userId, boolean allowUnchecked)
            throws DomainException {
        return transition(milestoneId, userId, PartyRole.CLIENT, MilestoneStatus.COMPLETED, allowUnchecked,
                (context, now) -> context.milestone().setApprovedAt(now));
    }

    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public Milestone cancelMilestone(@NotNull UUID milestoneId, @NotNull UUID userId, boolean allowUnchecked)
            throws DomainException {
        return transition(milestoneId, userId, PartyRole.CLIENT, MilestoneStatus.CANCELED, allowUnchecked,
                (context, now) -> { });
    }

    /**
     * First step of the deletion handshake. Client only.
     */
    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public Milestone requestDeletion(@NotNull UUID milestoneId, @NotNull UUID userId) throws DomainException {
        MilestoneContext context = resolveContext(milestoneId, userId);
        accessPolicy.require(context.contract(), userId, PartyRole.CLIENT);

        Milestone milestone = context.milestone();
        milestone.setDeletionRequestedAt(LocalDateTime.now());
        log.info("Deletion of milestone {} requested by {}", milestoneId, userId);
        return milestoneRepository.save(milestone);
    }

    /**
     * Second step of the deletion handshake. Freelancer only.
     *
     * @return the deleted milestone
     * @throws NoDeletionRequestException if the client has not requested deletion
     */
    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public Milestone acceptRequestDeletion(@NotNull UUID milestoneId, @NotNull UUID userId) throws DomainException {
        MilestoneContext context = resolveContext(milestoneId, userId);
        accessPolicy.require(context.contract(), userId, PartyRole.FREELANCER);

        Milestone milestone = context.milestone();
        if (milestone.getDeletionRequestedAt() == null) {
            throw new NoDeletionRequestException(milestoneId);
        }

        milestoneRepository.delete(milestone);
        log.info("Milestone {} deleted, accepted by {}", milestoneId, userId);
        return milestone;
    }

    private Milestone transition(UUID milestoneId, UUID userId, PartyRole role, MilestoneStatus target,
                                 boolean allowUnchecked, TransitionEffect effect) throws DomainException {
        MilestoneContext context = resolveContext(milestoneId, userId);
        accessPolicy.require(context.contract(), userId, role);

        Milestone milestone = context.milestone();
        MilestoneStatus previous = milestone.getStatus();
        if (allowUnchecked) {
            log.warn("Unchecked milestone transition: id={}, {} → {}, by={}", milestoneId, previous, target, userId);
        } else {
            milestoneStatusStateMachine.validateTransition(previous, target);
        }

        effect.apply(context, LocalDateTime.now());
        milestone.setStatus(target);
        milestone = milestoneRepository.save(milestone);

        log.info("Milestone {} moved {} → {} by user {}", milestoneId, previous, target, userId);
        return milestone;
    }

    private MilestoneContext resolveContext(UUID milestoneId, UUID userId) throws DomainException {
        Milestone milestone = milestoneRepository.findByIdForUpdate(milestoneId)
                .orElseThrow(() -> ResourceNotFoundException.milestone(milestoneId));
        Contract contract = contractService.findContract(milestone.getContractId())
                .orElseThrow(() -> ResourceNotFoundException.contract(milestone.getContractId()));
        requireActionable(contract);
        accessPolicy.require(contract, userId, PartyRole.EITHER);
        return new MilestoneContext(milestone, contract);
    }

    private static void requireActionable(Contract contract) throws InactiveAccountException {
        if (contract.getStatus() != ContractStatus.ACTIVE && contract.getStatus() != ContractStatus.PENDING) {
            throw new InactiveAccountException("CONTRACT_INACTIVE",
                    "Contract " + contract.getId() + " is " + contract.getStatus());
        }
    }

    private static void validateTitle(String title) throws LedgerValidationException {
        if (title.isBlank() || title.length() > 255) {
            throw new LedgerValidationException("INVALID_TITLE", "Title must be between 1 and 255 characters");
        }
    }

    private static void validateAmount(long amount) throws LedgerValidationException {
        if (amount <= 0) {
            throw LedgerValidationException.nonPositiveAmount(amount);
        }
    }

    private static void validateDueDate(LocalDateTime dueDate) throws LedgerValidationException {
        if (dueDate != null && !dueDate.isAfter(LocalDateTime.now())) {
            throw new LedgerValidationException("INVALID_DUE_DATE", "Due date must be in the future");
        }
    }
}
