package com.nosota.mescrow.service;

import com.nosota.mescrow.api.model.ContractStatus;
import com.nosota.mescrow.api.model.EscrowAccountStatus;
import com.nosota.mescrow.api.model.EscrowCloseOutcome;
import com.nosota.mescrow.api.model.EscrowTransactionType;
import com.nosota.mescrow.api.model.RefundInitiator;
import com.nosota.mescrow.api.response.EscrowStatusResponse;
import com.nosota.mescrow.api.response.ReconciliationResponse;
import com.nosota.mescrow.dto.LedgerReceipt;
import com.nosota.mescrow.error.DomainException;
import com.nosota.mescrow.error.InactiveAccountException;
import com.nosota.mescrow.error.InsufficientFundsException;
import com.nosota.mescrow.error.InvalidStateTransitionException;
import com.nosota.mescrow.error.LedgerValidationException;
import com.nosota.mescrow.error.ResourceNotFoundException;
import com.nosota.mescrow.error.UnauthorizedPartyException;
import com.nosota.mescrow.mapper.LedgerMapper;
import com.nosota.mescrow.mapper.MinorUnits;
import com.nosota.mescrow.model.Contract;
import com.nosota.mescrow.model.EscrowAccount;
import com.nosota.mescrow.model.EscrowTransaction;
import com.nosota.mescrow.model.WalletTransaction;
import com.nosota.mescrow.repository.EscrowAccountRepository;
import com.nosota.mescrow.repository.EscrowTransactionRepository;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.Optional;
import java.util.UUID;

/**
 * Per-contract escrow accounts.
 *
 * <p>Money flow:
 * <pre>
 * client wallet (available) ──deposit──► escrow (held) ──release──► freelancer wallet (pending)
 *        ▲                                    │
 *        └───────────────refund───────────────┘
 * </pre>
 *
 * <p>Each operation runs in one transaction. The escrow account row is locked first, then
 * the wallet row inside {@link WalletLedgerService}; this order is the same for every
 * operation. Held amount and wallet balance change together with one {@link EscrowTransaction}
 * and one wallet transaction, or not at all.
 *
 * <p>Money-moving operations accept an Idempotency-Key, see {@link IdempotencyService}.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class EscrowService {

    private final EscrowAccountRepository escrowAccountRepository;
    private final EscrowTransactionRepository escrowTransactionRepository;
    private final WalletLedgerService walletLedgerService;
    private final ContractService contractService;
    private final AccessPolicy accessPolicy;
    private final IdempotencyService idempotencyService;

    /**
     * Opens the escrow account of a contract, funded with {@code initialAmount} from the client's wallet.
     *
     * @param initialAmount Minor units, may be 0
     * @return receipt pointing at the wallet HOLD entry, or at the account when nothing was funded
     */
    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public LedgerReceipt openAccount(@NotNull UUID clientId, @NotNull UUID contractId, long initialAmount,
                                     String idempotencyKey) throws DomainException {
        if (initialAmount < 0) {
            throw new LedgerValidationException("INVALID_AMOUNT", "Initial amount must not be negative");
        }
        String fingerprint = IdempotencyService.fingerprint("ESCROW_OPEN", clientId, contractId, initialAmount);

        return idempotencyService.execute(idempotencyKey, "ESCROW_OPEN", fingerprint, () -> {
            Contract contract = contractService.findContract(contractId)
                    .orElseThrow(() -> ResourceNotFoundException.contract(contractId));
            accessPolicy.require(contract, clientId, PartyRole.CLIENT);
            if (contract.getStatus() == ContractStatus.COMPLETED || contract.getStatus() == ContractStatus.TERMINATED) {
                throw new InactiveAccountException("CONTRACT_INACTIVE",
                        "Cannot open escrow for a " + contract.getStatus() + " contract");
            }
            if (escrowAccountRepository.findByContractId(contractId).isPresent()) {
                throw new LedgerValidationException("ESCROW_ALREADY_OPEN",
                        "Escrow account already exists for contract " + contractId);
            }

            EscrowAccount account = new EscrowAccount();
            account.setContractId(contractId);
            account.setClientId(contract.getClientId());
            account.setFreelancerId(contract.getFreelancerId());
            account.setHeldAmount(initialAmount);
            account.setInitialAmount(initialAmount);
            account.setStatus(EscrowAccountStatus.ACTIVE);
            account = escrowAccountRepository.saveAndFlush(account);

            UUID resultId = account.getId();
            if (initialAmount > 0) {
                resultId = walletLedgerService.holdForEscrow(clientId, initialAmount, contractId).getId();
            }

            log.info("Escrow opened: contractId={}, accountId={}, initialAmount={}",
                    contractId, account.getId(), initialAmount);
            return resultId;
        });
    }

    /**
     * Moves funds from the client's available balance into the escrow.
     *
     * @throws InsufficientFundsException if the client's available balance is lower than {@code amount}
     */
    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public LedgerReceipt deposit(@NotNull UUID clientId, @NotNull UUID contractId, long amount,
                                 String idempotencyKey) throws DomainException {
        requirePositive(amount);
        String fingerprint = IdempotencyService.fingerprint("ESCROW_DEPOSIT", clientId, contractId, amount);

        return idempotencyService.execute(idempotencyKey, "ESCROW_DEPOSIT", fingerprint, () -> {
            EscrowAccount account = lockActiveAccount(contractId);
            accessPolicy.require(loadContract(contractId), clientId, PartyRole.CLIENT);

            WalletTransaction hold = walletLedgerService.holdForEscrow(clientId, amount, contractId);
            account.setHeldAmount(Math.addExact(account.getHeldAmount(), amount));
            escrowAccountRepository.save(account);

            EscrowTransaction transaction = append(account, amount, EscrowTransactionType.DEPOSIT,
                    hold.getWalletId(), null, "Deposit from client");
            log.info("Escrow deposit: contractId={}, amount={}, held={}",
                    contractId, amount, account.getHeldAmount());
            return transaction.getId();
        });
    }

    /**
     * Releases held funds to the freelancer's pending balance and adds them to the contract's total paid.
     *
     * @throws InsufficientFundsException if the held amount is lower than {@code amount}
     */
    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public LedgerReceipt release(@NotNull UUID clientId, @NotNull UUID contractId, long amount,
                                 String idempotencyKey) throws DomainException {
        requirePositive(amount);
        String fingerprint = IdempotencyService.fingerprint("ESCROW_RELEASE", clientId, contractId, amount);

        return idempotencyService.execute(idempotencyKey, "ESCROW_RELEASE", fingerprint, () -> {
            EscrowAccount account = lockActiveAccount(contractId);
            accessPolicy.require(loadContract(contractId), clientId, PartyRole.CLIENT);
            requireHeld(account, amount);

            account.setHeldAmount(account.getHeldAmount() - amount);
            escrowAccountRepository.save(account);

            WalletTransaction credit = walletLedgerService.creditPending(account.getFreelancerId(), amount, contractId);
            EscrowTransaction transaction = append(account, amount, EscrowTransactionType.RELEASE,
                    null, credit.getWalletId(), "Release to freelancer");
            contractService.recordPayment(contractId, amount);

            log.info("Escrow release: contractId={}, amount={}, held={}",
                    contractId, amount, account.getHeldAmount());
            return transaction.getId();
        });
    }

    /**
     * Returns held funds to the client's available balance.
     *
     * <p>A FREELANCER refund must be initiated by the contract's freelancer. SYSTEM refunds are not
     * tied to a party; callers restrict them to administrators.
     *
     * @throws InsufficientFundsException if the held amount is lower than {@code amount}
     */
    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public LedgerReceipt refund(@NotNull UUID contractId, long amount, @NotNull RefundInitiator initiator,
                                @NotNull UUID actorId, String idempotencyKey) throws DomainException {
        requirePositive(amount);
        String fingerprint = IdempotencyService.fingerprint("ESCROW_REFUND", actorId, contractId, amount, initiator);

        return idempotencyService.execute(idempotencyKey, "ESCROW_REFUND", fingerprint, () -> {
            EscrowAccount account = lockActiveAccount(contractId);
            switch (initiator) {
                case FREELANCER -> accessPolicy.require(loadContract(contractId), actorId, PartyRole.FREELANCER);
                case SYSTEM -> log.debug("System refund on contract {} by {}", contractId, actorId);
            }
            requireHeld(account, amount);

            EscrowTransaction transaction = refundHeld(account, amount, "Refund initiated by " + initiator);
            log.info("Escrow refund: contractId={}, amount={}, initiator={}, held={}",
                    contractId, amount, initiator, account.getHeldAmount());
            return transaction.getId();
        });
    }

    /**
     * Closes an active escrow account.
     *
     * <p>COMPLETED requires the account to be empty. CANCELED first refunds whatever is still held
     * to the client.
     *
     * @param admin true when the actor is an administrator; otherwise the actor must be the client
     */
    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public EscrowAccount closeAccount(@NotNull UUID actorId, boolean admin, @NotNull UUID contractId,
                                      @NotNull EscrowCloseOutcome outcome) throws DomainException {
        EscrowAccount account = escrowAccountRepository.findByContractIdForUpdate(contractId)
                .orElseThrow(() -> ResourceNotFoundException.escrow(contractId));
        EscrowAccountStatus target = switch (outcome) {
            case COMPLETED -> EscrowAccountStatus.COMPLETED;
            case CANCELED -> EscrowAccountStatus.CANCELED;
        };
        if (account.getStatus() != EscrowAccountStatus.ACTIVE) {
            throw new InvalidStateTransitionException(account.getStatus(), target);
        }
        if (!admin) {
            accessPolicy.require(loadContract(contractId), actorId, PartyRole.CLIENT);
        }

        switch (outcome) {
            case COMPLETED -> {
                if (account.getHeldAmount() != 0) {
                    throw new LedgerValidationException("ESCROW_NOT_EMPTY",
                            "Escrow still holds " + account.getHeldAmount() + "; release or refund it first");
                }
            }
            case CANCELED -> {
                if (account.getHeldAmount() > 0) {
                    refundHeld(account, account.getHeldAmount(), "Refund on cancellation");
                }
            }
        }

        account.setStatus(target);
        account = escrowAccountRepository.save(account);
        log.info("Escrow closed: contractId={}, status={}, by={}", contractId, target, actorId);
        return account;
    }

    /**
     * Returns held and initial amounts in major units, or empty when no account was opened.
     */
    @Transactional(readOnly = true)
    public Optional<EscrowStatusResponse> getStatus(@NotNull UUID contractId, @NotNull UUID userId)
            throws DomainException {
        Optional<EscrowAccount> account = escrowAccountRepository.findByContractId(contractId);
        if (account.isPresent()) {
            accessPolicy.require(loadContract(contractId), userId, PartyRole.EITHER);
        }
        return account.map(LedgerMapper.INSTANCE::toStatusResponse);
    }

    /**
     * Recomputes the held amount from the escrow log and compares it with the stored value.
     */
    @Transactional(readOnly = true)
    public ReconciliationResponse reconcile(@NotNull UUID contractId, @NotNull UUID userId, boolean admin)
            throws DomainException {
        EscrowAccount account = escrowAccountRepository.findByContractId(contractId)
                .orElseThrow(() -> ResourceNotFoundException.escrow(contractId));
        if (!admin) {
            accessPolicy.require(loadContract(contractId), userId, PartyRole.EITHER);
        }

        long deposits = escrowTransactionRepository.sumAmountByType(account.getId(), EscrowTransactionType.DEPOSIT);
        long releases = escrowTransactionRepository.sumAmountByType(account.getId(), EscrowTransactionType.RELEASE);
        long refunds = escrowTransactionRepository.sumAmountByType(account.getId(), EscrowTransactionType.REFUND);
        long expected = account.getInitialAmount() + deposits - releases - refunds;
        boolean balanced = expected == account.getHeldAmount();
        if (!balanced) {
            log.error("Escrow out of balance: contractId={}, expected={}, held={}",
                    contractId, expected, account.getHeldAmount());
        }

        return new ReconciliationResponse(
                contractId,
                MinorUnits.toMajor(account.getInitialAmount()),
                MinorUnits.toMajor(deposits),
                MinorUnits.toMajor(releases),
                MinorUnits.toMajor(refunds),
                MinorUnits.toMajor(account.getHeldAmount()),
                balanced
        );
    }

    /**
     * Returns the escrow log, newest first. Either party.
     */
    @Transactional(readOnly = true)
    public Page<EscrowTransaction> getTransactions(@NotNull UUID contractId, @NotNull UUID userId, int page, int size)
            throws DomainException {
        EscrowAccount account = escrowAccountRepository.findByContractId(contractId)
                .orElseThrow(() -> ResourceNotFoundException.escrow(contractId));
        accessPolicy.require(loadContract(contractId), userId, PartyRole.EITHER);
        return escrowTransactionRepository.findByEscrowAccountIdOrderByCreatedAtDesc(account.getId(),
                PageRequest.of(page, size));
    }

    private EscrowTransaction refundHeld(EscrowAccount account, long amount, String description)
            throws DomainException {
        account.setHeldAmount(account.getHeldAmount() - amount);
        escrowAccountRepository.save(account);

        WalletTransaction credit = walletLedgerService.returnFromEscrow(account.getClientId(), amount,
                account.getContractId());
        return append(account, amount, EscrowTransactionType.REFUND, null, credit.getWalletId(), description);
    }

    private EscrowAccount lockActiveAccount(UUID contractId)
            throws ResourceNotFoundException, InactiveAccountException {
        EscrowAccount account = escrowAccountRepository.findByContractIdForUpdate(contractId)
                .orElseThrow(() -> ResourceNotFoundException.escrow(contractId));
        if (account.getStatus() != EscrowAccountStatus.ACTIVE) {
            throw new InactiveAccountException("ESCROW_INACTIVE",
                    "Escrow account of contract " + contractId + " is " + account.getStatus());
        }
        return account;
    }

    private Contract loadContract(UUID contractId) throws ResourceNotFoundException {
        return contractService.findContract(contractId)
                .orElseThrow(() -> ResourceNotFoundException.contract(contractId));
    }

    private EscrowTransaction append(EscrowAccount account, long amount, EscrowTransactionType type,
                                     UUID sourceWalletId, UUID destinationWalletId, String description) {
        EscrowTransaction transaction = new EscrowTransaction();
        transaction.setEscrowAccountId(account.getId());
        transaction.setAmount(amount);
        transaction.setType(type);
        transaction.setSourceWalletId(sourceWalletId);
        transaction.setDestinationWalletId(destinationWalletId);
        transaction.setDescription(description);
        return escrowTransactionRepository.save(transaction);
    }

    private static void requireHeld(EscrowAccount account, long amount) throws InsufficientFundsException {
        if (account.getHeldAmount() < amount) {
            throw new InsufficientFundsException("Insufficient escrow balance", account.getHeldAmount(), amount);
        }
    }

    private static void requirePositive(long amount) throws LedgerValidationException {
        if (amount <= 0) {
            throw LedgerValidationException.nonPositiveAmount(amount);
        }
    }
}
