package com.nosota.mescrow.service;

import com.nosota.mescrow.api.model.UserRole;
import com.nosota.mescrow.api.model.UserStatus;
import com.nosota.mescrow.api.model.WalletTransactionType;
import com.nosota.mescrow.api.response.WalletBalanceResponse;
import com.nosota.mescrow.config.LedgerProperties;
import com.nosota.mescrow.dto.LedgerReceipt;
import com.nosota.mescrow.error.DomainException;
import com.nosota.mescrow.error.InactiveAccountException;
import com.nosota.mescrow.error.InsufficientFundsException;
import com.nosota.mescrow.error.LedgerValidationException;
import com.nosota.mescrow.error.ResourceNotFoundException;
import com.nosota.mescrow.mapper.LedgerMapper;
import com.nosota.mescrow.model.UserAccount;
import com.nosota.mescrow.model.Wallet;
import com.nosota.mescrow.model.WalletTransaction;
import com.nosota.mescrow.repository.UserAccountRepository;
import com.nosota.mescrow.repository.WalletRepository;
import com.nosota.mescrow.repository.WalletTransactionRepository;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Wallet ledger: the only writer of wallet balances.
 *
 * <p>Every operation runs in one transaction, locks the wallet row before reading the balance,
 * and writes exactly one {@link WalletTransaction} per balance change. A failed check aborts the
 * transaction before anything is written.
 *
 * <p>Operations exposed to users ({@link #topUp}, {@link #movePendingToAvailable},
 * {@link #processPayoutDeduction}) accept an Idempotency-Key. The escrow-facing operations
 * ({@link #holdForEscrow}, {@link #creditPending}, {@link #returnFromEscrow}) always join the
 * transaction of the escrow operation that calls them, which is guarded instead.
 *
 * <p>All amounts are in minor units and must be positive.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class WalletLedgerService {

    private final WalletRepository walletRepository;
    private final WalletTransactionRepository walletTransactionRepository;
    private final UserAccountRepository userAccountRepository;
    private final IdempotencyService idempotencyService;
    private final LedgerProperties ledgerProperties;

    /**
     * Creates the user's account mirror and wallet if they do not exist yet.
     * An existing account keeps its role and status.
     *
     * @return the user's wallet
     */
    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public Wallet initializeWallet(@NotNull UUID userId, @NotNull UserRole role) {
        if (!userAccountRepository.existsById(userId)) {
            userAccountRepository.save(new UserAccount(userId, role, UserStatus.ACTIVE, null));
            log.info("Registered user account: userId={}, role={}", userId, role);
        }

        return walletRepository.findByUserId(userId)
                .orElseGet(() -> createWallet(userId));
    }

    /**
     * Credits funds confirmed by the payment provider to the available balance.
     * Creates the wallet when the user has none.
     *
     * @param externalReference Provider reference of the payment, stored as relatedId
     */
    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public LedgerReceipt topUp(@NotNull UUID userId, long amount, String externalReference, String idempotencyKey)
            throws DomainException {
        requirePositive(amount);
        String fingerprint = IdempotencyService.fingerprint("TOP_UP", userId, externalReference, amount);

        return idempotencyService.execute(idempotencyKey, "TOP_UP", fingerprint, () -> {
            Wallet wallet = lockOrCreateWallet(userId);
            wallet.setAvailableBalance(Math.addExact(wallet.getAvailableBalance(), amount));
            walletRepository.save(wallet);

            WalletTransaction transaction = append(wallet, amount, WalletTransactionType.DEPOSIT,
                    externalReference, Map.of("source", "TOP_UP"));
            log.info("Wallet top-up: userId={}, amount={}, available={}",
                    userId, amount, wallet.getAvailableBalance());
            return transaction.getId();
        });
    }

    /**
     * Adds escrow funds released to a freelancer to their pending balance.
     *
     * @throws ResourceNotFoundException if the user or the wallet does not exist
     * @throws InactiveAccountException  if the user is not an active freelancer
     */
    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public WalletTransaction creditPending(@NotNull UUID userId, long amount, UUID contractId)
            throws DomainException {
        requirePositive(amount);

        UserAccount account = userAccountRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.user(userId));
        if (account.getRole() != UserRole.FREELANCER) {
            throw new InactiveAccountException("INVALID_FREELANCER",
                    "User " + userId + " is not a freelancer");
        }
        if (account.getStatus() != UserStatus.ACTIVE) {
            throw new InactiveAccountException("USER_INACTIVE",
                    "Freelancer " + userId + " is " + account.getStatus());
        }

        Wallet wallet = walletRepository.findByUserIdForUpdate(userId)
                .orElseThrow(() -> ResourceNotFoundException.wallet(userId));
        wallet.setPendingBalance(Math.addExact(wallet.getPendingBalance(), amount));
        walletRepository.save(wallet);

        WalletTransaction transaction = append(wallet, amount, WalletTransactionType.RELEASE,
                stringOrNull(contractId), Map.of("source", "ESCROW_RELEASE"));
        log.info("Pending balance credited: userId={}, amount={}, pending={}, contractId={}",
                userId, amount, wallet.getPendingBalance(), contractId);
        return transaction;
    }

    /**
     * Moves funds from the pending balance to the available balance.
     *
     * @throws InsufficientFundsException if the pending balance is lower than {@code amount}
     */
    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public LedgerReceipt movePendingToAvailable(@NotNull UUID userId, long amount, String idempotencyKey)
            throws DomainException {
        requirePositive(amount);
        String fingerprint = IdempotencyService.fingerprint("PENDING_MOVE", userId, amount);

        return idempotencyService.execute(idempotencyKey, "PENDING_MOVE", fingerprint, () -> {
            Wallet wallet = walletRepository.findByUserIdForUpdate(userId)
                    .orElseThrow(() -> ResourceNotFoundException.wallet(userId));
            if (wallet.getPendingBalance() < amount) {
                throw new InsufficientFundsException("Insufficient pending balance",
                        wallet.getPendingBalance(), amount);
            }

            wallet.setPendingBalance(wallet.getPendingBalance() - amount);
            wallet.setAvailableBalance(Math.addExact(wallet.getAvailableBalance(), amount));
            walletRepository.save(wallet);

            WalletTransaction transaction = append(wallet, amount, WalletTransactionType.ADJUSTMENT, null,
                    Map.of("from", "PENDING", "to", "AVAILABLE"));
            log.info("Pending moved to available: userId={}, amount={}, available={}, pending={}",
                    userId, amount, wallet.getAvailableBalance(), wallet.getPendingBalance());
            return transaction.getId();
        });
    }

    /**
     * Deducts a payout from the available balance.
     *
     * @param payoutId ID of the payout in the payout system, stored as relatedId
     * @throws InsufficientFundsException if the available balance is lower than {@code amount}
     */
    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public LedgerReceipt processPayoutDeduction(@NotNull UUID userId, long amount, @NotNull String payoutId,
                                                String idempotencyKey) throws DomainException {
        requirePositive(amount);
        String fingerprint = IdempotencyService.fingerprint("PAYOUT", userId, payoutId, amount);

        return idempotencyService.execute(idempotencyKey, "PAYOUT", fingerprint, () -> {
            Wallet wallet = walletRepository.findByUserIdForUpdate(userId)
                    .orElseThrow(() -> ResourceNotFoundException.wallet(userId));
            if (wallet.getAvailableBalance() < amount) {
                throw new InsufficientFundsException("Insufficient balance for payout",
                        wallet.getAvailableBalance(), amount);
            }

            wallet.setAvailableBalance(wallet.getAvailableBalance() - amount);
            walletRepository.save(wallet);

            WalletTransaction transaction = append(wallet, amount, WalletTransactionType.WITHDRAWAL, payoutId,
                    Map.of("payoutId", payoutId));
            log.info("Payout deducted: userId={}, amount={}, payoutId={}, available={}",
                    userId, amount, payoutId, wallet.getAvailableBalance());
            return transaction.getId();
        });
    }

    /**
     * Takes funds from the available balance to put them into a contract escrow.
     * A user without a wallet has a zero balance.
     *
     * @throws InsufficientFundsException if the available balance is lower than {@code amount}
     */
    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public WalletTransaction holdForEscrow(@NotNull UUID userId, long amount, @NotNull UUID contractId)
            throws DomainException {
        requirePositive(amount);

        Optional<Wallet> locked = walletRepository.findByUserIdForUpdate(userId);
        long available = locked.map(Wallet::getAvailableBalance).orElse(0L);
        if (locked.isEmpty() || available < amount) {
            throw new InsufficientFundsException("Insufficient balance for escrow deposit", available, amount);
        }

        Wallet wallet = locked.get();
        wallet.setAvailableBalance(available - amount);
        walletRepository.save(wallet);

        WalletTransaction transaction = append(wallet, amount, WalletTransactionType.HOLD,
                contractId.toString(), Map.of("source", "ESCROW_DEPOSIT"));
        log.info("Funds held for escrow: userId={}, amount={}, contractId={}, available={}",
                userId, amount, contractId, wallet.getAvailableBalance());
        return transaction;
    }

    /**
     * Returns refunded escrow funds to the available balance. Creates the wallet when the user has none.
     */
    @Transactional(rollbackFor = Exception.class, timeoutString = "${mescrow.ledger.transaction-timeout}")
    public WalletTransaction returnFromEscrow(@NotNull UUID userId, long amount, @NotNull UUID contractId)
            throws DomainException {
        requirePositive(amount);

        Wallet wallet = lockOrCreateWallet(userId);
        wallet.setAvailableBalance(Math.addExact(wallet.getAvailableBalance(), amount));
        walletRepository.save(wallet);

        WalletTransaction transaction = append(wallet, amount, WalletTransactionType.ADJUSTMENT,
                contractId.toString(), Map.of("source", "ESCROW_REFUND"));
        log.info("Escrow funds returned: userId={}, amount={}, contractId={}, available={}",
                userId, amount, contractId, wallet.getAvailableBalance());
        return transaction;
    }

    /**
     * Returns the balances in major units, or empty when the user has no wallet yet.
     */
    @Transactional(readOnly = true)
    public Optional<WalletBalanceResponse> getWallet(@NotNull UUID userId) {
        return walletRepository.findByUserId(userId)
                .map(LedgerMapper.INSTANCE::toBalanceResponse);
    }

    /**
     * Returns the wallet's ledger entries, newest first.
     */
    @Transactional(readOnly = true)
    public Page<WalletTransaction> getTransactions(@NotNull UUID userId, int page, int size)
            throws ResourceNotFoundException {
        Wallet wallet = walletRepository.findByUserId(userId)
                .orElseThrow(() -> ResourceNotFoundException.wallet(userId));
        return walletTransactionRepository.findByWalletIdOrderByCreatedAtDesc(wallet.getId(),
                PageRequest.of(page, size));
    }

    private Wallet lockOrCreateWallet(UUID userId) {
        return walletRepository.findByUserIdForUpdate(userId)
                .orElseGet(() -> createWallet(userId));
    }

    private Wallet createWallet(UUID userId) {
        Wallet wallet = new Wallet();
        wallet.setUserId(userId);
        wallet.setCurrency(ledgerProperties.getCurrency());
        wallet = walletRepository.saveAndFlush(wallet);
        log.info("Created wallet {} for user {}", wallet.getId(), userId);
        return wallet;
    }

    private WalletTransaction append(Wallet wallet, long amount, WalletTransactionType type, String relatedId,
                                     Map<String, Object> metadata) {
        WalletTransaction transaction = new WalletTransaction();
        transaction.setWalletId(wallet.getId());
        transaction.setAmount(amount);
        transaction.setType(type);
        transaction.setRelatedId(relatedId);
        transaction.setMetadata(metadata);
        return walletTransactionRepository.save(transaction);
    }

    private static void requirePositive(long amount) throws LedgerValidationException {
        if (amount <= 0) {
            throw LedgerValidationException.nonPositiveAmount(amount);
        }
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : value.toString();
    }
}
