package com.nosota.mescrow.tests;

import com.nosota.mescrow.TestBase;
import com.nosota.mescrow.api.model.UserRole;
import com.nosota.mescrow.api.model.WalletTransactionType;
import com.nosota.mescrow.dto.LedgerReceipt;
import com.nosota.mescrow.error.InsufficientFundsException;
import com.nosota.mescrow.error.ResourceNotFoundException;
import com.nosota.mescrow.model.Contract;
import com.nosota.mescrow.model.Wallet;
import com.nosota.mescrow.model.WalletTransaction;
import com.nosota.mescrow.repository.UserAccountRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for the wallet ledger.
 *
 * <ul>
 *   <li>WAL-001: Wallet initialization</li>
 *   <li>WAL-002..004: Top-up, pending → available, payout</li>
 *   <li>WAL-005: Concurrent payouts</li>
 *   <li>WAL-006: Transaction history</li>
 * </ul>
 */
@DisplayName("Wallet Ledger Tests")
public class WalletLedgerTest extends TestBase {

    @Autowired
    private LedgerAsyncService ledgerAsyncService;

    @Autowired
    private UserAccountRepository userAccountRepository;

    @Test
    @DisplayName("WAL-001: Initializing twice keeps one wallet and the first role")
    void testInitializeWallet() {
        UUID userId = UUID.randomUUID();

        Wallet first = walletLedgerService.initializeWallet(userId, UserRole.FREELANCER);
        Wallet second = walletLedgerService.initializeWallet(userId, UserRole.CLIENT);

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(first.getAvailableBalance()).isZero();
        assertThat(first.getPendingBalance()).isZero();
        assertThat(first.getCurrency()).isEqualTo("USD");
        assertThat(userAccountRepository.findById(userId).orElseThrow().getRole()).isEqualTo(UserRole.FREELANCER);
    }

    @Test
    @DisplayName("WAL-002: Top-up creates the wallet on first use")
    void testTopUpCreatesWallet() throws Exception {
        UUID userId = UUID.randomUUID();

        LedgerReceipt receipt = walletLedgerService.topUp(userId, 2500L, "pi_123", null);

        assertThat(availableBalance(userId)).isEqualTo(2500L);
        List<WalletTransaction> deposits = walletTransactionRepository.findByWalletIdAndType(walletId(userId),
                WalletTransactionType.DEPOSIT);
        assertThat(deposits).hasSize(1);
        assertThat(deposits.get(0).getId()).isEqualTo(receipt.transactionId());
        assertThat(deposits.get(0).getRelatedId()).isEqualTo("pi_123");
    }

    @Test
    @DisplayName("WAL-003: Released funds become spendable only after the pending move")
    void testPendingToAvailable() throws Exception {
        UUID clientId = registerFundedClient(9000L);
        UUID freelancerId = registerUser(UserRole.FREELANCER);
        Contract contract = createActiveContract(clientId, freelancerId);
        escrowService.openAccount(clientId, contract.getId(), 9000L, null);
        escrowService.release(clientId, contract.getId(), 9000L, null);

        assertThatThrownBy(() -> walletLedgerService.processPayoutDeduction(freelancerId, 1000L, "po-1", null))
                .isInstanceOf(InsufficientFundsException.class);
        assertThatThrownBy(() -> walletLedgerService.movePendingToAvailable(freelancerId, 9001L, null))
                .isInstanceOf(InsufficientFundsException.class);

        walletLedgerService.movePendingToAvailable(freelancerId, 6000L, null);

        assertThat(availableBalance(freelancerId)).isEqualTo(6000L);
        assertThat(pendingBalance(freelancerId)).isEqualTo(3000L);
    }

    @Test
    @DisplayName("WAL-004: Payout deducts the available balance and records the payout id")
    void testPayout() throws Exception {
        UUID userId = registerFundedClient(4000L);

        walletLedgerService.processPayoutDeduction(userId, 1500L, "po-42", null);

        assertThat(availableBalance(userId)).isEqualTo(2500L);
        List<WalletTransaction> withdrawals = walletTransactionRepository.findByWalletIdAndType(walletId(userId),
                WalletTransactionType.WITHDRAWAL);
        assertThat(withdrawals).hasSize(1);
        assertThat(withdrawals.get(0).getRelatedId()).isEqualTo("po-42");
        assertThat(withdrawals.get(0).getMetadata()).containsEntry("payoutId", "po-42");

        assertThatThrownBy(() -> walletLedgerService.processPayoutDeduction(UUID.randomUUID(), 1L, "po-x", null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("WAL-005: Concurrent payouts never overdraw the wallet")
    void testConcurrentPayouts() throws Exception {
        UUID userId = registerFundedClient(3000L);

        List<CompletableFuture<LedgerReceipt>> futures = List.of(
                ledgerAsyncService.asyncPayout(userId, 1000L, "po-a"),
                ledgerAsyncService.asyncPayout(userId, 1000L, "po-b"),
                ledgerAsyncService.asyncPayout(userId, 1000L, "po-c"),
                ledgerAsyncService.asyncPayout(userId, 1000L, "po-d"),
                ledgerAsyncService.asyncPayout(userId, 1000L, "po-e"),
                ledgerAsyncService.asyncPayout(userId, 1000L, "po-f")
        );
        long succeeded = futures.stream()
                .filter(future -> future.handle((receipt, error) -> error == null).join())
                .count();

        assertThat(succeeded).isEqualTo(3L);
        assertThat(availableBalance(userId)).isZero();
        assertThat(walletTransactionRepository.findByWalletIdAndType(walletId(userId),
                WalletTransactionType.WITHDRAWAL)).hasSize(3);
    }

    @Test
    @DisplayName("WAL-006: History is paged, newest first")
    void testHistory() throws Exception {
        UUID userId = registerFundedClient(100L);
        walletLedgerService.topUp(userId, 200L, "second", null);
        walletLedgerService.topUp(userId, 300L, "third", null);

        Page<WalletTransaction> page = walletLedgerService.getTransactions(userId, 0, 2);

        assertThat(page.getTotalElements()).isEqualTo(3L);
        assertThat(page.getContent()).hasSize(2);
        assertThat(page.getContent().get(0).getCreatedAt())
                .isAfterOrEqualTo(page.getContent().get(1).getCreatedAt());
    }
}
