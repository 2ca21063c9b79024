package com.nosota.mescrow.tests;

import com.nosota.mescrow.TestBase;
import com.nosota.mescrow.api.model.EscrowAccountStatus;
import com.nosota.mescrow.api.model.EscrowCloseOutcome;
import com.nosota.mescrow.api.model.EscrowTransactionType;
import com.nosota.mescrow.api.model.RefundInitiator;
import com.nosota.mescrow.api.model.UserRole;
import com.nosota.mescrow.api.model.WalletTransactionType;
import com.nosota.mescrow.api.response.ReconciliationResponse;
import com.nosota.mescrow.dto.LedgerReceipt;
import com.nosota.mescrow.error.InactiveAccountException;
import com.nosota.mescrow.error.InsufficientFundsException;
import com.nosota.mescrow.error.LedgerValidationException;
import com.nosota.mescrow.error.UnauthorizedPartyException;
import com.nosota.mescrow.model.Contract;
import com.nosota.mescrow.model.EscrowAccount;
import com.nosota.mescrow.model.EscrowTransaction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for escrow money movement.
 *
 * <ul>
 *   <li>ESC-001..003: deposit, release and a rejected overdraw</li>
 *   <li>ESC-004..005: refunds</li>
 *   <li>ESC-006..008: opening and closing the account</li>
 *   <li>ESC-009..010: reconciliation and concurrent releases</li>
 * </ul>
 */
@DisplayName("Escrow Tests")
public class EscrowTest extends TestBase {

    @Autowired
    private LedgerAsyncService ledgerAsyncService;

    @Test
    @DisplayName("ESC-001: Deposit moves funds from the client wallet into escrow")
    void testDeposit() throws Exception {
        UUID clientId = registerFundedClient(15000L);
        UUID freelancerId = registerUser(UserRole.FREELANCER);
        Contract contract = createActiveContract(clientId, freelancerId);
        escrowService.openAccount(clientId, contract.getId(), 0L, null);

        LedgerReceipt receipt = escrowService.deposit(clientId, contract.getId(), 10000L, null);

        assertThat(receipt.replayed()).isFalse();
        assertThat(availableBalance(clientId)).isEqualTo(5000L);
        assertThat(heldAmount(contract.getId())).isEqualTo(10000L);

        EscrowAccount account = escrowAccountRepository.findByContractId(contract.getId()).orElseThrow();
        List<EscrowTransaction> escrowLog = escrowTransactionRepository.findByEscrowAccountId(account.getId());
        assertThat(escrowLog).hasSize(1);
        assertThat(escrowLog.get(0).getType()).isEqualTo(EscrowTransactionType.DEPOSIT);
        assertThat(escrowLog.get(0).getSourceWalletId()).isEqualTo(walletId(clientId));
        assertThat(walletTransactionRepository.findByWalletIdAndType(walletId(clientId), WalletTransactionType.HOLD))
                .hasSize(1);
    }

    @Test
    @DisplayName("ESC-002: Release moves held funds to the freelancer's pending balance")
    void testRelease() throws Exception {
        UUID clientId = registerFundedClient(10000L);
        UUID freelancerId = registerUser(UserRole.FREELANCER);
        Contract contract = createActiveContract(clientId, freelancerId);
        escrowService.openAccount(clientId, contract.getId(), 10000L, null);

        escrowService.release(clientId, contract.getId(), 4000L, null);

        assertThat(heldAmount(contract.getId())).isEqualTo(6000L);
        assertThat(pendingBalance(freelancerId)).isEqualTo(4000L);
        assertThat(availableBalance(freelancerId)).isZero();
        assertThat(contractService.findContract(contract.getId()).orElseThrow().getTotalPaid()).isEqualTo(4000L);

        EscrowAccount account = escrowAccountRepository.findByContractId(contract.getId()).orElseThrow();
        assertThat(escrowTransactionRepository.findByEscrowAccountId(account.getId()))
                .extracting(EscrowTransaction::getType)
                .containsExactly(EscrowTransactionType.RELEASE);
    }

    @Test
    @DisplayName("ESC-003: A deposit above the available balance changes nothing")
    void testDepositInsufficientFunds() throws Exception {
        UUID clientId = registerFundedClient(5000L);
        UUID freelancerId = registerUser(UserRole.FREELANCER);
        Contract contract = createActiveContract(clientId, freelancerId);
        escrowService.openAccount(clientId, contract.getId(), 0L, null);
        long walletEntriesBefore = walletTransactionRepository.countByWalletId(walletId(clientId));

        assertThatThrownBy(() -> escrowService.deposit(clientId, contract.getId(), 20000L, null))
                .isInstanceOf(InsufficientFundsException.class);

        assertThat(availableBalance(clientId)).isEqualTo(5000L);
        assertThat(heldAmount(contract.getId())).isZero();
        assertThat(walletTransactionRepository.countByWalletId(walletId(clientId))).isEqualTo(walletEntriesBefore);
        EscrowAccount account = escrowAccountRepository.findByContractId(contract.getId()).orElseThrow();
        assertThat(escrowTransactionRepository.findByEscrowAccountId(account.getId())).isEmpty();
    }

    @Test
    @DisplayName("ESC-004: Freelancer refund returns held funds to the client")
    void testFreelancerRefund() throws Exception {
        UUID clientId = registerFundedClient(10000L);
        UUID freelancerId = registerUser(UserRole.FREELANCER);
        Contract contract = createActiveContract(clientId, freelancerId);
        escrowService.openAccount(clientId, contract.getId(), 8000L, null);

        escrowService.refund(contract.getId(), 3000L, RefundInitiator.FREELANCER, freelancerId, null);

        assertThat(heldAmount(contract.getId())).isEqualTo(5000L);
        assertThat(availableBalance(clientId)).isEqualTo(5000L);
        assertThat(pendingBalance(freelancerId)).isZero();
    }

    @Test
    @DisplayName("ESC-005: Refund rules: only the freelancer, never more than held")
    void testRefundRules() throws Exception {
        UUID clientId = registerFundedClient(10000L);
        UUID freelancerId = registerUser(UserRole.FREELANCER);
        Contract contract = createActiveContract(clientId, freelancerId);
        escrowService.openAccount(clientId, contract.getId(), 2000L, null);

        assertThatThrownBy(() -> escrowService.refund(contract.getId(), 1000L, RefundInitiator.FREELANCER,
                clientId, null))
                .isInstanceOf(UnauthorizedPartyException.class);
        assertThatThrownBy(() -> escrowService.refund(contract.getId(), 2500L, RefundInitiator.FREELANCER,
                freelancerId, null))
                .isInstanceOf(InsufficientFundsException.class);

        assertThat(heldAmount(contract.getId())).isEqualTo(2000L);
        assertThat(availableBalance(clientId)).isEqualTo(8000L);
    }

    @Test
    @DisplayName("ESC-006: Only the client opens the escrow, and only once")
    void testOpenRules() throws Exception {
        UUID clientId = registerFundedClient(1000L);
        UUID freelancerId = registerUser(UserRole.FREELANCER);
        Contract contract = createActiveContract(clientId, freelancerId);

        assertThatThrownBy(() -> escrowService.openAccount(freelancerId, contract.getId(), 0L, null))
                .isInstanceOf(UnauthorizedPartyException.class);

        escrowService.openAccount(clientId, contract.getId(), 500L, null);
        assertThatThrownBy(() -> escrowService.openAccount(clientId, contract.getId(), 0L, null))
                .isInstanceOfSatisfying(LedgerValidationException.class,
                        e -> assertThat(e.getCode()).isEqualTo("ESCROW_ALREADY_OPEN"));

        assertThat(heldAmount(contract.getId())).isEqualTo(500L);
        assertThat(availableBalance(clientId)).isEqualTo(500L);
        assertThat(escrowService.getStatus(contract.getId(), freelancerId)).isPresent();
    }

    @Test
    @DisplayName("ESC-007: Closing as COMPLETED requires an empty account")
    void testCloseCompleted() throws Exception {
        UUID clientId = registerFundedClient(3000L);
        UUID freelancerId = registerUser(UserRole.FREELANCER);
        Contract contract = createActiveContract(clientId, freelancerId);
        escrowService.openAccount(clientId, contract.getId(), 3000L, null);

        assertThatThrownBy(() -> escrowService.closeAccount(clientId, false, contract.getId(),
                EscrowCloseOutcome.COMPLETED))
                .isInstanceOfSatisfying(LedgerValidationException.class,
                        e -> assertThat(e.getCode()).isEqualTo("ESCROW_NOT_EMPTY"));

        escrowService.release(clientId, contract.getId(), 3000L, null);
        EscrowAccount closed = escrowService.closeAccount(clientId, false, contract.getId(),
                EscrowCloseOutcome.COMPLETED);

        assertThat(closed.getStatus()).isEqualTo(EscrowAccountStatus.COMPLETED);
        assertThatThrownBy(() -> escrowService.deposit(clientId, contract.getId(), 100L, null))
                .isInstanceOfSatisfying(InactiveAccountException.class,
                        e -> assertThat(e.getCode()).isEqualTo("ESCROW_INACTIVE"));
    }

    @Test
    @DisplayName("ESC-008: Cancelling returns whatever is still held to the client")
    void testCloseCanceled() throws Exception {
        UUID clientId = registerFundedClient(6000L);
        UUID freelancerId = registerUser(UserRole.FREELANCER);
        UUID adminId = registerUser(UserRole.ADMIN);
        Contract contract = createActiveContract(clientId, freelancerId);
        escrowService.openAccount(clientId, contract.getId(), 6000L, null);
        escrowService.release(clientId, contract.getId(), 1000L, null);

        EscrowAccount closed = escrowService.closeAccount(adminId, true, contract.getId(),
                EscrowCloseOutcome.CANCELED);

        assertThat(closed.getStatus()).isEqualTo(EscrowAccountStatus.CANCELED);
        assertThat(closed.getHeldAmount()).isZero();
        assertThat(availableBalance(clientId)).isEqualTo(5000L);
        assertThat(pendingBalance(freelancerId)).isEqualTo(1000L);
    }

    @Test
    @DisplayName("ESC-009: Reconciliation balances after a mixed sequence of operations")
    void testReconciliation() throws Exception {
        UUID clientId = registerFundedClient(20000L);
        UUID freelancerId = registerUser(UserRole.FREELANCER);
        Contract contract = createActiveContract(clientId, freelancerId);
        escrowService.openAccount(clientId, contract.getId(), 5000L, null);
        escrowService.deposit(clientId, contract.getId(), 7000L, null);
        escrowService.release(clientId, contract.getId(), 4000L, null);
        escrowService.refund(contract.getId(), 1000L, RefundInitiator.FREELANCER, freelancerId, null);
        assertThatThrownBy(() -> escrowService.release(clientId, contract.getId(), 50000L, null))
                .isInstanceOf(InsufficientFundsException.class);

        ReconciliationResponse reconciliation = escrowService.reconcile(contract.getId(), freelancerId, false);

        assertThat(reconciliation.balanced()).isTrue();
        assertThat(reconciliation.initialAmount()).isEqualByComparingTo("50.00");
        assertThat(reconciliation.totalDeposits()).isEqualByComparingTo("70.00");
        assertThat(reconciliation.totalReleases()).isEqualByComparingTo("40.00");
        assertThat(reconciliation.totalRefunds()).isEqualByComparingTo("10.00");
        assertThat(reconciliation.heldAmount()).isEqualByComparingTo("70.00");
        assertThat(availableBalance(clientId) + heldAmount(contract.getId()) + pendingBalance(freelancerId))
                .isEqualTo(20000L);
    }

    @Test
    @DisplayName("ESC-010: Concurrent releases never take the held amount below zero")
    void testConcurrentReleases() throws Exception {
        UUID clientId = registerFundedClient(5000L);
        UUID freelancerId = registerUser(UserRole.FREELANCER);
        Contract contract = createActiveContract(clientId, freelancerId);
        escrowService.openAccount(clientId, contract.getId(), 5000L, null);

        List<CompletableFuture<LedgerReceipt>> futures = List.of(
                ledgerAsyncService.asyncRelease(clientId, contract.getId(), 1000L),
                ledgerAsyncService.asyncRelease(clientId, contract.getId(), 1000L),
                ledgerAsyncService.asyncRelease(clientId, contract.getId(), 1000L),
                ledgerAsyncService.asyncRelease(clientId, contract.getId(), 1000L),
                ledgerAsyncService.asyncRelease(clientId, contract.getId(), 1000L),
                ledgerAsyncService.asyncRelease(clientId, contract.getId(), 1000L),
                ledgerAsyncService.asyncRelease(clientId, contract.getId(), 1000L)
        );
        long succeeded = futures.stream()
                .filter(future -> future.handle((receipt, error) -> error == null).join())
                .count();

        assertThat(succeeded).isEqualTo(5L);
        assertThat(heldAmount(contract.getId())).isZero();
        assertThat(pendingBalance(freelancerId)).isEqualTo(5000L);
        assertThat(escrowService.reconcile(contract.getId(), clientId, false).balanced()).isTrue();
    }
}
