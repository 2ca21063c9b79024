package com.nosota.mescrow.service;

import com.nosota.mescrow.api.model.UserRole;
import com.nosota.mescrow.api.model.UserStatus;
import com.nosota.mescrow.api.model.WalletTransactionType;
import com.nosota.mescrow.config.LedgerProperties;
import com.nosota.mescrow.dto.LedgerReceipt;
import com.nosota.mescrow.error.InactiveAccountException;
import com.nosota.mescrow.error.InsufficientFundsException;
import com.nosota.mescrow.error.LedgerValidationException;
import com.nosota.mescrow.error.ResourceNotFoundException;
import com.nosota.mescrow.model.UserAccount;
import com.nosota.mescrow.model.Wallet;
import com.nosota.mescrow.model.WalletTransaction;
import com.nosota.mescrow.repository.UserAccountRepository;
import com.nosota.mescrow.repository.WalletRepository;
import com.nosota.mescrow.repository.WalletTransactionRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Balance rules of {@link WalletLedgerService} with the repositories mocked out.
 */
@ExtendWith(MockitoExtension.class)
class WalletLedgerServiceTest {

    @Mock
    private WalletRepository walletRepository;

    @Mock
    private WalletTransactionRepository walletTransactionRepository;

    @Mock
    private UserAccountRepository userAccountRepository;

    @Mock
    private IdempotencyService idempotencyService;

    @Mock
    private LedgerProperties ledgerProperties;

    @InjectMocks
    private WalletLedgerService walletLedgerService;

    private final UUID userId = UUID.randomUUID();

    @Test
    @DisplayName("WLS-001: Moving pending funds updates both balances and writes one ADJUSTMENT")
    void movePendingToAvailable() throws Exception {
        Wallet wallet = wallet(0L, 500L);
        when(walletRepository.findByUserIdForUpdate(userId)).thenReturn(Optional.of(wallet));
        passThroughIdempotency();
        saveTransactionsWithId();

        LedgerReceipt receipt = walletLedgerService.movePendingToAvailable(userId, 200L, null);

        assertThat(receipt.replayed()).isFalse();
        assertThat(receipt.transactionId()).isNotNull();
        assertThat(wallet.getAvailableBalance()).isEqualTo(200L);
        assertThat(wallet.getPendingBalance()).isEqualTo(300L);

        ArgumentCaptor<WalletTransaction> captor = ArgumentCaptor.forClass(WalletTransaction.class);
        verify(walletTransactionRepository).save(captor.capture());
        assertThat(captor.getValue().getType()).isEqualTo(WalletTransactionType.ADJUSTMENT);
        assertThat(captor.getValue().getAmount()).isEqualTo(200L);
        assertThat(captor.getValue().getMetadata()).containsEntry("from", "PENDING");
    }

    @Test
    @DisplayName("WLS-002: A payout larger than the available balance changes nothing")
    void payoutOverdraw() throws Exception {
        Wallet wallet = wallet(1000L, 0L);
        when(walletRepository.findByUserIdForUpdate(userId)).thenReturn(Optional.of(wallet));
        passThroughIdempotency();

        assertThatThrownBy(() -> walletLedgerService.processPayoutDeduction(userId, 1500L, "payout-1", null))
                .isInstanceOfSatisfying(InsufficientFundsException.class, e -> {
                    assertThat(e.getAvailable()).isEqualTo(1000L);
                    assertThat(e.getRequested()).isEqualTo(1500L);
                });

        assertThat(wallet.getAvailableBalance()).isEqualTo(1000L);
        verify(walletRepository, never()).save(any());
        verifyNoInteractions(walletTransactionRepository);
    }

    @Test
    @DisplayName("WLS-003: Non-positive amounts are rejected before any lookup")
    void nonPositiveAmount() {
        assertThatThrownBy(() -> walletLedgerService.topUp(userId, 0L, "ext-1", null))
                .isInstanceOfSatisfying(LedgerValidationException.class,
                        e -> assertThat(e.getCode()).isEqualTo("INVALID_AMOUNT"));
        assertThatThrownBy(() -> walletLedgerService.holdForEscrow(userId, -5L, UUID.randomUUID()))
                .isInstanceOf(LedgerValidationException.class);

        verifyNoInteractions(walletRepository, walletTransactionRepository, idempotencyService);
    }

    @Test
    @DisplayName("WLS-004: A user without a wallet has nothing to hold for escrow")
    void holdWithoutWallet() {
        when(walletRepository.findByUserIdForUpdate(userId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> walletLedgerService.holdForEscrow(userId, 100L, UUID.randomUUID()))
                .isInstanceOfSatisfying(InsufficientFundsException.class,
                        e -> assertThat(e.getAvailable()).isZero());
    }

    @Test
    @DisplayName("WLS-005: Releases are credited only to known freelancers")
    void creditPendingUserNotFound() {
        when(userAccountRepository.findById(userId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> walletLedgerService.creditPending(userId, 100L, UUID.randomUUID()))
                .isInstanceOfSatisfying(ResourceNotFoundException.class,
                        e -> assertThat(e.getCode()).isEqualTo("USER_NOT_FOUND"));
        verifyNoInteractions(walletRepository);
    }

    @Test
    @DisplayName("WLS-006: Releases to a client account are rejected")
    void creditPendingNotFreelancer() {
        when(userAccountRepository.findById(userId))
                .thenReturn(Optional.of(new UserAccount(userId, UserRole.CLIENT, UserStatus.ACTIVE, null)));

        assertThatThrownBy(() -> walletLedgerService.creditPending(userId, 100L, UUID.randomUUID()))
                .isInstanceOfSatisfying(InactiveAccountException.class,
                        e -> assertThat(e.getCode()).isEqualTo("INVALID_FREELANCER"));
    }

    @Test
    @DisplayName("WLS-007: Releases to a suspended freelancer are rejected")
    void creditPendingSuspended() {
        when(userAccountRepository.findById(userId))
                .thenReturn(Optional.of(new UserAccount(userId, UserRole.FREELANCER, UserStatus.SUSPENDED, null)));

        assertThatThrownBy(() -> walletLedgerService.creditPending(userId, 100L, UUID.randomUUID()))
                .isInstanceOfSatisfying(InactiveAccountException.class,
                        e -> assertThat(e.getCode()).isEqualTo("USER_INACTIVE"));
        verifyNoInteractions(walletRepository);
    }

    @Test
    @DisplayName("WLS-008: Releases go to the pending balance, not the available one")
    void creditPending() throws Exception {
        Wallet wallet = wallet(700L, 0L);
        when(userAccountRepository.findById(userId))
                .thenReturn(Optional.of(new UserAccount(userId, UserRole.FREELANCER, UserStatus.ACTIVE, null)));
        when(walletRepository.findByUserIdForUpdate(userId)).thenReturn(Optional.of(wallet));
        saveTransactionsWithId();

        WalletTransaction transaction = walletLedgerService.creditPending(userId, 400L, UUID.randomUUID());

        assertThat(transaction.getType()).isEqualTo(WalletTransactionType.RELEASE);
        assertThat(wallet.getPendingBalance()).isEqualTo(400L);
        assertThat(wallet.getAvailableBalance()).isEqualTo(700L);
    }

    private Wallet wallet(long available, long pending) {
        Wallet wallet = new Wallet();
        wallet.setId(UUID.randomUUID());
        wallet.setUserId(userId);
        wallet.setAvailableBalance(available);
        wallet.setPendingBalance(pending);
        return wallet;
    }

    private void passThroughIdempotency() throws Exception {
        when(idempotencyService.execute(any(), anyString(), anyString(), any()))
                .thenAnswer(invocation -> LedgerReceipt.written(invocation.<LedgerWrite>getArgument(3).apply()));
    }

    private void saveTransactionsWithId() {
        when(walletTransactionRepository.save(any(WalletTransaction.class))).thenAnswer(invocation -> {
            WalletTransaction transaction = invocation.getArgument(0);
            transaction.setId(UUID.randomUUID());
            return transaction;
        });
    }
}
