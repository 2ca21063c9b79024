package com.nosota.mescrow.controller;

import com.nosota.mescrow.api.FinanceApi;
import com.nosota.mescrow.api.dto.EscrowTransactionDTO;
import com.nosota.mescrow.api.dto.PagedResponse;
import com.nosota.mescrow.api.dto.WalletTransactionDTO;
import com.nosota.mescrow.api.model.RefundInitiator;
import com.nosota.mescrow.api.model.UserRole;
import com.nosota.mescrow.api.request.AmountRequest;
import com.nosota.mescrow.api.request.CloseEscrowRequest;
import com.nosota.mescrow.api.request.OpenEscrowRequest;
import com.nosota.mescrow.api.request.PayoutRequest;
import com.nosota.mescrow.api.request.RefundEscrowRequest;
import com.nosota.mescrow.api.request.TopUpRequest;
import com.nosota.mescrow.api.response.EscrowStatusResponse;
import com.nosota.mescrow.api.response.LedgerOperationResponse;
import com.nosota.mescrow.api.response.ReconciliationResponse;
import com.nosota.mescrow.api.response.WalletBalanceResponse;
import com.nosota.mescrow.api.response.WalletResponse;
import com.nosota.mescrow.dto.LedgerReceipt;
import com.nosota.mescrow.error.ResourceNotFoundException;
import com.nosota.mescrow.error.UnauthorizedPartyException;
import com.nosota.mescrow.mapper.LedgerMapper;
import com.nosota.mescrow.mapper.MinorUnits;
import com.nosota.mescrow.model.EscrowAccount;
import com.nosota.mescrow.model.EscrowTransaction;
import com.nosota.mescrow.model.Wallet;
import com.nosota.mescrow.model.WalletTransaction;
import com.nosota.mescrow.service.EscrowService;
import com.nosota.mescrow.service.WalletLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * REST controller for wallet and escrow operations.
 *
 * <p>Implements {@link FinanceApi}. Converts amounts from major units to the ledger's minor units
 * and back; all business rules live in {@link WalletLedgerService} and {@link EscrowService}.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class FinanceController implements FinanceApi {

    private final WalletLedgerService walletLedgerService;
    private final EscrowService escrowService;

    // ==================== Wallet ====================

    @Override
    public ResponseEntity<WalletResponse> initializeWallet(UUID userId, UserRole role) {
        Wallet wallet = walletLedgerService.initializeWallet(userId, role);
        WalletResponse response = new WalletResponse(wallet.getId(), userId, role.name(), wallet.getCurrency());
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<WalletBalanceResponse> getWallet(UUID userId) throws Exception {
        WalletBalanceResponse response = walletLedgerService.getWallet(userId)
                .orElseThrow(() -> ResourceNotFoundException.wallet(userId));
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<PagedResponse<WalletTransactionDTO>> getWalletTransactions(UUID userId, int page, int size)
            throws Exception {
        Page<WalletTransaction> transactions = walletLedgerService.getTransactions(userId, page, size);
        PagedResponse<WalletTransactionDTO> response = PagedResponse.of(
                LedgerMapper.INSTANCE.toWalletTransactionDTOList(transactions.getContent()),
                transactions.getNumber(),
                transactions.getSize(),
                transactions.getTotalElements()
        );
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<LedgerOperationResponse> topUp(UUID userId, String idempotencyKey, TopUpRequest request)
            throws Exception {
        LedgerReceipt receipt = walletLedgerService.topUp(userId, MinorUnits.toMinor(request.amount()),
                request.externalReference(), idempotencyKey);
        return ResponseEntity.ok(toResponse("TOP_UP", receipt, request.amount(), "Wallet topped up"));
    }

    @Override
    public ResponseEntity<LedgerOperationResponse> movePendingToAvailable(UUID userId, String idempotencyKey,
                                                                          AmountRequest request) throws Exception {
        LedgerReceipt receipt = walletLedgerService.movePendingToAvailable(userId,
                MinorUnits.toMinor(request.amount()), idempotencyKey);
        return ResponseEntity.ok(toResponse("PENDING_MOVE", receipt, request.amount(),
                "Pending funds moved to available balance"));
    }

    @Override
    public ResponseEntity<LedgerOperationResponse> requestPayout(UUID userId, String idempotencyKey,
                                                                 PayoutRequest request) throws Exception {
        LedgerReceipt receipt = walletLedgerService.processPayoutDeduction(userId,
                MinorUnits.toMinor(request.amount()), request.payoutId(), idempotencyKey);
        return ResponseEntity.ok(toResponse("PAYOUT", receipt, request.amount(), "Payout deducted"));
    }

    // ==================== Escrow ====================

    @Override
    public ResponseEntity<LedgerOperationResponse> openEscrow(UUID userId, UUID contractId, String idempotencyKey,
                                                              OpenEscrowRequest request) throws Exception {
        BigDecimal initialAmount = request.initialAmount() != null ? request.initialAmount() : BigDecimal.ZERO;
        LedgerReceipt receipt = escrowService.openAccount(userId, contractId, MinorUnits.toMinor(initialAmount),
                idempotencyKey);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(toResponse("ESCROW_OPEN", receipt, initialAmount, "Escrow account opened"));
    }

    @Override
    public ResponseEntity<LedgerOperationResponse> depositToEscrow(UUID userId, UUID contractId, String idempotencyKey,
                                                                   AmountRequest request) throws Exception {
        LedgerReceipt receipt = escrowService.deposit(userId, contractId, MinorUnits.toMinor(request.amount()),
                idempotencyKey);
        return ResponseEntity.ok(toResponse("ESCROW_DEPOSIT", receipt, request.amount(), "Funds deposited to escrow"));
    }

    @Override
    public ResponseEntity<LedgerOperationResponse> releaseFromEscrow(UUID userId, UUID contractId,
                                                                     String idempotencyKey, AmountRequest request)
            throws Exception {
        LedgerReceipt receipt = escrowService.release(userId, contractId, MinorUnits.toMinor(request.amount()),
                idempotencyKey);
        return ResponseEntity.ok(toResponse("ESCROW_RELEASE", receipt, request.amount(),
                "Funds released to freelancer"));
    }

    @Override
    public ResponseEntity<LedgerOperationResponse> refundFromEscrow(UUID userId, UserRole role, UUID contractId,
                                                                    String idempotencyKey,
                                                                    RefundEscrowRequest request) throws Exception {
        if (request.initiator() == RefundInitiator.SYSTEM && role != UserRole.ADMIN) {
            throw new UnauthorizedPartyException("ADMIN_REQUIRED", "Only administrators can issue system refunds");
        }
        LedgerReceipt receipt = escrowService.refund(contractId, MinorUnits.toMinor(request.amount()),
                request.initiator(), userId, idempotencyKey);
        return ResponseEntity.ok(toResponse("ESCROW_REFUND", receipt, request.amount(), "Funds refunded to client"));
    }

    @Override
    public ResponseEntity<EscrowStatusResponse> closeEscrow(UUID userId, UserRole role, UUID contractId,
                                                            CloseEscrowRequest request) throws Exception {
        EscrowAccount account = escrowService.closeAccount(userId, role == UserRole.ADMIN, contractId,
                request.outcome());
        return ResponseEntity.ok(LedgerMapper.INSTANCE.toStatusResponse(account));
    }

    @Override
    public ResponseEntity<EscrowStatusResponse> getEscrowStatus(UUID userId, UUID contractId) throws Exception {
        EscrowStatusResponse response = escrowService.getStatus(contractId, userId)
                .orElseThrow(() -> ResourceNotFoundException.escrow(contractId));
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<ReconciliationResponse> reconcileEscrow(UUID userId, UserRole role, UUID contractId)
            throws Exception {
        return ResponseEntity.ok(escrowService.reconcile(contractId, userId, role == UserRole.ADMIN));
    }

    @Override
    public ResponseEntity<PagedResponse<EscrowTransactionDTO>> getEscrowTransactions(UUID userId, UUID contractId,
                                                                                     int page, int size)
            throws Exception {
        Page<EscrowTransaction> transactions = escrowService.getTransactions(contractId, userId, page, size);
        PagedResponse<EscrowTransactionDTO> response = PagedResponse.of(
                LedgerMapper.INSTANCE.toEscrowTransactionDTOList(transactions.getContent()),
                transactions.getNumber(),
                transactions.getSize(),
                transactions.getTotalElements()
        );
        return ResponseEntity.ok(response);
    }

    private static LedgerOperationResponse toResponse(String operation, LedgerReceipt receipt, BigDecimal amount,
                                                      String message) {
        return new LedgerOperationResponse(
                operation,
                receipt.transactionId(),
                amount,
                receipt.replayed(),
                receipt.replayed() ? "Already processed" : message
        );
    }
}
