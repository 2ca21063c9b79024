package com.nosota.mescrow.api;

import com.nosota.mescrow.api.dto.EscrowTransactionDTO;
import com.nosota.mescrow.api.dto.PagedResponse;
import com.nosota.mescrow.api.dto.WalletTransactionDTO;
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
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Finance API: user wallets and contract escrow accounts.
 *
 * <p>All amounts are exchanged in major currency units (e.g. 150.00) and stored by the service
 * as integer minor units (15000).
 *
 * <p>Money-moving endpoints accept an optional {@value ApiHeaders#IDEMPOTENCY_KEY} header. A request
 * repeated with the same key and the same payload is answered with {@code replayed=true} and does not
 * move money again.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>FinanceController - in service module (server-side implementation)</li>
 *   <li>{@link FinanceClient} - WebClient-based client for consumers</li>
 * </ul>
 */
@RequestMapping("/api/v1/finance")
public interface FinanceApi {

    // ==================== Wallet ====================

    /**
     * Creates the caller's wallet if it does not exist yet. Idempotent.
     */
    @PostMapping("/wallet")
    ResponseEntity<WalletResponse> initializeWallet(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestHeader(ApiHeaders.USER_ROLE) UserRole role) throws Exception;

    /**
     * Returns the caller's balances. 404 when the wallet was never initialized.
     */
    @GetMapping("/wallet")
    ResponseEntity<WalletBalanceResponse> getWallet(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId) throws Exception;

    @GetMapping("/wallet/transactions")
    ResponseEntity<PagedResponse<WalletTransactionDTO>> getWalletTransactions(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size) throws Exception;

    /**
     * Credits funds confirmed by the external payment provider to the caller's available balance.
     */
    @PostMapping("/wallet/top-up")
    ResponseEntity<LedgerOperationResponse> topUp(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestHeader(value = ApiHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @RequestBody @Valid TopUpRequest request) throws Exception;

    /**
     * Moves funds from the caller's pending balance to the available balance.
     */
    @PostMapping("/pending/move")
    ResponseEntity<LedgerOperationResponse> movePendingToAvailable(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestHeader(value = ApiHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @RequestBody @Valid AmountRequest request) throws Exception;

    /**
     * Deducts a payout from the caller's available balance.
     */
    @PostMapping("/payout/request")
    ResponseEntity<LedgerOperationResponse> requestPayout(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestHeader(value = ApiHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @RequestBody @Valid PayoutRequest request) throws Exception;

    // ==================== Escrow ====================

    /**
     * Opens the escrow account of a contract. Client only.
     */
    @PostMapping("/escrow/{contractId}/open")
    ResponseEntity<LedgerOperationResponse> openEscrow(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable("contractId") UUID contractId,
            @RequestHeader(value = ApiHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @RequestBody @Valid OpenEscrowRequest request) throws Exception;

    /**
     * Moves funds from the client's available balance into the contract escrow. Client only.
     */
    @PostMapping("/escrow/{contractId}/deposit")
    ResponseEntity<LedgerOperationResponse> depositToEscrow(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable("contractId") UUID contractId,
            @RequestHeader(value = ApiHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @RequestBody @Valid AmountRequest request) throws Exception;

    /**
     * Releases held funds to the freelancer's pending balance. Client only.
     */
    @PostMapping("/escrow/{contractId}/release")
    ResponseEntity<LedgerOperationResponse> releaseFromEscrow(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable("contractId") UUID contractId,
            @RequestHeader(value = ApiHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @RequestBody @Valid AmountRequest request) throws Exception;

    /**
     * Returns held funds to the client's available balance. Contract freelancer or ADMIN.
     */
    @PostMapping("/escrow/{contractId}/refund")
    ResponseEntity<LedgerOperationResponse> refundFromEscrow(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestHeader(value = ApiHeaders.USER_ROLE, required = false) UserRole role,
            @PathVariable("contractId") UUID contractId,
            @RequestHeader(value = ApiHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @RequestBody @Valid RefundEscrowRequest request) throws Exception;

    /**
     * Closes the escrow account. Contract client or ADMIN.
     */
    @PostMapping("/escrow/{contractId}/close")
    ResponseEntity<EscrowStatusResponse> closeEscrow(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestHeader(value = ApiHeaders.USER_ROLE, required = false) UserRole role,
            @PathVariable("contractId") UUID contractId,
            @RequestBody @Valid CloseEscrowRequest request) throws Exception;

    /**
     * Returns held and initial amounts. 404 when the account was never opened.
     */
    @GetMapping("/escrow/{contractId}")
    ResponseEntity<EscrowStatusResponse> getEscrowStatus(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable("contractId") UUID contractId) throws Exception;

    @GetMapping("/escrow/{contractId}/reconciliation")
    ResponseEntity<ReconciliationResponse> reconcileEscrow(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestHeader(value = ApiHeaders.USER_ROLE, required = false) UserRole role,
            @PathVariable("contractId") UUID contractId) throws Exception;

    @GetMapping("/escrow/{contractId}/transactions")
    ResponseEntity<PagedResponse<EscrowTransactionDTO>> getEscrowTransactions(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable("contractId") UUID contractId,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size) throws Exception;
}
