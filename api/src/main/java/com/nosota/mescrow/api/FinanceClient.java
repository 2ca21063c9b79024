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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.UUID;
import java.util.function.Consumer;

/**
 * WebClient-based implementation of FinanceApi for consuming the mEscrow finance endpoints.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class MEscrowClientConfig {
 *     @Bean
 *     public WebClient mescrowWebClient(WebClient.Builder builder,
 *                                       @Value("${services.mescrow.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public FinanceClient financeClient(WebClient mescrowWebClient) {
 *         return new FinanceClient(mescrowWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class FinanceClient implements FinanceApi {

    private static final String BASE = "/api/v1/finance";

    private final WebClient webClient;

    @Override
    public ResponseEntity<WalletResponse> initializeWallet(UUID userId, UserRole role) {
        log.debug("Calling initializeWallet: userId={}, role={}", userId, role);

        return webClient.post()
                .uri(BASE + "/wallet")
                .headers(identity(userId, role, null))
                .retrieve()
                .toEntity(WalletResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<WalletBalanceResponse> getWallet(UUID userId) {
        log.debug("Calling getWallet: userId={}", userId);

        return webClient.get()
                .uri(BASE + "/wallet")
                .headers(identity(userId, null, null))
                .retrieve()
                .toEntity(WalletBalanceResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<WalletTransactionDTO>> getWalletTransactions(UUID userId, int page, int size) {
        log.debug("Calling getWalletTransactions: userId={}, page={}, size={}", userId, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE + "/wallet/transactions")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .headers(identity(userId, null, null))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<WalletTransactionDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<LedgerOperationResponse> topUp(UUID userId, String idempotencyKey, TopUpRequest request) {
        log.debug("Calling topUp: userId={}, amount={}", userId, request.amount());

        return webClient.post()
                .uri(BASE + "/wallet/top-up")
                .headers(identity(userId, null, idempotencyKey))
                .bodyValue(request)
                .retrieve()
                .toEntity(LedgerOperationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<LedgerOperationResponse> movePendingToAvailable(UUID userId, String idempotencyKey,
                                                                          AmountRequest request) {
        log.debug("Calling movePendingToAvailable: userId={}, amount={}", userId, request.amount());

        return webClient.post()
                .uri(BASE + "/pending/move")
                .headers(identity(userId, null, idempotencyKey))
                .bodyValue(request)
                .retrieve()
                .toEntity(LedgerOperationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<LedgerOperationResponse> requestPayout(UUID userId, String idempotencyKey,
                                                                 PayoutRequest request) {
        log.debug("Calling requestPayout: userId={}, amount={}, payoutId={}",
                userId, request.amount(), request.payoutId());

        return webClient.post()
                .uri(BASE + "/payout/request")
                .headers(identity(userId, null, idempotencyKey))
                .bodyValue(request)
                .retrieve()
                .toEntity(LedgerOperationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<LedgerOperationResponse> openEscrow(UUID userId, UUID contractId, String idempotencyKey,
                                                              OpenEscrowRequest request) {
        log.debug("Calling openEscrow: contractId={}, initialAmount={}", contractId, request.initialAmount());

        return webClient.post()
                .uri(BASE + "/escrow/{contractId}/open", contractId)
                .headers(identity(userId, null, idempotencyKey))
                .bodyValue(request)
                .retrieve()
                .toEntity(LedgerOperationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<LedgerOperationResponse> depositToEscrow(UUID userId, UUID contractId, String idempotencyKey,
                                                                   AmountRequest request) {
        log.debug("Calling depositToEscrow: contractId={}, amount={}", contractId, request.amount());

        return webClient.post()
                .uri(BASE + "/escrow/{contractId}/deposit", contractId)
                .headers(identity(userId, null, idempotencyKey))
                .bodyValue(request)
                .retrieve()
                .toEntity(LedgerOperationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<LedgerOperationResponse> releaseFromEscrow(UUID userId, UUID contractId,
                                                                     String idempotencyKey, AmountRequest request) {
        log.debug("Calling releaseFromEscrow: contractId={}, amount={}", contractId, request.amount());

        return webClient.post()
                .uri(BASE + "/escrow/{contractId}/release", contractId)
                .headers(identity(userId, null, idempotencyKey))
                .bodyValue(request)
                .retrieve()
                .toEntity(LedgerOperationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<LedgerOperationResponse> refundFromEscrow(UUID userId, UserRole role, UUID contractId,
                                                                    String idempotencyKey,
                                                                    RefundEscrowRequest request) {
        log.debug("Calling refundFromEscrow: contractId={}, amount={}, initiator={}",
                contractId, request.amount(), request.initiator());

        return webClient.post()
                .uri(BASE + "/escrow/{contractId}/refund", contractId)
                .headers(identity(userId, role, idempotencyKey))
                .bodyValue(request)
                .retrieve()
                .toEntity(LedgerOperationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<EscrowStatusResponse> closeEscrow(UUID userId, UserRole role, UUID contractId,
                                                            CloseEscrowRequest request) {
        log.debug("Calling closeEscrow: contractId={}, outcome={}", contractId, request.outcome());

        return webClient.post()
                .uri(BASE + "/escrow/{contractId}/close", contractId)
                .headers(identity(userId, role, null))
                .bodyValue(request)
                .retrieve()
                .toEntity(EscrowStatusResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<EscrowStatusResponse> getEscrowStatus(UUID userId, UUID contractId) {
        log.debug("Calling getEscrowStatus: contractId={}", contractId);

        return webClient.get()
                .uri(BASE + "/escrow/{contractId}", contractId)
                .headers(identity(userId, null, null))
                .retrieve()
                .toEntity(EscrowStatusResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ReconciliationResponse> reconcileEscrow(UUID userId, UserRole role, UUID contractId) {
        log.debug("Calling reconcileEscrow: contractId={}", contractId);

        return webClient.get()
                .uri(BASE + "/escrow/{contractId}/reconciliation", contractId)
                .headers(identity(userId, role, null))
                .retrieve()
                .toEntity(ReconciliationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<EscrowTransactionDTO>> getEscrowTransactions(UUID userId, UUID contractId,
                                                                                     int page, int size) {
        log.debug("Calling getEscrowTransactions: contractId={}, page={}, size={}", contractId, page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE + "/escrow/{contractId}/transactions")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build(contractId))
                .headers(identity(userId, null, null))
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<EscrowTransactionDTO>>() {})
                .block();
    }

    private static Consumer<HttpHeaders> identity(UUID userId, UserRole role, String idempotencyKey) {
        return headers -> {
            headers.set(ApiHeaders.USER_ID, userId.toString());
            if (role != null) {
                headers.set(ApiHeaders.USER_ROLE, role.name());
            }
            if (idempotencyKey != null) {
                headers.set(ApiHeaders.IDEMPOTENCY_KEY, idempotencyKey);
            }
        };
    }
}
