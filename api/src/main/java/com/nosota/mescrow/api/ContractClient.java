package com.nosota.mescrow.api;

import com.nosota.mescrow.api.request.CreateContractRequest;
import com.nosota.mescrow.api.response.ContractResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.UUID;

/**
 * WebClient-based implementation of ContractApi.
 *
 * <p>Not a Spring @Component; register it as a bean the same way as {@link FinanceClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class ContractClient implements ContractApi {

    private static final String BASE = "/api/v1/contracts";

    private final WebClient webClient;

    @Override
    public ResponseEntity<ContractResponse> createContract(UUID userId, CreateContractRequest request) {
        log.debug("Calling createContract: clientId={}, freelancerId={}, amount={}",
                userId, request.freelancerId(), request.amount());

        return webClient.post()
                .uri(BASE)
                .header(ApiHeaders.USER_ID, userId.toString())
                .bodyValue(request)
                .retrieve()
                .toEntity(ContractResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ContractResponse> getContract(UUID userId, UUID contractId) {
        log.debug("Calling getContract: contractId={}", contractId);

        return webClient.get()
                .uri(BASE + "/{contractId}", contractId)
                .header(ApiHeaders.USER_ID, userId.toString())
                .retrieve()
                .toEntity(ContractResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ContractResponse> startContract(UUID userId, UUID contractId) {
        return transition(userId, contractId, "start");
    }

    @Override
    public ResponseEntity<ContractResponse> submitWork(UUID userId, UUID contractId) {
        return transition(userId, contractId, "submit-work");
    }

    @Override
    public ResponseEntity<ContractResponse> completeContract(UUID userId, UUID contractId) {
        return transition(userId, contractId, "complete");
    }

    @Override
    public ResponseEntity<ContractResponse> disputeContract(UUID userId, UUID contractId) {
        return transition(userId, contractId, "dispute");
    }

    @Override
    public ResponseEntity<ContractResponse> terminateContract(UUID userId, UUID contractId) {
        return transition(userId, contractId, "terminate");
    }

    private ResponseEntity<ContractResponse> transition(UUID userId, UUID contractId, String action) {
        log.debug("Calling contract {}: contractId={}, userId={}", action, contractId, userId);

        return webClient.post()
                .uri(BASE + "/{contractId}/" + action, contractId)
                .header(ApiHeaders.USER_ID, userId.toString())
                .retrieve()
                .toEntity(ContractResponse.class)
                .block();
    }
}
