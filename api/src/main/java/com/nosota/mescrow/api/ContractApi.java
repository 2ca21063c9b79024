package com.nosota.mescrow.api;

import com.nosota.mescrow.api.request.CreateContractRequest;
import com.nosota.mescrow.api.response.ContractResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Contract lifecycle API.
 *
 * <p>Who may call what:
 * <ul>
 *   <li>create, start, complete, dispute - client</li>
 *   <li>submit-work - freelancer</li>
 *   <li>terminate, get - either party</li>
 * </ul>
 */
@RequestMapping("/api/v1/contracts")
public interface ContractApi {

    @PostMapping
    ResponseEntity<ContractResponse> createContract(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestBody @Valid CreateContractRequest request) throws Exception;

    @GetMapping("/{contractId}")
    ResponseEntity<ContractResponse> getContract(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable("contractId") UUID contractId) throws Exception;

    @PostMapping("/{contractId}/start")
    ResponseEntity<ContractResponse> startContract(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable("contractId") UUID contractId) throws Exception;

    @PostMapping("/{contractId}/submit-work")
    ResponseEntity<ContractResponse> submitWork(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable("contractId") UUID contractId) throws Exception;

    @PostMapping("/{contractId}/complete")
    ResponseEntity<ContractResponse> completeContract(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable("contractId") UUID contractId) throws Exception;

    @PostMapping("/{contractId}/dispute")
    ResponseEntity<ContractResponse> disputeContract(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable("contractId") UUID contractId) throws Exception;

    @PostMapping("/{contractId}/terminate")
    ResponseEntity<ContractResponse> terminateContract(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable("contractId") UUID contractId) throws Exception;
}
