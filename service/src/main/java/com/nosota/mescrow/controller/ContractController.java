package com.nosota.mescrow.controller;

import com.nosota.mescrow.api.ContractApi;
import com.nosota.mescrow.api.request.CreateContractRequest;
import com.nosota.mescrow.api.response.ContractResponse;
import com.nosota.mescrow.mapper.LedgerMapper;
import com.nosota.mescrow.mapper.MinorUnits;
import com.nosota.mescrow.model.Contract;
import com.nosota.mescrow.service.ContractService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class ContractController implements ContractApi {

    private final ContractService contractService;

    @Override
    public ResponseEntity<ContractResponse> createContract(UUID userId, CreateContractRequest request)
            throws Exception {
        Contract contract = contractService.createContract(
                userId,
                request.freelancerId(),
                request.jobId(),
                MinorUnits.toMinor(request.amount()),
                request.currency(),
                request.startDate(),
                request.endDate()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(LedgerMapper.INSTANCE.toResponse(contract));
    }

    @Override
    public ResponseEntity<ContractResponse> getContract(UUID userId, UUID contractId) throws Exception {
        return ResponseEntity.ok(LedgerMapper.INSTANCE.toResponse(contractService.getContract(contractId, userId)));
    }

    @Override
    public ResponseEntity<ContractResponse> startContract(UUID userId, UUID contractId) throws Exception {
        return ResponseEntity.ok(LedgerMapper.INSTANCE.toResponse(contractService.start(contractId, userId)));
    }

    @Override
    public ResponseEntity<ContractResponse> submitWork(UUID userId, UUID contractId) throws Exception {
        return ResponseEntity.ok(LedgerMapper.INSTANCE.toResponse(contractService.submitWork(contractId, userId)));
    }

    @Override
    public ResponseEntity<ContractResponse> completeContract(UUID userId, UUID contractId) throws Exception {
        return ResponseEntity.ok(LedgerMapper.INSTANCE.toResponse(contractService.complete(contractId, userId)));
    }

    @Override
    public ResponseEntity<ContractResponse> disputeContract(UUID userId, UUID contractId) throws Exception {
        return ResponseEntity.ok(LedgerMapper.INSTANCE.toResponse(contractService.dispute(contractId, userId)));
    }

    @Override
    public ResponseEntity<ContractResponse> terminateContract(UUID userId, UUID contractId) throws Exception {
        return ResponseEntity.ok(LedgerMapper.INSTANCE.toResponse(contractService.terminate(contractId, userId)));
    }
}
