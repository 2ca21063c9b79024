package com.nosota.mescrow.service;

import com.nosota.mescrow.api.model.ContractStatus;
import com.nosota.mescrow.config.LedgerProperties;
import com.nosota.mescrow.error.InactiveAccountException;
import com.nosota.mescrow.error.InvalidStateTransitionException;
import com.nosota.mescrow.error.LedgerValidationException;
import com.nosota.mescrow.error.UnauthorizedPartyException;
import com.nosota.mescrow.model.Contract;
import com.nosota.mescrow.repository.ContractRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContractServiceTest {

    @Mock
    private ContractRepository contractRepository;

    @Spy
    private ContractStatusStateMachine contractStatusStateMachine = new ContractStatusStateMachine();

    @Spy
    private ContractPartyAccessPolicy accessPolicy = new ContractPartyAccessPolicy();

    @Mock
    private LedgerProperties ledgerProperties;

    @InjectMocks
    private ContractService contractService;

    private final UUID clientId = UUID.randomUUID();
    private final UUID freelancerId = UUID.randomUUID();
    private final UUID contractId = UUID.randomUUID();

    @Test
    @DisplayName("CSV-001: A payout on a terminated contract is refused and total paid is kept")
    void paymentOnTerminatedContract() {
        Contract contract = contract(ContractStatus.TERMINATED);
        contract.setTotalPaid(2000L);
        when(contractRepository.findByIdForUpdate(contractId)).thenReturn(Optional.of(contract));

        assertThatThrownBy(() -> contractService.recordPayment(contractId, 500L))
                .isInstanceOfSatisfying(InactiveAccountException.class,
                        e -> assertThat(e.getCode()).isEqualTo("CONTRACT_INACTIVE"));

        assertThat(contract.getTotalPaid()).isEqualTo(2000L);
        verify(contractRepository, never()).save(any());
    }

    @Test
    @DisplayName("CSV-002: A payout on a running contract adds to total paid")
    void paymentOnActiveContract() throws Exception {
        Contract contract = contract(ContractStatus.REVIEW_PENDING);
        contract.setTotalPaid(2000L);
        when(contractRepository.findByIdForUpdate(contractId)).thenReturn(Optional.of(contract));

        contractService.recordPayment(contractId, 500L);

        assertThat(contract.getTotalPaid()).isEqualTo(2500L);
        verify(contractRepository).save(contract);
    }

    @Test
    @DisplayName("CSV-003: Only the client starts a contract, and only from the allowed statuses")
    void startAndComplete() throws Exception {
        Contract contract = contract(ContractStatus.PENDING);
        when(contractRepository.findByIdForUpdate(contractId)).thenReturn(Optional.of(contract));
        when(contractRepository.save(any(Contract.class))).thenAnswer(invocation -> invocation.getArgument(0));

        assertThatThrownBy(() -> contractService.start(contractId, freelancerId))
                .isInstanceOf(UnauthorizedPartyException.class);
        assertThat(contract.getStatus()).isEqualTo(ContractStatus.PENDING);

        Contract started = contractService.start(contractId, clientId);
        assertThat(started.getStatus()).isEqualTo(ContractStatus.ACTIVE);
        assertThat(started.getStartDate()).isNotNull();

        assertThatThrownBy(() -> contractService.complete(contractId, clientId))
                .isInstanceOfSatisfying(InvalidStateTransitionException.class, e -> {
                    assertThat(e.getFromStatus()).isEqualTo("ACTIVE");
                    assertThat(e.getToStatus()).isEqualTo("COMPLETED");
                });
        assertThat(contract.getStatus()).isEqualTo(ContractStatus.ACTIVE);
        assertThat(contract.getEndDate()).isNull();
    }

    @Test
    @DisplayName("CSV-004: A user cannot contract with themselves; the default currency fills a missing one")
    void createContract() throws Exception {
        LocalDateTime start = LocalDateTime.now();

        assertThatThrownBy(() -> contractService.createContract(clientId, clientId, UUID.randomUUID(), 1000L,
                null, start, null))
                .isInstanceOfSatisfying(LedgerValidationException.class,
                        e -> assertThat(e.getCode()).isEqualTo("SELF_CONTRACT"));
        verify(contractRepository, never()).save(any());

        when(ledgerProperties.getCurrency()).thenReturn("USD");
        when(contractRepository.save(any(Contract.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Contract created = contractService.createContract(clientId, freelancerId, UUID.randomUUID(), 1000L,
                null, start, null);

        assertThat(created.getStatus()).isEqualTo(ContractStatus.PENDING);
        assertThat(created.getCurrency()).isEqualTo("USD");
        assertThat(created.getTotalPaid()).isZero();
    }

    private Contract contract(ContractStatus status) {
        Contract contract = new Contract();
        contract.setId(contractId);
        contract.setClientId(clientId);
        contract.setFreelancerId(freelancerId);
        contract.setJobId(UUID.randomUUID());
        contract.setStatus(status);
        contract.setAmount(10000L);
        contract.setCurrency("USD");
        return contract;
    }
}
