package com.nosota.mescrow.service;

import com.nosota.mescrow.api.model.ContractStatus;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating ContractStatus transitions.
 *
 * <p>State diagram:
 * <pre>
 * PENDING ──► ACTIVE ──► REVIEW_PENDING ──► COMPLETED
 *    │          │            │
 *    │          │            └──► DISPUTED
 *    │          │                    │
 *    └──────────┴────────────────────┴──► TERMINATED
 * </pre>
 *
 * <p>COMPLETED and TERMINATED are final.
 */
@Component
public class ContractStatusStateMachine extends StatusStateMachine<ContractStatus> {

    private static final Map<ContractStatus, Set<ContractStatus>> ALLOWED_TRANSITIONS = Map.of(
            ContractStatus.PENDING, EnumSet.of(ContractStatus.ACTIVE, ContractStatus.TERMINATED),
            ContractStatus.ACTIVE, EnumSet.of(ContractStatus.REVIEW_PENDING, ContractStatus.TERMINATED),
            ContractStatus.REVIEW_PENDING, EnumSet.of(
                    ContractStatus.COMPLETED,
                    ContractStatus.DISPUTED,
                    ContractStatus.TERMINATED
            ),
            ContractStatus.DISPUTED, EnumSet.of(ContractStatus.TERMINATED),
            ContractStatus.COMPLETED, EnumSet.noneOf(ContractStatus.class),
            ContractStatus.TERMINATED, EnumSet.noneOf(ContractStatus.class)
    );

    public ContractStatusStateMachine() {
        super(ALLOWED_TRANSITIONS);
    }
}
