package com.nosota.mescrow.service;

import com.nosota.mescrow.api.model.MilestoneStatus;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating MilestoneStatus transitions.
 *
 * <p>Allowed transitions:
 * <pre>
 * PENDING     → IN_PROGRESS, CANCELED
 * IN_PROGRESS → SUBMITTED, CANCELED
 * SUBMITTED   → APPROVED, REJECTED, DISPUTED
 * APPROVED    → PAID, DISPUTED
 * PAID        → COMPLETED
 * DISPUTED    → APPROVED, REJECTED
 * REJECTED    → IN_PROGRESS, CANCELED
 * </pre>
 *
 * <p>CANCELED and COMPLETED are final.
 */
@Component
public class MilestoneStatusStateMachine extends StatusStateMachine<MilestoneStatus> {

    private static final Map<MilestoneStatus, Set<MilestoneStatus>> ALLOWED_TRANSITIONS = Map.of(
            MilestoneStatus.PENDING, EnumSet.of(MilestoneStatus.IN_PROGRESS, MilestoneStatus.CANCELED),
            MilestoneStatus.IN_PROGRESS, EnumSet.of(MilestoneStatus.SUBMITTED, MilestoneStatus.CANCELED),
            MilestoneStatus.SUBMITTED, EnumSet.of(
                    MilestoneStatus.APPROVED,
                    MilestoneStatus.REJECTED,
                    MilestoneStatus.DISPUTED
            ),
            MilestoneStatus.APPROVED, EnumSet.of(MilestoneStatus.PAID, MilestoneStatus.DISPUTED),
            MilestoneStatus.PAID, EnumSet.of(MilestoneStatus.COMPLETED),
            MilestoneStatus.DISPUTED, EnumSet.of(MilestoneStatus.APPROVED, MilestoneStatus.REJECTED),
            MilestoneStatus.REJECTED, EnumSet.of(MilestoneStatus.IN_PROGRESS, MilestoneStatus.CANCELED),
            MilestoneStatus.CANCELED, EnumSet.noneOf(MilestoneStatus.class),
            MilestoneStatus.COMPLETED, EnumSet.noneOf(MilestoneStatus.class)
    );

    public MilestoneStatusStateMachine() {
        super(ALLOWED_TRANSITIONS);
    }
}
