package com.nosota.mescrow.api.model;

/**
 * Lifecycle status of a contract between a client and a freelancer.
 *
 * <p>Allowed transitions:
 * <pre>
 * PENDING        → ACTIVE, TERMINATED
 * ACTIVE         → REVIEW_PENDING, TERMINATED
 * REVIEW_PENDING → COMPLETED, DISPUTED, TERMINATED
 * DISPUTED       → TERMINATED
 * COMPLETED, TERMINATED are final
 * </pre>
 */
public enum ContractStatus {
    /**
     * PENDING: contract created by the client, work not started yet.
     */
    PENDING,

    /**
     * ACTIVE: work is in progress. Milestones can be managed.
     */
    ACTIVE,

    /**
     * REVIEW_PENDING: freelancer submitted the work, client has to review it.
     */
    REVIEW_PENDING,

    /**
     * COMPLETED: client accepted the work. Final state.
     */
    COMPLETED,

    /**
     * DISPUTED: client disputed the submitted work. Can only be terminated.
     */
    DISPUTED,

    /**
     * TERMINATED: contract ended early by either party. Final state.
     */
    TERMINATED
}
