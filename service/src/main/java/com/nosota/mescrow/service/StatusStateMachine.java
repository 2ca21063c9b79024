package com.nosota.mescrow.service;

import com.nosota.mescrow.error.InvalidStateTransitionException;

import java.util.Map;
import java.util.Set;

/**
 * Table-driven validation of status transitions.
 *
 * <p>Subclasses supply the full table: every status maps to the set of statuses it may move to.
 * A status mapped to an empty set is final. Staying in the same status is not a transition
 * and is rejected unless the table lists it.
 *
 * @param <S> status enum
 */
public abstract class StatusStateMachine<S extends Enum<S>> {

    private final Map<S, Set<S>> allowedTransitions;

    protected StatusStateMachine(Map<S, Set<S>> allowedTransitions) {
        this.allowedTransitions = allowedTransitions;
    }

    /**
     * Validates if a status transition is allowed.
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @return true if transition is allowed, false otherwise
     */
    public boolean isTransitionAllowed(S fromStatus, S toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }

        Set<S> allowedTargets = allowedTransitions.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * Validates if a status transition is allowed, throwing exception if not.
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @throws InvalidStateTransitionException if transition is not allowed
     */
    public void validateTransition(S fromStatus, S toStatus) throws InvalidStateTransitionException {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new InvalidStateTransitionException(fromStatus, toStatus);
        }
    }

    /**
     * Checks if a status is a final state (no further transitions allowed).
     */
    public boolean isFinalState(S status) {
        return getAllowedTransitions(status).isEmpty();
    }

    /**
     * Gets all allowed target statuses from a given status.
     *
     * @param fromStatus Current status
     * @return Set of allowed target statuses (empty if none allowed)
     */
    public Set<S> getAllowedTransitions(S fromStatus) {
        return allowedTransitions.getOrDefault(fromStatus, Set.of());
    }
}
