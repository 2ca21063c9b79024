package com.nosota.mescrow.api.model;

/**
 * Lifecycle status of a milestone within a contract.
 *
 * <pre>
 *  PENDING ──► IN_PROGRESS ──► SUBMITTED ──► APPROVED ──► PAID ──► COMPLETED
 *     │             │             │  │           │
 *     ▼             ▼             │  └► DISPUTED ◄┘
 *  CANCELED ◄── REJECTED ◄────────┘      │
 *                  ▲                     │
 *                  └─────────────────────┘
 * </pre>
 */
public enum MilestoneStatus {
    PENDING,
    IN_PROGRESS,
    SUBMITTED,
    APPROVED,
    PAID,
    DISPUTED,
    CANCELED,
    COMPLETED,
    REJECTED
}
