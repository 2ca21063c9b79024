package com.nosota.mescrow.model;

import com.nosota.mescrow.api.model.EscrowAccountStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Funds held for a single contract.
 * <p>
 * {@code heldAmount = initialAmount + deposits - releases - refunds} at all times and never
 * goes below zero. Amounts are in minor units.
 * </p>
 */
@Entity
@Table(name = "escrow_account")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class EscrowAccount {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "contract_id", nullable = false, unique = true)
    private UUID contractId;

    @Column(name = "client_id", nullable = false)
    private UUID clientId;

    @Column(name = "freelancer_id", nullable = false)
    private UUID freelancerId;

    @Column(name = "held_amount", nullable = false)
    private long heldAmount;

    @Column(name = "initial_amount", nullable = false)
    private long initialAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EscrowAccountStatus status;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
