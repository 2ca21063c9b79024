package com.nosota.mescrow.model;

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
 * A user's wallet. One per user.
 * <p>
 * Balances are stored in minor units (cents). Both must stay non-negative; the database
 * enforces it with CHECK constraints in migration V1.
 * </p>
 * <p>
 * Balances change only through WalletLedgerService, and every change is paired with a
 * {@link WalletTransaction} row.
 * </p>
 */
@Entity
@Table(name = "wallet")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Wallet {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false, unique = true)
    private UUID userId;

    /**
     * Funds the user can spend, deposit into escrow or withdraw.
     */
    @Column(name = "available_balance", nullable = false)
    private long availableBalance;

    /**
     * Funds released from escrow that have not been moved to the available balance yet.
     */
    @Column(name = "pending_balance", nullable = false)
    private long pendingBalance;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency = "USD";

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public long getTotalBalance() {
        return availableBalance + pendingBalance;
    }
}
