package com.nosota.mescrow.model;

import com.nosota.mescrow.api.model.EscrowTransactionType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Escrow ledger entry. Append-only.
 */
@Entity
@Table(name = "escrow_transaction")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class EscrowTransaction {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "escrow_account_id", nullable = false)
    private UUID escrowAccountId;

    @Column(nullable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EscrowTransactionType type;

    /**
     * Wallet the funds came from (DEPOSIT).
     */
    @Column(name = "source_wallet_id")
    private UUID sourceWalletId;

    /**
     * Wallet the funds went to (RELEASE, REFUND).
     */
    @Column(name = "destination_wallet_id")
    private UUID destinationWalletId;

    private String description;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
