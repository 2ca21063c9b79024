package com.nosota.mescrow.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Processed Idempotency-Key.
 * <p>
 * Inserted before the ledger rows of the operation, in the same transaction, so a key is
 * recorded if and only if the operation committed.
 * </p>
 */
@Entity
@Table(name = "idempotency_record")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class IdempotencyRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "idempotency_key", nullable = false, unique = true)
    private String idempotencyKey;

    @Column(nullable = false, length = 50)
    private String operation;

    /**
     * {@code operation|user|subject|amount} of the first request that used the key.
     */
    @Column(nullable = false)
    private String fingerprint;

    /**
     * Ledger row written by the operation. Null only inside the claiming transaction.
     */
    @Column(name = "result_id")
    private UUID resultId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
