package com.nosota.mescrow.repository;

import com.nosota.mescrow.api.model.EscrowTransactionType;
import com.nosota.mescrow.model.EscrowTransaction;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EscrowTransactionRepository extends JpaRepository<EscrowTransaction, UUID> {

    Page<EscrowTransaction> findByEscrowAccountIdOrderByCreatedAtDesc(UUID escrowAccountId, Pageable pageable);

    List<EscrowTransaction> findByEscrowAccountId(UUID escrowAccountId);

    /**
     * Sums the amounts of one transaction type for an escrow account.
     *
     * @return the sum in minor units, 0 when there are no rows
     */
    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM EscrowTransaction t " +
            "WHERE t.escrowAccountId = :escrowAccountId AND t.type = :type")
    long sumAmountByType(@Param("escrowAccountId") UUID escrowAccountId,
                         @Param("type") EscrowTransactionType type);
}
