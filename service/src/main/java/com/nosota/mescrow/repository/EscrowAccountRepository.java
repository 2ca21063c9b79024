package com.nosota.mescrow.repository;

import com.nosota.mescrow.model.EscrowAccount;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface EscrowAccountRepository extends JpaRepository<EscrowAccount, UUID> {

    Optional<EscrowAccount> findByContractId(UUID contractId);

    /**
     * Retrieves the escrow account of a contract and locks it for update.
     * <p>
     * Must be acquired before any wallet lock of the same operation.
     * </p>
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000")})
    @Query("SELECT e FROM EscrowAccount e WHERE e.contractId = :contractId")
    Optional<EscrowAccount> findByContractIdForUpdate(@Param("contractId") UUID contractId);
}
