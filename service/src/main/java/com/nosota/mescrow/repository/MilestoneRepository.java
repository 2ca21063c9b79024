package com.nosota.mescrow.repository;

import com.nosota.mescrow.model.Milestone;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MilestoneRepository extends JpaRepository<Milestone, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000")})
    @Query("SELECT m FROM Milestone m WHERE m.id = :id")
    Optional<Milestone> findByIdForUpdate(@Param("id") UUID id);

    List<Milestone> findByContractIdOrderBySequenceAsc(UUID contractId);

    /**
     * Highest sequence number ever kept for the contract, 0 when it has no milestones.
     */
    @Query("SELECT COALESCE(MAX(m.sequence), 0) FROM Milestone m WHERE m.contractId = :contractId")
    int findMaxSequence(@Param("contractId") UUID contractId);
}
