package com.nosota.mescrow.repository;

import com.nosota.mescrow.model.Wallet;
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
public interface WalletRepository extends JpaRepository<Wallet, UUID> {

    Optional<Wallet> findByUserId(UUID userId);

    /**
     * Retrieves the {@link Wallet} of the given user and locks it for update.
     * <p>
     * Every balance check and the balance change that follows it happen under this lock,
     * so two concurrent debits of the same wallet are serialized and cannot both pass the check.
     * </p>
     * <p>
     * The lock wait is bounded; when it expires the caller gets a lock timeout failure
     * instead of blocking until the transaction timeout.
     * </p>
     *
     * @param userId ID of the wallet owner
     * @return the wallet, locked for the rest of the transaction
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000")})
    @Query("SELECT w FROM Wallet w WHERE w.userId = :userId")
    Optional<Wallet> findByUserIdForUpdate(@Param("userId") UUID userId);
}
