package com.nosota.mescrow.repository;

import com.nosota.mescrow.api.model.WalletTransactionType;
import com.nosota.mescrow.model.WalletTransaction;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface WalletTransactionRepository extends JpaRepository<WalletTransaction, UUID> {

    Page<WalletTransaction> findByWalletIdOrderByCreatedAtDesc(UUID walletId, Pageable pageable);

    List<WalletTransaction> findByWalletIdAndType(UUID walletId, WalletTransactionType type);

    long countByWalletId(UUID walletId);
}
