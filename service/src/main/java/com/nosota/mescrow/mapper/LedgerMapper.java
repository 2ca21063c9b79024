package com.nosota.mescrow.mapper;

import com.nosota.mescrow.api.dto.EscrowTransactionDTO;
import com.nosota.mescrow.api.dto.WalletTransactionDTO;
import com.nosota.mescrow.api.response.ContractResponse;
import com.nosota.mescrow.api.response.EscrowStatusResponse;
import com.nosota.mescrow.api.response.MilestoneResponse;
import com.nosota.mescrow.api.response.WalletBalanceResponse;
import com.nosota.mescrow.model.Contract;
import com.nosota.mescrow.model.EscrowAccount;
import com.nosota.mescrow.model.EscrowTransaction;
import com.nosota.mescrow.model.Milestone;
import com.nosota.mescrow.model.Wallet;
import com.nosota.mescrow.model.WalletTransaction;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.math.BigDecimal;
import java.util.List;

/**
 * MapStruct mapper from ledger and lifecycle entities to API types.
 *
 * <p>Every {@code long} amount is converted from minor to major units by {@link #toMajor(long)}.
 */
@Mapper
public interface LedgerMapper {

    LedgerMapper INSTANCE = Mappers.getMapper(LedgerMapper.class);

    WalletBalanceResponse toBalanceResponse(Wallet wallet);

    WalletTransactionDTO toDTO(WalletTransaction transaction);

    List<WalletTransactionDTO> toWalletTransactionDTOList(List<WalletTransaction> transactions);

    EscrowStatusResponse toStatusResponse(EscrowAccount account);

    EscrowTransactionDTO toDTO(EscrowTransaction transaction);

    List<EscrowTransactionDTO> toEscrowTransactionDTOList(List<EscrowTransaction> transactions);

    ContractResponse toResponse(Contract contract);

    MilestoneResponse toResponse(Milestone milestone);

    List<MilestoneResponse> toMilestoneResponseList(List<Milestone> milestones);

    default BigDecimal toMajor(long minor) {
        return MinorUnits.toMajor(minor);
    }
}
