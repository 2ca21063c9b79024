package com.nosota.mescrow.service;

import com.nosota.mescrow.config.LedgerProperties;
import com.nosota.mescrow.dto.LedgerReceipt;
import com.nosota.mescrow.error.DomainException;
import com.nosota.mescrow.error.IdempotencyInFlightException;
import com.nosota.mescrow.error.LedgerValidationException;
import com.nosota.mescrow.model.IdempotencyRecord;
import com.nosota.mescrow.repository.IdempotencyRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Idempotency-Key handling for money-moving operations.
 *
 * <p>The key is claimed before the guarded write, in the same transaction as the ledger rows:
 * <ul>
 *   <li>unseen key - the key is inserted, the operation runs and the key is completed with its result</li>
 *   <li>same key, same fingerprint - the operation is skipped and reported as replayed</li>
 *   <li>same key, different fingerprint - rejected with IDEMPOTENCY_KEY_REUSED</li>
 * </ul>
 *
 * <p>A concurrent request with the same key blocks on the key's unique index until the first
 * transaction ends. If that one committed, the insert fails and the request is rejected with a
 * retryable 409 before touching any balance; the retry is answered as a replay.
 *
 * <p>Requests without a key are not deduplicated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotencyService {

    private final IdempotencyRecordRepository idempotencyRecordRepository;
    private final LedgerProperties ledgerProperties;

    /**
     * Builds the fingerprint {@code operation|part1|part2|...} of a request.
     */
    public static String fingerprint(String operation, Object... parts) {
        return operation + "|" + Arrays.stream(parts)
                .map(String::valueOf)
                .collect(Collectors.joining("|"));
    }

    /**
     * Runs {@code write} unless {@code idempotencyKey} was already processed.
     * Must be called inside the transaction of the guarded operation.
     *
     * @param idempotencyKey Key from the request, may be null
     * @param operation      Operation name stored with the key
     * @param fingerprint    See {@link #fingerprint(String, Object...)}
     * @param write          The guarded ledger write
     * @return receipt of the write, or of the original write when replayed
     */
    @Transactional(propagation = Propagation.MANDATORY, rollbackFor = Exception.class)
    public LedgerReceipt execute(String idempotencyKey, String operation, String fingerprint, LedgerWrite write)
            throws DomainException {
        Optional<IdempotencyRecord> replay = findReplay(idempotencyKey, fingerprint);
        if (replay.isPresent()) {
            log.info("Replaying {} for Idempotency-Key {}: resultId={}",
                    operation, idempotencyKey, replay.get().getResultId());
            return LedgerReceipt.replayed(replay.get().getResultId());
        }

        Optional<IdempotencyRecord> claim = claim(idempotencyKey, operation, fingerprint);
        UUID resultId = write.apply();
        if (claim.isPresent()) {
            IdempotencyRecord record = claim.get();
            record.setResultId(resultId);
            idempotencyRecordRepository.save(record);
        }
        return LedgerReceipt.written(resultId);
    }

    /**
     * Looks up a processed key.
     *
     * @return the record when the key was processed with the same fingerprint within the retention
     * period, empty when the key is null, unseen or expired
     * @throws LedgerValidationException if the key was processed with a different fingerprint
     */
    @Transactional(propagation = Propagation.MANDATORY, rollbackFor = Exception.class)
    public Optional<IdempotencyRecord> findReplay(String idempotencyKey, String fingerprint)
            throws LedgerValidationException {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return Optional.empty();
        }

        Optional<IdempotencyRecord> existing = idempotencyRecordRepository.findByIdempotencyKey(idempotencyKey);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        IdempotencyRecord record = existing.get();
        LocalDateTime expiry = LocalDateTime.now().minus(ledgerProperties.getIdempotencyRetention());
        if (record.getCreatedAt().isBefore(expiry)) {
            log.debug("Idempotency-Key {} expired (created {}), processing as new", idempotencyKey,
                    record.getCreatedAt());
            idempotencyRecordRepository.delete(record);
            idempotencyRecordRepository.flush();
            return Optional.empty();
        }

        if (!record.getFingerprint().equals(fingerprint)) {
            throw new LedgerValidationException("IDEMPOTENCY_KEY_REUSED",
                    "Idempotency-Key " + idempotencyKey + " was already used for a different request");
        }
        return Optional.of(record);
    }

    /**
     * Inserts the key before the guarded write runs. Its result is filled in afterwards.
     *
     * @return the claimed record, empty when the key is null
     * @throws IdempotencyInFlightException if a concurrent request claimed the same key first
     */
    @Transactional(propagation = Propagation.MANDATORY, rollbackFor = Exception.class)
    public Optional<IdempotencyRecord> claim(String idempotencyKey, String operation, String fingerprint)
            throws IdempotencyInFlightException {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return Optional.empty();
        }

        try {
            return Optional.of(idempotencyRecordRepository.saveAndFlush(
                    new IdempotencyRecord(null, idempotencyKey, operation, fingerprint, null, null)));
        } catch (DataIntegrityViolationException e) {
            log.warn("Idempotency-Key {} was claimed by a concurrent {} request", idempotencyKey, operation);
            throw new IdempotencyInFlightException(idempotencyKey, e);
        }
    }
}
