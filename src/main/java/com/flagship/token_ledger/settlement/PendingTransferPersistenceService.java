package com.flagship.token_ledger.settlement;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges {@link PendingTransfer} and its JPA entity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PendingTransferPersistenceService {

    private final PendingTransferRepository repository;

    @Transactional
    public PendingTransfer save(PendingTransfer transfer) {
        PendingTransferEntity saved = repository.save(PendingTransferEntity.fromDomain(transfer));
        log.debug("Saved pending transfer {} in {} status", saved.getId(), saved.getStatus());
        return saved.toDomain();
    }

    @Transactional
    public PendingTransfer update(PendingTransfer transfer) {
        PendingTransferEntity existing = repository.findById(transfer.getId())
            .orElseThrow(() -> new IllegalArgumentException("Pending transfer not found: " + transfer.getId()));
        existing.updateFromDomain(transfer);
        PendingTransferEntity updated = repository.save(existing);
        log.debug("Updated pending transfer {} to {} status", updated.getId(), updated.getStatus());
        return updated.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<PendingTransfer> findById(UUID id) {
        return repository.findById(id).map(PendingTransferEntity::toDomain);
    }

    /**
     * Loads a transfer with its row locked until the surrounding transaction commits.
     */
    @Transactional
    public Optional<PendingTransfer> findByIdForUpdate(UUID id) {
        return repository.findByIdForUpdate(id).map(PendingTransferEntity::toDomain);
    }

    /**
     * Takes the settlement lease for {@code lease}. Fails for unknown or
     * terminal transfers and while another worker's lease is unexpired.
     */
    @Transactional
    public boolean claim(UUID id, Duration lease) {
        Instant now = Instant.now();
        boolean claimed = repository.claim(id, now, now.plus(lease)) == 1;
        if (!claimed) {
            log.debug("Pending transfer {} is terminal or claimed by another worker", id);
        }
        return claimed;
    }

    @Transactional
    public void release(UUID id) {
        repository.release(id);
    }

    /**
     * Oldest transfers first, at most {@code limit}.
     */
    @Transactional(readOnly = true)
    public List<PendingTransfer> findByStatus(PendingTransferStatus status, int limit) {
        return repository.findByStatusOrderByCreatedAtAsc(status, PageRequest.of(0, limit))
            .stream()
            .map(PendingTransferEntity::toDomain)
            .toList();
    }

    /**
     * Transfers that are not yet terminal.
     */
    @Transactional(readOnly = true)
    public long countOpen() {
        return repository.countByStatusIn(EnumSet.of(PendingTransferStatus.STARTED, PendingTransferStatus.NOTIFIED));
    }
}
