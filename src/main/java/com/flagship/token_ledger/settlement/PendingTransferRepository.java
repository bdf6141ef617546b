package com.flagship.token_ledger.settlement;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PendingTransferRepository extends JpaRepository<PendingTransferEntity, UUID> {

    List<PendingTransferEntity> findByStatusOrderByCreatedAtAsc(PendingTransferStatus status, Pageable pageable);

    long countByStatusIn(Collection<PendingTransferStatus> statuses);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PendingTransferEntity p WHERE p.id = :id")
    Optional<PendingTransferEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Takes the settlement lease on an open transfer unless another worker holds an unexpired one.
     *
     * @return 1 if the lease was taken, 0 otherwise
     */
    @Modifying
    @Query(value = "UPDATE pending_transfers SET claimed_until = :until "
        + "WHERE id = :id AND status IN ('STARTED', 'NOTIFIED') "
        + "AND (claimed_until IS NULL OR claimed_until < :now)", nativeQuery = true)
    int claim(@Param("id") UUID id, @Param("now") Instant now, @Param("until") Instant until);

    @Modifying
    @Query(value = "UPDATE pending_transfers SET claimed_until = NULL WHERE id = :id", nativeQuery = true)
    int release(@Param("id") UUID id);
}
