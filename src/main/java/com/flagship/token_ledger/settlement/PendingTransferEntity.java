package com.flagship.token_ledger.settlement;

import com.flagship.token_ledger.approval.Approval;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JPA entity for a pending transfer and its legs.
 *
 * No setters: the entity is created from the domain object and afterwards
 * only takes the mutable parts (status, outcome, per-leg results) from it.
 */
@Entity
@Table(
    name = "pending_transfers",
    indexes = @Index(name = "idx_pending_transfers_status", columnList = "status, created_at")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PendingTransferEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "sender_id", nullable = false, updatable = false)
    private String senderId;

    @Column(name = "receiver_id", nullable = false, updatable = false)
    private String receiverId;

    @Column(name = "memo", updatable = false, columnDefinition = "TEXT")
    private String memo;

    @Column(name = "message", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PendingTransferStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", length = 16)
    private NotificationOutcome.Kind outcome;

    @Column(name = "outcome_detail", columnDefinition = "TEXT")
    private String outcomeDetail;

    @ElementCollection
    @CollectionTable(name = "pending_transfer_legs", joinColumns = @JoinColumn(name = "pending_transfer_id"))
    @OrderColumn(name = "leg_index")
    private List<TransferLegEmbeddable> legs = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "pending_transfer_approvals", joinColumns = @JoinColumn(name = "pending_transfer_id"))
    @OrderColumn(name = "approval_index")
    private List<PriorApprovalEmbeddable> priorApprovals = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static PendingTransferEntity fromDomain(PendingTransfer transfer) {
        PendingTransferEntity entity = new PendingTransferEntity();
        entity.id = transfer.getId();
        entity.senderId = transfer.getSenderId();
        entity.receiverId = transfer.getReceiverId();
        entity.memo = transfer.getMemo();
        entity.message = transfer.getMessage();
        entity.createdAt = transfer.getCreatedAt();
        entity.updatedAt = transfer.getUpdatedAt();

        List<TransferLeg> legs = transfer.getLegs();
        for (int i = 0; i < legs.size(); i++) {
            TransferLeg leg = legs.get(i);
            entity.legs.add(new TransferLegEmbeddable(
                leg.getTokenId(), leg.getPreviousOwnerId(), leg.getAmount(), null, null, null));
            for (Map.Entry<String, Approval> approval : leg.getPriorApprovals().entrySet()) {
                entity.priorApprovals.add(new PriorApprovalEmbeddable(
                    i, approval.getKey(), approval.getValue().getApprovalId(), approval.getValue().getCeiling()));
            }
        }
        entity.updateFromDomain(transfer);
        return entity;
    }

    /**
     * Copies status, outcome and per-leg results. Everything else is immutable.
     */
    void updateFromDomain(PendingTransfer transfer) {
        this.status = transfer.getStatus();
        this.outcome = transfer.getOutcome();
        this.outcomeDetail = transfer.getOutcomeDetail();

        List<TransferLeg> domainLegs = transfer.getLegs();
        for (int i = 0; i < legs.size(); i++) {
            TransferLegEmbeddable stored = legs.get(i);
            TransferLeg leg = domainLegs.get(i);
            legs.set(i, new TransferLegEmbeddable(
                stored.getTokenId(),
                stored.getPreviousOwnerId(),
                stored.getAmount(),
                leg.getUnusedAmount(),
                leg.getRefundedAmount(),
                leg.getForfeitedAmount()
            ));
        }
    }

    public PendingTransfer toDomain() {
        List<TransferLeg> domainLegs = new ArrayList<>(legs.size());
        for (int i = 0; i < legs.size(); i++) {
            TransferLegEmbeddable leg = legs.get(i);
            domainLegs.add(new TransferLeg(
                leg.getTokenId(),
                leg.getPreviousOwnerId(),
                leg.getAmount(),
                priorApprovalsOf(i),
                leg.getUnusedAmount(),
                leg.getRefundedAmount(),
                leg.getForfeitedAmount()
            ));
        }
        return new PendingTransfer(
            id,
            senderId,
            receiverId,
            List.copyOf(domainLegs),
            memo,
            message,
            status,
            outcome,
            outcomeDetail,
            createdAt,
            updatedAt
        );
    }

    private Map<String, Approval> priorApprovalsOf(int legIndex) {
        Map<String, Approval> approvals = new LinkedHashMap<>();
        for (PriorApprovalEmbeddable approval : priorApprovals) {
            if (approval.getLegIndex() == legIndex) {
                approvals.put(approval.getSpenderId(), new Approval(approval.getApprovalId(), approval.getCeiling()));
            }
        }
        return approvals;
    }
}
