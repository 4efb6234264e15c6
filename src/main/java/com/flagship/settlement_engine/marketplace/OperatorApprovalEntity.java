package com.flagship.settlement_engine.marketplace;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Owner-wide approval: the operator may transfer and approve any token of the owner.
 * The row exists only while the approval is granted.
 */
@Entity
@Table(name = "operator_approvals")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OperatorApprovalEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private String ownerId;

    @Column(name = "operator_id", nullable = false, updatable = false)
    private String operatorId;

    static OperatorApprovalEntity grant(String ownerId, String operatorId) {
        OperatorApprovalEntity entity = new OperatorApprovalEntity();
        entity.ownerId = ownerId;
        entity.operatorId = operatorId;
        return entity;
    }
}
