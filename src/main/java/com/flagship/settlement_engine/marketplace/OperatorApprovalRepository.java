package com.flagship.settlement_engine.marketplace;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface OperatorApprovalRepository extends JpaRepository<OperatorApprovalEntity, Long> {

    Optional<OperatorApprovalEntity> findByOwnerIdAndOperatorId(String ownerId, String operatorId);

    boolean existsByOwnerIdAndOperatorId(String ownerId, String operatorId);
}
