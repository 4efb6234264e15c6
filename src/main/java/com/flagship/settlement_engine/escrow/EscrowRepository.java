package com.flagship.settlement_engine.escrow;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface EscrowRepository extends JpaRepository<EscrowEntity, Long> {

    Optional<EscrowEntity> findByBuyerIdAndIdempotencyKey(String buyerId, String idempotencyKey);

    long countByState(EscrowState state);
}
