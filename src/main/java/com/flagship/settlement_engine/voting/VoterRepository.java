package com.flagship.settlement_engine.voting;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface VoterRepository extends JpaRepository<VoterEntity, Long> {

    Optional<VoterEntity> findByBallotIdAndAccountId(Long ballotId, String accountId);

    boolean existsByBallotIdAndAccountId(Long ballotId, String accountId);
}
