package com.flagship.settlement_engine.voting;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProposalRepository extends JpaRepository<ProposalEntity, Long> {

    Optional<ProposalEntity> findByBallotIdAndProposalIndex(Long ballotId, int proposalIndex);

    List<ProposalEntity> findByBallotIdOrderByProposalIndexAsc(Long ballotId);

    long countByBallotId(Long ballotId);
}
