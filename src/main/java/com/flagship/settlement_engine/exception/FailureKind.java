package com.flagship.settlement_engine.exception;

import lombok.Getter;

/**
 * Every way an engine call can fail.
 *
 * All failures are local validation failures: the call is aborted, its mutations are
 * discarded and nothing is retried. The kind and its arguments are the only information
 * surfaced to the caller.
 */
@Getter
public enum FailureKind {

    // Authorization
    UNAUTHORIZED(Category.AUTHORIZATION, "Unauthorized"),
    NOT_CHAIRPERSON(Category.AUTHORIZATION, "NotChairperson"),
    NOT_TOKEN_OWNER(Category.AUTHORIZATION, "NotTokenOwner"),
    NOT_CONTRACT_OWNER(Category.AUTHORIZATION, "NotContractOwner"),
    NOT_OWNER_OR_APPROVED(Category.AUTHORIZATION, "NotOwnerOrApproved"),

    // State
    INVALID_STATE(Category.STATE, "InvalidState"),
    ALREADY_VOTED(Category.STATE, "AlreadyVoted"),
    ALREADY_FINALIZED(Category.STATE, "AlreadyFinalized"),
    NOT_LISTED(Category.STATE, "NotListed"),
    ALREADY_LISTED(Category.STATE, "AlreadyListed"),
    VOTING_NOT_ACTIVE(Category.STATE, "VotingNotActive"),
    VOTING_STILL_ACTIVE(Category.STATE, "VotingStillActive"),
    VOTER_ALREADY_REGISTERED(Category.STATE, "VoterAlreadyRegistered"),
    VOTER_NOT_REGISTERED(Category.STATE, "VoterNotRegistered"),
    INVALID_PROPOSAL(Category.NOT_FOUND, "InvalidProposal"),
    ESCROW_NOT_FOUND(Category.NOT_FOUND, "EscrowNotFound"),
    BALLOT_NOT_FOUND(Category.NOT_FOUND, "BallotNotFound"),
    TOKEN_DOES_NOT_EXIST(Category.NOT_FOUND, "TokenDoesNotExist"),

    // Input
    INVALID_AMOUNT(Category.INPUT, "InvalidAmount"),
    INVALID_DEADLINE(Category.INPUT, "InvalidDeadline"),
    INVALID_TIME_RANGE(Category.INPUT, "InvalidTimeRange"),
    ZERO_ADDRESS(Category.INPUT, "ZeroAddress"),
    INSUFFICIENT_PAYMENT(Category.INPUT, "InsufficientPayment"),
    INSUFFICIENT_FUNDS(Category.INPUT, "InsufficientFunds"),
    INVALID_FEE(Category.INPUT, "InvalidFee"),
    PRICE_MUST_BE_ABOVE_ZERO(Category.INPUT, "PriceMustBeAboveZero"),

    // Integrity
    DELEGATION_LOOP_DETECTED(Category.INTEGRITY, "DelegationLoopDetected"),
    SELF_DELEGATION_NOT_ALLOWED(Category.INTEGRITY, "SelfDelegationNotAllowed"),
    DEADLINE_NOT_REACHED(Category.INTEGRITY, "DeadlineNotReached"),
    REENTRANCY_DETECTED(Category.INTEGRITY, "ReentrancyDetected"),
    NO_FUNDS(Category.INTEGRITY, "NoPendingWithdrawals"),

    // Transfer
    TRANSFER_FAILED(Category.TRANSFER, "TransferFailed");

    private final Category category;
    private final String errorName;

    FailureKind(Category category, String errorName) {
        this.category = category;
        this.errorName = errorName;
    }

    public enum Category {
        AUTHORIZATION,
        STATE,
        NOT_FOUND,
        INPUT,
        INTEGRITY,
        TRANSFER
    }
}
