package com.flagship.settlement_engine.marketplace;

import com.flagship.settlement_engine.exception.FailureKind;
import com.flagship.settlement_engine.exception.SettlementException;
import com.flagship.settlement_engine.guard.AccessGuard;
import com.flagship.settlement_engine.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Ownership records for marketplace items: minting, transfers and approvals.
 *
 * Mutations join the marketplace call's transaction and never run on their own. Listing
 * bookkeeping is the caller's concern.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AssetRegistry {

    private final AssetRepository assetRepository;
    private final OperatorApprovalRepository operatorApprovalRepository;
    private final OutboxService outboxService;
    private final Clock clock;

    /**
     * Creates a token owned by its creator. Token ids are sequential from 1.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Asset mint(String creator, String tokenUri) {
        AccessGuard.requireAccount(creator, "creator");
        if (tokenUri == null || tokenUri.isBlank()) {
            throw new IllegalArgumentException("Token URI is required");
        }

        long tokenId = assetRepository.count() + 1;
        AssetEntity asset = assetRepository.save(AssetEntity.mint(tokenId, creator, tokenUri, clock.instant()));

        outboxService.saveEvent(new MarketplaceEvents.Transfer(null, creator, tokenId));
        outboxService.saveEvent(new MarketplaceEvents.ItemMinted(tokenId, creator, tokenUri));
        log.info("Token minted: tokenId={}, creator={}", tokenId, creator);
        return asset.toDomain();
    }

    /**
     * Transfer on behalf of the owner, an approved account or an operator.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Asset transferFrom(String caller, String from, String to, long tokenId) {
        AssetEntity asset = load(tokenId);
        if (!isOwnerOrApproved(caller, asset)) {
            throw SettlementException.of(FailureKind.NOT_OWNER_OR_APPROVED, "caller", caller, "tokenId", tokenId);
        }
        if (from == null || !from.equals(asset.getOwnerId())) {
            throw SettlementException.of(FailureKind.NOT_OWNER_OR_APPROVED, "from", from, "tokenId", tokenId);
        }
        AccessGuard.requireAccount(to, "to");
        return move(asset, to);
    }

    /**
     * Unchecked ownership move for settlement of a sale.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Asset transfer(long tokenId, String to) {
        return move(load(tokenId), to);
    }

    /**
     * Approves one account for one token; {@code null} clears the approval.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Asset approve(String caller, String to, long tokenId) {
        AssetEntity asset = load(tokenId);
        String owner = asset.getOwnerId();
        if (caller == null || !(caller.equals(owner) || isApprovedForAll(owner, caller))) {
            throw SettlementException.of(FailureKind.NOT_OWNER_OR_APPROVED, "caller", caller, "tokenId", tokenId);
        }

        asset.approve(to);
        assetRepository.save(asset);

        outboxService.saveEvent(new MarketplaceEvents.Approval(owner, to, tokenId));
        log.debug("Token approval: tokenId={}, owner={}, approved={}", tokenId, owner, to);
        return asset.toDomain();
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void setApprovalForAll(String owner, String operator, boolean approved) {
        AccessGuard.requireAccount(owner, "owner");
        AccessGuard.requireAccount(operator, "operator");

        if (approved) {
            if (!operatorApprovalRepository.existsByOwnerIdAndOperatorId(owner, operator)) {
                operatorApprovalRepository.save(OperatorApprovalEntity.grant(owner, operator));
            }
        } else {
            operatorApprovalRepository.findByOwnerIdAndOperatorId(owner, operator)
                .ifPresent(operatorApprovalRepository::delete);
        }

        outboxService.saveEvent(new MarketplaceEvents.ApprovalForAll(owner, operator, approved));
        log.info("Operator approval: owner={}, operator={}, approved={}", owner, operator, approved);
    }

    public Asset getAsset(long tokenId) {
        return load(tokenId).toDomain();
    }

    public String ownerOf(long tokenId) {
        return getAsset(tokenId).getOwner();
    }

    public String tokenUri(long tokenId) {
        return getAsset(tokenId).getTokenUri();
    }

    public String creatorOf(long tokenId) {
        return getAsset(tokenId).getCreator();
    }

    public String getApproved(long tokenId) {
        return getAsset(tokenId).getApproved();
    }

    public long balanceOf(String owner) {
        AccessGuard.requireAccount(owner, "owner");
        return assetRepository.countByOwnerId(owner);
    }

    public long totalSupply() {
        return assetRepository.count();
    }

    public boolean isApprovedForAll(String owner, String operator) {
        return owner != null && operator != null
            && operatorApprovalRepository.existsByOwnerIdAndOperatorId(owner, operator);
    }

    private Asset move(AssetEntity asset, String to) {
        String from = asset.getOwnerId();
        asset.transferTo(to);
        assetRepository.save(asset);

        outboxService.saveEvent(new MarketplaceEvents.Transfer(from, to, asset.getTokenId()));
        log.info("Token transferred: tokenId={}, from={}, to={}", asset.getTokenId(), from, to);
        return asset.toDomain();
    }

    private boolean isOwnerOrApproved(String caller, AssetEntity asset) {
        if (caller == null) {
            return false;
        }
        return caller.equals(asset.getOwnerId())
            || caller.equals(asset.getApprovedId())
            || isApprovedForAll(asset.getOwnerId(), caller);
    }

    private AssetEntity load(long tokenId) {
        return assetRepository.findById(tokenId)
            .orElseThrow(() -> SettlementException.of(FailureKind.TOKEN_DOES_NOT_EXIST, "tokenId", tokenId));
    }
}
