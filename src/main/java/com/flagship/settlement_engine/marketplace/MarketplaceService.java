package com.flagship.settlement_engine.marketplace;

import com.flagship.settlement_engine.exception.FailureKind;
import com.flagship.settlement_engine.exception.SettlementException;
import com.flagship.settlement_engine.guard.AccessGuard;
import com.flagship.settlement_engine.guard.ReentrancyGuard;
import com.flagship.settlement_engine.host.EngineCallExecutor;
import com.flagship.settlement_engine.ledger.Amounts;
import com.flagship.settlement_engine.ledger.LedgerAccounts;
import com.flagship.settlement_engine.observability.SettlementMetrics;
import com.flagship.settlement_engine.outbox.OutboxService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;

/**
 * Marketplace engine: fixed-price listings settled through the shared ledger.
 *
 * A sale collects the buyer's payment into custody and splits the price into a platform
 * fee, a creator royalty (resales only) and the seller's proceeds, each credited as a
 * pending balance. Only the excess over the price is paid out directly, after the listing
 * and ownership have been updated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketplaceService {

    private final ReentrancyGuard guard = new ReentrancyGuard("marketplace");

    private final AssetRegistry assetRegistry;
    private final ListingRepository listingRepository;
    private final MarketplaceSettingsRepository settingsRepository;
    private final LedgerAccounts ledger;
    private final OutboxService outboxService;
    private final EngineCallExecutor executor;
    private final SettlementMetrics metrics;
    private final Clock clock;

    @Value("${settlement.marketplace.owner:marketplace-owner}")
    private String owner;

    @Value("${settlement.marketplace.platform-fee-bps:250}")
    private int defaultPlatformFeeBps;

    @Value("${settlement.marketplace.creator-royalty-bps:500}")
    private int creatorRoyaltyBps;

    @Value("${settlement.marketplace.max-platform-fee-bps:1000}")
    private int maxPlatformFeeBps;

    @PostConstruct
    void validateConfiguration() {
        requireValidFee(defaultPlatformFeeBps);
        log.info("Marketplace configured: owner={}, platformFeeBps={}, royaltyBps={}",
            owner, defaultPlatformFeeBps, creatorRoyaltyBps);
    }

    public Asset mint(String caller, String tokenUri) {
        return executor.execute(guard, "mint", () -> assetRegistry.mint(caller, tokenUri));
    }

    /**
     * Direct transfer outside a sale. An active listing for the token is withdrawn.
     */
    public Asset transferFrom(String caller, String from, String to, long tokenId) {
        return executor.execute(guard, "transferFrom", () -> {
            Asset asset = assetRegistry.transferFrom(caller, from, to, tokenId);
            listingRepository.findById(tokenId)
                .filter(ListingEntity::isActive)
                .ifPresent(listing -> {
                    listing.deactivate();
                    listingRepository.save(listing);
                    log.info("Listing cleared by transfer: tokenId={}, seller={}", tokenId, listing.getSellerId());
                });
            return asset;
        });
    }

    public Asset approve(String caller, String to, long tokenId) {
        return executor.execute(guard, "approve", () -> assetRegistry.approve(caller, to, tokenId));
    }

    public void setApprovalForAll(String caller, String operator, boolean approved) {
        executor.run(guard, "setApprovalForAll", () -> assetRegistry.setApprovalForAll(caller, operator, approved));
    }

    public Listing listItem(String caller, long tokenId, BigDecimal price) {
        return executor.execute(guard, "listItem", () -> {
            Asset asset = assetRegistry.getAsset(tokenId);
            if (caller == null || !caller.equals(asset.getOwner())) {
                throw SettlementException.of(FailureKind.NOT_TOKEN_OWNER, "caller", caller, "tokenId", tokenId);
            }
            if (price == null || price.signum() <= 0) {
                throw SettlementException.of(FailureKind.PRICE_MUST_BE_ABOVE_ZERO, "price", price);
            }
            BigDecimal listingPrice = Amounts.requirePositive(price);

            Optional<ListingEntity> existing = listingRepository.findById(tokenId);
            if (existing.isPresent() && existing.get().isActive()) {
                throw SettlementException.of(FailureKind.ALREADY_LISTED, "tokenId", tokenId);
            }

            ListingEntity listing;
            if (existing.isPresent()) {
                listing = existing.get();
                listing.relist(caller, listingPrice, clock.instant());
            } else {
                listing = ListingEntity.create(tokenId, caller, listingPrice, clock.instant());
            }
            listingRepository.save(listing);

            outboxService.saveEvent(new MarketplaceEvents.ItemListed(tokenId, caller, listingPrice));
            log.info("Item listed: tokenId={}, seller={}, price={}", tokenId, caller, listingPrice);
            return listing.toDomain();
        });
    }

    /**
     * Buys a listed item. {@code payment} is taken from the buyer's available balance;
     * anything above the price is returned at the end of the call.
     */
    public Sale buyItem(String buyer, long tokenId, BigDecimal payment) {
        return executor.execute(guard, "buyItem", () -> {
            AccessGuard.requireAccount(buyer, "buyer");
            ListingEntity listing = listingRepository.findById(tokenId)
                .filter(ListingEntity::isActive)
                .orElseThrow(() -> SettlementException.of(FailureKind.NOT_LISTED, "tokenId", tokenId));

            BigDecimal price = listing.getPrice();
            if (payment == null || payment.compareTo(price) < 0) {
                throw SettlementException.of(FailureKind.INSUFFICIENT_PAYMENT, "payment", payment, "price", price);
            }
            BigDecimal paid = Amounts.requirePositive(payment);

            String seller = listing.getSellerId();
            Asset asset = assetRegistry.getAsset(tokenId);
            FeeSplit split = FeeSplit.of(price, currentPlatformFeeBps(), creatorRoyaltyBps,
                !asset.isPrimarySale(seller));

            listing.deactivate();
            listingRepository.save(listing);
            assetRegistry.transfer(tokenId, buyer);

            String reference = "Token #" + tokenId;
            ledger.collect(buyer, paid, reference + " purchase");
            creditIfPositive(owner, split.getPlatformFee(), reference + " platform fee");
            creditIfPositive(asset.getCreator(), split.getRoyalty(), reference + " creator royalty");
            creditIfPositive(seller, split.getSellerProceeds(), reference + " sale proceeds");

            outboxService.saveEvent(new MarketplaceEvents.ItemSold(tokenId, seller, buyer, price,
                split.getPlatformFee(), split.getRoyalty()));

            BigDecimal excess = paid.subtract(price);
            if (excess.signum() > 0) {
                ledger.pay(buyer, excess, reference + " excess payment refund");
            }

            metrics.recordValueMoved("marketplace_sale", price);
            log.info("Item sold: tokenId={}, seller={}, buyer={}, price={}, fee={}, royalty={}, refunded={}",
                tokenId, seller, buyer, price, split.getPlatformFee(), split.getRoyalty(), excess);
            return new Sale(tokenId, seller, buyer, asset.getCreator(), split, excess);
        });
    }

    public Listing cancelListing(String caller, long tokenId) {
        return executor.execute(guard, "cancelListing", () -> {
            ListingEntity listing = listingRepository.findById(tokenId)
                .orElseThrow(() -> SettlementException.of(FailureKind.NOT_LISTED, "tokenId", tokenId));
            if (caller == null || !caller.equals(listing.getSellerId())) {
                throw SettlementException.of(FailureKind.NOT_TOKEN_OWNER, "caller", caller, "tokenId", tokenId);
            }
            if (!listing.isActive()) {
                throw SettlementException.of(FailureKind.NOT_LISTED, "tokenId", tokenId);
            }

            listing.deactivate();
            listingRepository.save(listing);

            outboxService.saveEvent(new MarketplaceEvents.ListingCanceled(tokenId, caller));
            log.info("Listing canceled: tokenId={}, seller={}", tokenId, caller);
            return listing.toDomain();
        });
    }

    /**
     * Pulls the caller's pending sale proceeds, royalties or fees.
     */
    public BigDecimal withdraw(String caller) {
        return executor.execute(guard, "withdraw", () -> {
            AccessGuard.requireAccount(caller, "caller");
            BigDecimal amount = ledger.withdraw(caller);

            outboxService.saveEvent(new MarketplaceEvents.Withdrawal(caller, amount));
            metrics.recordValueMoved("marketplace_withdrawal", amount);
            log.info("Marketplace withdrawal: account={}, amount={}", caller, amount);
            return amount;
        });
    }

    public int updatePlatformFee(String caller, int platformFeeBps) {
        return executor.execute(guard, "updatePlatformFee", () -> {
            AccessGuard.requireRole(caller, owner, FailureKind.NOT_CONTRACT_OWNER);
            requireValidFee(platformFeeBps);

            int previous = currentPlatformFeeBps();
            MarketplaceSettingsEntity settings = settingsRepository.findById(MarketplaceSettingsEntity.SETTINGS_ID)
                .orElseGet(() -> MarketplaceSettingsEntity.create(platformFeeBps, clock.instant()));
            settings.updateFee(platformFeeBps, clock.instant());
            settingsRepository.save(settings);

            outboxService.saveEvent(new MarketplaceEvents.PlatformFeeUpdated(previous, platformFeeBps));
            log.info("Platform fee updated: {} -> {} bps", previous, platformFeeBps);
            return platformFeeBps;
        });
    }

    /**
     * Listing for the token; a token that was never listed yields an inactive placeholder.
     */
    public Listing getListing(long tokenId) {
        return listingRepository.findById(tokenId)
            .map(ListingEntity::toDomain)
            .orElseGet(() -> Listing.unlisted(tokenId));
    }

    public int getPlatformFeeBps() {
        return currentPlatformFeeBps();
    }

    public int getCreatorRoyaltyBps() {
        return creatorRoyaltyBps;
    }

    public String getOwner() {
        return owner;
    }

    public long getActiveListingCount() {
        return listingRepository.countByActiveTrue();
    }

    public BigDecimal getPendingWithdrawal(String account) {
        return ledger.getPendingWithdrawal(account);
    }

    private int currentPlatformFeeBps() {
        return settingsRepository.findById(MarketplaceSettingsEntity.SETTINGS_ID)
            .map(MarketplaceSettingsEntity::getPlatformFeeBps)
            .orElse(defaultPlatformFeeBps);
    }

    private void requireValidFee(int platformFeeBps) {
        if (platformFeeBps < 0 || platformFeeBps > maxPlatformFeeBps) {
            throw SettlementException.of(FailureKind.INVALID_FEE,
                "feeBps", platformFeeBps, "maximum", maxPlatformFeeBps);
        }
    }

    private void creditIfPositive(String account, BigDecimal amount, String description) {
        if (amount.signum() > 0) {
            ledger.credit(account, amount, description);
        }
    }
}
