package com.flagship.settlement_engine.marketplace;

import com.flagship.settlement_engine.outbox.EngineEvent;
import com.flagship.settlement_engine.outbox.EventAggregates;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Notifications emitted by the marketplace engine and its asset registry.
 */
public final class MarketplaceEvents {

    private MarketplaceEvents() {
    }

    interface AssetEvent extends EngineEvent {

        long getTokenId();

        @Override
        default String getAggregateType() {
            return EventAggregates.ASSET;
        }

        @Override
        default String getAggregateId() {
            return String.valueOf(getTokenId());
        }
    }

    interface ListingEvent extends EngineEvent {

        long getTokenId();

        @Override
        default String getAggregateType() {
            return EventAggregates.LISTING;
        }

        @Override
        default String getAggregateId() {
            return String.valueOf(getTokenId());
        }
    }

    /**
     * Ownership change. {@code from} is null on mint.
     */
    @Value
    public static class Transfer implements AssetEvent {
        String from;
        String to;
        long tokenId;
    }

    @Value
    public static class ItemMinted implements AssetEvent {
        long tokenId;
        String creator;
        String tokenUri;
    }

    @Value
    public static class Approval implements AssetEvent {
        String owner;
        String approved;
        long tokenId;
    }

    @Value
    public static class ApprovalForAll implements EngineEvent {
        String owner;
        String operator;
        boolean approved;

        @Override
        public String getAggregateType() {
            return EventAggregates.MARKETPLACE;
        }

        @Override
        public String getAggregateId() {
            return owner;
        }
    }

    @Value
    public static class ItemListed implements ListingEvent {
        long tokenId;
        String seller;
        BigDecimal price;
    }

    @Value
    public static class ItemSold implements ListingEvent {
        long tokenId;
        String seller;
        String buyer;
        BigDecimal price;
        BigDecimal platformFee;
        BigDecimal royalty;
    }

    @Value
    public static class ListingCanceled implements ListingEvent {
        long tokenId;
        String seller;
    }

    @Value
    public static class Withdrawal implements EngineEvent {
        String account;
        BigDecimal amount;

        @Override
        public String getAggregateType() {
            return EventAggregates.MARKETPLACE;
        }

        @Override
        public String getAggregateId() {
            return account;
        }
    }

    @Value
    public static class PlatformFeeUpdated implements EngineEvent {
        int previousFeeBps;
        int platformFeeBps;

        @Override
        public String getAggregateType() {
            return EventAggregates.MARKETPLACE;
        }

        @Override
        public String getAggregateId() {
            return "settings";
        }
    }
}
