package com.flagship.settlement_engine.outbox;

/**
 * Aggregate type names used on outbox rows and for topic routing.
 */
public final class EventAggregates {

    public static final String ESCROW = "Escrow";
    public static final String BALLOT = "Ballot";
    public static final String ASSET = "Asset";
    public static final String LISTING = "Listing";
    public static final String MARKETPLACE = "Marketplace";
    public static final String ACCOUNT = "Account";

    private EventAggregates() {
    }
}
