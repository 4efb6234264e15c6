package com.flagship.settlement_engine.marketplace;

import com.flagship.settlement_engine.host.EngineHost;
import com.flagship.settlement_engine.ledger.dto.WithdrawalResponse;
import com.flagship.settlement_engine.marketplace.dto.ApprovalRequest;
import com.flagship.settlement_engine.marketplace.dto.AssetResponse;
import com.flagship.settlement_engine.marketplace.dto.HolderResponse;
import com.flagship.settlement_engine.marketplace.dto.ListItemRequest;
import com.flagship.settlement_engine.marketplace.dto.ListingResponse;
import com.flagship.settlement_engine.marketplace.dto.MarketplaceResponse;
import com.flagship.settlement_engine.marketplace.dto.MintRequest;
import com.flagship.settlement_engine.marketplace.dto.OperatorApprovalRequest;
import com.flagship.settlement_engine.marketplace.dto.PlatformFeeRequest;
import com.flagship.settlement_engine.marketplace.dto.PurchaseRequest;
import com.flagship.settlement_engine.marketplace.dto.SaleResponse;
import com.flagship.settlement_engine.marketplace.dto.TransferRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.Map;

import static com.flagship.settlement_engine.observability.CorrelationContext.CALLER_HEADER;

@RestController
@RequestMapping("/api/marketplace")
@RequiredArgsConstructor
@Slf4j
public class MarketplaceController {

    private final MarketplaceService marketplaceService;
    private final AssetRegistry assetRegistry;
    private final EngineHost host;

    @GetMapping
    public ResponseEntity<MarketplaceResponse> getMarketplace() {
        return ResponseEntity.ok(new MarketplaceResponse(
            marketplaceService.getOwner(),
            marketplaceService.getPlatformFeeBps(),
            marketplaceService.getCreatorRoyaltyBps(),
            assetRegistry.totalSupply(),
            marketplaceService.getActiveListingCount()));
    }

    @PostMapping("/tokens")
    public ResponseEntity<AssetResponse> mint(@RequestHeader(CALLER_HEADER) String caller,
                                              @Valid @RequestBody MintRequest request) {
        log.info("Received mint request: creator={}", caller);
        Asset asset = host.call(() -> marketplaceService.mint(caller, request.getTokenUri()));
        return ResponseEntity.status(HttpStatus.CREATED).body(AssetResponse.from(asset));
    }

    @GetMapping("/tokens/{id}")
    public ResponseEntity<AssetResponse> getToken(@PathVariable("id") long tokenId) {
        return ResponseEntity.ok(AssetResponse.from(assetRegistry.getAsset(tokenId)));
    }

    @PostMapping("/tokens/{id}/transfer")
    public ResponseEntity<AssetResponse> transferFrom(@RequestHeader(CALLER_HEADER) String caller,
                                                      @PathVariable("id") long tokenId,
                                                      @RequestBody TransferRequest request) {
        Asset asset = host.call(() ->
            marketplaceService.transferFrom(caller, request.getFrom(), request.getTo(), tokenId));
        return ResponseEntity.ok(AssetResponse.from(asset));
    }

    @PostMapping("/tokens/{id}/approval")
    public ResponseEntity<AssetResponse> approve(@RequestHeader(CALLER_HEADER) String caller,
                                                 @PathVariable("id") long tokenId,
                                                 @RequestBody ApprovalRequest request) {
        Asset asset = host.call(() -> marketplaceService.approve(caller, request.getTo(), tokenId));
        return ResponseEntity.ok(AssetResponse.from(asset));
    }

    @PutMapping("/operators/{operator}")
    public ResponseEntity<Map<String, Object>> setApprovalForAll(@RequestHeader(CALLER_HEADER) String caller,
                                                                 @PathVariable("operator") String operator,
                                                                 @Valid @RequestBody OperatorApprovalRequest request) {
        host.run(() -> marketplaceService.setApprovalForAll(caller, operator, request.getApproved()));
        return ResponseEntity.ok(Map.of("owner", caller, "operator", operator, "approved", request.getApproved()));
    }

    @GetMapping("/accounts/{account}")
    public ResponseEntity<HolderResponse> getHolder(@PathVariable("account") String account) {
        return ResponseEntity.ok(new HolderResponse(account,
            assetRegistry.balanceOf(account),
            marketplaceService.getPendingWithdrawal(account)));
    }

    @PostMapping("/listings/{token}")
    public ResponseEntity<ListingResponse> listItem(@RequestHeader(CALLER_HEADER) String caller,
                                                    @PathVariable("token") long tokenId,
                                                    @RequestBody ListItemRequest request) {
        Listing listing = host.call(() -> marketplaceService.listItem(caller, tokenId, request.getPrice()));
        return ResponseEntity.status(HttpStatus.CREATED).body(ListingResponse.from(listing));
    }

    @GetMapping("/listings/{token}")
    public ResponseEntity<ListingResponse> getListing(@PathVariable("token") long tokenId) {
        return ResponseEntity.ok(ListingResponse.from(marketplaceService.getListing(tokenId)));
    }

    @DeleteMapping("/listings/{token}")
    public ResponseEntity<ListingResponse> cancelListing(@RequestHeader(CALLER_HEADER) String caller,
                                                         @PathVariable("token") long tokenId) {
        Listing listing = host.call(() -> marketplaceService.cancelListing(caller, tokenId));
        return ResponseEntity.ok(ListingResponse.from(listing));
    }

    @PostMapping("/listings/{token}/purchase")
    public ResponseEntity<SaleResponse> buyItem(@RequestHeader(CALLER_HEADER) String caller,
                                                @PathVariable("token") long tokenId,
                                                @Valid @RequestBody PurchaseRequest request) {
        log.info("Received purchase request: buyer={}, tokenId={}, payment={}", caller, tokenId, request.getPayment());
        Sale sale = host.call(() -> marketplaceService.buyItem(caller, tokenId, request.getPayment()));
        return ResponseEntity.ok(SaleResponse.from(sale));
    }

    @PostMapping("/withdrawals")
    public ResponseEntity<WithdrawalResponse> withdraw(@RequestHeader(CALLER_HEADER) String caller) {
        BigDecimal amount = host.call(() -> marketplaceService.withdraw(caller));
        return ResponseEntity.ok(new WithdrawalResponse(caller, amount));
    }

    @PutMapping("/platform-fee")
    public ResponseEntity<Map<String, Object>> updatePlatformFee(@RequestHeader(CALLER_HEADER) String caller,
                                                                 @Valid @RequestBody PlatformFeeRequest request) {
        int feeBps = host.call(() -> marketplaceService.updatePlatformFee(caller, request.getFeeBps()));
        return ResponseEntity.ok(Map.of("platform_fee_bps", feeBps));
    }
}
