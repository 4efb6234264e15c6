package com.flagship.settlement_engine.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("Failure categories map to HTTP statuses")
    void categoryStatuses() {
        assertEquals(HttpStatus.FORBIDDEN, GlobalExceptionHandler.statusFor(FailureKind.NOT_CHAIRPERSON));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(FailureKind.ALREADY_VOTED));
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.statusFor(FailureKind.ESCROW_NOT_FOUND));
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusFor(FailureKind.INSUFFICIENT_PAYMENT));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, GlobalExceptionHandler.statusFor(FailureKind.DELEGATION_LOOP_DETECTED));
        assertEquals(HttpStatus.BAD_GATEWAY, GlobalExceptionHandler.statusFor(FailureKind.TRANSFER_FAILED));
    }

    @ParameterizedTest
    @EnumSource(FailureKind.class)
    @DisplayName("Every failure kind has a status and a name")
    void everyKindMapped(FailureKind kind) {
        assertNotNull(GlobalExceptionHandler.statusFor(kind));
        assertFalse(kind.getErrorName().isBlank());
    }

    @Test
    @DisplayName("The body carries the error name and the failure arguments")
    void responseBody() {
        SettlementException e = SettlementException.of(FailureKind.INSUFFICIENT_PAYMENT,
            "tokenId", 4L, "price", "100");

        ResponseEntity<GlobalExceptionHandler.ErrorResponse> response = handler.handleSettlementFailure(e);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("InsufficientPayment", response.getBody().getError());
        assertEquals("4", response.getBody().getDetails().get("tokenId"));
        assertEquals("100", response.getBody().getDetails().get("price"));
    }
}
