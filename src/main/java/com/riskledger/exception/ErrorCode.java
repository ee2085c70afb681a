package com.riskledger.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    LEDGER_INCONSISTENCY("LEDGER_INCONSISTENCY", 409),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    BUYING_POWER_UNAVAILABLE("BUYING_POWER_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
