package com.riskledger.exception;

import java.util.Map;

/** A fill event is malformed and cannot be applied to any ledger. */
public class FillValidationException extends BaseException {

    public FillValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public FillValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
