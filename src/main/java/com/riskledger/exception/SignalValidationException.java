package com.riskledger.exception;

import java.util.Map;

/**
 * A trade signal is malformed (missing symbol or action, non-positive quantity or price).
 * Raised before any risk rule runs; the signal never reaches the rule chain.
 */
public class SignalValidationException extends BaseException {

    public SignalValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public SignalValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
