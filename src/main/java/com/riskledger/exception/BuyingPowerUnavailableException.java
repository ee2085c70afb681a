package com.riskledger.exception;

/** The remote ledger did not return a usable buying-power figure. */
public class BuyingPowerUnavailableException extends BaseException {

    public BuyingPowerUnavailableException(String message) {
        super(ErrorCode.BUYING_POWER_UNAVAILABLE, message);
    }

    public BuyingPowerUnavailableException(String message, Throwable cause) {
        super(ErrorCode.BUYING_POWER_UNAVAILABLE, message, cause);
    }
}
