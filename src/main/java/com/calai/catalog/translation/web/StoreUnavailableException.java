package com.calai.catalog.translation.web;

/** DB 連不上 / 逾時：交易已 rollback，client 可以重試 */
public class StoreUnavailableException extends RuntimeException {

    private final int retryAfterSec;

    public StoreUnavailableException(Throwable cause, int retryAfterSec) {
        super("STORE_UNAVAILABLE", cause);
        this.retryAfterSec = retryAfterSec;
    }

    public int retryAfterSec() { return retryAfterSec; }
}
