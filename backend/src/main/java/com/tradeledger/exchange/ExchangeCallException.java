package com.tradeledger.exchange;

/**
 * Failure of a single exchange call. Transient failures (429, 5xx, connection errors, timeouts, local rate
 * limiter) are retried by {@link HttpExchangeFillSource}; others surface immediately.
 */
public class ExchangeCallException extends RuntimeException {

    private final boolean transientFailure;

    public ExchangeCallException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public static ExchangeCallException transientFailure(String message, Throwable cause) {
        return new ExchangeCallException(message, true, cause);
    }

    public static ExchangeCallException permanentFailure(String message, Throwable cause) {
        return new ExchangeCallException(message, false, cause);
    }

    /** Classifies an HTTP error status. 404 is handled before this as a definitive not-found. */
    public static ExchangeCallException fromStatus(int status, Throwable cause) {
        boolean retryable = status == 429 || status >= 500;
        return new ExchangeCallException("Exchange responded HTTP " + status, retryable, cause);
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
