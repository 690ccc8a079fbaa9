package com.pricefeed.retry;

import com.pricefeed.error.FetchFailure;

/**
 * One attempt of a retryable operation.
 */
@FunctionalInterface
public interface RetryableCall<T> {

    T call() throws FetchFailure, InterruptedException;
}
