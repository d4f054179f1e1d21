package com.polysearch.search.engine;

import com.polysearch.search.provider.ProviderBinding;

/**
 * Settled result of one provider call. {@code value} is only meaningful when {@link #isSuccess()}.
 */
public record ProviderCallOutcome<T>(ProviderBinding binding, T value, Status status, double durationMs) {

    public enum Status {
        SUCCESS,
        TIMEOUT,
        ERROR
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
