package io.tradehybrid.brokerlink.domain.common;

/**
 * Structured outcome of an aggregator call. Aggregator methods return this instead of throwing.
 */
public record OperationResult<T>(
    boolean success,
    T data,
    String error
) {
    public static <T> OperationResult<T> success(T data) {
        return new OperationResult<>(true, data, null);
    }

    public static <T> OperationResult<T> failure(String error) {
        return new OperationResult<>(false, null, error);
    }

    public boolean isFailure() {
        return !success;
    }
}
