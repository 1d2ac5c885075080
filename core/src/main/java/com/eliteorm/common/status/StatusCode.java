package com.eliteorm.common.status;

/**
 * Status codes for the outcome of an entity or store operation. The names follow the gRPC
 * canonical codes so that callers embedding this library in a service can pass them through.
 */
public enum StatusCode {
    OK,
    INVALID_ARGUMENT,        // caller supplied a value the operation cannot use
    NOT_FOUND,               // update or targeted delete touched no rows
    FAILED_PRECONDITION,     // stored row does not match the entity schema
    INTERNAL,                // store failure, cause attached
    DATA_LOSS;               // stored value cannot be decoded into its typed form

    /**
     * Returns whether this status code represents a successful operation.
     */
    public boolean isSuccess() {
        return this == OK;
    }

    /**
     * Returns whether this status code represents an error.
     */
    public boolean isError() {
        return !isSuccess();
    }
}
