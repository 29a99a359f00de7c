package com.trod.common.status;

/**
 * Status codes shared by validation failures raised by the mapping layer and by driver
 * implementations reporting storage-level outcomes. Names follow the gRPC canonical codes.
 */
public enum StatusCode {
    OK,
    INVALID_ARGUMENT,
    NOT_FOUND,
    ALREADY_EXISTS,
    FAILED_PRECONDITION,
    DATA_LOSS
}
