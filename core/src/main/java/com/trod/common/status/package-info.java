/**
 * Contains classes for status reporting between driver internals and the driver boundary.
 *
 * <ul>
 *   <li>{@link com.trod.common.status.StatusCode} - Enum of possible status codes, aligned with
 *       the gRPC canonical codes</li>
 *   <li>{@link com.trod.common.status.Status} - A status with an optional message and cause</li>
 *   <li>{@link com.trod.common.status.StatusOr} - Holds either a successful value or an error
 *       status</li>
 * </ul>
 *
 * <p>Validation failures of the mapping layer itself are exceptions (see {@code com.trod.errors});
 * each of them reports the {@link com.trod.common.status.StatusCode} that classifies it.
 */
package com.trod.common.status;
