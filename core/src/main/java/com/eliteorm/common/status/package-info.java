/**
 * Contains classes for error handling and status reporting.
 *
 * <p>Every decode, reconstruction and data access operation in this library reports its outcome
 * as a value rather than an exception:
 *
 * <ul>
 *   <li>{@link com.eliteorm.common.status.StatusCode} - Enum of possible status codes
 *   <li>{@link com.eliteorm.common.status.Status} - A status with an optional message and cause
 *   <li>{@link com.eliteorm.common.status.StatusOr} - Either a successful value or an error status
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 * StatusOr&lt;List&lt;Band&gt;&gt; bandsOr = dao.get();
 * if (bandsOr.isNotOk()) {
 *     Logger.error("Failed to load bands: {}", bandsOr.getStatus());
 *     return;
 * }
 * for (Band band : bandsOr.getValue()) {
 *     // ...
 * }
 * </pre>
 */
package com.eliteorm.common.status;
