/**
 * The storage boundary. A {@link com.trod.driver.Driver} receives fully built statements and
 * answers with futures of {@link com.trod.query.ExecutionOutcome}s or raw rows.
 */
package com.trod.driver;
