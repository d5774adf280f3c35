/**
 * Task state persistence: the {@link com.auditsentinel.worker.store.JobStore}
 * contract the scheduler reports to, and its in-memory implementation.
 */
package com.auditsentinel.worker.store;
