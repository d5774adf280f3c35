/**
 * Batch-level correlation across all events of one analysis run.
 */
package com.auditsentinel.core.correlation;
