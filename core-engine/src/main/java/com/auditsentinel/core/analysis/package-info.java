/**
 * Entry point of the analysis engine: one batch of raw records in, one
 * {@link com.auditsentinel.core.model.AnalysisResult} out.
 */
package com.auditsentinel.core.analysis;
