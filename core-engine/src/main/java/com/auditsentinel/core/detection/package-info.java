/**
 * Per-event detection rules.
 *
 * <p>
 * Every rule implements {@link com.auditsentinel.core.detection.DetectionRule}
 * and reports findings into the run's
 * {@link com.auditsentinel.core.detection.AnalysisContext}. Operation-name
 * rules share the table-driven
 * {@link com.auditsentinel.core.detection.PatternRule}; ATT&amp;CK mappings and
 * per-type advice come from
 * {@link com.auditsentinel.core.detection.MitreCatalog}.
 * </p>
 */
package com.auditsentinel.core.detection;
