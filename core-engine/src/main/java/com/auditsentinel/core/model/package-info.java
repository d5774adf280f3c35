/**
 * Domain model: raw audit records, normalized events and user identities,
 * findings with their MITRE mapping, run statistics and summaries, and the
 * alert payload derived from high-severity findings.
 *
 * @since 1.0.0
 */
package com.auditsentinel.core.model;
