/**
 * Risk scoring, severity summary and run-level recommendations.
 */
package com.auditsentinel.core.scoring;
