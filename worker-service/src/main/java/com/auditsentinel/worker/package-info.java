/**
 * Runnable worker service: environment configuration, the HTTP status and
 * submission server, and the {@code main} entry point that wires the
 * scheduler to the analysis pipeline.
 */
package com.auditsentinel.worker;
