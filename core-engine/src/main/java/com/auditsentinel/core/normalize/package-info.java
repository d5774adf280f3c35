/**
 * Event normalization: raw audit records of several upstream shapes into
 * one canonical event.
 */
package com.auditsentinel.core.normalize;
