/**
 * Analysis settings: YAML loading via SnakeYAML with fail-fast validation,
 * and the CSV denylists (applications, countries, user agents) loaded once
 * into immutable shared state.
 *
 * @since 1.0.0
 */
package com.auditsentinel.core.config;
