/**
 * YAML configuration for alert definitions and sentiment settings.
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.config;
