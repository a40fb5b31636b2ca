/**
 * Trailing-edge debouncing of trigger events into per-alert batches.
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.batch;
