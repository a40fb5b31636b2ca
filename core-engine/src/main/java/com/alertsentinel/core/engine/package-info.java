/**
 * Orchestration: gate, per-type dispatch, trigger creation, lifecycle
 * mutations and hand-off to the batcher.
 *
 * <p>
 * {@link com.alertsentinel.core.engine.AlertProcessor} is the reusable
 * per-alert step shared by the in-process
 * {@link com.alertsentinel.core.engine.AlertEngine} and the streaming host.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.engine;
