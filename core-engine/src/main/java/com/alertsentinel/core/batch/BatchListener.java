package com.alertsentinel.core.batch;

import com.alertsentinel.core.model.TriggerEvent;

import java.util.List;

/**
 * Receives a debounced batch of trigger events.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface BatchListener {

    /**
     * @param key    batch key, normally the ticker
     * @param events the batched events in arrival order; never empty
     */
    void onReady(String key, List<TriggerEvent> events);
}
