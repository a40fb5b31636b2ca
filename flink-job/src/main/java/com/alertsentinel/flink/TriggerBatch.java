package com.alertsentinel.flink;

import com.alertsentinel.core.model.TriggerEvent;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One delivery unit published to the trigger topic: every event debounced
 * for a ticker since its window last went quiet.
 *
 * <pre>
 * {"ticker":"SBER","flushedAt":"2026-03-02T10:30:00Z","size":2,"events":[...]}
 * </pre>
 *
 * @since 1.0.0
 */
public class TriggerBatch implements Serializable {

    private static final long serialVersionUID = 1L;

    private String ticker;
    private Instant flushedAt;
    private List<TriggerEvent> events = new ArrayList<>();

    public TriggerBatch() {
    }

    /**
     * @param ticker    batch key; must not be {@code null}
     * @param events    the events in arrival order; must not be empty
     * @param flushedAt when the batch was closed; must not be {@code null}
     * @return a new batch
     * @throws IllegalArgumentException if {@code events} is empty
     */
    public static TriggerBatch of(String ticker, List<TriggerEvent> events, Instant flushedAt) {
        Objects.requireNonNull(events, "events must not be null");
        if (events.isEmpty()) {
            throw new IllegalArgumentException("A trigger batch needs at least one event");
        }
        TriggerBatch batch = new TriggerBatch();
        batch.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
        batch.flushedAt = Objects.requireNonNull(flushedAt, "flushedAt must not be null");
        batch.events = new ArrayList<>(events);
        return batch;
    }

    public int getSize() {
        return events.size();
    }

    public String getTicker() {
        return ticker;
    }

    public void setTicker(String ticker) {
        this.ticker = ticker;
    }

    public Instant getFlushedAt() {
        return flushedAt;
    }

    public void setFlushedAt(Instant flushedAt) {
        this.flushedAt = flushedAt;
    }

    public List<TriggerEvent> getEvents() {
        return events;
    }

    public void setEvents(List<TriggerEvent> events) {
        this.events = events != null ? new ArrayList<>(events) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "TriggerBatch{ticker='" + ticker + "', size=" + events.size() + ", flushedAt=" + flushedAt + '}';
    }
}
