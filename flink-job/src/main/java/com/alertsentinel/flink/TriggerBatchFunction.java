package com.alertsentinel.flink;

import com.alertsentinel.core.model.TriggerEvent;
import org.apache.flink.api.common.state.ListState;
import org.apache.flink.api.common.state.ListStateDescriptor;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Trailing-edge debounce of trigger events per ticker on Flink
 * processing-time timers.
 *
 * <p>
 * Each batched arrival deletes the ticker's pending timer and registers a new
 * one {@code windowMinutes} ahead, taken from the arriving trigger. When a
 * timer fires, every accumulated event is emitted as one {@link TriggerBatch}
 * and the state is cleared. A trigger whose alert has batching disabled is
 * emitted at once as a single-event batch and does not touch the pending
 * queue.
 * </p>
 *
 * <p>
 * Timers are keyed state, so at most one is live per ticker and pending
 * events survive a restore from checkpoint.
 * </p>
 *
 * @since 1.0.0
 */
public class TriggerBatchFunction
        extends KeyedProcessFunction<String, PendingTrigger, TriggerBatch> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(TriggerBatchFunction.class);

    private transient ListState<TriggerEvent> pendingState;
    private transient ValueState<Long> timerState;

    @Override
    public void open(Configuration parameters) {
        pendingState = getRuntimeContext().getListState(
                new ListStateDescriptor<>("pending-triggers", TypeInformation.of(TriggerEvent.class)));
        timerState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("batch-timer", Long.class));
    }

    @Override
    public void processElement(PendingTrigger trigger,
            KeyedProcessFunction<String, PendingTrigger, TriggerBatch>.Context ctx,
            Collector<TriggerBatch> out) throws Exception {
        long now = ctx.timerService().currentProcessingTime();

        if (!trigger.isBatchingEnabled() || trigger.getWindowMinutes() <= 0) {
            out.collect(TriggerBatch.of(ctx.getCurrentKey(), List.of(trigger.getEvent()), Instant.ofEpochMilli(now)));
            return;
        }

        pendingState.add(trigger.getEvent());

        Long pendingTimer = timerState.value();
        if (pendingTimer != null) {
            ctx.timerService().deleteProcessingTimeTimer(pendingTimer);
        }
        long fireAt = now + Duration.ofMinutes(trigger.getWindowMinutes()).toMillis();
        ctx.timerService().registerProcessingTimeTimer(fireAt);
        timerState.update(fireAt);

        LOG.debug("Batch for {} re-armed, fires at {}", ctx.getCurrentKey(), Instant.ofEpochMilli(fireAt));
    }

    @Override
    public void onTimer(long timestamp,
            KeyedProcessFunction<String, PendingTrigger, TriggerBatch>.OnTimerContext ctx,
            Collector<TriggerBatch> out) throws Exception {
        Long pendingTimer = timerState.value();
        if (pendingTimer == null || pendingTimer != timestamp) {
            return;
        }

        List<TriggerEvent> events = new ArrayList<>();
        for (TriggerEvent event : pendingState.get()) {
            events.add(event);
        }
        pendingState.clear();
        timerState.clear();

        if (!events.isEmpty()) {
            LOG.info("Flushing batch of {} trigger(s) for {}", events.size(), ctx.getCurrentKey());
            out.collect(TriggerBatch.of(ctx.getCurrentKey(), events, Instant.ofEpochMilli(timestamp)));
        }
    }
}
