package com.alertsentinel.core.evaluation;

import com.alertsentinel.core.model.MarketObservation;
import com.alertsentinel.core.model.NewsContext;
import com.alertsentinel.core.model.PricePoint;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Everything known about one ticker at one evaluation tick.
 *
 * <p>
 * News defaults to an empty context and history to an empty list, so
 * evaluators never see {@code null}.
 * </p>
 *
 * @since 1.0.0
 */
public final class EvaluationContext {

    private final MarketObservation observation;
    private final NewsContext news;
    private final List<PricePoint> history;
    private final Instant evaluatedAt;

    private EvaluationContext(MarketObservation observation, NewsContext news,
            List<PricePoint> history, Instant evaluatedAt) {
        this.observation = Objects.requireNonNull(observation, "observation must not be null");
        this.news = news != null ? news : NewsContext.empty(observation.getTicker());
        this.history = history != null ? List.copyOf(history) : List.of();
        this.evaluatedAt = Objects.requireNonNull(evaluatedAt, "evaluatedAt must not be null");
    }

    /**
     * @param observation current market data; must not be {@code null}
     * @param news        current news, may be {@code null}
     * @param history     rolling price history, may be {@code null}
     * @param evaluatedAt evaluation instant; must not be {@code null}
     * @return a new context
     */
    public static EvaluationContext of(MarketObservation observation, NewsContext news,
            List<PricePoint> history, Instant evaluatedAt) {
        return new EvaluationContext(observation, news, history, evaluatedAt);
    }

    /**
     * Context evaluated at the observation's own timestamp.
     */
    public static EvaluationContext of(MarketObservation observation, NewsContext news,
            List<PricePoint> history) {
        Objects.requireNonNull(observation, "observation must not be null");
        return new EvaluationContext(observation, news, history, observation.getTimestamp());
    }

    public MarketObservation getObservation() {
        return observation;
    }

    public NewsContext getNews() {
        return news;
    }

    public List<PricePoint> getHistory() {
        return history;
    }

    public Instant getEvaluatedAt() {
        return evaluatedAt;
    }

    public String getTicker() {
        return observation.getTicker();
    }
}
