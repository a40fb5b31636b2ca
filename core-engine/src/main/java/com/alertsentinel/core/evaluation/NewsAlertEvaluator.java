package com.alertsentinel.core.evaluation;

import com.alertsentinel.core.model.Alert;
import com.alertsentinel.core.model.NewsContext;
import com.alertsentinel.core.sentiment.SentimentAnalyzer;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Evaluation path for {@code NEWS_TRIGGERED} alerts.
 *
 * <p>
 * Fires when at least one article exists and the averaged sentiment is
 * strictly below the trigger threshold. A context that carries articles but no
 * precomputed sentiment is scored with the analyzer.
 * </p>
 *
 * @since 1.0.0
 */
public class NewsAlertEvaluator implements AlertEvaluator {

    private final SentimentAnalyzer analyzer;
    private final double threshold;

    /**
     * @param analyzer  scorer for contexts without a precomputed sentiment
     * @param threshold sentiment below which the alert fires
     */
    public NewsAlertEvaluator(SentimentAnalyzer analyzer, double threshold) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.threshold = threshold;
    }

    @Override
    public EvaluationResult evaluate(Alert alert, EvaluationContext context) {
        Objects.requireNonNull(context, "context must not be null");
        NewsContext news = context.getNews();

        if (!news.hasNews()) {
            return EvaluationResult.notTriggered("No news data available");
        }

        Double sentiment = news.getAverageSentiment()
                .orElseGet(() -> news.getArticles().isEmpty()
                        ? null
                        : analyzer.averageSentiment(news.getArticles()));

        if (sentiment != null && sentiment < threshold) {
            return EvaluationResult.triggered(
                    String.format(Locale.ROOT, "Negative news sentiment detected: %.2f", sentiment),
                    List.of(news.getNewsCount() + " news articles with negative sentiment"));
        }
        return EvaluationResult.notTriggered("No negative news sentiment");
    }

    public double getThreshold() {
        return threshold;
    }
}
