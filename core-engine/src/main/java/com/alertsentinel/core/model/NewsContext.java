package com.alertsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * News known about a ticker at evaluation time: article count and averaged
 * sentiment in [-1, 1].
 *
 * <p>
 * The articles themselves are optional. When present, their publication
 * instants let the anomaly detector restrict itself to a lookback window;
 * otherwise only {@link #getNewsCount()} is consulted.
 * </p>
 *
 * @since 1.0.0
 */
public final class NewsContext implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String ticker;
    private final int newsCount;
    private final Double averageSentiment;
    private final List<NewsItem> articles;

    private NewsContext(String ticker, int newsCount, Double averageSentiment, List<NewsItem> articles) {
        if (newsCount < 0) {
            throw new IllegalArgumentException("newsCount must be >= 0, got: " + newsCount);
        }
        this.ticker = ticker;
        this.newsCount = newsCount;
        this.averageSentiment = averageSentiment;
        this.articles = articles;
    }

    /**
     * @param ticker the ticker
     * @return a context with no news
     */
    public static NewsContext empty(String ticker) {
        return new NewsContext(ticker, 0, null, List.of());
    }

    /**
     * Context known only by its aggregates.
     *
     * @param ticker           the ticker
     * @param newsCount        number of articles, &gt;= 0
     * @param averageSentiment averaged sentiment, may be {@code null}
     * @return a new context
     */
    public static NewsContext of(String ticker, int newsCount, Double averageSentiment) {
        return new NewsContext(ticker, newsCount, averageSentiment, List.of());
    }

    /**
     * Context that keeps its articles.
     *
     * @param ticker           the ticker
     * @param articles         the articles; must not be {@code null}
     * @param averageSentiment averaged sentiment of {@code articles}
     * @return a new context
     */
    public static NewsContext withArticles(String ticker, List<NewsItem> articles, Double averageSentiment) {
        Objects.requireNonNull(articles, "articles must not be null");
        return new NewsContext(ticker, articles.size(), averageSentiment, List.copyOf(articles));
    }

    /**
     * Count news published in {@code [since, until]}.
     *
     * <p>
     * Falls back to {@link #getNewsCount()} when the articles were not kept or
     * none of them carries a publication instant.
     * </p>
     *
     * @param since window start, inclusive
     * @param until window end, inclusive
     * @return number of articles in the window
     */
    public int countPublishedBetween(Instant since, Instant until) {
        if (articles.isEmpty() || articles.stream().allMatch(a -> a.getPublishedAt() == null)) {
            return newsCount;
        }
        return (int) articles.stream()
                .map(NewsItem::getPublishedAt)
                .filter(Objects::nonNull)
                .filter(t -> !t.isBefore(since) && !t.isAfter(until))
                .count();
    }

    public boolean hasNews() {
        return newsCount > 0;
    }

    public String getTicker() {
        return ticker;
    }

    public int getNewsCount() {
        return newsCount;
    }

    public Optional<Double> getAverageSentiment() {
        return Optional.ofNullable(averageSentiment);
    }

    public List<NewsItem> getArticles() {
        return Collections.unmodifiableList(articles);
    }

    @Override
    public String toString() {
        return "NewsContext{" +
                "ticker='" + ticker + '\'' +
                ", newsCount=" + newsCount +
                ", averageSentiment=" + averageSentiment +
                '}';
    }
}
