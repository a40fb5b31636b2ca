package com.alertsentinel.core.sentiment;

import com.alertsentinel.core.config.SentimentSettings;
import com.alertsentinel.core.model.NewsContext;
import com.alertsentinel.core.model.NewsItem;

import java.io.Serializable;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Keyword-polarity sentiment scorer.
 *
 * <p>
 * Each article scores {@value #KEYWORD_WEIGHT} per distinct positive keyword
 * found in its title and summary, minus the same per negative keyword, clamped
 * to [-1, 1]. Matching is case-insensitive substring matching. The result for
 * a list of articles is the mean of the per-article scores, 0 for no articles.
 * </p>
 *
 * <p>
 * Instances are immutable and safe to share between threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentimentAnalyzer implements Serializable {

    private static final long serialVersionUID = 1L;

    static final double KEYWORD_WEIGHT = 0.2;

    static final List<String> DEFAULT_NEGATIVE = List.of(
            "падение", "снижение", "убыток", "кризис", "банкротство", "риск", "потери",
            "долг", "падают", "снижаются", "обвал", "дефолт", "санкции",
            "loss", "decline", "crisis", "bankruptcy", "lawsuit", "downgrade",
            "plunge", "fraud", "default", "sanctions", "investigation", "layoffs");

    static final List<String> DEFAULT_POSITIVE = List.of(
            "рост", "прибыль", "успех", "достижение", "увеличение", "дивиденд", "растут",
            "повышение", "расширение", "инновация", "лидер", "прорыв",
            "growth", "profit", "record high", "dividend", "upgrade", "beats estimates",
            "expansion", "innovation", "breakthrough", "rally", "buyback");

    private final List<String> positiveKeywords;
    private final List<String> negativeKeywords;

    /**
     * @param positiveKeywords keywords adding to the score
     * @param negativeKeywords keywords subtracting from the score
     */
    public SentimentAnalyzer(List<String> positiveKeywords, List<String> negativeKeywords) {
        this.positiveKeywords = normalise(Objects.requireNonNull(positiveKeywords, "positiveKeywords must not be null"));
        this.negativeKeywords = normalise(Objects.requireNonNull(negativeKeywords, "negativeKeywords must not be null"));
    }

    /**
     * @return an analyzer using the built-in lexicon
     */
    public static SentimentAnalyzer withDefaultLexicon() {
        return new SentimentAnalyzer(DEFAULT_POSITIVE, DEFAULT_NEGATIVE);
    }

    /**
     * @param settings sentiment configuration; empty keyword lists fall back to
     *                 the built-in lexicon
     * @return a configured analyzer
     */
    public static SentimentAnalyzer from(SentimentSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        List<String> positive = settings.getPositiveKeywords().isEmpty()
                ? DEFAULT_POSITIVE
                : settings.getPositiveKeywords();
        List<String> negative = settings.getNegativeKeywords().isEmpty()
                ? DEFAULT_NEGATIVE
                : settings.getNegativeKeywords();
        return new SentimentAnalyzer(positive, negative);
    }

    /**
     * @param articles articles to score; must not be {@code null}
     * @return mean article score in [-1, 1], 0 for an empty list
     */
    public double averageSentiment(List<NewsItem> articles) {
        Objects.requireNonNull(articles, "articles must not be null");
        if (articles.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (NewsItem article : articles) {
            sum += score(article);
        }
        return sum / articles.size();
    }

    /**
     * @param article the article; must not be {@code null}
     * @return article score in [-1, 1]
     */
    public double score(NewsItem article) {
        Objects.requireNonNull(article, "article must not be null");
        String text = ((article.getTitle() != null ? article.getTitle() : "")
                + " "
                + (article.getSummary() != null ? article.getSummary() : ""))
                .toLowerCase(Locale.ROOT);

        int net = countMatches(text, positiveKeywords) - countMatches(text, negativeKeywords);
        return Math.max(-1, Math.min(1, net * KEYWORD_WEIGHT));
    }

    /**
     * Build the news context for a ticker, scoring its articles.
     *
     * @param ticker   the ticker
     * @param articles the ticker's articles; must not be {@code null}
     * @return context with count, averaged sentiment and the articles
     */
    public NewsContext contextFor(String ticker, List<NewsItem> articles) {
        Objects.requireNonNull(articles, "articles must not be null");
        List<NewsItem> present = articles.stream()
                .filter(Objects::nonNull)
                .toList();
        if (present.isEmpty()) {
            return NewsContext.empty(ticker);
        }
        return NewsContext.withArticles(ticker, present, averageSentiment(present));
    }

    private static int countMatches(String text, List<String> keywords) {
        int matches = 0;
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                matches++;
            }
        }
        return matches;
    }

    private static List<String> normalise(List<String> keywords) {
        return keywords.stream()
                .filter(Objects::nonNull)
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .filter(k -> !k.isEmpty())
                .distinct()
                .toList();
    }
}
