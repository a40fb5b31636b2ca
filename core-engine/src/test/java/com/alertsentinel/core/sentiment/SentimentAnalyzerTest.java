package com.alertsentinel.core.sentiment;

import com.alertsentinel.core.config.SentimentSettings;
import com.alertsentinel.core.model.NewsContext;
import com.alertsentinel.core.model.NewsItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SentimentAnalyzer}.
 */
class SentimentAnalyzerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:15:00Z");

    private final SentimentAnalyzer analyzer = SentimentAnalyzer.withDefaultLexicon();

    @Test
    @DisplayName("One negative and one positive article should average to zero")
    void oppositeArticlesShouldCancelOut() {
        NewsItem negative = article("Company faces lawsuit", null);
        NewsItem positive = article("Board raises dividend", null);

        assertThat(analyzer.score(negative)).isCloseTo(-0.2, within(1e-9));
        assertThat(analyzer.score(positive)).isCloseTo(0.2, within(1e-9));
        assertThat(analyzer.averageSentiment(List.of(negative, positive))).isCloseTo(0.0, within(1e-9));
    }

    @Test
    @DisplayName("Matches in one article should net out")
    void matchesShouldNetWithinArticle() {
        assertThat(analyzer.score(article("Lawsuit settled", "Dividend restored"))).isCloseTo(0.0, within(1e-9));
    }

    @Test
    @DisplayName("Per-article score should be clamped to [-1, 1]")
    void scoreShouldBeClamped() {
        NewsItem disaster = article("Crisis: fraud, lawsuit and downgrade",
                "Bankruptcy and default feared, layoffs announced");

        assertThat(analyzer.score(disaster)).isEqualTo(-1.0);
    }

    @Test
    @DisplayName("Matching should be case-insensitive and cover the Russian lexicon")
    void shouldMatchCaseInsensitivelyInRussian() {
        assertThat(analyzer.score(article("ОБВАЛ котировок", "Санкции и дефолт"))).isCloseTo(-0.6, within(1e-9));
        assertThat(analyzer.score(article("Рекордная ПРИБЫЛЬ", null))).isCloseTo(0.2, within(1e-9));
    }

    @Test
    @DisplayName("Text without keywords should be neutral")
    void neutralTextShouldScoreZero() {
        assertThat(analyzer.score(article("Annual meeting scheduled", "Agenda published"))).isZero();
    }

    @Test
    @DisplayName("Configured keywords should replace the built-in lists")
    void configuredKeywordsShouldReplaceDefaults() {
        SentimentSettings settings = new SentimentSettings();
        settings.setNegativeKeywords(List.of("Recall"));

        SentimentAnalyzer custom = SentimentAnalyzer.from(settings);

        assertThat(custom.score(article("Product recall announced", null))).isCloseTo(-0.2, within(1e-9));
        assertThat(custom.score(article("Company faces lawsuit", null))).isZero();
        assertThat(custom.score(article("Board raises dividend", null))).isCloseTo(0.2, within(1e-9));
    }

    @Test
    @DisplayName("Should build a news context with count and averaged sentiment")
    void shouldBuildNewsContext() {
        NewsContext context = analyzer.contextFor("SBER",
                List.of(article("Company faces lawsuit", null), article("Downgrade and lawsuit", null)));

        assertThat(context.getNewsCount()).isEqualTo(2);
        assertThat(context.getAverageSentiment()).hasValueSatisfying(
                s -> assertThat(s).isCloseTo(-0.3, within(1e-9)));
        assertThat(analyzer.contextFor("SBER", List.of()).hasNews()).isFalse();
    }

    @Test
    @DisplayName("Null articles should be ignored when building a news context")
    void shouldIgnoreNullArticles() {
        NewsContext context = analyzer.contextFor("SBER",
                Arrays.asList(null, article("Board raises dividend", null), null));

        assertThat(context.getNewsCount()).isEqualTo(1);
        assertThat(context.getAverageSentiment()).hasValueSatisfying(
                s -> assertThat(s).isCloseTo(0.2, within(1e-9)));
        assertThat(analyzer.contextFor("SBER", Arrays.asList((NewsItem) null)).hasNews()).isFalse();
    }

    private static NewsItem article(String title, String summary) {
        return NewsItem.of(title, summary, NOW);
    }
}
