package com.alertsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A news article relevant to a ticker.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NewsItem implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private String title;
    private String summary;
    private String source;
    private Instant publishedAt;

    /** No-arg constructor required by Jackson. */
    public NewsItem() {
    }

    /**
     * @param title       headline
     * @param summary     short description, may be {@code null}
     * @param publishedAt publication instant, may be {@code null}
     * @return a new article
     */
    public static NewsItem of(String title, String summary, Instant publishedAt) {
        NewsItem item = new NewsItem();
        item.setTitle(title);
        item.setSummary(summary);
        item.setPublishedAt(publishedAt);
        return item;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    public void setPublishedAt(Instant publishedAt) {
        this.publishedAt = publishedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NewsItem that))
            return false;
        return Objects.equals(id, that.id)
                && Objects.equals(title, that.title)
                && Objects.equals(publishedAt, that.publishedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, publishedAt);
    }

    @Override
    public String toString() {
        return "NewsItem{title='" + title + "', publishedAt=" + publishedAt + '}';
    }
}
