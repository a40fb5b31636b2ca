package com.alertsentinel.flink;

import com.alertsentinel.core.model.MarketObservation;
import com.alertsentinel.core.model.NewsItem;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Wire format of one record on the tick topic: a market snapshot for one
 * ticker plus the news published about it since the previous tick.
 *
 * <pre>
 * {"ticker":"SBER","price":281.4,"previousClose":270.0,"volume":1.2E7,
 *  "averageVolume":9.8E6,"rsi":71.2,"timestamp":"2026-03-02T10:15:00Z",
 *  "news":[{"title":"...","summary":"...","publishedAt":"2026-03-02T09:50:00Z"}]}
 * </pre>
 *
 * <p>
 * Flink POJO: public no-arg constructor plus getters and setters.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MarketTick implements Serializable {

    private static final long serialVersionUID = 1L;

    private String ticker;
    private double price;
    private double previousClose;
    private double volume;
    private Double averageVolume;
    private Double peRatio;
    private Double rsi;
    private Double movingAvg50;
    private Double movingAvg200;
    private Double marketCap;
    private Instant timestamp;
    private List<NewsItem> news = new ArrayList<>();

    public MarketTick() {
    }

    /**
     * @return the core observation for this tick
     * @throws NullPointerException if {@code ticker} or {@code timestamp} is missing
     */
    public MarketObservation toObservation() {
        return MarketObservation.builder()
                .ticker(ticker)
                .price(price)
                .previousClose(previousClose)
                .volume(volume)
                .averageVolume(averageVolume)
                .peRatio(peRatio)
                .rsi(rsi)
                .movingAvg50(movingAvg50)
                .movingAvg200(movingAvg200)
                .marketCap(marketCap)
                .timestamp(timestamp)
                .build();
    }

    public String getTicker() {
        return ticker;
    }

    public void setTicker(String ticker) {
        this.ticker = ticker;
    }

    public double getPrice() {
        return price;
    }

    public void setPrice(double price) {
        this.price = price;
    }

    public double getPreviousClose() {
        return previousClose;
    }

    public void setPreviousClose(double previousClose) {
        this.previousClose = previousClose;
    }

    public double getVolume() {
        return volume;
    }

    public void setVolume(double volume) {
        this.volume = volume;
    }

    public Double getAverageVolume() {
        return averageVolume;
    }

    public void setAverageVolume(Double averageVolume) {
        this.averageVolume = averageVolume;
    }

    public Double getPeRatio() {
        return peRatio;
    }

    public void setPeRatio(Double peRatio) {
        this.peRatio = peRatio;
    }

    public Double getRsi() {
        return rsi;
    }

    public void setRsi(Double rsi) {
        this.rsi = rsi;
    }

    public Double getMovingAvg50() {
        return movingAvg50;
    }

    public void setMovingAvg50(Double movingAvg50) {
        this.movingAvg50 = movingAvg50;
    }

    public Double getMovingAvg200() {
        return movingAvg200;
    }

    public void setMovingAvg200(Double movingAvg200) {
        this.movingAvg200 = movingAvg200;
    }

    public Double getMarketCap() {
        return marketCap;
    }

    public void setMarketCap(Double marketCap) {
        this.marketCap = marketCap;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public List<NewsItem> getNews() {
        return news;
    }

    public void setNews(List<NewsItem> news) {
        this.news = new ArrayList<>();
        if (news != null) {
            news.stream().filter(Objects::nonNull).forEach(this.news::add);
        }
    }

    @Override
    public String toString() {
        return "MarketTick{" +
                "ticker='" + ticker + '\'' +
                ", price=" + price +
                ", previousClose=" + previousClose +
                ", volume=" + volume +
                ", timestamp=" + timestamp +
                ", news=" + news.size() +
                '}';
    }
}
