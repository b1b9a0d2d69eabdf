package com.debaterank.debaterank_api.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Rating engine constants, read once at start-up.
 */
@Validated
@ConfigurationProperties(prefix = "debaterank.rating")
public class RatingProperties {

    /** Rating every entrant starts from. */
    private int baselineRating = 1500;

    @Min(1)
    private int kFactor = 32;

    /** Capacity of the recent-form window kept on each snapshot. */
    @Min(1)
    private int recentFormSize = 10;

    /** Number of events the standings trend column sums over. */
    @Min(1)
    private int trendWindow = 10;

    @Min(1)
    private int ledgerPageSize = 500;

    public int getBaselineRating() {
        return baselineRating;
    }

    public void setBaselineRating(int baselineRating) {
        this.baselineRating = baselineRating;
    }

    public int getKFactor() {
        return kFactor;
    }

    public void setKFactor(int kFactor) {
        this.kFactor = kFactor;
    }

    public int getRecentFormSize() {
        return recentFormSize;
    }

    public void setRecentFormSize(int recentFormSize) {
        this.recentFormSize = recentFormSize;
    }

    public int getTrendWindow() {
        return trendWindow;
    }

    public void setTrendWindow(int trendWindow) {
        this.trendWindow = trendWindow;
    }

    public int getLedgerPageSize() {
        return ledgerPageSize;
    }

    public void setLedgerPageSize(int ledgerPageSize) {
        this.ledgerPageSize = ledgerPageSize;
    }
}
