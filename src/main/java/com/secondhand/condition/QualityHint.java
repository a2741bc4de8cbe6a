package com.secondhand.condition;

import lombok.Getter;

/**
 * What an inspector lets slip about the hidden quality scalar. Each band covers a tenth
 * of the [0, 1] range and carries a handful of quote keys for the presentation layer.
 */
@Getter
public enum QualityHint {

    CATASTROPHIC("Catastrophic", "cat"),
    TERRIBLE("Terrible", "ter"),
    POOR("Poor", "poor"),
    BELOW_AVERAGE("Below average", "below"),
    SLIGHTLY_BELOW("Slightly below average", "slight"),
    AVERAGE("Average", "avg"),
    ABOVE_AVERAGE("Above average", "above"),
    GOOD("Good", "good"),
    EXCELLENT("Excellent", "exc"),
    LEGENDARY("Legendary", "leg");

    public static final int QUOTES_PER_BAND = 5;

    private final String displayName;
    private final String quotePrefix;

    QualityHint(String displayName, String quotePrefix) {
        this.displayName = displayName;
        this.quotePrefix = quotePrefix;
    }

    public static QualityHint fromHiddenQuality(double hiddenQuality) {
        int band = (int) Math.floor(hiddenQuality * 10);
        band = Math.max(0, Math.min(values().length - 1, band));
        return values()[band];
    }

    /**
     * Message key for quote {@code n} (1-based) in this band.
     */
    public String quoteKey(int n) {
        return "quote." + quotePrefix + "." + n;
    }
}
