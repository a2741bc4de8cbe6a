package com.secondhand.host;

/**
 * Credit score lookup. Hosts without a credit system use {@link #NEUTRAL}.
 */
public interface CreditScoreProvider {

    /**
     * Scores 650..699 carry no fee adjustment.
     */
    CreditScoreProvider NEUTRAL = ownerId -> 650;

    int creditScore(String ownerId);

    /**
     * Fractional agent-fee adjustment for a credit score: good credit makes agents cheaper.
     */
    static double feeModifier(int score) {
        if (score >= 750) {
            return -0.15;
        } else if (score >= 700) {
            return -0.08;
        } else if (score >= 650) {
            return 0.0;
        } else if (score >= 600) {
            return 0.10;
        }
        return 0.20;
    }
}
