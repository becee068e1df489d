package com.gnovoa.tournament.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Round simulator tuning. Shares and probabilities are in [0, 1].
 *
 * @param lowScoringShare share of games drawn from the 0-3 goal distribution, the rest from 2-5
 * @param homeAdvantage chance that the home side is the stronger one in a game
 * @param homeBoost chance the stronger home side gets one extra goal
 * @param awayBoost chance the stronger away side gets one extra goal
 * @param goallessShare chance a game is forced to 0-0
 * @param assistProbability chance a goal comes with an assist
 * @param seed fixed seed for repeatable simulations; unset picks a fresh one at startup
 */
@ConfigurationProperties(prefix = "sim")
public record SimProperties(
        double lowScoringShare,
        double homeAdvantage,
        double homeBoost,
        double awayBoost,
        double goallessShare,
        double assistProbability,
        Long seed
) {
    public static SimProperties defaults() {
        return new SimProperties(0.7, 0.7, 0.4, 0.3, 0.3, 0.6, null);
    }
}
