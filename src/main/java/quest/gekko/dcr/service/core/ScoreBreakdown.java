package quest.gekko.dcr.service.core;

/**
 * Every component that went into an entity's daily total, so a score can be explained line by line.
 */
public record ScoreBreakdown(int volumePoints,
                             int orderPoints,
                             int revenuePoints,
                             int ratingCountPoints,
                             int ratingQualityPoints,
                             int basePoints,
                             int rankBonus,
                             int trendMomentumPoints,
                             int consistencyBonus,
                             int velocityBonus,
                             int trendBonus,
                             int totalPoints,
                             double trendMultiplier,
                             int consistencyScore,
                             int velocityScore,
                             int streakDays,
                             int previousRank,
                             double marketSharePercent) {
}
