package quest.gekko.dcr.service.core;

import quest.gekko.dcr.domain.EntityType;
import quest.gekko.dcr.service.integration.TrendSnapshot;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Daily points for a ranked entity.
 *
 * <pre>
 * total      = base + rankBonus + trendBonus
 * base       = floor(volume / 10) * typeMultiplier + orders * orderWeight [+ floor(revenueCents / 1000)]
 * trendBonus = floor((trendMultiplier - 1) * 25)            0..100
 *            + min(20, floor(consistencyScore * 0.20))       0..20
 *            + min(15, floor(max(0, velocityScore) * 0.15))  0..15
 * </pre>
 *
 * Brands have no order data and score {@code ratings * 10 + floor(bayesianAverage * 20) + rankBonus}.
 * Nothing in here throws on missing inputs; absent values are zero.
 */
public final class TrendScoringEngine {

    public static final double NEUTRAL_MULTIPLIER = 1.0;
    public static final double MAX_MULTIPLIER = 5.0;
    public static final int TOP_RANK_CUTOFF = 10;

    private TrendScoringEngine() {
    }

    public static ScoreBreakdown score(EntityType type, EntityCounters counters, int rank, TrendInputs trend) {
        if (counters == null) counters = EntityCounters.ofOrders(0, 0, 0);
        if (trend == null) trend = TrendInputs.NONE;

        int rankBonus = type.rankBonus(rank);
        double multiplier = trendMultiplier(trend.days1(), trend.days7());
        int consistency = consistencyScore(trend.streakDays(), trend.dailyVolumes());
        int velocity = velocityScore(trend.days1(), trend.days7(), trend.days14());

        if (type == EntityType.BRAND) {
            int ratingCountPoints = counters.totalRatings() * 10;
            int ratingQualityPoints = (int) Math.floor(Math.max(0d, counters.bayesianAverage()) * 20);
            int base = ratingCountPoints + ratingQualityPoints;
            return new ScoreBreakdown(0, 0, 0, ratingCountPoints, ratingQualityPoints, base,
                    rankBonus, 0, 0, 0, 0, base + rankBonus,
                    multiplier, consistency, velocity, trend.streakDays(), trend.previousRank(), trend.marketSharePercent());
        }

        int volumePoints = (int) (Math.max(0L, counters.volume()) / 10) * type.volumeMultiplier();
        int orderPoints = counters.orderCount() * type.orderWeight();
        int revenuePoints = type.scoresRevenue() ? (int) (Math.max(0L, counters.revenueCents()) / 1000) : 0;
        int base = volumePoints + orderPoints + revenuePoints;

        int momentumPoints = (int) Math.floor((multiplier - NEUTRAL_MULTIPLIER) * 25);
        int consistencyBonus = Math.min(20, (int) Math.floor(consistency * 0.20));
        int velocityBonus = Math.min(15, (int) Math.floor(Math.max(0, velocity) * 0.15));
        int trendBonus = momentumPoints + consistencyBonus + velocityBonus;

        return new ScoreBreakdown(volumePoints, orderPoints, revenuePoints, 0, 0, base,
                rankBonus, momentumPoints, consistencyBonus, velocityBonus, trendBonus, base + rankBonus + trendBonus,
                multiplier, consistency, velocity, trend.streakDays(), trend.previousRank(), trend.marketSharePercent());
    }

    /**
     * Latest day against the trailing 7-day average, clamped to [1.0, 5.0]. A brand-new entity with sales
     * today but no weekly history gets the cap.
     */
    public static double trendMultiplier(long days1, long days7) {
        if (days1 <= 0) return NEUTRAL_MULTIPLIER;
        if (days7 <= 0) return MAX_MULTIPLIER;

        double ratio = days1 / (days7 / 7.0);
        if (Double.isNaN(ratio) || ratio <= NEUTRAL_MULTIPLIER) return NEUTRAL_MULTIPLIER;
        return Math.min(ratio, MAX_MULTIPLIER);
    }

    /** 0..100: up to 70 from the top-10 streak, up to 30 from how flat the trailing week was. */
    public static int consistencyScore(int streakDays, List<Double> dailyVolumes) {
        int streakPart = Math.min(70, Math.max(0, streakDays) * 10);
        int stabilityPart = (int) Math.floor(stabilityScore(dailyVolumes) * 0.30);
        return Math.min(100, streakPart + stabilityPart);
    }

    /** 100 for a perfectly flat series, 0 once the coefficient of variation reaches 1. */
    static int stabilityScore(List<Double> dailyVolumes) {
        if (dailyVolumes == null || dailyVolumes.size() < 3) return 0;

        double mean = dailyVolumes.stream().mapToDouble(Double::doubleValue).average().orElse(0d);
        if (mean <= 0) return 0;

        double variance = dailyVolumes.stream().mapToDouble(v -> (v - mean) * (v - mean)).average().orElse(0d);
        double cv = Math.sqrt(variance) / mean;
        return Math.max(0, (int) Math.floor((1 - cv) * 100));
    }

    /**
     * Acceleration of weekly growth: (days7 - days1) - (days14 - days7), scaled and clamped to [-50, 100].
     * Zero when no 14-day window is published.
     */
    public static int velocityScore(long days1, long days7, long days14) {
        if (days14 <= 0) return 0;
        long acceleration = (days7 - days1) - (days14 - days7);
        int score = (int) Math.floor(acceleration * 0.05);
        return Math.min(Math.max(score, -50), 100);
    }

    /**
     * Consecutive top-10 days ending today. Walks back from the day before {@code date} and stops at the first
     * day that is missing or outside the top 10.
     */
    public static int streakDays(int currentRank, LocalDate date, Map<LocalDate, Integer> rankHistory, int maxLookbackDays) {
        if (currentRank <= 0 || currentRank > TOP_RANK_CUTOFF) return 0;

        int streak = 1;
        for (int back = 1; back <= maxLookbackDays; back++) {
            Integer rank = rankHistory.get(date.minusDays(back));
            if (rank == null || rank <= 0 || rank > TOP_RANK_CUTOFF) break;
            streak++;
        }
        return streak;
    }

    public static double marketSharePercent(long entityDays7, long categoryDays7) {
        if (categoryDays7 <= 0 || entityDays7 <= 0) return 0d;
        return BigDecimal.valueOf(entityDays7 * 100.0 / categoryDays7).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /** Day 1 as published, days 2..7 spread evenly from the remainder of the weekly window. */
    public static List<Double> estimateDailyVolumes(TrendSnapshot snapshot) {
        if (snapshot == null || (snapshot.days1() == 0 && snapshot.days7() == 0)) return List.of();

        List<Double> volumes = new ArrayList<>(7);
        volumes.add((double) snapshot.days1());
        double rest = Math.max(0L, snapshot.days7() - snapshot.days1()) / 6.0;
        for (int i = 0; i < 6; i++) volumes.add(rest);
        return volumes;
    }
}
